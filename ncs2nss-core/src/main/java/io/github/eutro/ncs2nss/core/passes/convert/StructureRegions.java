package io.github.eutro.ncs2nss.core.passes.convert;

import io.github.eutro.ncs2nss.core.Diagnostic;
import io.github.eutro.ncs2nss.core.DiagnosticKind;
import io.github.eutro.ncs2nss.core.Diagnostics;
import io.github.eutro.ncs2nss.core.ast.BlockCode;
import io.github.eutro.ncs2nss.core.ast.Expr;
import io.github.eutro.ncs2nss.core.ast.Operator;
import io.github.eutro.ncs2nss.core.ast.Region;
import io.github.eutro.ncs2nss.core.cfg.EdgeKind;
import io.github.eutro.ncs2nss.core.cfg.Loop;
import io.github.eutro.ncs2nss.core.cfg.Subroutine;
import io.github.eutro.ncs2nss.core.ext.CommonExts;
import io.github.eutro.ncs2nss.core.ext.MetadataState;
import io.github.eutro.ncs2nss.core.passes.InPlaceIRPass;
import org.jetbrains.annotations.Nullable;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.*;

/**
 * Rebuilds structured control flow for a subroutine whose block code has been recovered,
 * attaching the result as {@link CommonExts#BODY}, and the region that took each block as
 * {@link CommonExts#REGION_OWNERS}.
 * <p>
 * The walk follows the dominator structure: a two-way branch is closed at its immediate post-dominator,
 * and a loop at its follow. Jumps to the enclosing loop's follow and header become {@code break} and
 * {@code continue}. Anything left over is emitted as a {@code goto} comment and reported.
 * <p>
 * Structuring is deterministic, so when the first walk jumps back into placed code it is repeated
 * with the jump targets known, and each target gets a label where its block is placed.
 */
public class StructureRegions implements InPlaceIRPass<Subroutine> {
    private static final Logger LOGGER = System.getLogger(StructureRegions.class.getName());
    private static final int NONE = -1;

    private final boolean preferSwitches;

    public StructureRegions(boolean preferSwitches) {
        this.preferSwitches = preferSwitches;
    }

    @Override
    public void runInPlace(Subroutine sub) {
        Structurer first = new Structurer(sub, Collections.emptySet());
        first.run();
        Structurer result = first;
        if (!first.gotoTargets.isEmpty()) {
            result = new Structurer(sub, first.gotoTargets);
            result.run();
        }
        result.attach();
    }

    private static final class Ctx {
        static final Ctx ROOT = new Ctx(NONE, NONE, null);

        final int breakTarget;
        final int continueTarget;
        @Nullable
        final Loop loop;

        Ctx(int breakTarget, int continueTarget, @Nullable Loop loop) {
            this.breakTarget = breakTarget;
            this.continueTarget = continueTarget;
            this.loop = loop;
        }
    }

    private final class Structurer {
        final Subroutine sub;
        final BlockCode[] blocks;
        final int[][] succs;
        final int[][] preds;
        final int[] ipdom;
        final Map<Integer, Loop> loops;
        final int[] trueSucc;
        final boolean[] placed;
        final Map<Integer, Region> owners = new TreeMap<>();
        final Diagnostics diagnostics;
        final Set<Integer> labelled;
        final Set<Integer> labelsPlaced = new HashSet<>();
        final Set<Integer> gotoTargets = new TreeSet<>();
        final Diagnostics pending = new Diagnostics();
        Region result;

        Structurer(Subroutine sub, Set<Integer> labelled) {
            this.sub = sub;
            this.labelled = labelled;
            MetadataState ms = sub.getExtOrThrow(CommonExts.METADATA_STATE);
            ms.ensureValid(sub, MetadataState.PREDS, MetadataState.DOMS, MetadataState.LOOPS, MetadataState.POST_DOMS);
            blocks = sub.getExtOrThrow(CommonExts.BLOCK_CODE);
            succs = sub.successors();
            preds = sub.getExtOrThrow(CommonExts.PREDS);
            ipdom = sub.getExtOrThrow(CommonExts.IPDOM);
            loops = sub.getExtOrThrow(CommonExts.LOOPS);
            diagnostics = sub.getGraph().getExtOrThrow(CommonExts.DIAGNOSTICS);
            placed = new boolean[blocks.length];
            trueSucc = new int[blocks.length];
            for (int l = 0; l < blocks.length; l++) {
                trueSucc[l] = succs[l].length == 2 ? sub.local(sub.basicBlock(l).target(EdgeKind.BRANCH_TRUE)) : NONE;
            }
        }

        void run() {
            Region.Sequence top = seq(0, NONE, Ctx.ROOT, NONE);
            List<Region> body = new ArrayList<>(top.children);
            boolean leftover = false;
            for (int l = 0; l < blocks.length; l++) {
                if (placed[l]) continue;
                placed[l] = true;
                owners.put(sub.block(l), top);
                if (blocks[l].statements.isEmpty()) continue;
                leftover = true;
                labelsPlaced.add(l);
                body.add(new Region.Label(blocks[l].offset));
                body.addAll(blocks[l].statements);
            }
            if (leftover) {
                report(sub.getOffset(), "Blocks not reached by structured control flow in " + sub);
            }
            result = leftover ? new Region.Sequence(body) : top;
        }

        void attach() {
            for (Diagnostic d : pending.list()) diagnostics.report(d.kind, d.offset, d.message);
            sub.attachExt(CommonExts.BODY, result);
            sub.attachExt(CommonExts.REGION_OWNERS, owners);
            LOGGER.log(Level.DEBUG, "Structured {0} with {1} goto target(s)", sub, gotoTargets.size());
        }

        private void report(int offset, String message) {
            pending.report(DiagnosticKind.UNSTRUCTURED_REGION, offset, message);
        }

        /**
         * Emit the label of a block that some {@code goto} targets, once.
         */
        private void label(List<Region> out, int l) {
            if (labelled.contains(l) && labelsPlaced.add(l)) out.add(new Region.Label(blocks[l].offset));
        }

        private void own(int l, Region region) {
            owners.put(sub.block(l), region);
        }

        /**
         * Structure the blocks from {@code start} until {@code stop} is reached or control leaves.
         *
         * @param enter A loop header being structured, whose first visit is a plain block.
         */
        Region.Sequence seq(int start, int stop, Ctx ctx, int enter) {
            List<Region> out = new ArrayList<>();
            List<Integer> mine = new ArrayList<>();
            int cur = start;
            boolean first = true;
            while (cur != NONE) {
                boolean entering = first && cur == enter;
                first = false;
                if (!entering) {
                    if (cur == stop) break;
                    if (cur == ctx.continueTarget) {
                        out.add(Region.Continue.INSTANCE);
                        break;
                    }
                    if (cur == ctx.breakTarget) {
                        out.add(Region.Break.INSTANCE);
                        break;
                    }
                }
                BlockCode code = blocks[cur];
                if (code.isEpilogue()) {
                    placed[cur] = true;
                    mine.add(cur);
                    out.add(new Region.Return(null));
                    break;
                }
                if (placed[cur]) {
                    out.add(new Region.Goto(code.offset));
                    gotoTargets.add(cur);
                    report(code.offset, "Control flow re-enters placed code");
                    break;
                }
                label(out, cur);
                Loop loop = loops.get(cur);
                if (loop != null && !entering) {
                    int[] follow = new int[1];
                    out.add(structureLoop(cur, loop, follow));
                    cur = follow[0];
                    continue;
                }

                placed[cur] = true;
                out.addAll(code.statements);
                if (code.endsInReturn()) {
                    mine.add(cur);
                    break;
                }
                int[] ss = succs[cur];
                if (ss.length == 0) {
                    mine.add(cur);
                    break;
                }
                if (ss.length == 1 || code.getCondition() == null) {
                    mine.add(cur);
                    cur = ss[0];
                    continue;
                }

                int[] next = new int[1];
                Region control = null;
                if (preferSwitches) control = trySwitch(cur, stop, ctx, next);
                if (control == null) control = structureIf(cur, stop, ctx, next);
                out.add(control);
                cur = next[0];
            }
            Region.Sequence result = new Region.Sequence(out);
            for (int l : mine) own(l, result);
            return result;
        }

        private Expr conditionTowards(int block, int succ) {
            Expr cond = Objects.requireNonNull(blocks[block].getCondition());
            return trueSucc[block] == succ ? cond : Expr.negate(cond);
        }

        private Region structureIf(int cur, int stop, Ctx ctx, int[] next) {
            int follow = ipdom[cur];
            if (follow != NONE && ctx.loop != null && !ctx.loop.contains(follow)) follow = NONE;
            if (follow != NONE && placed[follow] && !blocks[follow].isEpilogue()) follow = NONE;
            int armStop = follow != NONE ? follow : stop;
            int fall = succs[cur][0];
            int jump = succs[cur][1];
            Expr fallCond = conditionTowards(cur, fall);

            Region.If region;
            int skipTo = earlyContinue(ctx, follow, fall, jump);
            if (skipTo != NONE) {
                Expr cond = skipTo == fall ? Expr.negate(fallCond) : fallCond;
                region = new Region.If(cond, new Region.Sequence(Collections.singletonList(Region.Continue.INSTANCE)), null);
                own(cur, region);
                next[0] = skipTo;
                return region;
            }
            if (jump == follow) {
                region = new Region.If(fallCond, seq(fall, armStop, ctx, NONE), null);
            } else if (fall == follow) {
                region = new Region.If(Expr.negate(fallCond), seq(jump, armStop, ctx, NONE), null);
            } else {
                Region.Sequence thenArm = seq(fall, armStop, ctx, NONE);
                Region.Sequence elseArm = seq(jump, armStop, ctx, NONE);
                region = new Region.If(fallCond, thenArm, elseArm.isEmpty() ? null : elseArm);
            }
            own(cur, region);
            next[0] = follow;
            return region;
        }

        /**
         * A branch with no join inside the loop, one arm of which goes straight back to the loop header,
         * is an {@code if (...) continue;} followed by the other arm.
         *
         * @return The arm the enclosing sequence continues with, or {@link #NONE}.
         */
        private int earlyContinue(Ctx ctx, int follow, int fall, int jump) {
            if (follow != NONE || ctx.loop == null || ctx.continueTarget != ctx.loop.header) return NONE;
            if (jump == ctx.continueTarget && fall != ctx.continueTarget) return fall;
            if (fall == ctx.continueTarget && jump != ctx.continueTarget) return jump;
            return NONE;
        }

        private Region structureLoop(int header, Loop loop, int[] next) {
            BlockCode hc = blocks[header];
            int follow = loop.follow;
            next[0] = follow;

            int[] hs = succs[header];
            if (hs.length == 2 && hc.statements.isEmpty() && hc.getCondition() != null) {
                int in = loop.contains(hs[0]) ? hs[0] : loop.contains(hs[1]) ? hs[1] : NONE;
                int out = in == hs[0] ? hs[1] : hs[0];
                if (in != NONE && !loop.contains(out)) {
                    placed[header] = true;
                    next[0] = out;
                    Ctx inner = new Ctx(out, header, loop);
                    Region.While region = new Region.While(conditionTowards(header, in), seq(in, header, inner, NONE));
                    own(header, region);
                    return region;
                }
            }

            int latch = loop.singleLatch();
            if (latch != NONE && succs[latch].length == 2 && blocks[latch].getCondition() != null) {
                int[] ls = succs[latch];
                int exit = ls[0] == header ? ls[1] : ls[1] == header ? ls[0] : NONE;
                if (exit != NONE && !loop.contains(exit)) {
                    next[0] = exit;
                    List<Region> body = new ArrayList<>();
                    if (latch != header) {
                        Ctx inner = new Ctx(exit, latch, loop);
                        body.addAll(seq(header, latch, inner, header).children);
                    }
                    if (!placed[latch]) {
                        placed[latch] = true;
                        label(body, latch);
                        body.addAll(blocks[latch].statements);
                    }
                    Region.DoWhile region = new Region.DoWhile(new Region.Sequence(body), conditionTowards(latch, header));
                    own(latch, region);
                    if (latch == header) own(header, region);
                    return region;
                }
            }

            Ctx inner = new Ctx(follow, header, loop);
            Region.Sequence body = seq(header, header, inner, header);
            Region.While region = new Region.While(Expr.Literal.ofInt(1), body);
            own(header, region);
            return region;
        }

        /**
         * Match a chain of equality tests of one operand against literals.
         *
         * @return The switch, or null if the chain does not qualify.
         */
        @Nullable
        private Region trySwitch(int cur, int stop, Ctx ctx, int[] next) {
            Expr operand = null;
            List<Integer> tests = new ArrayList<>();
            List<Expr.Literal> labels = new ArrayList<>();
            List<Integer> targets = new ArrayList<>();
            int test = cur;
            int fallback = NONE;
            while (true) {
                Expr cond = blocks[test].getCondition();
                if (cond == null || succs[test].length != 2 || trueSucc[test] == NONE) break;
                if (test != cur && (!blocks[test].statements.isEmpty() || preds[test].length != 1 || placed[test])) break;
                if (!(cond instanceof Expr.BinaryOp) || ((Expr.BinaryOp) cond).op != Operator.EQ) break;
                Expr.BinaryOp eq = (Expr.BinaryOp) cond;
                Expr lhs = eq.lhs;
                Expr.Literal label;
                if (eq.rhs instanceof Expr.Literal) {
                    label = (Expr.Literal) eq.rhs;
                } else if (eq.lhs instanceof Expr.Literal) {
                    label = (Expr.Literal) eq.lhs;
                    lhs = eq.rhs;
                } else {
                    break;
                }
                if (operand == null) operand = lhs;
                else if (!sameOperand(operand, lhs)) break;
                if (labels.contains(label)) break;
                tests.add(test);
                labels.add(label);
                targets.add(trueSucc[test]);
                fallback = succs[test][0] == trueSucc[test] ? succs[test][1] : succs[test][0];
                test = fallback;
                if (test == NONE || loops.containsKey(test)) break;
            }
            if (tests.size() < 2) return null;
            int last = tests.get(tests.size() - 1);
            fallback = succs[last][0] == trueSucc[last] ? succs[last][1] : succs[last][0];

            int follow = ipdom[cur];
            if (follow != NONE && ctx.loop != null && !ctx.loop.contains(follow)) follow = NONE;
            Set<Integer> testSet = new HashSet<>(tests);
            Set<Integer> targetSet = new LinkedHashSet<>(targets);
            if (targetSet.contains(fallback) || testSet.contains(fallback)) return null;
            boolean hasDefault = fallback != follow && fallback != stop && fallback != ctx.breakTarget;
            List<Integer> bodies = new ArrayList<>(targetSet);
            if (hasDefault) bodies.add(fallback);
            for (int body : bodies) {
                if (testSet.contains(body) || placed[body] || body == follow) return null;
                for (int p : preds[body]) {
                    if (!testSet.contains(p)) return null;
                }
            }

            for (int t : tests) placed[t] = true;
            int caseStop = follow != NONE ? follow : stop;
            Ctx inner = new Ctx(follow, ctx.continueTarget, ctx.loop);
            List<Region.Case> cases = new ArrayList<>();
            for (int body : bodies) {
                List<Expr.Literal> caseLabels = new ArrayList<>();
                for (int i = 0; i < targets.size(); i++) {
                    if (targets.get(i) == body) caseLabels.add(labels.get(i));
                }
                List<Region> stmts = new ArrayList<>(seq(body, caseStop, inner, NONE).children);
                if (stmts.isEmpty() || !stmts.get(stmts.size() - 1).isTerminal()) stmts.add(Region.Break.INSTANCE);
                cases.add(new Region.Case(caseLabels, new Region.Sequence(stmts)));
            }
            Region.Switch region = new Region.Switch(operand, cases);
            for (int t : tests) own(t, region);
            next[0] = follow;
            return region;
        }

        private boolean sameOperand(Expr a, Expr b) {
            if (a instanceof Expr.LocalRef) return a.equals(b);
            return a == b;
        }
    }
}
