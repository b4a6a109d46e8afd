package io.github.eutro.ncs2nss.core.passes.opts;

import io.github.eutro.ncs2nss.core.ast.*;
import io.github.eutro.ncs2nss.core.cfg.Subroutine;
import io.github.eutro.ncs2nss.core.ext.CommonExts;
import io.github.eutro.ncs2nss.core.passes.InPlaceIRPass;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Tidies a structured body into the shapes a programmer would have written.
 * <ul>
 *     <li>counting {@code while} loops become {@code for} loops;</li>
 *     <li>an {@code else} after a {@code then} that cannot complete is hoisted after the {@code if};</li>
 *     <li>a declaration followed by its first assignment becomes an initialized declaration;</li>
 *     <li>the final {@code return;} of a {@code void} function is dropped.</li>
 * </ul>
 */
public class SimplifyRegions implements InPlaceIRPass<Subroutine> {
    public static final SimplifyRegions INSTANCE = new SimplifyRegions();

    @Override
    public void runInPlace(Subroutine sub) {
        Region body = sub.getNullable(CommonExts.BODY);
        if (body == null) return;
        List<Region> stmts = Region.statements(simplify(body));
        SubroutineSignature sig = sub.getNullable(CommonExts.SIGNATURE);
        boolean isVoid = sig == null || sig.getReturnType() == NssType.VOID || sub.getKind() == Subroutine.Kind.CLOSURE;
        if (isVoid && !stmts.isEmpty() && isBareReturn(stmts.get(stmts.size() - 1))) {
            stmts.remove(stmts.size() - 1);
        }
        sub.attachExt(CommonExts.BODY, new Region.Sequence(stmts));
    }

    private static boolean isBareReturn(Region region) {
        return region instanceof Region.Return && ((Region.Return) region).value == null;
    }

    /**
     * Simplify a region and everything under it.
     *
     * @param region The region.
     * @return The simplified region, which may be the same object.
     */
    public static Region simplify(Region region) {
        switch (region.kind) {
            case SEQUENCE:
                return new Region.Sequence(simplifyList(((Region.Sequence) region).children));
            case IF: {
                Region.If anIf = (Region.If) region;
                Region then = simplify(anIf.thenBranch);
                Region otherwise = anIf.elseBranch == null ? null : simplify(anIf.elseBranch);
                if (otherwise != null && isEmpty(otherwise)) otherwise = null;
                if (isEmpty(then) && otherwise != null) {
                    return new Region.If(Expr.negate(anIf.condition), otherwise, null);
                }
                return new Region.If(anIf.condition, then, otherwise);
            }
            case WHILE: {
                Region.While loop = (Region.While) region;
                return new Region.While(loop.condition, simplify(loop.body));
            }
            case DO_WHILE: {
                Region.DoWhile loop = (Region.DoWhile) region;
                return new Region.DoWhile(simplify(loop.body), loop.condition);
            }
            case FOR: {
                Region.For loop = (Region.For) region;
                return new Region.For(loop.init, loop.condition, loop.step, simplify(loop.body));
            }
            case SWITCH: {
                Region.Switch sw = (Region.Switch) region;
                List<Region.Case> cases = new ArrayList<>();
                for (Region.Case c : sw.cases) {
                    cases.add(new Region.Case(c.labels, new Region.Sequence(simplifyList(Region.statements(c.body)))));
                }
                return new Region.Switch(sw.selector, cases);
            }
            default:
                return region;
        }
    }

    private static boolean isEmpty(Region region) {
        return region instanceof Region.Sequence && Region.statements(region).isEmpty();
    }

    private static List<Region> simplifyList(List<Region> in) {
        List<Region> out = new ArrayList<>();
        for (Region child : in) {
            Region simple = simplify(child);
            if (simple instanceof Region.Sequence) {
                for (Region stmt : ((Region.Sequence) simple).children) append(out, stmt);
            } else {
                append(out, simple);
            }
        }
        return out;
    }

    private static void append(List<Region> out, Region stmt) {
        if (stmt instanceof Region.If) {
            Region.If anIf = (Region.If) stmt;
            if (anIf.elseBranch != null && anIf.thenBranch.isTerminal()) {
                out.add(new Region.If(anIf.condition, anIf.thenBranch, null));
                for (Region s : Region.statements(anIf.elseBranch)) append(out, s);
                return;
            }
            if (anIf.elseBranch != null && isLoneTerminator(anIf.elseBranch)) {
                out.add(new Region.If(Expr.negate(anIf.condition), anIf.elseBranch, null));
                for (Region s : Region.statements(anIf.thenBranch)) append(out, s);
                return;
            }
        }
        if (stmt instanceof Region.While) {
            Region loop = toFor((Region.While) stmt, out);
            if (loop != null) {
                out.add(loop);
                return;
            }
        }
        if (stmt instanceof Region.Statement && !out.isEmpty() && out.get(out.size() - 1) instanceof Region.Declare) {
            Region.Declare decl = (Region.Declare) out.get(out.size() - 1);
            Expr.LocalRef target = plainAssignTo(((Region.Statement) stmt).expr);
            if (decl.init == null && target != null && target.slot == decl.slot) {
                Expr value = ((Expr.Assign) ((Region.Statement) stmt).expr).value;
                if (!value.references(decl.slot)) {
                    out.set(out.size() - 1, new Region.Declare(decl.slot, value));
                    return;
                }
            }
        }
        out.add(stmt);
    }

    private static boolean isLoneTerminator(Region region) {
        List<Region> stmts = Region.statements(region);
        return stmts.size() == 1 && stmts.get(0).isTerminal();
    }

    @Nullable
    private static Expr.LocalRef plainAssignTo(Expr expr) {
        if (!(expr instanceof Expr.Assign)) return null;
        Expr.Assign assign = (Expr.Assign) expr;
        if (assign.compound != null || !(assign.target instanceof Expr.LocalRef)) return null;
        return (Expr.LocalRef) assign.target;
    }

    /**
     * Turn {@code while (x < n) { ...; x++; }} into a {@code for}, taking the preceding
     * assignment of {@code x} from {@code out} as the initializer.
     *
     * @return The loop, or null if it does not count.
     */
    @Nullable
    private static Region toFor(Region.While loop, List<Region> out) {
        List<Region> body = Region.statements(loop.body);
        if (body.isEmpty() || !(body.get(body.size() - 1) instanceof Region.Statement)) return null;
        Expr step = ((Region.Statement) body.get(body.size() - 1)).expr;
        LocalSlot counter = stepped(step);
        if (counter == null) return null;
        List<LocalSlot> used = new ArrayList<>();
        loop.condition.collectSlots(used);
        if (used.size() != 1 || used.get(0) != counter) return null;
        if (hasOwnContinue(loop.body)) return null;

        Expr init = null;
        if (!out.isEmpty()) {
            Region prev = out.get(out.size() - 1);
            if (prev instanceof Region.Statement) {
                Expr.LocalRef target = plainAssignTo(((Region.Statement) prev).expr);
                if (target != null && target.slot == counter) {
                    init = ((Region.Statement) prev).expr;
                    out.remove(out.size() - 1);
                }
            } else if (prev instanceof Region.Declare && ((Region.Declare) prev).slot == counter
                    && ((Region.Declare) prev).init != null) {
                Region.Declare decl = (Region.Declare) prev;
                init = new Expr.Assign(new Expr.LocalRef(counter), decl.init);
                out.set(out.size() - 1, new Region.Declare(counter, null));
            }
        }
        body.remove(body.size() - 1);
        return new Region.For(init, loop.condition, step, new Region.Sequence(body));
    }

    @Nullable
    private static LocalSlot stepped(Expr step) {
        if (step instanceof Expr.IncDec) {
            Expr target = ((Expr.IncDec) step).target;
            return target instanceof Expr.LocalRef ? ((Expr.LocalRef) target).slot : null;
        }
        if (!(step instanceof Expr.Assign) || !(((Expr.Assign) step).target instanceof Expr.LocalRef)) return null;
        Expr.Assign assign = (Expr.Assign) step;
        Expr.LocalRef target = (Expr.LocalRef) assign.target;
        if (assign.compound != null) {
            boolean additive = assign.compound == Operator.ADD || assign.compound == Operator.SUB;
            return additive && assign.value instanceof Expr.Literal ? target.slot : null;
        }
        Expr value = ((Expr.Assign) step).value;
        if (!(value instanceof Expr.BinaryOp)) return null;
        Expr.BinaryOp op = (Expr.BinaryOp) value;
        if ((op.op != Operator.ADD && op.op != Operator.SUB) || !target.equals(op.lhs) || !(op.rhs instanceof Expr.Literal)) {
            return null;
        }
        return target.slot;
    }

    private static boolean hasOwnContinue(Region region) {
        switch (region.kind) {
            case CONTINUE:
                return true;
            case SEQUENCE:
                for (Region child : ((Region.Sequence) region).children) {
                    if (hasOwnContinue(child)) return true;
                }
                return false;
            case IF: {
                Region.If anIf = (Region.If) region;
                return hasOwnContinue(anIf.thenBranch) || anIf.elseBranch != null && hasOwnContinue(anIf.elseBranch);
            }
            case SWITCH:
                for (Region.Case c : ((Region.Switch) region).cases) {
                    if (hasOwnContinue(c.body)) return true;
                }
                return false;
            default:
                return false;
        }
    }
}
