package io.github.eutro.ncs2nss.core.passes.meta;

import io.github.eutro.ncs2nss.core.actions.SignatureResolver;
import io.github.eutro.ncs2nss.core.actions.SignatureTable;
import io.github.eutro.ncs2nss.core.ast.LocalSlot;
import io.github.eutro.ncs2nss.core.ast.NssType;
import io.github.eutro.ncs2nss.core.ast.SubroutineSignature;
import io.github.eutro.ncs2nss.core.cfg.BasicBlock;
import io.github.eutro.ncs2nss.core.cfg.ControlFlowGraph;
import io.github.eutro.ncs2nss.core.cfg.Subroutine;
import io.github.eutro.ncs2nss.core.ext.CommonExts;
import io.github.eutro.ncs2nss.core.ncs.Instruction;
import io.github.eutro.ncs2nss.core.ncs.InstructionStream;
import io.github.eutro.ncs2nss.core.ncs.TypeQualifier;
import io.github.eutro.ncs2nss.core.passes.InPlaceIRPass;
import org.jetbrains.annotations.NotNull;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.*;

/**
 * Works out how many parameter and return cells each subroutine has, from stack depths alone,
 * and attaches a {@link SubroutineSignature} to each as {@link CommonExts#SIGNATURE}.
 * <p>
 * A subroutine pops its own parameters, so the depth at its {@code RETN}, relative to its entry,
 * is minus its parameter count. Its return value is whatever it writes below its parameters.
 * Since calls pop the callee's parameters, the counts are iterated to a fixed point.
 * <p>
 * Functions other than the entry function are named {@code sub1}, {@code sub2}, and so on, in offset order.
 */
public class InferSubroutineSignatures implements InPlaceIRPass<ControlFlowGraph> {
    private static final Logger LOGGER = System.getLogger(InferSubroutineSignatures.class.getName());
    private static final int MAX_ITERATIONS = 64;
    private static final int UNKNOWN = Integer.MIN_VALUE;

    @NotNull
    private final SignatureTable table;

    public InferSubroutineSignatures(@NotNull SignatureTable table) {
        this.table = table;
    }

    @Override
    public void runInPlace(ControlFlowGraph graph) {
        List<Subroutine> subs = graph.getExtOrThrow(CommonExts.SUBROUTINES);
        Subroutine main = graph.getExtOrThrow(CommonExts.MAIN_SUBROUTINE);

        Map<Integer, Integer> params = new HashMap<>();
        Map<Integer, Integer> returns = new HashMap<>();
        for (Subroutine sub : subs) params.put(sub.getEntry(), 0);
        boolean changed = true;
        for (int iter = 0; changed && iter < MAX_ITERATIONS; iter++) {
            changed = false;
            for (Subroutine sub : subs) {
                int[] pr = analyse(sub, params);
                if (pr[0] != params.get(sub.getEntry())) {
                    params.put(sub.getEntry(), pr[0]);
                    changed = true;
                }
                returns.put(sub.getEntry(), pr[1]);
            }
        }
        if (changed) {
            LOGGER.log(Level.WARNING, "Parameter counts did not settle after {0} iterations", MAX_ITERATIONS);
        }

        int counter = 1;
        for (Subroutine sub : subs) {
            String name;
            if (sub == main) {
                name = "main";
            } else if (sub.getKind() == Subroutine.Kind.FUNCTION) {
                name = "sub" + counter++;
            } else {
                name = sub.getKind().name().toLowerCase(Locale.ROOT);
            }
            int offset = sub.getOffset();
            List<LocalSlot> paramSlots = new ArrayList<>();
            for (int i = 0; i < params.get(sub.getEntry()); i++) {
                paramSlots.add(new LocalSlot(LocalSlot.Kind.PARAM, NssType.ANY, offset));
            }
            List<LocalSlot> returnSlots = new ArrayList<>();
            for (int i = 0; i < returns.get(sub.getEntry()); i++) {
                returnSlots.add(new LocalSlot(LocalSlot.Kind.RETURN, NssType.ANY, offset));
            }
            SubroutineSignature sig = new SubroutineSignature(name, paramSlots, returnSlots);
            sub.attachExt(CommonExts.SIGNATURE, sig);
            LOGGER.log(Level.DEBUG, "{0}: {1}", sub, sig);
        }
    }

    /**
     * Replay the stack depth through a subroutine.
     *
     * @return The parameter and return cell counts.
     */
    private int[] analyse(Subroutine sub, Map<Integer, Integer> params) {
        InstructionStream code = sub.getGraph().getCode();
        int[][] succs = sub.successors();
        int[] entryDepth = new int[sub.size()];
        Arrays.fill(entryDepth, UNKNOWN);
        entryDepth[0] = 0;
        Deque<Integer> work = new ArrayDeque<>();
        work.add(0);
        int retnDepth = UNKNOWN;
        int lowestWrite = 0;
        while (!work.isEmpty()) {
            int l = work.poll();
            BasicBlock block = sub.basicBlock(l);
            int depth = entryDepth[l];
            for (int i = block.getFirst(); i <= block.getLast(); i++) {
                Instruction insn = code.get(i);
                switch (insn.getOpcode()) {
                    case CPDOWNSP:
                        lowestWrite = Math.min(lowestWrite, depth + insn.getA() / 4);
                        break;
                    case RETN:
                        if (retnDepth == UNKNOWN) retnDepth = depth;
                        break;
                    default:
                        break;
                }
                depth += delta(insn, block, params);
            }
            for (int s : succs[l]) {
                if (entryDepth[s] == UNKNOWN) {
                    entryDepth[s] = depth;
                    work.add(s);
                }
            }
            if (succs[l].length == 0 && retnDepth == UNKNOWN && block.getEdges().size() == 1
                    && block.getEdges().get(0).target == BasicBlock.EXIT) {
                retnDepth = depth;
            }
        }
        int paramCells = retnDepth == UNKNOWN ? 0 : Math.max(0, -retnDepth);
        int returnCells = lowestWrite < -paramCells ? -paramCells - lowestWrite : 0;
        return new int[]{paramCells, returnCells};
    }

    private int delta(Instruction insn, BasicBlock block, Map<Integer, Integer> params) {
        TypeQualifier q = insn.getQualifier();
        switch (insn.getOpcode()) {
            case RSADD:
            case CONST:
                return 1;
            case CPTOPSP:
            case CPTOPBP:
                return insn.getB() / 4;
            case ACTION:
                return SignatureResolver.stackDelta(table, insn.getA(), insn.getB());
            case LOGAND:
            case LOGOR:
            case INCOR:
            case EXCOR:
            case BOOLAND:
            case GEQ:
            case GT:
            case LT:
            case LEQ:
            case SHLEFT:
            case SHRIGHT:
            case USHRIGHT:
            case MOD:
                return -1;
            case EQUAL:
            case NEQUAL:
                if (q == TypeQualifier.STRUCT_STRUCT) return 1 - 2 * (insn.getA() / 4);
                if (q == TypeQualifier.VECTOR_VECTOR) return -5;
                return -1;
            case ADD:
            case SUB:
            case MUL:
            case DIV:
                // vector op vector leaves one vector, a vector scaled by a float leaves the vector
                return q == TypeQualifier.VECTOR_VECTOR ? -3 : -1;
            case MOVSP:
                return insn.getA() / 4;
            case JZ:
            case JNZ:
                return -1;
            case JSR: {
                Integer p = params.get(block.getCallee());
                return p == null ? 0 : -p;
            }
            case DESTRUCT:
                return (insn.getC() - insn.getA()) / 4;
            default:
                return 0;
        }
    }
}
