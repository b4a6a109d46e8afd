package io.github.eutro.ncs2nss.core.passes.meta;

import io.github.eutro.ncs2nss.core.DiagnosticKind;
import io.github.eutro.ncs2nss.core.cfg.BasicBlock;
import io.github.eutro.ncs2nss.core.cfg.ControlFlowGraph;
import io.github.eutro.ncs2nss.core.cfg.Edge;
import io.github.eutro.ncs2nss.core.cfg.Subroutine;
import io.github.eutro.ncs2nss.core.ext.CommonExts;
import io.github.eutro.ncs2nss.core.ext.MetadataState;
import io.github.eutro.ncs2nss.core.ncs.Instruction;
import io.github.eutro.ncs2nss.core.ncs.InstructionStream;
import io.github.eutro.ncs2nss.core.ncs.Opcode;
import io.github.eutro.ncs2nss.core.passes.InPlaceIRPass;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.*;

/**
 * Partitions a graph into subroutines, and finds the entry function and the globals initializer.
 * <p>
 * Subroutines start at block 0, at every call target and at every deferred action saved by {@code STORE_STATE}.
 * Each block belongs to the first subroutine, in block order, that reaches it without following calls.
 * Blocks no subroutine reaches are reported as {@link DiagnosticKind#UNREACHABLE_CODE} and left out.
 * <p>
 * Attaches {@link CommonExts#SUBROUTINES}, {@link CommonExts#SUBROUTINE_BY_ENTRY},
 * {@link CommonExts#MAIN_SUBROUTINE} and, if there is one, {@link CommonExts#GLOBALS_SUBROUTINE}.
 */
public class FindSubroutines implements InPlaceIRPass<ControlFlowGraph> {
    private static final Logger LOGGER = System.getLogger(FindSubroutines.class.getName());

    public static final FindSubroutines INSTANCE = new FindSubroutines();

    private static final Set<Opcode> STUB_OPCODES = EnumSet.of(Opcode.RSADD, Opcode.JSR, Opcode.RETN, Opcode.MOVSP, Opcode.NOP);

    @Override
    public void runInPlace(ControlFlowGraph graph) {
        TreeSet<Integer> entries = new TreeSet<>();
        Set<Integer> closures = new HashSet<>();
        entries.add(0);
        for (BasicBlock block : graph.getBlocks()) {
            if (block.getCallee() != -1) entries.add(block.getCallee());
            if (block.getClosure() != -1) {
                entries.add(block.getClosure());
                closures.add(block.getClosure());
            }
        }

        int[] owner = new int[graph.size()];
        Arrays.fill(owner, -1);
        List<Subroutine> subs = new ArrayList<>();
        Map<Integer, Subroutine> byEntry = new TreeMap<>();
        for (int entry : entries) {
            if (owner[entry] != -1) continue;
            List<Integer> members = new ArrayList<>();
            Deque<Integer> queue = new ArrayDeque<>();
            queue.add(entry);
            owner[entry] = entry;
            while (!queue.isEmpty()) {
                int b = queue.poll();
                members.add(b);
                for (Edge edge : graph.get(b).getEdges()) {
                    int t = edge.target;
                    if (t == BasicBlock.EXIT || owner[t] != -1 || entries.contains(t)) continue;
                    owner[t] = entry;
                    queue.add(t);
                }
            }
            Subroutine sub = new Subroutine(graph, Subroutine.Kind.FUNCTION, entry, members);
            sub.attachExt(CommonExts.METADATA_STATE, new MetadataState());
            if (closures.contains(entry)) {
                sub.setKind(Subroutine.Kind.CLOSURE);
            } else if (findOpcode(sub, Opcode.SAVEBP) != -1) {
                sub.setKind(Subroutine.Kind.GLOBALS);
            } else if (entry == 0 && isStub(sub)) {
                sub.setKind(Subroutine.Kind.ENTRY_STUB);
            }
            subs.add(sub);
            byEntry.put(entry, sub);
        }

        for (int b = 0; b < owner.length; b++) {
            if (owner[b] == -1) {
                graph.getExtOrThrow(CommonExts.DIAGNOSTICS).report(DiagnosticKind.UNREACHABLE_CODE,
                        graph.offsetOf(b), "Block " + b + " is unreachable and was dropped");
            }
        }

        Subroutine globals = null;
        for (Subroutine sub : subs) {
            if (sub.getKind() == Subroutine.Kind.GLOBALS) {
                globals = sub;
                break;
            }
        }
        Subroutine main = byEntry.get(0);
        if (globals != null) {
            graph.attachExt(CommonExts.GLOBALS_SUBROUTINE, globals);
            int callee = firstCallAfter(globals, findOpcode(globals, Opcode.SAVEBP));
            if (callee != -1) main = byEntry.get(callee);
            else if (main == globals) main = null;
        } else if (main.getKind() == Subroutine.Kind.ENTRY_STUB) {
            main = byEntry.get(firstCallAfter(main, -1));
        }
        if (main == null || main.getKind() != Subroutine.Kind.FUNCTION) {
            throw new IllegalStateException("No entry function found");
        }

        graph.attachExt(CommonExts.SUBROUTINES, Collections.unmodifiableList(subs));
        graph.attachExt(CommonExts.SUBROUTINE_BY_ENTRY, Collections.unmodifiableMap(byEntry));
        graph.attachExt(CommonExts.MAIN_SUBROUTINE, main);
        LOGGER.log(Level.DEBUG, "Found subroutines {0}, entry function {1}", subs, main);
    }

    private static boolean isStub(Subroutine sub) {
        InstructionStream code = sub.getGraph().getCode();
        int calls = 0;
        for (int l = 0; l < sub.size(); l++) {
            BasicBlock block = sub.basicBlock(l);
            for (int i = block.getFirst(); i <= block.getLast(); i++) {
                Opcode op = code.get(i).getOpcode();
                if (!STUB_OPCODES.contains(op)) return false;
                if (op == Opcode.JSR) calls++;
            }
        }
        return calls == 1;
    }

    /**
     * Find the first instruction with an opcode, in instruction order.
     *
     * @param sub The subroutine.
     * @param op  The opcode.
     * @return The instruction index, or -1.
     */
    static int findOpcode(Subroutine sub, Opcode op) {
        int found = -1;
        for (int l = 0; l < sub.size(); l++) {
            BasicBlock block = sub.basicBlock(l);
            for (int i = block.getFirst(); i <= block.getLast(); i++) {
                if (sub.getGraph().getCode().get(i).getOpcode() == op && (found == -1 || i < found)) {
                    found = i;
                }
            }
        }
        return found;
    }

    private static int firstCallAfter(Subroutine sub, int insn) {
        int best = -1;
        int bestCallee = -1;
        for (int l = 0; l < sub.size(); l++) {
            BasicBlock block = sub.basicBlock(l);
            Instruction term = block.terminator(sub.getGraph().getCode());
            if (block.getCallee() != -1 && term.getIndex() > insn && (best == -1 || term.getIndex() < best)) {
                best = term.getIndex();
                bestCallee = block.getCallee();
            }
        }
        return bestCallee;
    }
}
