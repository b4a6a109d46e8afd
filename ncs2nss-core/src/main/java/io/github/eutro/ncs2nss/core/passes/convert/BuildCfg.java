package io.github.eutro.ncs2nss.core.passes.convert;

import io.github.eutro.ncs2nss.core.Diagnostics;
import io.github.eutro.ncs2nss.core.cfg.*;
import io.github.eutro.ncs2nss.core.ext.CommonExts;
import io.github.eutro.ncs2nss.core.ncs.Instruction;
import io.github.eutro.ncs2nss.core.ncs.InstructionStream;
import io.github.eutro.ncs2nss.core.ncs.MalformedBytecodeException;
import io.github.eutro.ncs2nss.core.ncs.NcsReader;
import io.github.eutro.ncs2nss.core.ncs.Opcode;
import io.github.eutro.ncs2nss.core.passes.IRPass;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * Splits an instruction stream into basic blocks.
 * <p>
 * Blocks start at the first instruction, at every jump or call target, and after every jump, call and return.
 * Conditional branches list their fallthrough edge first. A fresh {@link Diagnostics} is attached
 * to the graph as {@link CommonExts#DIAGNOSTICS}.
 */
public class BuildCfg implements IRPass<InstructionStream, ControlFlowGraph> {
    private static final Logger LOGGER = System.getLogger(BuildCfg.class.getName());

    public static final BuildCfg INSTANCE = new BuildCfg();

    @Override
    public ControlFlowGraph run(InstructionStream code) {
        if (code.size() == 0) {
            throw new MalformedBytecodeException("Script has no instructions", NcsReader.HEADER_SIZE);
        }

        BitSet leaders = new BitSet(code.size());
        leaders.set(0);
        for (Instruction insn : code) {
            Opcode op = insn.getOpcode();
            if (op.isJump()) {
                leaders.set(resolve(code, insn));
            }
            if (op.endsBlock() && insn.getIndex() + 1 < code.size()) {
                leaders.set(insn.getIndex() + 1);
            }
        }

        int[] blockStarts = leaders.stream().toArray();
        int[] blockOfInsn = new int[code.size()];
        for (int b = 0; b < blockStarts.length; b++) {
            int end = b + 1 < blockStarts.length ? blockStarts[b + 1] : code.size();
            for (int i = blockStarts[b]; i < end; i++) blockOfInsn[i] = b;
        }

        List<BasicBlock> blocks = new ArrayList<>(blockStarts.length);
        for (int b = 0; b < blockStarts.length; b++) {
            int first = blockStarts[b];
            int last = (b + 1 < blockStarts.length ? blockStarts[b + 1] : code.size()) - 1;
            Instruction term = code.get(last);
            int next = b + 1 < blockStarts.length ? b + 1 : BasicBlock.EXIT;
            List<Edge> edges = new ArrayList<>(2);
            int callee = -1;
            switch (term.getOpcode()) {
                case JMP:
                    edges.add(new Edge(EdgeKind.JUMP, blockOfInsn[resolve(code, term)]));
                    break;
                case JZ:
                    edges.add(new Edge(EdgeKind.BRANCH_TRUE, fallthrough(term, next)));
                    edges.add(new Edge(EdgeKind.BRANCH_FALSE, blockOfInsn[resolve(code, term)]));
                    break;
                case JNZ:
                    edges.add(new Edge(EdgeKind.BRANCH_FALSE, fallthrough(term, next)));
                    edges.add(new Edge(EdgeKind.BRANCH_TRUE, blockOfInsn[resolve(code, term)]));
                    break;
                case JSR:
                    callee = blockOfInsn[resolve(code, term)];
                    edges.add(new Edge(EdgeKind.CALL, fallthrough(term, next)));
                    break;
                case RETN:
                    edges.add(new Edge(EdgeKind.RETURN, BasicBlock.EXIT));
                    break;
                default:
                    // the last block may fall off the end of the code, which returns
                    edges.add(next == BasicBlock.EXIT
                            ? new Edge(EdgeKind.RETURN, BasicBlock.EXIT)
                            : new Edge(EdgeKind.FALLTHROUGH, next));
                    break;
            }
            int closure = -1;
            for (int i = first; i <= last; i++) {
                if (code.get(i).getOpcode() == Opcode.STORE_STATE) {
                    closure = closureEntry(code, blockOfInsn, i);
                }
            }
            blocks.add(ControlFlowGraph.block(b, first, last, edges, callee, closure));
        }

        ControlFlowGraph graph = ControlFlowGraph.of(code, blocks);
        graph.attachExt(CommonExts.DIAGNOSTICS, new Diagnostics());
        LOGGER.log(Level.DEBUG, "Built {0} blocks from {1} instructions", blocks.size(), code.size());
        return graph;
    }

    private static int fallthrough(Instruction term, int next) {
        if (next == BasicBlock.EXIT) {
            throw new UnresolvedJumpTargetException(term.getOffset(), term.getEnd());
        }
        return next;
    }

    private static int resolve(InstructionStream code, Instruction jump) {
        int target = jump.jumpTarget();
        int index = code.indexAt(target);
        if (index == -1) {
            throw new UnresolvedJumpTargetException(jump.getOffset(), target);
        }
        return index;
    }

    // STORE_STATE is followed by a JMP over the deferred code, which starts right after the JMP
    private static int closureEntry(InstructionStream code, int[] blockOfInsn, int storeState) {
        int jmp = storeState + 1;
        if (jmp + 1 >= code.size() || code.get(jmp).getOpcode() != Opcode.JMP) {
            throw new MalformedBytecodeException("STORE_STATE not followed by a jump over its action",
                    code.get(storeState).getOffset());
        }
        return blockOfInsn[jmp + 1];
    }
}
