package io.github.eutro.ncs2nss.core.passes.meta;

import io.github.eutro.ncs2nss.core.cfg.BasicBlock;
import io.github.eutro.ncs2nss.core.cfg.EdgeKind;
import io.github.eutro.ncs2nss.core.cfg.Subroutine;
import io.github.eutro.ncs2nss.core.ext.CommonExts;
import io.github.eutro.ncs2nss.core.ncs.Instruction;
import io.github.eutro.ncs2nss.core.ncs.InstructionStream;
import io.github.eutro.ncs2nss.core.ncs.Opcode;
import io.github.eutro.ncs2nss.core.passes.InPlaceIRPass;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Finds the branches that implement {@code &&} and {@code ||}, and removes them from the control flow.
 * <p>
 * The left operand is duplicated and tested; if the test decides the result, the jump skips
 * the right operand with the duplicate left on the stack:
 * <pre>
 *     [lhs]; CPTOPSP -4, 4; JZ join; [rhs]; LOGANDII; join: ...
 * </pre>
 * The testing block is {@link Subroutine#forceSuccessor(int, int) forced} into the right operand,
 * and the join is recorded in {@link CommonExts#SHORT_CIRCUIT_JOINS} with the block computing the operator.
 */
public class FindShortCircuits implements InPlaceIRPass<Subroutine> {
    public static final FindShortCircuits INSTANCE = new FindShortCircuits();

    @Override
    public void runInPlace(Subroutine sub) {
        InstructionStream code = sub.getGraph().getCode();
        int n = sub.size();
        int[][] succs = sub.successors().clone();
        List<List<Integer>> preds = new ArrayList<>(n);
        for (int i = 0; i < n; i++) preds.add(new ArrayList<>());
        for (int i = 0; i < n; i++) {
            for (int s : succs[i]) {
                if (!preds.get(s).contains(i)) preds.get(s).add(i);
            }
        }

        Map<Integer, Integer> joins = new TreeMap<>();
        for (int b = 0; b < n; b++) {
            BasicBlock block = sub.basicBlock(b);
            Instruction term = block.terminator(code);
            if (!term.getOpcode().isConditionalJump() || block.size() < 2 || succs[b].length != 2) continue;
            Instruction dup = code.get(block.getLast() - 1);
            if (dup.getOpcode() != Opcode.CPTOPSP || dup.getA() != -4 || dup.getB() != 4) continue;
            int rhs = succs[b][0];
            int join = succs[b][1];
            if (rhs == join || preds.get(rhs).size() != 1 || preds.get(join).size() != 2) continue;
            int op = preds.get(join).get(0) == b ? preds.get(join).get(1) : preds.get(join).get(0);
            BasicBlock opBlock = sub.basicBlock(op);
            if (opBlock.getEdges().size() != 1 || opBlock.getEdges().get(0).kind != EdgeKind.FALLTHROUGH) continue;
            Opcode expected = term.getOpcode() == Opcode.JZ ? Opcode.LOGAND : Opcode.LOGOR;
            if (opBlock.terminator(code).getOpcode() != expected) continue;
            sub.forceSuccessor(b, rhs);
            joins.put(join, op);
        }
        sub.attachExt(CommonExts.SHORT_CIRCUIT_JOINS, joins);
    }
}
