package io.github.eutro.ncs2nss.test;

import io.github.eutro.ncs2nss.core.DiagnosticKind;
import io.github.eutro.ncs2nss.core.cfg.*;
import io.github.eutro.ncs2nss.core.ext.CommonExts;
import io.github.eutro.ncs2nss.core.ncs.GameVariant;
import io.github.eutro.ncs2nss.core.ncs.MalformedBytecodeException;
import io.github.eutro.ncs2nss.core.ncs.NcsReader;
import io.github.eutro.ncs2nss.core.passes.convert.BuildCfg;
import io.github.eutro.ncs2nss.core.passes.meta.FindSubroutines;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CfgTest {
    private static ControlFlowGraph build(byte[] bytes) {
        return BuildCfg.INSTANCE.run(NcsReader.read(bytes, GameVariant.K1));
    }

    @Test
    void testLoopEdges() {
        ControlFlowGraph graph = build(Utils.countingLoop());
        // stub call, stub return, main prologue, loop test, loop body, epilogue
        assertEquals(6, graph.size());

        BasicBlock call = graph.get(0);
        assertEquals(2, call.getCallee());
        assertEquals(1, call.target(EdgeKind.CALL));

        assertEquals(3, graph.get(2).target(EdgeKind.FALLTHROUGH));

        BasicBlock test = graph.get(3);
        assertTrue(test.isConditional());
        assertEquals(4, test.target(EdgeKind.BRANCH_TRUE));
        assertEquals(5, test.target(EdgeKind.BRANCH_FALSE));

        assertEquals(3, graph.get(4).target(EdgeKind.JUMP));
        assertEquals(BasicBlock.EXIT, graph.get(5).target(EdgeKind.RETURN));
        assertNotNull(graph.getNullable(CommonExts.DIAGNOSTICS));
    }

    @Test
    void testBlocksCoverEveryInstruction() {
        ControlFlowGraph graph = build(Utils.dispatch());
        int next = 0;
        for (BasicBlock block : graph.getBlocks()) {
            assertEquals(next, block.getFirst());
            assertEquals(block.getIndex(), graph.blockOf(block.getFirst()));
            next = block.getLast() + 1;
        }
        assertEquals(graph.getCode().size(), next);
    }

    @Test
    void testJumpIntoAnInstruction() {
        byte[] bytes = new NcsAssembler()
                .jmpBy(8)
                .consti(0)
                .retn()
                .toBytes();
        UnresolvedJumpTargetException e = assertThrows(UnresolvedJumpTargetException.class, () -> build(bytes));
        assertEquals(NcsReader.HEADER_SIZE, e.getOffset());
        assertEquals(NcsReader.HEADER_SIZE + 8, e.getTarget());
    }

    @Test
    void testCallOffTheEnd() {
        byte[] bytes = new NcsAssembler()
                .label("self")
                .jsr("self")
                .toBytes();
        assertThrows(UnresolvedJumpTargetException.class, () -> build(bytes));
    }

    @Test
    void testEmptyScript() {
        byte[] bytes = new NcsAssembler().toBytes();
        MalformedBytecodeException e = assertThrows(MalformedBytecodeException.class, () -> build(bytes));
        assertEquals(NcsReader.HEADER_SIZE, e.getOffset());
    }

    @Test
    void testSubroutineKinds() {
        ControlFlowGraph graph = build(Utils.printedGlobal());
        FindSubroutines.INSTANCE.run(graph);
        List<Subroutine> subs = graph.getExtOrThrow(CommonExts.SUBROUTINES);
        assertEquals(3, subs.size());
        assertEquals(Subroutine.Kind.ENTRY_STUB, subs.get(0).getKind());
        assertEquals(Subroutine.Kind.GLOBALS, subs.get(1).getKind());
        assertSame(subs.get(1), graph.getExtOrThrow(CommonExts.GLOBALS_SUBROUTINE));
        assertSame(subs.get(2), graph.getExtOrThrow(CommonExts.MAIN_SUBROUTINE));

        graph = build(Utils.delayedPrint());
        FindSubroutines.INSTANCE.run(graph);
        subs = graph.getExtOrThrow(CommonExts.SUBROUTINES);
        assertEquals(Subroutine.Kind.CLOSURE, subs.get(subs.size() - 1).getKind());
    }

    @Test
    void testUnreachableCodeReported() {
        byte[] bytes = Utils.withStub()
                .retn()
                .consti(1)
                .movsp(-4)
                .retn()
                .toBytes();
        ControlFlowGraph graph = build(bytes);
        FindSubroutines.INSTANCE.run(graph);
        assertTrue(graph.getExtOrThrow(CommonExts.DIAGNOSTICS).has(DiagnosticKind.UNREACHABLE_CODE));
    }
}
