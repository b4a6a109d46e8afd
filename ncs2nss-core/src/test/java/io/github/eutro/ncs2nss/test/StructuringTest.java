package io.github.eutro.ncs2nss.test;

import io.github.eutro.ncs2nss.core.DecompileOptions;
import io.github.eutro.ncs2nss.core.DiagnosticKind;
import io.github.eutro.ncs2nss.core.actions.SignatureTable;
import io.github.eutro.ncs2nss.core.ast.Region;
import io.github.eutro.ncs2nss.core.ast.Script;
import io.github.eutro.ncs2nss.core.cfg.ControlFlowGraph;
import io.github.eutro.ncs2nss.core.cfg.Subroutine;
import io.github.eutro.ncs2nss.core.ext.CommonExts;
import io.github.eutro.ncs2nss.core.ncs.GameVariant;
import io.github.eutro.ncs2nss.core.ncs.NcsReader;
import io.github.eutro.ncs2nss.core.ncs.Opcode;
import io.github.eutro.ncs2nss.core.passes.convert.BuildCfg;
import io.github.eutro.ncs2nss.core.passes.convert.CfgToScript;
import io.github.eutro.ncs2nss.core.util.GraphWalker;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static io.github.eutro.ncs2nss.core.ncs.TypeQualifier.INT;
import static io.github.eutro.ncs2nss.core.ncs.TypeQualifier.INT_INT;
import static org.junit.jupiter.api.Assertions.*;

public class StructuringTest {
    @Test
    void testSwitchPreferred() {
        String source = Utils.decompile(Utils.dispatch(), GameVariant.K1,
                DecompileOptions.builder().preferSwitches(true).build());
        assertTrue(source.contains("switch (int1) {"), source);
        assertTrue(source.contains("case 1:"), source);
        assertTrue(source.contains("case 2:"), source);
        assertTrue(source.contains("default:"), source);
        assertTrue(source.contains("break;"), source);
        assertFalse(source.contains("if ("), source);
    }

    @Test
    void testSwitchesDisabled() {
        String source = Utils.decompile(Utils.dispatch(), GameVariant.K1,
                DecompileOptions.builder().preferSwitches(false).build());
        assertFalse(source.contains("switch"), source);
        assertTrue(source.contains("if (int1 == 1) {"), source);
        assertTrue(source.contains("} else if (int1 == 2) {"), source);
        assertTrue(source.contains("} else {"), source);
    }

    @Test
    void testSwitchNeedsTwoTests() {
        byte[] bytes = Utils.withStub()
                .rsadd(INT)
                .consti(10)
                .action(Utils.RANDOM, 1)
                .cpdownsp(-8, 4)
                .movsp(-4)
                .cptopsp(-4, 4)
                .consti(1)
                .binary(Opcode.EQUAL, INT_INT)
                .jz("end")
                .consts("one")
                .action(Utils.PRINT_STRING, 1)
                .label("end")
                .movsp(-4)
                .retn()
                .toBytes();
        String source = Utils.decompile(bytes);
        assertFalse(source.contains("switch"), source);
        assertTrue(source.contains("if (int1 == 1) {"), source);
    }

    @Test
    void testDoWhile() {
        byte[] bytes = Utils.withStub()
                .rsadd(INT)
                .consti(0)
                .cpdownsp(-8, 4)
                .movsp(-4)
                .label("body")
                .cptopsp(-4, 4)
                .consti(1)
                .binary(Opcode.ADD, INT_INT)
                .cpdownsp(-8, 4)
                .movsp(-4)
                .cptopsp(-4, 4)
                .consti(5)
                .binary(Opcode.LT, INT_INT)
                .jnz("body")
                .movsp(-4)
                .retn()
                .toBytes();
        String source = Utils.decompile(bytes);
        assertTrue(source.contains("do {"), source);
        assertTrue(source.contains("} while (int1 < 5);"), source);
    }

    @Test
    void testWellStructuredCodeHasNoLeftovers() {
        Script script = Utils.recover(Utils.countingLoop(), GameVariant.K1, DecompileOptions.DEFAULT);
        assertFalse(script.diagnostics.has(DiagnosticKind.UNSTRUCTURED_REGION));
        assertFalse(script.diagnostics.has(DiagnosticKind.STACK_IMBALANCE));
        List<Region> body = Region.statements(script.getEntry().body);
        for (Region stmt : body) {
            assertNotEquals(Region.Kind.GOTO, stmt.kind);
            assertNotEquals(Region.Kind.LABEL, stmt.kind);
        }
        assertTrue(body.stream().anyMatch(r -> r.kind == Region.Kind.FOR || r.kind == Region.Kind.WHILE));
    }

    @Test
    void testSwitchWithThreeTests() {
        byte[] bytes = Utils.dispatch("one", "two", "three");
        String source = Utils.decompile(bytes, GameVariant.K1, DecompileOptions.builder().preferSwitches(true).build());
        assertTrue(source.contains("switch (int1) {"), source);
        assertTrue(source.contains("case 1:"), source);
        assertTrue(source.contains("case 2:"), source);
        assertTrue(source.contains("case 3:"), source);
        assertTrue(source.contains("PrintString(\"three\");"), source);
        assertTrue(source.contains("default:"), source);
        assertFalse(source.contains("if ("), source);

        source = Utils.decompile(bytes, GameVariant.K1, DecompileOptions.builder().preferSwitches(false).build());
        assertFalse(source.contains("switch"), source);
        assertTrue(source.contains("if (int1 == 1) {"), source);
        assertTrue(source.contains("} else if (int1 == 2) {"), source);
        assertTrue(source.contains("} else if (int1 == 3) {"), source);
        assertTrue(source.contains("} else {"), source);
    }

    /**
     * <pre>
     * int int1 = 0;
     * while (int1 < 10) {
     *     int1 = int1 + 1;
     *     [jump]
     *     PrintInteger(int1);
     * }
     * </pre>
     * where the jump goes to {@code target} when {@code int1 == limit}.
     */
    private static byte[] loopWithJump(int limit, String target) {
        return Utils.withStub()
                .rsadd(INT)
                .consti(0)
                .cpdownsp(-8, 4)
                .movsp(-4)
                .label("head")
                .cptopsp(-4, 4)
                .consti(10)
                .binary(Opcode.LT, INT_INT)
                .jz("done")
                .cptopsp(-4, 4)
                .consti(1)
                .binary(Opcode.ADD, INT_INT)
                .cpdownsp(-8, 4)
                .movsp(-4)
                .cptopsp(-4, 4)
                .consti(limit)
                .binary(Opcode.EQUAL, INT_INT)
                .jnz(target)
                .cptopsp(-4, 4)
                .action(Utils.PRINT_INTEGER, 1)
                .jmp("head")
                .label("done")
                .movsp(-4)
                .retn()
                .toBytes();
    }

    @Test
    void testBreak() {
        byte[] bytes = loopWithJump(8, "done");
        String source = Utils.decompile(bytes);
        assertTrue(source.contains("while (int1 < 10) {"), source);
        assertTrue(source.contains("if (int1 == 8) {"), source);
        assertTrue(source.contains("break;"), source);
        assertTrue(source.indexOf("break;") < source.indexOf("PrintInteger(int1);"), source);
        assertFalse(source.contains("goto"), source);
        assertFalse(Utils.recover(bytes, GameVariant.K1, DecompileOptions.DEFAULT)
                .diagnostics.has(DiagnosticKind.UNSTRUCTURED_REGION));
    }

    @Test
    void testEarlyContinue() {
        byte[] bytes = loopWithJump(5, "head");
        String source = Utils.decompile(bytes);
        assertTrue(source.contains("while (int1 < 10) {"), source);
        assertTrue(source.contains("if (int1 == 5) {"), source);
        assertTrue(source.contains("continue;"), source);
        assertTrue(source.indexOf("continue;") < source.indexOf("PrintInteger(int1);"), source);
        // the step is not the last statement, so this stays a while loop
        assertFalse(source.contains("for ("), source);
        assertFalse(source.contains("goto"), source);
    }

    /**
     * A cycle with two entries, which no loop statement can express:
     * <pre>
     * if (!int1) goto b;
     * a: PrintString("a"); if (!int1) return;
     * b: PrintString("b"); if (int1) goto a;
     * </pre>
     */
    private static byte[] twoEntryCycle() {
        return Utils.withStub()
                .rsadd(INT)
                .consti(0)
                .cpdownsp(-8, 4)
                .movsp(-4)
                .cptopsp(-4, 4)
                .jz("b")
                .label("a")
                .consts("a")
                .action(Utils.PRINT_STRING, 1)
                .cptopsp(-4, 4)
                .jz("done")
                .label("b")
                .consts("b")
                .action(Utils.PRINT_STRING, 1)
                .cptopsp(-4, 4)
                .jnz("a")
                .label("done")
                .movsp(-4)
                .retn()
                .toBytes();
    }

    @Test
    void testIrreducibleCycleGotosHaveLabels() {
        byte[] bytes = twoEntryCycle();
        Script script = Utils.recover(bytes, GameVariant.K1, DecompileOptions.DEFAULT);
        assertTrue(script.diagnostics.has(DiagnosticKind.UNSTRUCTURED_REGION));

        String source = Utils.decompile(bytes);
        Matcher gotos = Pattern.compile("// goto (label_[0-9a-f]+);").matcher(source);
        int count = 0;
        while (gotos.find()) {
            count++;
            String label = gotos.group(1);
            assertTrue(source.contains("// " + label + ":"), label + " is never placed in\n" + source);
        }
        assertTrue(count > 0, source);
        assertTrue(source.contains("PrintString(\"a\");"), source);
        assertTrue(source.contains("PrintString(\"b\");"), source);

        assertEquals(source, Utils.decompile(bytes));
    }

    @Test
    void testEveryReachableBlockHasOneOwner() {
        byte[][] scripts = {
                Utils.countingLoop(),
                Utils.dispatch("one", "two", "three"),
                Utils.delayedPrint(),
                loopWithJump(5, "head"),
                loopWithJump(8, "done"),
                twoEntryCycle(),
        };
        for (byte[] bytes : scripts) {
            ControlFlowGraph graph = BuildCfg.INSTANCE.run(NcsReader.read(bytes, GameVariant.K1));
            new CfgToScript(SignatureTable.forVariant(GameVariant.K1), DecompileOptions.DEFAULT).run(graph);
            for (Subroutine sub : graph.getExtOrThrow(CommonExts.SUBROUTINES)) {
                Map<Integer, Region> owners = sub.getNullable(CommonExts.REGION_OWNERS);
                if (owners == null) continue;
                Set<Integer> reachable = new HashSet<>();
                for (int l : GraphWalker.reversePostOrder(sub)) reachable.add(sub.block(l));
                assertEquals(sub.size(), owners.size(), sub.toString());
                assertTrue(owners.keySet().containsAll(reachable), sub.toString());
                for (int block : owners.keySet()) {
                    assertTrue(sub.contains(block), sub + " does not contain " + block);
                    assertNotNull(owners.get(block));
                }
            }
        }
    }
}
