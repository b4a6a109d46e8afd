package io.github.eutro.ncs2nss.test;

import io.github.eutro.ncs2nss.core.Diagnostic;
import io.github.eutro.ncs2nss.core.DiagnosticKind;
import io.github.eutro.ncs2nss.core.Diagnostics;
import io.github.eutro.ncs2nss.core.repair.OutputRepairProcessor;
import io.github.eutro.ncs2nss.core.repair.RepairConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RepairTest {
    private static final String UNCLOSED = "void main() {\n"
            + "    if (TRUE) {\n"
            + "        PrintString(\"a\");\n";

    private static String lines(String... lines) {
        return String.join("\n", lines) + "\n";
    }

    @Test
    void testMissingBraces() {
        Diagnostics diagnostics = new Diagnostics();
        RepairConfig config = RepairConfig.createDefault();
        String repaired = new OutputRepairProcessor(config, diagnostics).run(UNCLOSED);

        assertEquals(UNCLOSED + "}\n}\n", repaired);
        assertTrue(config.isRepairsApplied());
        assertEquals(1, diagnostics.count(DiagnosticKind.REPAIR_APPLIED));
        Diagnostic repair = diagnostics.list().get(0);
        assertTrue(repair.message.contains("Added 2 missing closing brace(s)"), repair.message);
        // the record is only kept when asked for
        assertTrue(config.getAppliedRepairs().isEmpty());
    }

    @Test
    void testVerboseRecord() {
        RepairConfig config = RepairConfig.createComprehensive();
        OutputRepairProcessor.repair(UNCLOSED, config);
        assertTrue(config.getAppliedRepairs().contains("Added 2 missing closing brace(s)"), config.getAppliedRepairs().toString());
        assertTrue(config.getAppliedRepairs().contains("Pass 1: Applied repairs"), config.getAppliedRepairs().toString());
        assertFalse(config.getAppliedRepairs().contains("Pass 2: Applied repairs"), config.getAppliedRepairs().toString());
    }

    @Test
    void testIdempotent() {
        String[] inputs = {
                UNCLOSED,
                lines("integer GetValue(str, unknown, object int) {", "    x = (foo)y", "    return x"),
                lines("void main() {", "    if x > 0 {", "        y = a * b + c;", "    }", "}"),
                Utils.decompile(Utils.dispatch()),
        };
        for (String input : inputs) {
            String once = OutputRepairProcessor.repair(input, RepairConfig.createDefault());
            RepairConfig again = RepairConfig.createDefault();
            assertEquals(once, OutputRepairProcessor.repair(once, again));
            assertFalse(again.isRepairsApplied(), once);
        }
    }

    @Test
    void testCleanOutputUntouched() {
        byte[][] scripts = {Utils.countingLoop(), Utils.dispatch(), Utils.delayedPrint(), Utils.printedGlobal()};
        for (byte[] script : scripts) {
            String source = Utils.decompile(script);
            RepairConfig config = RepairConfig.createDefault();
            assertEquals(source, OutputRepairProcessor.repair(source, config));
            assertFalse(config.isRepairsApplied(), source);
        }
    }

    @Test
    void testMissingSemicolons() {
        String repaired = OutputRepairProcessor.repair(lines(
                "void main() {",
                "    int x = 1",
                "    // a comment",
                "    switch (x) {",
                "        case 1:",
                "            x = 2",
                "            break;",
                "        default:",
                "            break;",
                "    }",
                "}"), RepairConfig.createMinimal());
        assertTrue(repaired.contains("    int x = 1;\n"), repaired);
        assertTrue(repaired.contains("            x = 2;\n"), repaired);
        assertTrue(repaired.contains("    // a comment\n"), repaired);
        assertTrue(repaired.contains("        case 1:\n"), repaired);
        assertTrue(repaired.contains("        default:\n"), repaired);
    }

    @Test
    void testExtraBracesOnlyWarned() {
        String input = lines("void main() {", "}", "}");
        RepairConfig config = RepairConfig.createComprehensive();
        assertEquals(input, OutputRepairProcessor.repair(input, config));
        assertFalse(config.isRepairsApplied());
        assertTrue(config.getAppliedRepairs().stream().anyMatch(s -> s.startsWith("Warning: Found 1 extra")),
                config.getAppliedRepairs().toString());
    }

    @Test
    void testCasts() {
        Diagnostics diagnostics = new Diagnostics();
        String repaired = new OutputRepairProcessor(RepairConfig.createDefault(), diagnostics).run(lines(
                "    x = (foo)y;",
                "    z = (int)w;",
                "    if (bDone) return;",
                "    PrintString(s);"));
        assertEquals(lines(
                "    x = y;",
                "    z = (int)w;",
                "    if (bDone) return;",
                "    PrintString(s);"), repaired);
        assertEquals(1, diagnostics.count(DiagnosticKind.UNKNOWN_CAST_TYPE));
    }

    @Test
    void testExpressions() {
        String repaired = OutputRepairProcessor.repair(lines(
                "    x = a + b * c + d;",
                "    y = a * b + c;",
                "    z = a + b / c;",
                "    w = a + b + c;",
                "    PrintString(\"a + b * c + d\");"), RepairConfig.createDefault());
        assertEquals(lines(
                "    x = a + (b * c) + d;",
                "    y = (a * b) + c;",
                "    z = a + (b / c);",
                "    w = a + b + c;",
                "    PrintString(\"a + b * c + d\");"), repaired);
    }

    @Test
    void testControlFlow() {
        // the headers are not closed here
        RepairConfig config = RepairConfig.createDefault();
        config.setSyntaxRepair(false);
        String repaired = OutputRepairProcessor.repair(lines(
                "    if x > 0 {",
                "    } else if y {",
                "    while (a) && (b) {",
                "    for (i = 0;i < 3;i++) {",
                "    return 1"), config);
        assertEquals(lines(
                "    if (x > 0) {",
                "    } else if (y) {",
                "    while ((a) && (b)) {",
                "    for (i = 0; i < 3; i++) {",
                "    return 1;"), repaired);
    }

    @Test
    void testFunctionSignatures() {
        Diagnostics diagnostics = new Diagnostics();
        String repaired = new OutputRepairProcessor(RepairConfig.createDefault(), diagnostics).run(lines(
                "integer GetValue(str, unknown, object int) {",
                "}",
                "void Helper(int a, float b = 1.0);",
                "vec Where(int value, int);"));
        assertEquals(lines(
                "int GetValue(string text, int value, object target) {",
                "}",
                "void Helper(int a, float b = 1.0);",
                "vector Where(int value, int value2);"), repaired);
        assertTrue(diagnostics.has(DiagnosticKind.UNKNOWN_SIGNATURE_TYPE));
    }

    @Test
    void testMinimalLeavesTheRest() {
        String input = lines("void main() {", "    x = (foo)y;", "    if x {");
        String repaired = OutputRepairProcessor.repair(input, RepairConfig.createMinimal());
        assertTrue(repaired.contains("(foo)y"), repaired);
        assertTrue(repaired.contains("    if x {"), repaired);
        assertTrue(repaired.endsWith("}\n}\n"), repaired);
    }

    @Test
    void testPassLimit() {
        RepairConfig config = RepairConfig.createDefault();
        config.setMaxRepairPasses(0);
        assertEquals(UNCLOSED, OutputRepairProcessor.repair(UNCLOSED, config));
        assertFalse(config.isRepairsApplied());
        assertThrows(IllegalArgumentException.class, () -> config.setMaxRepairPasses(-1));
    }

    @Test
    void testLineEndingsNormalized() {
        assertEquals("int a;\nint b;\n", OutputRepairProcessor.repair("int a;\r\nint b;\r\n", RepairConfig.createDefault()));
        assertEquals("", OutputRepairProcessor.repair("", RepairConfig.createDefault()));
    }

    @Test
    void testCopyStartsEmpty() {
        RepairConfig config = RepairConfig.createComprehensive();
        config.setTypeRepair(false);
        OutputRepairProcessor.repair(UNCLOSED, config);
        RepairConfig copy = config.copy();
        assertFalse(copy.isTypeRepair());
        assertTrue(copy.isVerboseLogging());
        assertTrue(copy.getAppliedRepairs().isEmpty());
        assertFalse(copy.isRepairsApplied());
    }
}
