package io.github.eutro.ncs2nss.test;

import io.github.eutro.ncs2nss.core.DecompileOptions;
import io.github.eutro.ncs2nss.core.DiagnosticKind;
import io.github.eutro.ncs2nss.core.Diagnostics;
import io.github.eutro.ncs2nss.core.actions.EngineFunctionSignature;
import io.github.eutro.ncs2nss.core.actions.SignatureResolver;
import io.github.eutro.ncs2nss.core.actions.SignatureTable;
import io.github.eutro.ncs2nss.core.ast.NssType;
import io.github.eutro.ncs2nss.core.ast.Script;
import io.github.eutro.ncs2nss.core.ncs.GameVariant;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SignatureTest {
    private static final DecompileOptions STRICT = DecompileOptions.builder().strictSignatures(true).build();

    @Test
    void testTablesLoad() {
        SignatureTable k1 = SignatureTable.forVariant(GameVariant.K1);
        EngineFunctionSignature delay = k1.get(Utils.DELAY_COMMAND);
        assertNotNull(delay);
        assertEquals("DelayCommand", delay.name);
        assertEquals(NssType.ACTION, delay.params.get(1).type);
        assertSame(k1, SignatureTable.forVariant(GameVariant.K1));
    }

    @Test
    void testFullTables() {
        SignatureTable k1 = SignatureTable.forVariant(GameVariant.K1);
        assertEquals(772, k1.size());
        for (int i = 0; i < k1.size(); i++) {
            assertNotNull(k1.get(i), "K1 routine " + i);
        }
        assertEquals("GetFirstPC", k1.get(Utils.GET_FIRST_PC).name);
        assertEquals("GetGlobalNumber", k1.get(580).name);
        assertEquals("GetLocalBoolean", k1.get(679).name);
        assertEquals("YavinHackCloseDoor", k1.get(771).name);

        SignatureTable k2 = SignatureTable.forVariant(GameVariant.K2);
        assertTrue(k2.size() > k1.size());
        assertEquals("GetFirstPC", k2.get(Utils.GET_FIRST_PC).name);
        assertEquals("GetScriptParameter", k2.get(768).name);
        assertEquals(NssType.INT, k2.get(768).returnType);
        assertNull(k1.get(768));
        assertEquals(k1.get(241).arity() + 1, k2.get(241).arity());
    }

    @Test
    void testHighRoutineCall() {
        Script script = Utils.recover(Utils.printedFirstPc(), GameVariant.K1, STRICT);
        assertFalse(script.diagnostics.has(DiagnosticKind.UNKNOWN_ACTION));
        assertFalse(script.diagnostics.has(DiagnosticKind.SIGNATURE_MISMATCH));

        String source = Utils.decompile(Utils.printedFirstPc());
        assertTrue(source.contains("void main() {"), source);
        assertTrue(source.contains("object object1 = GetFirstPC();"), source);
        assertTrue(source.contains("PrintObject(object1);"), source);
        assertFalse(source.contains("Param"), source);
        assertFalse(source.contains("Action_"), source);
    }

    @Test
    void testExecuteScriptArity() {
        EngineFunctionSignature k1 = SignatureTable.forVariant(GameVariant.K1).get(Utils.EXECUTE_SCRIPT);
        EngineFunctionSignature k2 = SignatureTable.forVariant(GameVariant.K2).get(Utils.EXECUTE_SCRIPT);
        assertNotNull(k1);
        assertNotNull(k2);
        assertEquals(2, k1.arity());
        assertEquals(3, k2.arity());
        assertEquals("-1", k2.params.get(2).defaultText);
    }

    @Test
    void testExecuteScriptPerVariant() {
        Script k1 = Utils.recover(Utils.executeScript(2), GameVariant.K1, STRICT);
        assertFalse(k1.diagnostics.has(DiagnosticKind.SIGNATURE_MISMATCH));
        Script k2 = Utils.recover(Utils.executeScript(3), GameVariant.K2, STRICT);
        assertFalse(k2.diagnostics.has(DiagnosticKind.SIGNATURE_MISMATCH));

        assertTrue(Utils.recover(Utils.executeScript(3), GameVariant.K1, STRICT)
                .diagnostics.has(DiagnosticKind.SIGNATURE_MISMATCH));
        assertTrue(Utils.recover(Utils.executeScript(2), GameVariant.K2, STRICT)
                .diagnostics.has(DiagnosticKind.SIGNATURE_MISMATCH));

        String source = Utils.decompile(Utils.executeScript(3), GameVariant.K2, DecompileOptions.DEFAULT);
        assertTrue(source.contains("ExecuteScript(\"k_test\", OBJECT_SELF, -1);"), source);
        source = Utils.decompile(Utils.executeScript(2), GameVariant.K1, DecompileOptions.DEFAULT);
        assertTrue(source.contains("ExecuteScript(\"k_test\", OBJECT_SELF);"), source);
    }

    @Test
    void testTolerantByDefault() {
        Script script = Utils.recover(Utils.executeScript(3), GameVariant.K1, DecompileOptions.DEFAULT);
        assertFalse(script.diagnostics.has(DiagnosticKind.SIGNATURE_MISMATCH));
        String source = Utils.decompile(Utils.executeScript(3), GameVariant.K1, DecompileOptions.DEFAULT);
        assertTrue(source.contains("ExecuteScript(\"k_test\", OBJECT_SELF, -1);"), source);
    }

    @Test
    void testResolver() {
        SignatureTable table = SignatureTable.forVariant(GameVariant.K1);
        Diagnostics diagnostics = new Diagnostics();

        SignatureResolver.Resolution ok = new SignatureResolver(table, true, diagnostics).resolve(Utils.PRINT_STRING, 1, 0);
        assertFalse(ok.mismatch);
        assertEquals(NssType.STRING, ok.argTypes.get(0));
        assertEquals(NssType.VOID, ok.returnType);

        SignatureResolver.Resolution tolerant = new SignatureResolver(table, false, diagnostics).resolve(Utils.PRINT_STRING, 2, 0);
        assertTrue(tolerant.mismatch);
        assertEquals(2, tolerant.argTypes.size());
        assertFalse(diagnostics.has(DiagnosticKind.SIGNATURE_MISMATCH));

        new SignatureResolver(table, true, diagnostics).resolve(Utils.PRINT_STRING, 2, 42);
        assertEquals(1, diagnostics.count(DiagnosticKind.SIGNATURE_MISMATCH));
        assertEquals(42, diagnostics.list().get(0).offset);
    }

    @Test
    void testUnknownRoutine() {
        SignatureTable table = SignatureTable.forVariant(GameVariant.K1);
        Diagnostics diagnostics = new Diagnostics();
        SignatureResolver.Resolution res = new SignatureResolver(table, false, diagnostics).resolve(65000, 1, 0);
        assertNull(res.signature);
        assertEquals(NssType.VOID, res.returnType);
        assertTrue(diagnostics.has(DiagnosticKind.UNKNOWN_ACTION));
    }

    @Test
    void testParseDeclarations() {
        SignatureTable table = SignatureTable.parse(GameVariant.K2, String.join("\n",
                "// 3: Some comment",
                "// continued",
                "vector Mix(vector vA, vector vB = [0.0,0.0,0.0], float fT=0.5);",
                "",
                "// 5: Not a declaration",
                "#define NOTHING"));
        EngineFunctionSignature mix = table.get(3);
        assertNotNull(mix);
        assertEquals(NssType.VECTOR, mix.returnType);
        assertEquals(3, mix.arity());
        assertEquals("[0.0,0.0,0.0]", mix.params.get(1).defaultText);
        assertNull(table.get(5));
    }
}
