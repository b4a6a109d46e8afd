package io.github.eutro.ncs2nss.test;

import io.github.eutro.ncs2nss.core.DecompileOptions;
import io.github.eutro.ncs2nss.core.ast.NssType;
import io.github.eutro.ncs2nss.core.ast.Script;
import io.github.eutro.ncs2nss.core.ncs.GameVariant;
import io.github.eutro.ncs2nss.core.passes.convert.CfgToScript;
import org.junit.jupiter.api.Test;

import static io.github.eutro.ncs2nss.core.ncs.TypeQualifier.INT;
import static org.junit.jupiter.api.Assertions.*;

public class EndToEndTest {
    @Test
    void testCountingLoop() {
        String source = Utils.decompile(Utils.countingLoop());
        assertTrue(source.contains("void main() {"), source);
        assertTrue(source.contains("int1 < 10"), source);
        assertTrue(source.contains("for (") || source.contains("while ("), source);
        assertTrue(source.contains("int int1"), source);
        assertFalse(source.contains("goto"), source);
    }

    @Test
    void testDeterministic() {
        byte[][] scripts = {Utils.countingLoop(), Utils.dispatch(), Utils.delayedPrint(), Utils.printedGlobal()};
        for (byte[] script : scripts) {
            assertEquals(Utils.decompile(script), Utils.decompile(script));
        }
    }

    @Test
    void testGlobals() {
        String source = Utils.decompile(Utils.printedGlobal());
        int globals = source.indexOf("// Globals");
        int main = source.indexOf("void main() {");
        assertTrue(globals != -1 && main != -1 && globals < main, source);
        assertTrue(source.contains("intGlobal1 = 5;"), source);
        assertTrue(source.contains("PrintInteger(intGlobal1);"), source);
    }

    @Test
    void testNoGlobalsSection() {
        assertFalse(Utils.decompile(Utils.countingLoop()).contains("// Globals"));
    }

    @Test
    void testDelayedAction() {
        String source = Utils.decompile(Utils.delayedPrint());
        assertTrue(source.contains("DelayCommand(2.0, PrintString(\"hello\"));"), source);
        // the action's code is not a function of its own
        assertFalse(source.contains("closure"), source);
    }

    @Test
    void testStartingConditional() {
        byte[] bytes = new NcsAssembler()
                .rsadd(INT)
                .jsr("main")
                .retn()
                .label("main")
                .consti(1)
                .cpdownsp(-8, 4)
                .movsp(-4)
                .retn()
                .toBytes();
        Script script = Utils.recover(bytes, GameVariant.K1, DecompileOptions.DEFAULT);
        assertEquals(CfgToScript.CONDITIONAL_ENTRY, script.getEntry().signature.getName());
        assertEquals(NssType.INT, script.getEntry().signature.getReturnType());

        String source = Utils.decompile(bytes);
        assertTrue(source.contains("int StartingConditional() {"), source);
        assertTrue(source.contains("return 1;"), source);
    }

    @Test
    void testHelperSubroutine() {
        // main calls a helper that prints its integer argument
        byte[] bytes = Utils.withStub()
                .consti(3)
                .jsr("helper")
                .retn()
                .label("helper")
                .cptopsp(-4, 4)
                .action(Utils.PRINT_INTEGER, 1)
                .movsp(-4)
                .retn()
                .toBytes();
        String source = Utils.decompile(bytes);
        assertTrue(source.contains("// Prototypes"), source);
        assertTrue(source.contains("void sub1(int intParam1);"), source);
        assertTrue(source.contains("PrintInteger(intParam1);"), source);
        assertTrue(source.contains("sub1(3);"), source);
        assertTrue(source.indexOf("void sub1(int intParam1) {") < source.indexOf("void main() {"), source);
    }
}
