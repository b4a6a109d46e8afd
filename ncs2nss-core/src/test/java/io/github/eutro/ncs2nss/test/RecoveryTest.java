package io.github.eutro.ncs2nss.test;

import io.github.eutro.ncs2nss.core.DecompileOptions;
import io.github.eutro.ncs2nss.core.Diagnostic;
import io.github.eutro.ncs2nss.core.DiagnosticKind;
import io.github.eutro.ncs2nss.core.ast.Expr;
import io.github.eutro.ncs2nss.core.ast.FunctionDecl;
import io.github.eutro.ncs2nss.core.ast.NssType;
import io.github.eutro.ncs2nss.core.ast.Region;
import io.github.eutro.ncs2nss.core.ast.Script;
import io.github.eutro.ncs2nss.core.ncs.GameVariant;
import org.junit.jupiter.api.Test;

import static io.github.eutro.ncs2nss.core.ncs.TypeQualifier.INT;
import static org.junit.jupiter.api.Assertions.*;

public class RecoveryTest {
    private static Script recover(byte[] bytes) {
        return Utils.recover(bytes, GameVariant.K1, DecompileOptions.DEFAULT);
    }

    private static boolean reported(Script script, DiagnosticKind kind, String text) {
        for (Diagnostic d : script.diagnostics.list()) {
            if (d.kind == kind && d.message.contains(text)) return true;
        }
        return false;
    }

    private static FunctionDecl function(Script script, String name) {
        for (FunctionDecl fn : script.functions) {
            if (fn.signature.getName().equals(name)) return fn;
        }
        throw new AssertionError("No function " + name);
    }

    @Test
    void testPredecessorsDisagreeOnDepth() {
        // one arm leaves an extra cell behind, the join continues with the dominator's stack
        byte[] bytes = Utils.withStub()
                .consti(1)
                .jz("join")
                .consti(7)
                .label("join")
                .consts("x")
                .action(Utils.PRINT_STRING, 1)
                .retn()
                .toBytes();
        Script script = recover(bytes);
        assertTrue(reported(script, DiagnosticKind.STACK_IMBALANCE, "disagree"), script.diagnostics.list().toString());
        assertTrue(script.getEntry().signature.params.isEmpty());

        String source = Utils.decompile(bytes);
        assertTrue(source.contains("void main() {"), source);
        assertTrue(source.contains("PrintString(\"x\");"), source);
    }

    @Test
    void testUnderflowIsPadded() {
        // the join pops a cell that only one arm pushed
        byte[] bytes = Utils.withStub()
                .consti(1)
                .jz("join")
                .consti(7)
                .label("join")
                .action(Utils.PRINT_INTEGER, 1)
                .consti(0)
                .retn()
                .toBytes();
        Script script = recover(bytes);
        assertTrue(reported(script, DiagnosticKind.STACK_IMBALANCE, "disagree"), script.diagnostics.list().toString());
        assertTrue(reported(script, DiagnosticKind.STACK_IMBALANCE, "underflow"), script.diagnostics.list().toString());

        String source = Utils.decompile(bytes);
        assertTrue(source.contains("PrintInteger(__unknown_param_1);"), source);
    }

    @Test
    void testLoopReentryImbalance() {
        // each iteration leaves one more cell on the stack
        byte[] bytes = Utils.withStub()
                .label("body")
                .consts("x")
                .action(Utils.PRINT_STRING, 1)
                .consti(3)
                .consti(1)
                .jnz("body")
                .movsp(-4)
                .retn()
                .toBytes();
        Script script = recover(bytes);
        assertTrue(reported(script, DiagnosticKind.STACK_IMBALANCE, "re-enters"), script.diagnostics.list().toString());

        String source = Utils.decompile(bytes);
        assertTrue(source.contains("do {"), source);
        assertTrue(source.contains("PrintString(\"x\");"), source);
    }

    @Test
    void testConflictingUsesWidenToAny() {
        // a parameter printed both as an integer and as a string
        byte[] bytes = Utils.withStub()
                .consti(3)
                .jsr("helper")
                .retn()
                .label("helper")
                .cptopsp(-4, 4)
                .action(Utils.PRINT_INTEGER, 1)
                .cptopsp(-4, 4)
                .action(Utils.PRINT_STRING, 1)
                .movsp(-4)
                .retn()
                .toBytes();
        Script script = recover(bytes);
        assertTrue(reported(script, DiagnosticKind.TYPE_CONFLICT, "both int and string"), script.diagnostics.list().toString());
        FunctionDecl helper = function(script, "sub1");
        assertEquals(1, helper.signature.params.size());
        assertEquals(NssType.ANY, helper.signature.params.get(0).getType());
        assertTrue(helper.signature.params.get(0).isConflicted());

        String source = Utils.decompile(bytes);
        assertTrue(source.contains("sub1(3);"), source);
        assertTrue(source.contains("PrintInteger(intParam1);"), source);
        assertTrue(source.contains("PrintString(intParam1);"), source);
    }

    @Test
    void testStoreOfWrongTypeIsCast() {
        byte[] bytes = Utils.withStub()
                .rsadd(INT)
                .consts("x")
                .cpdownsp(-8, 4)
                .movsp(-4)
                .cptopsp(-4, 4)
                .action(Utils.PRINT_INTEGER, 1)
                .movsp(-4)
                .retn()
                .toBytes();
        Script script = recover(bytes);
        assertTrue(reported(script, DiagnosticKind.TYPE_CONFLICT, "Storing string into a int"), script.diagnostics.list().toString());

        boolean cast = false;
        for (Region stmt : Region.statements(script.getEntry().body)) {
            if (stmt instanceof Region.Declare && ((Region.Declare) stmt).init instanceof Expr.Cast) {
                assertEquals(NssType.INT, ((Region.Declare) stmt).init.type());
                cast = true;
            }
        }
        assertTrue(cast, Utils.decompile(bytes));
    }
}
