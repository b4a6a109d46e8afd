package io.github.eutro.ncs2nss.test;

import io.github.eutro.ncs2nss.core.DecompileOptions;
import io.github.eutro.ncs2nss.core.actions.SignatureTable;
import io.github.eutro.ncs2nss.core.ast.Script;
import io.github.eutro.ncs2nss.core.ncs.GameVariant;
import io.github.eutro.ncs2nss.core.ncs.NcsReader;
import io.github.eutro.ncs2nss.core.ncs.Opcode;
import io.github.eutro.ncs2nss.core.passes.Passes;

import static io.github.eutro.ncs2nss.core.ncs.TypeQualifier.*;

public class Utils {
    public static final int RANDOM = 0;
    public static final int PRINT_STRING = 1;
    public static final int PRINT_INTEGER = 4;
    public static final int PRINT_OBJECT = 5;
    public static final int DELAY_COMMAND = 7;
    public static final int EXECUTE_SCRIPT = 8;
    public static final int GET_FIRST_PC = 548;

    public static String decompile(byte[] bytes, GameVariant variant, DecompileOptions options) {
        return Passes.decompile(SignatureTable.forVariant(variant), options).run(NcsReader.read(bytes, variant));
    }

    public static String decompile(byte[] bytes) {
        return decompile(bytes, GameVariant.K1, DecompileOptions.DEFAULT);
    }

    public static Script recover(byte[] bytes, GameVariant variant, DecompileOptions options) {
        return Passes.recover(SignatureTable.forVariant(variant), options).run(NcsReader.read(bytes, variant));
    }

    /**
     * A call to {@code main} from the usual entry stub.
     */
    public static NcsAssembler withStub() {
        return new NcsAssembler()
                .jsr("main")
                .retn()
                .label("main");
    }

    /**
     * <pre>
     * void main() {
     *     int int1 = 0;
     *     while (int1 < 10) int1 = int1 + 1;
     * }
     * </pre>
     */
    public static byte[] countingLoop() {
        return withStub()
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
                .jmp("head")
                .label("done")
                .movsp(-4)
                .retn()
                .toBytes();
    }

    /**
     * A dispatch on {@code Random(10)} with two cases and a fallback, each printing a string.
     */
    public static byte[] dispatch() {
        return dispatch("one", "two");
    }

    /**
     * A dispatch on {@code Random(10)}, printing the {@code i}th string when the result is {@code i + 1},
     * and {@code "other"} otherwise.
     */
    public static byte[] dispatch(String... cases) {
        NcsAssembler asm = withStub()
                .rsadd(INT)
                .consti(10)
                .action(RANDOM, 1)
                .cpdownsp(-8, 4)
                .movsp(-4);
        for (int i = 0; i < cases.length; i++) {
            String next = i + 1 < cases.length ? "test" + (i + 1) : "other";
            if (i > 0) asm.label("test" + i);
            asm.cptopsp(-4, 4)
                    .consti(i + 1)
                    .binary(Opcode.EQUAL, INT_INT)
                    .jz(next)
                    .consts(cases[i])
                    .action(PRINT_STRING, 1)
                    .jmp("end");
        }
        return asm
                .label("other")
                .consts("other")
                .action(PRINT_STRING, 1)
                .label("end")
                .movsp(-4)
                .retn()
                .toBytes();
    }

    /**
     * {@code DelayCommand(2.0, PrintString("hello"));}
     */
    public static byte[] delayedPrint() {
        return withStub()
                .storeState(0, 0)
                .jmp("after")
                .consts("hello")
                .action(PRINT_STRING, 1)
                .retn()
                .label("after")
                .constf(2.0f)
                .action(DELAY_COMMAND, 2)
                .retn()
                .toBytes();
    }

    /**
     * A global integer set to 5 and printed from {@code main}.
     */
    public static byte[] printedGlobal() {
        return new NcsAssembler()
                .jsr("globals")
                .retn()
                .label("globals")
                .rsadd(INT)
                .consti(5)
                .cpdownsp(-8, 4)
                .movsp(-4)
                .savebp()
                .jsr("main")
                .restorebp()
                .movsp(-4)
                .retn()
                .label("main")
                .cptopbp(-4, 4)
                .action(PRINT_INTEGER, 1)
                .retn()
                .toBytes();
    }

    /**
     * {@code ExecuteScript("k_test", OBJECT_SELF, ...)} with the given number of arguments, 2 or 3.
     */
    public static byte[] executeScript(int argc) {
        NcsAssembler asm = withStub();
        if (argc == 3) asm.consti(-1);
        return asm
                .consto(0)
                .consts("k_test")
                .action(EXECUTE_SCRIPT, argc)
                .retn()
                .toBytes();
    }

    /**
     * <pre>
     * object object1 = GetFirstPC();
     * PrintObject(object1);
     * </pre>
     */
    public static byte[] printedFirstPc() {
        return withStub()
                .rsadd(OBJECT)
                .action(GET_FIRST_PC, 0)
                .cpdownsp(-8, 4)
                .movsp(-4)
                .cptopsp(-4, 4)
                .action(PRINT_OBJECT, 1)
                .movsp(-4)
                .retn()
                .toBytes();
    }
}
