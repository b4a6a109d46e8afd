package io.github.eutro.ncs2nss.core.actions;

import io.github.eutro.ncs2nss.core.DiagnosticKind;
import io.github.eutro.ncs2nss.core.Diagnostics;
import io.github.eutro.ncs2nss.core.ast.NssType;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Resolves {@code ACTION} instructions against a {@link SignatureTable}.
 * <p>
 * The argument count in the bytecode always decides how many arguments are taken from the stack.
 * In tolerant mode a call whose count disagrees with the table is still named and typed from the table.
 * In strict mode the disagreement is reported, and the arguments are given placeholder types.
 */
public final class SignatureResolver {
    /**
     * How a call site resolved.
     */
    public static final class Resolution {
        /**
         * The matching signature, or null if the routine is unknown.
         */
        @Nullable
        public final EngineFunctionSignature signature;
        /**
         * The type of each argument, first argument first. Its size in cells is how much of the stack it takes.
         */
        public final List<NssType> argTypes;
        @NotNull
        public final NssType returnType;
        /**
         * Whether the argument count disagreed with the table.
         */
        public final boolean mismatch;

        Resolution(@Nullable EngineFunctionSignature signature, List<NssType> argTypes, @NotNull NssType returnType, boolean mismatch) {
            this.signature = signature;
            this.argTypes = Collections.unmodifiableList(argTypes);
            this.returnType = returnType;
            this.mismatch = mismatch;
        }
    }

    @NotNull
    private final SignatureTable table;
    private final boolean strict;
    @Nullable
    private final Diagnostics diagnostics;

    public SignatureResolver(@NotNull SignatureTable table, boolean strict, @Nullable Diagnostics diagnostics) {
        this.table = table;
        this.strict = strict;
        this.diagnostics = diagnostics;
    }

    @NotNull
    public SignatureTable getTable() {
        return table;
    }

    /**
     * Resolve a call.
     *
     * @param routine The routine index.
     * @param argc    The argument count in the bytecode.
     * @param offset  The offset of the call, for diagnostics.
     * @return The resolution.
     */
    @NotNull
    public Resolution resolve(int routine, int argc, int offset) {
        EngineFunctionSignature sig = table.get(routine);
        List<NssType> argTypes = new ArrayList<>(argc);
        if (sig == null) {
            report(DiagnosticKind.UNKNOWN_ACTION, offset,
                    "Engine function " + routine + " is not in the " + table.getVariant() + " table");
            for (int i = 0; i < argc; i++) argTypes.add(NssType.ANY);
            return new Resolution(null, argTypes, NssType.VOID, false);
        }
        boolean mismatch = argc != sig.arity();
        if (mismatch && strict) {
            report(DiagnosticKind.SIGNATURE_MISMATCH, offset,
                    sig.name + " called with " + argc + " argument(s), declared with " + sig.arity());
        }
        for (int i = 0; i < argc; i++) {
            NssType declared = i < sig.arity() ? sig.params.get(i).type : NssType.ANY;
            // cell sizes must still follow the declaration to keep the stack in step
            if (mismatch && strict && declared.getCells() == 1) declared = NssType.ANY;
            argTypes.add(declared);
        }
        return new Resolution(sig, argTypes, sig.returnType, mismatch);
    }

    /**
     * Compute the number of stack cells a call pops and pushes, without reporting anything.
     *
     * @param table   The table.
     * @param routine The routine index.
     * @param argc    The argument count.
     * @return The change in stack depth, in cells.
     */
    public static int stackDelta(SignatureTable table, int routine, int argc) {
        EngineFunctionSignature sig = table.get(routine);
        if (sig == null) return -argc;
        int delta = sig.returnType.getCells();
        for (int i = 0; i < argc; i++) {
            delta -= i < sig.arity() ? sig.params.get(i).type.getCells() : 1;
        }
        return delta;
    }

    private void report(DiagnosticKind kind, int offset, String message) {
        if (diagnostics != null) diagnostics.report(kind, offset, message);
    }
}
