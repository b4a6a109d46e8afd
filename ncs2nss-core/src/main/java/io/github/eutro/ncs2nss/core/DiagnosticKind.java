package io.github.eutro.ncs2nss.core;

/**
 * The non-fatal conditions a decompilation can report.
 */
public enum DiagnosticKind {
    /**
     * Predecessors disagree on the stack depth at a block entry; the stack was truncated or padded.
     */
    STACK_IMBALANCE,
    /**
     * An engine call's argument count differs from its table entry, in strict mode.
     */
    SIGNATURE_MISMATCH,
    /**
     * Control flow that could not be mapped onto structured statements.
     */
    UNSTRUCTURED_REGION,
    /**
     * A cast to a type outside the known vocabulary was stripped.
     */
    UNKNOWN_CAST_TYPE,
    /**
     * A function signature used a type outside the known vocabulary.
     */
    UNKNOWN_SIGNATURE_TYPE,
    /**
     * Code with no path from any entry point.
     */
    UNREACHABLE_CODE,
    /**
     * A variable used at two different types.
     */
    TYPE_CONFLICT,
    /**
     * An engine call index missing from the signature table.
     */
    UNKNOWN_ACTION,
    /**
     * A textual repair applied to the emitted source.
     */
    REPAIR_APPLIED,
}
