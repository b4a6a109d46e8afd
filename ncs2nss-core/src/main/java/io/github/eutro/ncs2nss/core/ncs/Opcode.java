package io.github.eutro.ncs2nss.core.ncs;

import org.jetbrains.annotations.Nullable;

import java.util.EnumSet;
import java.util.Set;

import static io.github.eutro.ncs2nss.core.ncs.TypeQualifier.*;

/**
 * The closed set of NCS opcodes, with their byte codes, operand layouts and accepted qualifiers.
 */
public enum Opcode {
    CPDOWNSP(0x01, Layout.STACK_COPY, EnumSet.of(STACK)),
    RSADD(0x02, Layout.NONE, unaryValueTypes()),
    CPTOPSP(0x03, Layout.STACK_COPY, EnumSet.of(STACK)),
    CONST(0x04, Layout.CONSTANT, EnumSet.of(INT, FLOAT, STRING, OBJECT)),
    ACTION(0x05, Layout.ACTION, null),
    LOGAND(0x06, Layout.NONE, EnumSet.of(INT_INT)),
    LOGOR(0x07, Layout.NONE, EnumSet.of(INT_INT)),
    INCOR(0x08, Layout.NONE, EnumSet.of(INT_INT)),
    EXCOR(0x09, Layout.NONE, EnumSet.of(INT_INT)),
    BOOLAND(0x0A, Layout.NONE, EnumSet.of(INT_INT)),
    EQUAL(0x0B, Layout.EQUALITY, equalityTypes()),
    NEQUAL(0x0C, Layout.EQUALITY, equalityTypes()),
    GEQ(0x0D, Layout.NONE, EnumSet.of(INT_INT, FLOAT_FLOAT)),
    GT(0x0E, Layout.NONE, EnumSet.of(INT_INT, FLOAT_FLOAT)),
    LT(0x0F, Layout.NONE, EnumSet.of(INT_INT, FLOAT_FLOAT)),
    LEQ(0x10, Layout.NONE, EnumSet.of(INT_INT, FLOAT_FLOAT)),
    SHLEFT(0x11, Layout.NONE, EnumSet.of(INT_INT)),
    SHRIGHT(0x12, Layout.NONE, EnumSet.of(INT_INT)),
    USHRIGHT(0x13, Layout.NONE, EnumSet.of(INT_INT)),
    ADD(0x14, Layout.NONE, EnumSet.of(INT_INT, INT_FLOAT, FLOAT_INT, FLOAT_FLOAT, STRING_STRING, VECTOR_VECTOR)),
    SUB(0x15, Layout.NONE, EnumSet.of(INT_INT, INT_FLOAT, FLOAT_INT, FLOAT_FLOAT, VECTOR_VECTOR)),
    MUL(0x16, Layout.NONE, EnumSet.of(INT_INT, INT_FLOAT, FLOAT_INT, FLOAT_FLOAT, VECTOR_FLOAT, FLOAT_VECTOR)),
    DIV(0x17, Layout.NONE, EnumSet.of(INT_INT, INT_FLOAT, FLOAT_INT, FLOAT_FLOAT, VECTOR_FLOAT)),
    MOD(0x18, Layout.NONE, EnumSet.of(INT_INT)),
    NEG(0x19, Layout.NONE, EnumSet.of(INT, FLOAT)),
    COMP(0x1A, Layout.NONE, EnumSet.of(INT)),
    MOVSP(0x1B, Layout.INT32, null),
    STORE_STATEALL(0x1C, Layout.NONE, null),
    JMP(0x1D, Layout.JUMP, null),
    JSR(0x1E, Layout.JUMP, null),
    JZ(0x1F, Layout.JUMP, null),
    RETN(0x20, Layout.NONE, null),
    DESTRUCT(0x21, Layout.DESTRUCT, EnumSet.of(STACK)),
    NOT(0x22, Layout.NONE, EnumSet.of(INT)),
    DECSP(0x23, Layout.INT32, EnumSet.of(INT)),
    INCSP(0x24, Layout.INT32, EnumSet.of(INT)),
    JNZ(0x25, Layout.JUMP, null),
    CPDOWNBP(0x26, Layout.STACK_COPY, EnumSet.of(STACK)),
    CPTOPBP(0x27, Layout.STACK_COPY, EnumSet.of(STACK)),
    DECBP(0x28, Layout.INT32, EnumSet.of(INT)),
    INCBP(0x29, Layout.INT32, EnumSet.of(INT)),
    SAVEBP(0x2A, Layout.NONE, null),
    RESTOREBP(0x2B, Layout.NONE, null),
    STORE_STATE(0x2C, Layout.STORE_STATE, null),
    NOP(0x2D, Layout.NONE, null),
    ;

    /**
     * How the operands following the opcode and qualifier bytes are laid out.
     */
    public enum Layout {
        NONE,
        /**
         * {@code int32} stack offset, {@code uint16} byte count.
         */
        STACK_COPY,
        /**
         * Depends on the qualifier: {@code int32}, {@code float32}, or a {@code uint16}-prefixed string.
         */
        CONSTANT,
        /**
         * {@code uint16} routine index, {@code uint8} argument count.
         */
        ACTION,
        INT32,
        /**
         * {@code int32} offset relative to the start of the instruction.
         */
        JUMP,
        /**
         * {@code uint16} bytes to remove, {@code int16} offset of the kept element, {@code uint16} its size.
         */
        DESTRUCT,
        /**
         * {@code int32} base pointer bytes, {@code int32} stack pointer bytes.
         */
        STORE_STATE,
        /**
         * A {@code uint16} structure size, only for the {@link TypeQualifier#STRUCT_STRUCT} qualifier.
         */
        EQUALITY,
    }

    private static final Opcode[] BY_CODE = new Opcode[256];

    static {
        for (Opcode op : values()) {
            BY_CODE[op.code] = op;
        }
    }

    public final int code;
    public final Layout layout;
    @Nullable
    private final Set<TypeQualifier> qualifiers;

    Opcode(int code, Layout layout, @Nullable Set<TypeQualifier> qualifiers) {
        this.code = code;
        this.layout = layout;
        this.qualifiers = qualifiers;
    }

    @Nullable
    public static Opcode fromCode(int code) {
        return code >= 0 && code < BY_CODE.length ? BY_CODE[code] : null;
    }

    /**
     * Whether the qualifier is meaningful for this opcode. Opcodes whose qualifier carries no
     * information accept any qualifier.
     *
     * @param qualifier The qualifier.
     * @return Whether the pair decodes.
     */
    public boolean accepts(TypeQualifier qualifier) {
        return qualifiers == null || qualifiers.contains(qualifier);
    }

    public boolean acceptsAny() {
        return qualifiers == null;
    }

    public boolean isJump() {
        return layout == Layout.JUMP;
    }

    public boolean isConditionalJump() {
        return this == JZ || this == JNZ;
    }

    /**
     * Whether this instruction ends a basic block.
     *
     * @return Whether control may not simply continue to the next instruction.
     */
    public boolean endsBlock() {
        return isJump() || this == RETN;
    }

    private static Set<TypeQualifier> unaryValueTypes() {
        Set<TypeQualifier> set = EnumSet.of(INT, FLOAT, STRING, OBJECT);
        set.addAll(EnumSet.range(ENGINE_0, ENGINE_9));
        return set;
    }

    private static Set<TypeQualifier> equalityTypes() {
        Set<TypeQualifier> set = EnumSet.of(INT_INT, FLOAT_FLOAT, OBJECT_OBJECT, STRING_STRING, STRUCT_STRUCT, VECTOR_VECTOR);
        set.addAll(EnumSet.range(ENGINE_ENGINE_0, ENGINE_ENGINE_9));
        return set;
    }
}
