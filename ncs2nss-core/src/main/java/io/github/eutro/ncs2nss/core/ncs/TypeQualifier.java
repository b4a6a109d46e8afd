package io.github.eutro.ncs2nss.core.ncs;

import org.jetbrains.annotations.Nullable;

/**
 * The second byte of every instruction, naming the operand types it works on.
 */
public enum TypeQualifier {
    NONE(0x00, ""),
    STACK(0x01, ""),
    INT(0x03, "I"),
    FLOAT(0x04, "F"),
    STRING(0x05, "S"),
    OBJECT(0x06, "O"),
    ENGINE_0(0x10, "E0"),
    ENGINE_1(0x11, "E1"),
    ENGINE_2(0x12, "E2"),
    ENGINE_3(0x13, "E3"),
    ENGINE_4(0x14, "E4"),
    ENGINE_5(0x15, "E5"),
    ENGINE_6(0x16, "E6"),
    ENGINE_7(0x17, "E7"),
    ENGINE_8(0x18, "E8"),
    ENGINE_9(0x19, "E9"),
    INT_INT(0x20, "II"),
    FLOAT_FLOAT(0x21, "FF"),
    OBJECT_OBJECT(0x22, "OO"),
    STRING_STRING(0x23, "SS"),
    STRUCT_STRUCT(0x24, "TT"),
    INT_FLOAT(0x25, "IF"),
    FLOAT_INT(0x26, "FI"),
    ENGINE_ENGINE_0(0x30, "E0E0"),
    ENGINE_ENGINE_1(0x31, "E1E1"),
    ENGINE_ENGINE_2(0x32, "E2E2"),
    ENGINE_ENGINE_3(0x33, "E3E3"),
    ENGINE_ENGINE_4(0x34, "E4E4"),
    ENGINE_ENGINE_5(0x35, "E5E5"),
    ENGINE_ENGINE_6(0x36, "E6E6"),
    ENGINE_ENGINE_7(0x37, "E7E7"),
    ENGINE_ENGINE_8(0x38, "E8E8"),
    ENGINE_ENGINE_9(0x39, "E9E9"),
    VECTOR_VECTOR(0x3A, "VV"),
    VECTOR_FLOAT(0x3B, "VF"),
    FLOAT_VECTOR(0x3C, "FV"),
    ;

    private static final TypeQualifier[] BY_CODE = new TypeQualifier[256];

    static {
        for (TypeQualifier q : values()) {
            BY_CODE[q.code] = q;
        }
    }

    public final int code;
    public final String suffix;

    TypeQualifier(int code, String suffix) {
        this.code = code;
        this.suffix = suffix;
    }

    @Nullable
    public static TypeQualifier fromCode(int code) {
        return code >= 0 && code < BY_CODE.length ? BY_CODE[code] : null;
    }

    /**
     * Get the engine structure index of a unary or paired engine qualifier.
     *
     * @return The index, or -1 if this is not an engine qualifier.
     */
    public int engineIndex() {
        if (code >= 0x10 && code <= 0x19) return code - 0x10;
        if (code >= 0x30 && code <= 0x39) return code - 0x30;
        return -1;
    }

    public boolean isEngine() {
        return engineIndex() != -1;
    }

    /**
     * Whether this qualifier describes two operands.
     *
     * @return Whether the qualifier is a pair.
     */
    public boolean isPair() {
        return code >= 0x20;
    }
}
