package io.github.eutro.ncs2nss.core.ncs;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A single decoded instruction. Immutable, and owned by its {@link InstructionStream}.
 * <p>
 * The meaning of the integer operands depends on the {@link Opcode.Layout layout}:
 * <ul>
 *     <li>{@code STACK_COPY}: {@link #getA() a} is the byte offset, {@link #getB() b} the byte size.</li>
 *     <li>{@code CONSTANT}: {@link #getA() a} is the integer or object value.</li>
 *     <li>{@code ACTION}: {@link #getA() a} is the routine index, {@link #getB() b} the argument count.</li>
 *     <li>{@code INT32}, {@code JUMP}: {@link #getA() a} is the offset.</li>
 *     <li>{@code DESTRUCT}: {@link #getA() a}, {@link #getB() b} and {@link #getC() c} in declaration order.</li>
 *     <li>{@code STORE_STATE}: {@link #getA() a} is the base pointer size, {@link #getB() b} the stack size.</li>
 *     <li>{@code EQUALITY}: {@link #getA() a} is the structure size, if any.</li>
 * </ul>
 */
public final class Instruction {
    private final int index;
    private final int offset;
    private final int length;
    @NotNull
    private final Opcode opcode;
    @NotNull
    private final TypeQualifier qualifier;
    private final int a, b, c;
    private final float floatValue;
    @Nullable
    private final String stringValue;

    Instruction(int index,
                int offset,
                int length,
                @NotNull Opcode opcode,
                @NotNull TypeQualifier qualifier,
                int a,
                int b,
                int c,
                float floatValue,
                @Nullable String stringValue) {
        this.index = index;
        this.offset = offset;
        this.length = length;
        this.opcode = opcode;
        this.qualifier = qualifier;
        this.a = a;
        this.b = b;
        this.c = c;
        this.floatValue = floatValue;
        this.stringValue = stringValue;
    }

    public int getIndex() {
        return index;
    }

    public int getOffset() {
        return offset;
    }

    public int getLength() {
        return length;
    }

    public int getEnd() {
        return offset + length;
    }

    @NotNull
    public Opcode getOpcode() {
        return opcode;
    }

    @NotNull
    public TypeQualifier getQualifier() {
        return qualifier;
    }

    public int getA() {
        return a;
    }

    public int getB() {
        return b;
    }

    public int getC() {
        return c;
    }

    public float getFloatValue() {
        return floatValue;
    }

    @Nullable
    public String getStringValue() {
        return stringValue;
    }

    /**
     * Get the absolute byte offset a jump instruction transfers to.
     *
     * @return The target offset.
     * @throws IllegalStateException If this is not a jump.
     */
    public int jumpTarget() {
        if (!opcode.isJump()) throw new IllegalStateException(mnemonic() + " is not a jump");
        return offset + a;
    }

    /**
     * Get the conventional mnemonic, such as {@code CONSTI} or {@code ADDII}.
     *
     * @return The mnemonic.
     */
    public String mnemonic() {
        switch (opcode) {
            case DECSP:
            case INCSP:
                return opcode.name().substring(0, 3) + "ISP";
            case DECBP:
            case INCBP:
                return opcode.name().substring(0, 3) + "IBP";
            default:
                return opcode.name() + qualifier.suffix;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Instruction)) return false;
        Instruction that = (Instruction) o;
        return index == that.index
                && offset == that.offset
                && length == that.length
                && a == that.a
                && b == that.b
                && c == that.c
                && Float.compare(that.floatValue, floatValue) == 0
                && opcode == that.opcode
                && qualifier == that.qualifier
                && Objects.equals(stringValue, that.stringValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, offset, opcode, qualifier, a, b, c);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%04x: %s", offset, mnemonic()));
        switch (opcode.layout) {
            case STACK_COPY:
            case ACTION:
            case STORE_STATE:
                sb.append(' ').append(a).append(", ").append(b);
                break;
            case DESTRUCT:
                sb.append(' ').append(a).append(", ").append(b).append(", ").append(c);
                break;
            case INT32:
                sb.append(' ').append(a);
                break;
            case JUMP:
                sb.append(String.format(" %04x", jumpTarget()));
                break;
            case CONSTANT:
                if (qualifier == TypeQualifier.FLOAT) sb.append(' ').append(floatValue);
                else if (qualifier == TypeQualifier.STRING) sb.append(" \"").append(stringValue).append('"');
                else sb.append(' ').append(a);
                break;
            case EQUALITY:
                if (qualifier == TypeQualifier.STRUCT_STRUCT) sb.append(' ').append(a);
                break;
            default:
                break;
        }
        return sb.toString();
    }
}
