package io.github.eutro.ncs2nss.core.ncs;

import org.jetbrains.annotations.NotNull;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes NCS bytecode into an {@link InstructionStream}, in a single linear pass.
 */
public final class NcsReader {
    private static final Logger LOGGER = System.getLogger(NcsReader.class.getName());

    /**
     * The magic and version at the start of every script.
     */
    public static final byte[] MAGIC = "NCS V1.0".getBytes(StandardCharsets.US_ASCII);
    /**
     * The type byte after the magic, marking the program size field.
     */
    public static final int PROGRAM_MARKER = 0x42;
    /**
     * The size of the header, which is also the offset of the first instruction.
     */
    public static final int HEADER_SIZE = MAGIC.length + 1 + 4;

    private final ByteBuffer buf;
    private final GameVariant variant;
    private int limit;

    private NcsReader(ByteBuffer buf, GameVariant variant) {
        this.buf = buf.slice().order(ByteOrder.BIG_ENDIAN);
        this.variant = variant;
        this.limit = this.buf.limit();
    }

    /**
     * Decode a script.
     *
     * @param bytes   The script, from its first header byte. The buffer's position is not changed.
     * @param variant The game the script was compiled for.
     * @return The instructions.
     * @throws MalformedBytecodeException If the bytes are not a well-formed script.
     */
    @NotNull
    public static InstructionStream read(@NotNull ByteBuffer bytes, @NotNull GameVariant variant) {
        return new NcsReader(bytes, variant).read();
    }

    @NotNull
    public static InstructionStream read(byte @NotNull [] bytes, @NotNull GameVariant variant) {
        return read(ByteBuffer.wrap(bytes), variant);
    }

    private InstructionStream read() {
        readHeader();
        List<Instruction> insns = new ArrayList<>();
        while (buf.position() < limit) {
            insns.add(readInstruction(insns.size()));
        }
        LOGGER.log(Level.DEBUG, "Decoded {0} instructions", insns.size());
        return new InstructionStream(variant, insns);
    }

    private void readHeader() {
        if (limit < HEADER_SIZE) {
            throw new MalformedBytecodeException("Truncated header", 0);
        }
        for (int i = 0; i < MAGIC.length; i++) {
            if (buf.get(i) != MAGIC[i]) {
                throw new MalformedBytecodeException("Bad magic or version, expected \"NCS V1.0\"", i);
            }
        }
        buf.position(MAGIC.length);
        int marker = buf.get() & 0xFF;
        if (marker != PROGRAM_MARKER) {
            throw new MalformedBytecodeException(String.format("Bad program marker 0x%02x", marker), MAGIC.length);
        }
        long declared = buf.getInt() & 0xFFFFFFFFL;
        if (declared > limit) {
            throw new MalformedBytecodeException(
                    "Declared size " + declared + " exceeds the " + limit + " bytes available",
                    MAGIC.length + 1);
        }
        if (declared < HEADER_SIZE) {
            throw new MalformedBytecodeException("Declared size " + declared + " is smaller than the header",
                    MAGIC.length + 1);
        }
        if (declared < limit) {
            LOGGER.log(Level.DEBUG, "Ignoring {0} trailing bytes", limit - declared);
            limit = (int) declared;
        }
    }

    private void need(int start, int n) {
        if (buf.position() + n > limit) {
            throw new MalformedBytecodeException("Truncated operand", start);
        }
    }

    private Instruction readInstruction(int index) {
        int start = buf.position();
        need(start, 2);
        int opByte = buf.get() & 0xFF;
        int qualByte = buf.get() & 0xFF;
        Opcode opcode = Opcode.fromCode(opByte);
        if (opcode == null) {
            throw new MalformedBytecodeException(String.format("Unknown opcode 0x%02x", opByte), start);
        }
        TypeQualifier qualifier = TypeQualifier.fromCode(qualByte);
        if (qualifier == null && opcode.acceptsAny()) qualifier = TypeQualifier.NONE;
        if (qualifier == null || !opcode.accepts(qualifier)) {
            throw new MalformedBytecodeException(
                    String.format("Invalid type qualifier 0x%02x for %s", qualByte, opcode), start + 1);
        }

        int a = 0, b = 0, c = 0;
        float f = 0;
        String s = null;
        switch (opcode.layout) {
            case STACK_COPY:
                need(start, 6);
                a = buf.getInt();
                b = buf.getShort() & 0xFFFF;
                break;
            case CONSTANT:
                switch (qualifier) {
                    case FLOAT:
                        need(start, 4);
                        f = buf.getFloat();
                        break;
                    case STRING:
                        need(start, 2);
                        int len = buf.getShort() & 0xFFFF;
                        need(start, len);
                        byte[] bytes = new byte[len];
                        buf.get(bytes);
                        s = new String(bytes, StandardCharsets.ISO_8859_1);
                        break;
                    default:
                        need(start, 4);
                        a = buf.getInt();
                        break;
                }
                break;
            case ACTION:
                need(start, 3);
                a = buf.getShort() & 0xFFFF;
                b = buf.get() & 0xFF;
                break;
            case INT32:
            case JUMP:
                need(start, 4);
                a = buf.getInt();
                break;
            case DESTRUCT:
                need(start, 6);
                a = buf.getShort() & 0xFFFF;
                b = buf.getShort();
                c = buf.getShort() & 0xFFFF;
                break;
            case STORE_STATE:
                need(start, 8);
                a = buf.getInt();
                b = buf.getInt();
                break;
            case EQUALITY:
                if (qualifier == TypeQualifier.STRUCT_STRUCT) {
                    need(start, 2);
                    a = buf.getShort() & 0xFFFF;
                }
                break;
            case NONE:
                break;
        }
        return new Instruction(index, start, buf.position() - start, opcode, qualifier, a, b, c, f, s);
    }
}
