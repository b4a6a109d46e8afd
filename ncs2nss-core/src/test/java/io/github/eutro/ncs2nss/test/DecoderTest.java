package io.github.eutro.ncs2nss.test;

import io.github.eutro.ncs2nss.core.ncs.*;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class DecoderTest {
    private static byte[] withHeader(int... code) {
        return new NcsAssembler().raw(code).toBytes();
    }

    @Test
    void testOperandLayouts() {
        NcsAssembler asm = new NcsAssembler()
                .consti(-7)
                .constf(1.5f)
                .consts("hi")
                .consto(1)
                .cptopsp(-8, 4)
                .action(Utils.PRINT_STRING, 1)
                .destruct(12, 4, 4)
                .storeState(16, 8)
                .equalStruct(Opcode.EQUAL, 12)
                .incsp(-4)
                .label("back")
                .jmp("back")
                .retn();
        InstructionStream code = NcsReader.read(asm.toBytes(), GameVariant.K1);

        assertEquals(12, code.size());
        Instruction consti = code.get(0);
        assertEquals(NcsReader.HEADER_SIZE, consti.getOffset());
        assertEquals(6, consti.getLength());
        assertEquals("CONSTI", consti.mnemonic());
        assertEquals(-7, consti.getA());

        assertEquals(1.5f, code.get(1).getFloatValue());
        assertEquals("hi", code.get(2).getStringValue());
        assertEquals(TypeQualifier.OBJECT, code.get(3).getQualifier());

        Instruction copy = code.get(4);
        assertEquals(-8, copy.getA());
        assertEquals(4, copy.getB());

        Instruction action = code.get(5);
        assertEquals(Utils.PRINT_STRING, action.getA());
        assertEquals(1, action.getB());
        assertEquals(5, action.getLength());

        Instruction destruct = code.get(6);
        assertEquals(12, destruct.getA());
        assertEquals(4, destruct.getB());
        assertEquals(4, destruct.getC());

        Instruction store = code.get(7);
        assertEquals(16, store.getA());
        assertEquals(8, store.getB());

        Instruction eq = code.get(8);
        assertEquals("EQUALTT", eq.mnemonic());
        assertEquals(12, eq.getA());

        assertEquals("INCISP", code.get(9).mnemonic());

        Instruction jmp = code.get(10);
        assertEquals(jmp.getOffset(), jmp.jumpTarget());
        assertEquals(code.get(11).getOffset(), jmp.getEnd());
    }

    @Test
    void testEveryInstructionAtItsOffset() {
        InstructionStream code = NcsReader.read(Utils.countingLoop(), GameVariant.K1);
        int offset = NcsReader.HEADER_SIZE;
        for (Instruction insn : code) {
            assertEquals(offset, insn.getOffset());
            assertEquals(insn.getIndex(), code.indexAt(offset));
            offset += insn.getLength();
        }
        assertEquals(-1, code.indexAt(NcsReader.HEADER_SIZE + 1));
    }

    @Test
    void testDecodingIsRepeatable() {
        byte[] bytes = Utils.dispatch();
        assertEquals(NcsReader.read(bytes, GameVariant.K2), NcsReader.read(ByteBuffer.wrap(bytes), GameVariant.K2));
    }

    @Test
    void testBadMagic() {
        byte[] bytes = Utils.countingLoop();
        bytes[5] = '2';
        MalformedBytecodeException e = assertThrows(MalformedBytecodeException.class,
                () -> NcsReader.read(bytes, GameVariant.K1));
        assertEquals(5, e.getOffset());
    }

    @Test
    void testTruncatedHeader() {
        byte[] bytes = Arrays.copyOf(Utils.countingLoop(), 6);
        MalformedBytecodeException e = assertThrows(MalformedBytecodeException.class,
                () -> NcsReader.read(bytes, GameVariant.K1));
        assertEquals(0, e.getOffset());
    }

    @Test
    void testBadProgramMarker() {
        byte[] bytes = Utils.countingLoop();
        bytes[8] = 0x41;
        MalformedBytecodeException e = assertThrows(MalformedBytecodeException.class,
                () -> NcsReader.read(bytes, GameVariant.K1));
        assertEquals(8, e.getOffset());
    }

    @Test
    void testDeclaredSizeTooLarge() {
        byte[] bytes = Utils.countingLoop();
        ByteBuffer.wrap(bytes).putInt(9, bytes.length + 1);
        MalformedBytecodeException e = assertThrows(MalformedBytecodeException.class,
                () -> NcsReader.read(bytes, GameVariant.K1));
        assertEquals(9, e.getOffset());
    }

    @Test
    void testTrailingBytesIgnored() {
        byte[] bytes = Utils.countingLoop();
        byte[] padded = Arrays.copyOf(bytes, bytes.length + 3);
        assertEquals(NcsReader.read(bytes, GameVariant.K1), NcsReader.read(padded, GameVariant.K1));
    }

    @Test
    void testTruncatedOperand() {
        // CONSTI with two of its four operand bytes
        byte[] bytes = withHeader(0x2D, 0x00, 0x04, 0x03, 0x00, 0x00);
        MalformedBytecodeException e = assertThrows(MalformedBytecodeException.class,
                () -> NcsReader.read(bytes, GameVariant.K1));
        assertEquals(NcsReader.HEADER_SIZE + 2, e.getOffset());
    }

    @Test
    void testUnknownOpcode() {
        byte[] bytes = withHeader(0x2D, 0x00, 0x7F, 0x00);
        MalformedBytecodeException e = assertThrows(MalformedBytecodeException.class,
                () -> NcsReader.read(bytes, GameVariant.K1));
        assertEquals(NcsReader.HEADER_SIZE + 2, e.getOffset());
        assertTrue(e.getMessage().contains("0x7f"), e.getMessage());
    }

    @Test
    void testInvalidQualifier() {
        // CPDOWNSP only takes the stack qualifier
        byte[] bytes = withHeader(0x01, 0x03, 0xFF, 0xFF, 0xFF, 0xF8, 0x00, 0x04);
        MalformedBytecodeException e = assertThrows(MalformedBytecodeException.class,
                () -> NcsReader.read(bytes, GameVariant.K1));
        assertEquals(NcsReader.HEADER_SIZE + 1, e.getOffset());
    }

    @Test
    void testAnyQualifierForUntypedOpcodes() {
        InstructionStream code = NcsReader.read(withHeader(0x20, 0x55), GameVariant.K1);
        assertEquals(Opcode.RETN, code.get(0).getOpcode());
    }
}
