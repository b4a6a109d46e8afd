package io.github.eutro.ncs2nss.test;

import io.github.eutro.ncs2nss.core.ncs.NcsReader;
import io.github.eutro.ncs2nss.core.ncs.Opcode;
import io.github.eutro.ncs2nss.core.ncs.TypeQualifier;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.github.eutro.ncs2nss.core.ncs.TypeQualifier.*;

/**
 * Writes NCS bytecode for tests, with jumps to named labels.
 */
public class NcsAssembler {
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final Map<String, Integer> labels = new HashMap<>();
    private final List<Fixup> fixups = new ArrayList<>();

    private static final class Fixup {
        final int insn;
        final int operand;
        final String label;

        Fixup(int insn, int operand, String label) {
            this.insn = insn;
            this.operand = operand;
            this.label = label;
        }
    }

    /**
     * Get the offset the next instruction will have in the finished script.
     *
     * @return The offset, counting the header.
     */
    public int offset() {
        return NcsReader.HEADER_SIZE + out.size();
    }

    public NcsAssembler label(String name) {
        if (labels.put(name, out.size()) != null) throw new IllegalArgumentException("Duplicate label " + name);
        return this;
    }

    public NcsAssembler op(Opcode op, TypeQualifier q) {
        out.write(op.code);
        out.write(q.code);
        return this;
    }

    public NcsAssembler raw(int... bytes) {
        for (int b : bytes) out.write(b);
        return this;
    }

    private void i16(int v) {
        out.write(v >>> 8);
        out.write(v);
    }

    private void i32(int v) {
        out.write(v >>> 24);
        out.write(v >>> 16);
        out.write(v >>> 8);
        out.write(v);
    }

    public NcsAssembler rsadd(TypeQualifier q) {
        return op(Opcode.RSADD, q);
    }

    public NcsAssembler consti(int v) {
        op(Opcode.CONST, INT);
        i32(v);
        return this;
    }

    public NcsAssembler constf(float v) {
        op(Opcode.CONST, FLOAT);
        i32(Float.floatToIntBits(v));
        return this;
    }

    public NcsAssembler consts(String v) {
        byte[] bytes = v.getBytes(StandardCharsets.ISO_8859_1);
        op(Opcode.CONST, STRING);
        i16(bytes.length);
        out.write(bytes, 0, bytes.length);
        return this;
    }

    public NcsAssembler consto(int v) {
        op(Opcode.CONST, OBJECT);
        i32(v);
        return this;
    }

    private NcsAssembler stackCopy(Opcode op, int offset, int size) {
        op(op, STACK);
        i32(offset);
        i16(size);
        return this;
    }

    public NcsAssembler cpdownsp(int offset, int size) {
        return stackCopy(Opcode.CPDOWNSP, offset, size);
    }

    public NcsAssembler cptopsp(int offset, int size) {
        return stackCopy(Opcode.CPTOPSP, offset, size);
    }

    public NcsAssembler cpdownbp(int offset, int size) {
        return stackCopy(Opcode.CPDOWNBP, offset, size);
    }

    public NcsAssembler cptopbp(int offset, int size) {
        return stackCopy(Opcode.CPTOPBP, offset, size);
    }

    public NcsAssembler movsp(int offset) {
        op(Opcode.MOVSP, NONE);
        i32(offset);
        return this;
    }

    public NcsAssembler action(int routine, int argc) {
        op(Opcode.ACTION, NONE);
        i16(routine);
        out.write(argc);
        return this;
    }

    public NcsAssembler binary(Opcode op, TypeQualifier q) {
        return op(op, q);
    }

    public NcsAssembler equalStruct(Opcode op, int size) {
        op(op, STRUCT_STRUCT);
        i16(size);
        return this;
    }

    public NcsAssembler unary(Opcode op, TypeQualifier q) {
        return op(op, q);
    }

    private NcsAssembler jump(Opcode op, String label) {
        int insn = out.size();
        op(op, NONE);
        fixups.add(new Fixup(insn, out.size(), label));
        i32(0);
        return this;
    }

    public NcsAssembler jmp(String label) {
        return jump(Opcode.JMP, label);
    }

    public NcsAssembler jsr(String label) {
        return jump(Opcode.JSR, label);
    }

    public NcsAssembler jz(String label) {
        return jump(Opcode.JZ, label);
    }

    public NcsAssembler jnz(String label) {
        return jump(Opcode.JNZ, label);
    }

    /**
     * A jump by a raw relative offset, which need not land on an instruction.
     */
    public NcsAssembler jmpBy(int relative) {
        op(Opcode.JMP, NONE);
        i32(relative);
        return this;
    }

    public NcsAssembler retn() {
        return op(Opcode.RETN, NONE);
    }

    private NcsAssembler int32Op(Opcode op, TypeQualifier q, int v) {
        op(op, q);
        i32(v);
        return this;
    }

    public NcsAssembler incsp(int offset) {
        return int32Op(Opcode.INCSP, INT, offset);
    }

    public NcsAssembler decsp(int offset) {
        return int32Op(Opcode.DECSP, INT, offset);
    }

    public NcsAssembler incbp(int offset) {
        return int32Op(Opcode.INCBP, INT, offset);
    }

    public NcsAssembler decbp(int offset) {
        return int32Op(Opcode.DECBP, INT, offset);
    }

    public NcsAssembler savebp() {
        return op(Opcode.SAVEBP, NONE);
    }

    public NcsAssembler restorebp() {
        return op(Opcode.RESTOREBP, NONE);
    }

    public NcsAssembler storeState(int bpBytes, int spBytes) {
        op(Opcode.STORE_STATE, ENGINE_0);
        i32(bpBytes);
        i32(spBytes);
        return this;
    }

    public NcsAssembler destruct(int total, int keepFrom, int keep) {
        op(Opcode.DESTRUCT, STACK);
        i16(total);
        i16(keepFrom);
        i16(keep);
        return this;
    }

    public NcsAssembler nop() {
        return op(Opcode.NOP, NONE);
    }

    /**
     * Get the code without a header, jumps resolved.
     *
     * @return The code bytes.
     */
    public byte[] code() {
        byte[] code = out.toByteArray();
        ByteBuffer buf = ByteBuffer.wrap(code);
        for (Fixup fixup : fixups) {
            Integer target = labels.get(fixup.label);
            if (target == null) throw new IllegalStateException("Undefined label " + fixup.label);
            buf.putInt(fixup.operand, target - fixup.insn);
        }
        return code;
    }

    /**
     * Get the finished script, header included.
     *
     * @return The script bytes.
     */
    public byte[] toBytes() {
        byte[] code = code();
        ByteBuffer buf = ByteBuffer.allocate(NcsReader.HEADER_SIZE + code.length);
        buf.put(NcsReader.MAGIC);
        buf.put((byte) NcsReader.PROGRAM_MARKER);
        buf.putInt(NcsReader.HEADER_SIZE + code.length);
        buf.put(code);
        return buf.array();
    }
}
