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

/**
 * Writes small NCS scripts for tests.
 */
public class NcsAssembler {
    public static final int PRINT_STRING = 1;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final Map<String, Integer> labels = new HashMap<>();
    private final List<int[]> fixups = new ArrayList<>();
    private final List<String> fixupLabels = new ArrayList<>();

    /**
     * A script whose main prints {@code text}.
     */
    public static byte[] printing(String text) {
        return new NcsAssembler()
                .jsr("main")
                .retn()
                .label("main")
                .consts(text)
                .action(PRINT_STRING, 1)
                .retn()
                .toBytes();
    }

    public NcsAssembler label(String name) {
        labels.put(name, out.size());
        return this;
    }

    private NcsAssembler op(Opcode op, TypeQualifier q) {
        out.write(op.code);
        out.write(q.code);
        return this;
    }

    private void i16(int v) {
        out.write(v >>> 8);
        out.write(v);
    }

    public NcsAssembler consts(String v) {
        byte[] bytes = v.getBytes(StandardCharsets.ISO_8859_1);
        op(Opcode.CONST, TypeQualifier.STRING);
        i16(bytes.length);
        out.write(bytes, 0, bytes.length);
        return this;
    }

    public NcsAssembler action(int routine, int argc) {
        op(Opcode.ACTION, TypeQualifier.NONE);
        i16(routine);
        out.write(argc);
        return this;
    }

    public NcsAssembler jsr(String label) {
        int insn = out.size();
        op(Opcode.JSR, TypeQualifier.NONE);
        fixups.add(new int[]{insn, out.size()});
        fixupLabels.add(label);
        out.write(new byte[4], 0, 4);
        return this;
    }

    public NcsAssembler retn() {
        return op(Opcode.RETN, TypeQualifier.NONE);
    }

    public byte[] toBytes() {
        byte[] code = out.toByteArray();
        ByteBuffer fix = ByteBuffer.wrap(code);
        for (int i = 0; i < fixups.size(); i++) {
            int[] fixup = fixups.get(i);
            Integer target = labels.get(fixupLabels.get(i));
            if (target == null) throw new IllegalStateException("Undefined label " + fixupLabels.get(i));
            fix.putInt(fixup[1], target - fixup[0]);
        }
        ByteBuffer buf = ByteBuffer.allocate(NcsReader.HEADER_SIZE + code.length);
        buf.put(NcsReader.MAGIC);
        buf.put((byte) NcsReader.PROGRAM_MARKER);
        buf.putInt(NcsReader.HEADER_SIZE + code.length);
        buf.put(code);
        return buf.array();
    }
}
