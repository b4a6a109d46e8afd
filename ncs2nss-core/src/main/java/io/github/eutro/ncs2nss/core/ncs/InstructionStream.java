package io.github.eutro.ncs2nss.core.ncs;

import org.jetbrains.annotations.NotNull;

import java.util.*;

/**
 * The decoded instructions of one script, in order. Owns its instructions.
 */
public final class InstructionStream implements Iterable<Instruction> {
    @NotNull
    private final GameVariant variant;
    private final List<Instruction> instructions;
    private final Map<Integer, Integer> indexByOffset = new HashMap<>();

    InstructionStream(@NotNull GameVariant variant, List<Instruction> instructions) {
        this.variant = variant;
        this.instructions = Collections.unmodifiableList(new ArrayList<>(instructions));
        for (Instruction insn : this.instructions) {
            indexByOffset.put(insn.getOffset(), insn.getIndex());
        }
    }

    @NotNull
    public GameVariant getVariant() {
        return variant;
    }

    public int size() {
        return instructions.size();
    }

    public Instruction get(int index) {
        return instructions.get(index);
    }

    public List<Instruction> asList() {
        return instructions;
    }

    /**
     * Find the instruction starting at the given byte offset.
     *
     * @param offset The byte offset.
     * @return The instruction's index, or -1 if no instruction starts there.
     */
    public int indexAt(int offset) {
        Integer index = indexByOffset.get(offset);
        return index == null ? -1 : index;
    }

    @NotNull
    @Override
    public Iterator<Instruction> iterator() {
        return instructions.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InstructionStream)) return false;
        InstructionStream that = (InstructionStream) o;
        return variant == that.variant && instructions.equals(that.instructions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variant, instructions);
    }

    /**
     * Render a listing of the stream, one instruction per line.
     *
     * @return The listing.
     */
    public String disassemble() {
        StringBuilder sb = new StringBuilder();
        for (Instruction insn : instructions) {
            sb.append(insn).append('\n');
        }
        return sb.toString();
    }
}
