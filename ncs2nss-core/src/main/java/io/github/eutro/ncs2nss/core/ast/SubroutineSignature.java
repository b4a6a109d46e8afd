package io.github.eutro.ncs2nss.core.ast;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;

/**
 * The interface of a subroutine of the script: its parameters, bottom of the stack last,
 * and the cells it returns its value in.
 * <p>
 * Parameter and return types start out unknown, and are refined as calls and returns are recovered.
 */
public final class SubroutineSignature {
    @NotNull
    private String name;
    public final int paramCells;
    public final int returnCells;
    /**
     * One slot per parameter cell. Parameter 0 is the top of the stack on entry.
     */
    public final List<LocalSlot> params;
    /**
     * The cells the return value is written to, bottom of the stack first.
     */
    public final List<LocalSlot> returnSlots;

    public SubroutineSignature(@NotNull String name, List<LocalSlot> params, List<LocalSlot> returnSlots) {
        this.name = name;
        this.params = Collections.unmodifiableList(params);
        this.returnSlots = Collections.unmodifiableList(returnSlots);
        this.paramCells = params.size();
        this.returnCells = returnSlots.size();
    }

    @NotNull
    public String getName() {
        return name;
    }

    public void setName(@NotNull String name) {
        this.name = name;
    }

    @NotNull
    public NssType getReturnType() {
        switch (returnCells) {
            case 0:
                return NssType.VOID;
            case 1:
                return returnSlots.get(0).getType();
            case 3:
                return NssType.VECTOR;
            default:
                return NssType.STRUCT;
        }
    }

    @Override
    public String toString() {
        return name + "(" + paramCells + " -> " + returnCells + ")";
    }
}
