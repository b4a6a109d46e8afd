package io.github.eutro.ncs2nss.core.ast;

import io.github.eutro.ncs2nss.core.Diagnostics;
import io.github.eutro.ncs2nss.core.ncs.GameVariant;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A whole recovered script: global declarations, then functions with the entry function last.
 */
public final class Script {
    @NotNull
    public final GameVariant variant;
    /**
     * The global variable declarations and their initialization, in order.
     */
    public final List<Region> globals;
    public final List<FunctionDecl> functions;
    @NotNull
    public final Diagnostics diagnostics;

    public Script(@NotNull GameVariant variant, List<Region> globals, List<FunctionDecl> functions, @NotNull Diagnostics diagnostics) {
        this.variant = variant;
        this.globals = Collections.unmodifiableList(new ArrayList<>(globals));
        this.functions = Collections.unmodifiableList(new ArrayList<>(functions));
        this.diagnostics = diagnostics;
    }

    /**
     * Get the entry function.
     *
     * @return The function.
     */
    @NotNull
    public FunctionDecl getEntry() {
        return functions.get(functions.size() - 1);
    }
}
