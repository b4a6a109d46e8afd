package io.github.eutro.ncs2nss.api.events;

import io.github.eutro.ncs2nss.api.Decompilation;
import io.github.eutro.ncs2nss.core.ast.Script;
import org.jetbrains.annotations.NotNull;

/**
 * Fired once the statement tree of the whole script has been recovered, before it is printed.
 *
 * @see Decompilation
 */
public class ScriptRecoveredEvent implements DecompilationEvent {
    @NotNull
    public Script script;

    public ScriptRecoveredEvent(@NotNull Script script) {
        this.script = script;
    }
}
