package io.github.eutro.ncs2nss.api.events;

import io.github.eutro.ncs2nss.api.Decompilation;
import io.github.eutro.ncs2nss.core.cfg.ControlFlowGraph;
import org.jetbrains.annotations.NotNull;

/**
 * Fired once the control-flow graph has been built, before it is split into subroutines.
 * <p>
 * Metadata attached to the graph here is kept, so analyses may be run ahead of time.
 *
 * @see Decompilation
 */
public class CfgBuiltEvent implements DecompilationEvent {
    @NotNull
    public ControlFlowGraph graph;

    public CfgBuiltEvent(@NotNull ControlFlowGraph graph) {
        this.graph = graph;
    }
}
