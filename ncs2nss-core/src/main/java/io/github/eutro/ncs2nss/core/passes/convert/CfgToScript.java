package io.github.eutro.ncs2nss.core.passes.convert;

import io.github.eutro.ncs2nss.core.DecompileOptions;
import io.github.eutro.ncs2nss.core.actions.SignatureTable;
import io.github.eutro.ncs2nss.core.ast.FunctionDecl;
import io.github.eutro.ncs2nss.core.ast.NssType;
import io.github.eutro.ncs2nss.core.ast.Region;
import io.github.eutro.ncs2nss.core.ast.Script;
import io.github.eutro.ncs2nss.core.ast.SubroutineSignature;
import io.github.eutro.ncs2nss.core.cfg.ControlFlowGraph;
import io.github.eutro.ncs2nss.core.cfg.Subroutine;
import io.github.eutro.ncs2nss.core.ext.CommonExts;
import io.github.eutro.ncs2nss.core.passes.IRPass;
import io.github.eutro.ncs2nss.core.passes.meta.FindSubroutines;
import io.github.eutro.ncs2nss.core.passes.meta.InferSubroutineSignatures;
import io.github.eutro.ncs2nss.core.passes.opts.SimplifyRegions;
import org.jetbrains.annotations.NotNull;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs everything between the control-flow graph and the statement tree: subroutine partitioning,
 * signature inference, expression recovery, then structuring and simplification of every function.
 */
public class CfgToScript implements IRPass<ControlFlowGraph, Script> {
    private static final Logger LOGGER = System.getLogger(CfgToScript.class.getName());

    /**
     * The name of an entry point that returns a value.
     */
    public static final String CONDITIONAL_ENTRY = "StartingConditional";

    @NotNull
    private final SignatureTable table;
    @NotNull
    private final DecompileOptions options;

    public CfgToScript(@NotNull SignatureTable table, @NotNull DecompileOptions options) {
        this.table = table;
        this.options = options;
    }

    @Override
    public Script run(ControlFlowGraph graph) {
        FindSubroutines.INSTANCE.run(graph);
        new InferSubroutineSignatures(table).run(graph);
        new RecoverExpressions(table, options.strictSignatures).run(graph);

        StructureRegions structure = new StructureRegions(options.preferSwitches);
        List<Subroutine> subs = graph.getExtOrThrow(CommonExts.SUBROUTINES);
        for (Subroutine sub : subs) {
            if (sub.getKind() == Subroutine.Kind.FUNCTION || sub.getKind() == Subroutine.Kind.CLOSURE) {
                structure.then(SimplifyRegions.INSTANCE).run(sub);
            }
        }

        Subroutine main = graph.getExtOrThrow(CommonExts.MAIN_SUBROUTINE);
        SubroutineSignature mainSig = main.getExtOrThrow(CommonExts.SIGNATURE);
        if (mainSig.getReturnType() == NssType.INT) mainSig.setName(CONDITIONAL_ENTRY);

        List<FunctionDecl> functions = new ArrayList<>();
        for (Subroutine sub : subs) {
            if (sub.getKind() == Subroutine.Kind.FUNCTION && sub != main) functions.add(declaration(sub));
        }
        functions.add(declaration(main));

        List<Region> globals = graph.getNullable(CommonExts.GLOBAL_STATEMENTS);
        Script script = new Script(graph.getCode().getVariant(),
                globals == null ? new ArrayList<>() : globals,
                functions,
                graph.getExtOrThrow(CommonExts.DIAGNOSTICS));
        LOGGER.log(Level.DEBUG, "Recovered {0} functions and {1} global statements",
                functions.size(), script.globals.size());
        return script;
    }

    private static FunctionDecl declaration(Subroutine sub) {
        return new FunctionDecl(sub.getExtOrThrow(CommonExts.SIGNATURE), sub.getExtOrThrow(CommonExts.BODY), sub.getOffset());
    }
}
