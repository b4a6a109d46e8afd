package io.github.eutro.ncs2nss.core.passes;

import io.github.eutro.ncs2nss.core.DecompileOptions;
import io.github.eutro.ncs2nss.core.actions.SignatureTable;
import io.github.eutro.ncs2nss.core.ast.Script;
import io.github.eutro.ncs2nss.core.ncs.InstructionStream;
import io.github.eutro.ncs2nss.core.passes.convert.BuildCfg;
import io.github.eutro.ncs2nss.core.passes.convert.CfgToScript;
import io.github.eutro.ncs2nss.core.passes.convert.EmitSource;

/**
 * Some pre-composed passes. This should not be considered stable.
 */
public class Passes {
    /**
     * Recover the statement tree of a decoded script.
     *
     * @param table   The engine function signatures of the script's game.
     * @param options The structuring and signature options.
     * @return The pass.
     */
    public static IRPass<InstructionStream, Script> recover(SignatureTable table, DecompileOptions options) {
        return BuildCfg.INSTANCE.then(new CfgToScript(table, options));
    }

    /**
     * Decompile a decoded script to unrepaired source.
     *
     * @param table   The engine function signatures of the script's game.
     * @param options The structuring and signature options.
     * @return The pass.
     */
    public static IRPass<InstructionStream, String> decompile(SignatureTable table, DecompileOptions options) {
        return recover(table, options).then(EmitSource.INSTANCE);
    }
}
