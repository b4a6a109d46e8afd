package io.github.eutro.ncs2nss.core.actions;

import io.github.eutro.ncs2nss.core.ast.NssType;
import io.github.eutro.ncs2nss.core.ncs.GameVariant;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;

/**
 * The declaration of an engine function, as listed in a variant's {@code nwscript.nss}.
 */
public final class EngineFunctionSignature {
    public static final class Param {
        @NotNull
        public final NssType type;
        @NotNull
        public final String name;
        /**
         * The default value as written in the declaration, such as {@code OBJECT_SELF}.
         */
        @Nullable
        public final String defaultText;

        public Param(@NotNull NssType type, @NotNull String name, @Nullable String defaultText) {
            this.type = type;
            this.name = name;
            this.defaultText = defaultText;
        }

        @Override
        public String toString() {
            return type.getSourceName() + " " + name + (defaultText == null ? "" : "=" + defaultText);
        }
    }

    public final int index;
    @NotNull
    public final String name;
    @NotNull
    public final NssType returnType;
    public final List<Param> params;
    @NotNull
    public final GameVariant variant;

    public EngineFunctionSignature(int index,
                                   @NotNull String name,
                                   @NotNull NssType returnType,
                                   List<Param> params,
                                   @NotNull GameVariant variant) {
        this.index = index;
        this.name = name;
        this.returnType = returnType;
        this.params = Collections.unmodifiableList(params);
        this.variant = variant;
    }

    public int arity() {
        return params.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(returnType.getSourceName()).append(' ').append(name).append('(');
        for (int i = 0; i < params.size(); i++) {
            if (i != 0) sb.append(", ");
            sb.append(params.get(i));
        }
        return sb.append(");").toString();
    }
}
