package io.github.eutro.ncs2nss.core.actions;

import io.github.eutro.ncs2nss.core.ast.NssType;
import io.github.eutro.ncs2nss.core.ncs.GameVariant;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The engine functions of one game variant, by routine index. Immutable, and shared by all decompilations.
 * <p>
 * Tables are read from declaration files in the {@code nwscript.nss} format, where each function
 * is preceded by a comment line starting with its index: {@code // 7: ...}.
 */
public final class SignatureTable {
    private static final Logger LOGGER = System.getLogger(SignatureTable.class.getName());

    private static final Pattern INDEX_LINE = Pattern.compile("^//\\s*(\\d+)\\s*:.*");
    private static final Pattern DECLARATION = Pattern.compile("^(\\w+)\\s+(\\w+)\\s*\\((.*)\\)\\s*;.*");
    private static final Pattern PARAM = Pattern.compile("^(\\w+)\\s+(\\w+)\\s*(?:=\\s*(.+))?$");

    private static final Map<GameVariant, SignatureTable> CACHE = new EnumMap<>(GameVariant.class);

    @NotNull
    private final GameVariant variant;
    private final Map<Integer, EngineFunctionSignature> byIndex;

    private SignatureTable(@NotNull GameVariant variant, Map<Integer, EngineFunctionSignature> byIndex) {
        this.variant = variant;
        this.byIndex = Collections.unmodifiableMap(byIndex);
    }

    /**
     * Get the table for a variant, loading it from the classpath on first use.
     *
     * @param variant The game variant.
     * @return The table.
     */
    @NotNull
    public static SignatureTable forVariant(@NotNull GameVariant variant) {
        synchronized (SignatureTable.class) {
            SignatureTable table = CACHE.get(variant);
            if (table == null) {
                table = load(variant);
                CACHE.put(variant, table);
            }
            return table;
        }
    }

    private static SignatureTable load(GameVariant variant) {
        String resource = variant.getSignatureResource();
        InputStream is = SignatureTable.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalStateException("Missing signature table " + resource);
        }
        try (Reader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
            SignatureTable table = parse(variant, reader);
            LOGGER.log(Level.INFO, "Loaded {0} engine functions for {1}", table.size(), variant);
            return table;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }
    }

    /**
     * Parse declarations.
     *
     * @param variant The variant the declarations are for.
     * @param source  The declarations.
     * @return The table.
     * @throws IOException If reading fails.
     */
    public static SignatureTable parse(@NotNull GameVariant variant, @NotNull Reader source) throws IOException {
        Map<Integer, EngineFunctionSignature> byIndex = new TreeMap<>();
        BufferedReader reader = new BufferedReader(source);
        int pendingIndex = -1;
        String line;
        while ((line = reader.readLine()) != null) {
            line = line.trim();
            if (line.isEmpty()) continue;
            Matcher im = INDEX_LINE.matcher(line);
            if (im.matches()) {
                if (pendingIndex == -1) pendingIndex = Integer.parseInt(im.group(1));
                continue;
            }
            if (line.startsWith("//")) continue;
            if (pendingIndex != -1) {
                EngineFunctionSignature sig = parseDeclaration(variant, pendingIndex, line);
                if (sig != null) {
                    byIndex.put(pendingIndex, sig);
                } else {
                    LOGGER.log(Level.DEBUG, "Skipping unparseable declaration for {0}: {1}", pendingIndex, line);
                }
                pendingIndex = -1;
            }
        }
        return new SignatureTable(variant, byIndex);
    }

    public static SignatureTable parse(@NotNull GameVariant variant, @NotNull String source) {
        try {
            return parse(variant, new StringReader(source));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Nullable
    private static EngineFunctionSignature parseDeclaration(GameVariant variant, int index, String line) {
        Matcher m = DECLARATION.matcher(line);
        if (!m.matches()) return null;
        NssType returnType = NssType.fromName(m.group(1));
        if (returnType == null) return null;
        List<EngineFunctionSignature.Param> params = new ArrayList<>();
        for (String param : splitParams(m.group(3))) {
            Matcher pm = PARAM.matcher(param);
            if (!pm.matches()) return null;
            NssType type = NssType.fromName(pm.group(1));
            params.add(new EngineFunctionSignature.Param(
                    type == null ? NssType.ANY : type,
                    pm.group(2),
                    pm.group(3) == null ? null : pm.group(3).trim()));
        }
        return new EngineFunctionSignature(index, m.group(2), returnType, params, variant);
    }

    // commas inside vector defaults such as [0.0,0.0,0.0] don't separate parameters
    private static List<String> splitParams(String params) {
        List<String> out = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < params.length(); i++) {
            char c = params.charAt(i);
            if (c == '[' || c == '(') depth++;
            else if (c == ']' || c == ')') depth--;
            else if (c == ',' && depth == 0) {
                out.add(params.substring(start, i).trim());
                start = i + 1;
            }
        }
        String last = params.substring(start).trim();
        if (!last.isEmpty()) out.add(last);
        return out;
    }

    @NotNull
    public GameVariant getVariant() {
        return variant;
    }

    /**
     * Look up an engine function.
     *
     * @param index The routine index.
     * @return The signature, or null if the table has no such function.
     */
    @Nullable
    public EngineFunctionSignature get(int index) {
        return byIndex.get(index);
    }

    /**
     * Find an engine function by name.
     *
     * @param name The name.
     * @return The signature, or null.
     */
    @Nullable
    public EngineFunctionSignature byName(String name) {
        for (EngineFunctionSignature sig : byIndex.values()) {
            if (sig.name.equals(name)) return sig;
        }
        return null;
    }

    public int size() {
        return byIndex.size();
    }
}
