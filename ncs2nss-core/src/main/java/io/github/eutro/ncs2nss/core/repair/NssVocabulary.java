package io.github.eutro.ncs2nss.core.repair;

import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * The type names and keywords of NWScript, and the fallbacks the repairs use for names outside them.
 */
public final class NssVocabulary {
    private NssVocabulary() {
    }

    public static final Set<String> TYPES = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "int", "float", "string", "void", "object", "location", "vector",
            "talent", "effect", "event", "itemproperty", "action"
    )));

    public static final Set<String> KEYWORDS;
    public static final Set<String> CONTROL_KEYWORDS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "if", "else", "while", "for", "do", "switch", "return"
    )));

    private static final Map<String, String> CORRECTIONS = new HashMap<>();
    private static final Map<String, String> PARAMETER_NAMES = new HashMap<>();

    static {
        Set<String> keywords = new HashSet<>(TYPES);
        keywords.addAll(Arrays.asList(
                "if", "else", "while", "for", "do", "switch", "case", "default", "break", "continue",
                "return", "true", "false", "const", "static", "struct", "enum"
        ));
        KEYWORDS = Collections.unmodifiableSet(keywords);

        correct("int", "integer", "number", "num");
        correct("string", "str", "text");
        correct("object", "obj", "gameobject");
        correct("void", "null", "none");
        correct("float", "float32", "double", "real");
        correct("vector", "vec", "vec3");
        correct("location", "loc");
        correct("talent", "tal");
        correct("effect", "eff");
        correct("event", "evt");
        correct("itemproperty", "itemprop", "item_property");
        correct("action", "act");

        PARAMETER_NAMES.put("int", "value");
        PARAMETER_NAMES.put("float", "amount");
        PARAMETER_NAMES.put("string", "text");
        PARAMETER_NAMES.put("object", "target");
        PARAMETER_NAMES.put("location", "loc");
        PARAMETER_NAMES.put("vector", "pos");
        PARAMETER_NAMES.put("talent", "tal");
        PARAMETER_NAMES.put("effect", "eff");
        PARAMETER_NAMES.put("event", "evt");
        PARAMETER_NAMES.put("itemproperty", "ip");
        PARAMETER_NAMES.put("action", "act");
    }

    private static void correct(String type, String... misspellings) {
        for (String misspelling : misspellings) CORRECTIONS.put(misspelling, type);
    }

    public static boolean isType(String name) {
        return TYPES.contains(name);
    }

    public static boolean isKeyword(String name) {
        return KEYWORDS.contains(name.toLowerCase());
    }

    /**
     * Look up the type a misspelled or foreign type name stands for.
     *
     * @param name The name.
     * @return The type, or null if the name is not in the correction table.
     */
    @Nullable
    public static String correction(String name) {
        return CORRECTIONS.get(name.toLowerCase());
    }

    /**
     * Get the base name for a parameter of the given type.
     *
     * @param type The type.
     * @return The name.
     */
    public static String parameterName(String type) {
        String name = PARAMETER_NAMES.get(type);
        return name == null ? "param" : name;
    }
}
