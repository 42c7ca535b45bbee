package com.pseudoconv.core.generator;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Registry of the built-in style configurations.
 *
 * <p>Five families cover the nine style ids:
 * <pre>
 * sc-01              uppercase, structured loops, != and %, indent 2
 * sc-02              lowercase, structured loops, &lt;&gt; and mod, indent 4
 * sc-03, sc-07, sc-09  loop form
 * sc-04, sc-05, sc-08  loop form, a - (b * c)
 * sc-06              loop form, collection calls rewritten
 * </pre>
 */
public final class Styles {

    /** Every style removes items; keyed or positional is decided per receiver. */
    private static final List<MethodTranslation> COMMON_TRANSLATIONS = List.of(
        MethodTranslation.remove("remove")
    );

    private static final List<MethodTranslation> COLLECTION_TRANSLATIONS = List.of(
        MethodTranslation.remove("remove"),
        MethodTranslation.rename("add", 2, "insertItemAt"),
        MethodTranslation.rename("add", MethodTranslation.ANY_ARITY, "addItem"),
        MethodTranslation.subscriptWrite("set"),
        MethodTranslation.subscriptWrite("put"),
        MethodTranslation.subscriptRead("get"),
        MethodTranslation.functionForm("containsKey", 1, "containsKey"),
        MethodTranslation.functionForm("size", 0, "length"),
        MethodTranslation.rename("addAt", MethodTranslation.ANY_ARITY, "insertItemAt")
    );

    private static final Map<StyleId, StyleConfig> STYLES = buildStyles();

    private Styles() {
        // Utility class - no instantiation
    }

    /**
     * Returns the configuration for a style id.
     *
     * @param id style id
     * @return immutable style configuration
     */
    public static StyleConfig resolve(StyleId id) {
        return STYLES.get(Objects.requireNonNull(id, "id must not be null"));
    }

    private static Map<StyleId, StyleConfig> buildStyles() {
        Map<StyleId, StyleConfig> styles = new EnumMap<>(StyleId.class);
        styles.put(StyleId.SC_01, new StyleConfig(StyleId.SC_01, StyleKeywords.lowercase().uppercased(),
            LoopForm.STRUCTURED, "TRUE", "FALSE", "AND", "OR", "NOT", "!=", "%", 2,
            true, true, false, COMMON_TRANSLATIONS));
        styles.put(StyleId.SC_02, lowercase(StyleId.SC_02, LoopForm.STRUCTURED, false, COMMON_TRANSLATIONS));
        for (StyleId id : List.of(StyleId.SC_03, StyleId.SC_07, StyleId.SC_09)) {
            styles.put(id, lowercase(id, LoopForm.LOOP, false, COMMON_TRANSLATIONS));
        }
        for (StyleId id : List.of(StyleId.SC_04, StyleId.SC_05, StyleId.SC_08)) {
            styles.put(id, lowercase(id, LoopForm.LOOP, true, COMMON_TRANSLATIONS));
        }
        styles.put(StyleId.SC_06, lowercase(StyleId.SC_06, LoopForm.LOOP, false, COLLECTION_TRANSLATIONS));
        return styles;
    }

    private static StyleConfig lowercase(StyleId id, LoopForm loopForm, boolean wrapMulInSubtraction,
                                         List<MethodTranslation> translations) {
        return new StyleConfig(id, StyleKeywords.lowercase(), loopForm,
            "true", "false", "and", "or", "not", "<>", "mod", 4,
            false, true, wrapMulInSubtraction, translations);
    }
}
