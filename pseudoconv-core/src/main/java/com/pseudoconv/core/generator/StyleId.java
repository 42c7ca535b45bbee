package com.pseudoconv.core.generator;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Identifiers of the supported pseudocode styles.
 *
 * <p>Styles come in families that share one {@link StyleConfig}:
 * <ul>
 *   <li>{@code sc-01} - uppercase keywords, structured loops</li>
 *   <li>{@code sc-02} - lowercase keywords, structured loops (default)</li>
 *   <li>{@code sc-03}, {@code sc-07}, {@code sc-09} - loop form</li>
 *   <li>{@code sc-04}, {@code sc-05}, {@code sc-08} - loop form, multiplicative operands of subtraction wrapped</li>
 *   <li>{@code sc-06} - loop form with collection operations rewritten</li>
 * </ul>
 */
public enum StyleId {
    SC_01("sc-01"),
    SC_02("sc-02"),
    SC_03("sc-03"),
    SC_04("sc-04"),
    SC_05("sc-05"),
    SC_06("sc-06"),
    SC_07("sc-07"),
    SC_08("sc-08"),
    SC_09("sc-09");

    /** Style used when none is requested. */
    public static final StyleId DEFAULT = SC_02;

    private final String id;

    StyleId(String id) {
        this.id = id;
    }

    /**
     * Returns the external id, e.g. "sc-03".
     *
     * @return style id
     */
    public String id() {
        return id;
    }

    /**
     * Parses an external style id (case-insensitive).
     *
     * @param id style id such as "sc-06"
     * @return matching style
     * @throws IllegalArgumentException if the id is unknown
     */
    public static StyleId fromId(String id) {
        if (id != null) {
            String normalized = id.trim().toLowerCase(Locale.ROOT);
            for (StyleId style : values()) {
                if (style.id.equals(normalized)) {
                    return style;
                }
            }
        }
        throw new IllegalArgumentException("Unknown style '" + id + "'. Supported styles: "
            + Arrays.stream(values()).map(StyleId::id).collect(Collectors.joining(", ")));
    }

    @Override
    public String toString() {
        return id;
    }
}
