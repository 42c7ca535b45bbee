package com.pseudoconv.core.scope;

import com.pseudoconv.core.error.ConvertError;
import com.pseudoconv.core.error.Stage;
import com.pseudoconv.core.normalize.SourceNormalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Rejects source that uses constructs outside the supported Java subset
 * before any tokenizing happens.
 *
 * <p>This is a syntactic pre-filter, not a grammar check: rules are evaluated
 * in order against the normalized text (with string literal contents masked)
 * and the first match aborts the pipeline with a {@link Stage#SCOPE} error.
 * The parser remains the authority for structural correctness.
 *
 * <h2>Rules</h2>
 * <ol>
 *   <li>{@code interface}, {@code implements}: interfaces</li>
 *   <li>{@code extends}: inheritance</li>
 *   <li>{@code throws}, {@code try}, {@code catch}: exceptions</li>
 *   <li>{@code switch}</li>
 *   <li>type arguments such as {@code ArrayList<Integer>} or {@code new HashMap<>()}</li>
 *   <li>a second {@code class} declaration</li>
 *   <li>multi-dimensional arrays, only in the minimal profile</li>
 * </ol>
 */
public class ScopeGuard {

    static final String INTERFACES = "Interfaces are out of scope.";
    static final String INHERITANCE = "Inheritance is out of scope.";
    static final String EXCEPTIONS = "Exceptions are out of scope.";
    static final String SWITCH = "Switch is out of scope.";
    static final String GENERICS = "Generics are out of scope.";
    static final String MULTIPLE_CLASSES = "Multiple classes are out of scope.";
    static final String MULTI_DIMENSIONAL_ARRAYS = "2D arrays are out of scope.";

    private static final String TYPE_ARGUMENT = "(?:[A-Z]\\w*(?:\\s*\\[\\s*\\])*|\\?)";
    private static final String GENERICS_REGEX =
        "\\b[A-Z]\\w*\\s*<\\s*(?:" + TYPE_ARGUMENT + "(?:\\s*,\\s*" + TYPE_ARGUMENT + ")*\\s*)?>";

    private static final List<ScopeRule> STANDARD_RULES = List.of(
        ScopeRule.of("interface", "\\binterface\\b", INTERFACES),
        ScopeRule.of("implements", "\\bimplements\\b", INTERFACES),
        ScopeRule.of("extends", "\\bextends\\b", INHERITANCE),
        ScopeRule.of("throws", "\\bthrows\\b", EXCEPTIONS),
        ScopeRule.of("try", "\\btry\\b", EXCEPTIONS),
        ScopeRule.of("catch", "\\bcatch\\b", EXCEPTIONS),
        ScopeRule.of("switch", "\\bswitch\\b", SWITCH),
        ScopeRule.of("generics", GENERICS_REGEX, GENERICS),
        new ScopeRule("multiple-classes", Pattern.compile("\\bclass\\b.*\\bclass\\b", Pattern.DOTALL), MULTIPLE_CLASSES)
    );

    private static final ScopeRule MULTI_DIMENSIONAL_RULE =
        ScopeRule.of("multi-dimensional-arrays", "\\]\\s*\\[", MULTI_DIMENSIONAL_ARRAYS);

    private final List<ScopeRule> rules;

    /**
     * Creates a guard with the standard rules, multi-dimensional arrays allowed.
     */
    public ScopeGuard() {
        this(true);
    }

    /**
     * Creates a guard for the given scope profile.
     *
     * @param allowMultiDimensionalArrays false selects the minimal profile, which
     *                                    also rejects {@code int[][]} and {@code a[i][j]}
     */
    public ScopeGuard(boolean allowMultiDimensionalArrays) {
        List<ScopeRule> active = new ArrayList<>(STANDARD_RULES);
        if (!allowMultiDimensionalArrays) {
            active.add(MULTI_DIMENSIONAL_RULE);
        }
        this.rules = List.copyOf(active);
    }

    /**
     * Returns the rules in evaluation order.
     *
     * @return immutable rule list
     */
    public List<ScopeRule> rules() {
        return rules;
    }

    /**
     * Checks normalized source against every rule in order.
     *
     * @param normalized output of {@link SourceNormalizer#normalize(String)}
     * @return the first violation, or empty when the source is in scope
     */
    public Optional<ConvertError> check(String normalized) {
        String masked = SourceNormalizer.maskStringLiterals(normalized);
        for (ScopeRule rule : rules) {
            if (rule.matches(masked)) {
                return Optional.of(ConvertError.at(Stage.SCOPE, rule.reason()));
            }
        }
        return Optional.empty();
    }
}
