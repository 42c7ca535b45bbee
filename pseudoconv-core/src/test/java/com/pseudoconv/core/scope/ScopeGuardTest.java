package com.pseudoconv.core.scope;

import com.pseudoconv.core.error.ConvertError;
import com.pseudoconv.core.error.Stage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ScopeGuard}.
 */
class ScopeGuardTest {

    private final ScopeGuard guard = new ScopeGuard();

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "interface Shape { }                         | Interfaces are out of scope.",
        "class A implements Runnable { }             | Interfaces are out of scope.",
        "class Dog extends Animal { }                | Inheritance is out of scope.",
        "void run() throws Exception { }             | Exceptions are out of scope.",
        "try { x = 1; } finally { }                  | Exceptions are out of scope.",
        "catch (e) { }                               | Exceptions are out of scope.",
        "switch (x) { }                              | Switch is out of scope.",
        "ArrayList<Integer> xs;                      | Generics are out of scope.",
        "HashMap ages = new HashMap<>();             | Generics are out of scope.",
        "Map<String, Integer> m;                     | Generics are out of scope.",
        "class A { }  class B { }                    | Multiple classes are out of scope."
    })
    void check_outOfScopeConstruct_reportsReason(String source, String reason) {
        Optional<ConvertError> error = guard.check(source);

        assertThat(error).contains(new ConvertError(Stage.SCOPE, reason, 1, 1));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "int x = 1;",
        "if (a < b && c > d) { x = 1; }",
        "if (A < B && C > D) { x = 1; }",
        "int[][] grid = new int[3][3];",
        "String className = \"class\";",
        "public class Main { public static void main(String[] args) { } }"
    })
    void check_supportedSource_passes(String source) {
        assertThat(guard.check(source)).isEmpty();
    }

    @Test
    void check_bannedWordInsideString_passes() {
        assertThat(guard.check("String s = \"try the switch, then catch it\";")).isEmpty();
    }

    @Test
    void check_classesOnSeparateLines_rejected() {
        Optional<ConvertError> error = guard.check("class A {\n}\n\nclass B {\n}");

        assertThat(error).map(ConvertError::message).contains("Multiple classes are out of scope.");
    }

    @Test
    void check_severalViolations_firstRuleWins() {
        Optional<ConvertError> error = guard.check("switch (x) { } interface Y { }");

        assertThat(error).map(ConvertError::message).contains(ScopeGuard.INTERFACES);
    }

    @Test
    void check_minimalProfile_rejectsMultiDimensionalArrays() {
        ScopeGuard minimal = new ScopeGuard(false);

        assertThat(minimal.check("int[][] grid = new int[3][3];"))
            .map(ConvertError::message).contains(ScopeGuard.MULTI_DIMENSIONAL_ARRAYS);
        assertThat(minimal.check("grid[i] [j] = 0;"))
            .map(ConvertError::message).contains(ScopeGuard.MULTI_DIMENSIONAL_ARRAYS);
        assertThat(minimal.check("int[] a = new int[3]; a[0] = 1;")).isEmpty();
    }

    @Test
    void rules_minimalProfile_appendsArrayRuleLast() {
        assertThat(new ScopeGuard(true).rules()).extracting(ScopeRule::id)
            .doesNotContain("multi-dimensional-arrays")
            .startsWith("interface", "implements", "extends");
        assertThat(new ScopeGuard(false).rules()).extracting(ScopeRule::id)
            .endsWith("multiple-classes", "multi-dimensional-arrays");
    }
}
