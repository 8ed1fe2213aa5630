package com.specdrift.equivalence;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.specdrift.model.Assertion;
import com.specdrift.model.Effect;
import com.specdrift.model.Parameter;
import com.specdrift.model.Signature;
import com.specdrift.model.Specification;
import com.specdrift.sandbox.ExecutionFailureException;
import com.specdrift.sandbox.SandboxExecutor;
import com.specdrift.structure.JavaImplementationParser;
import com.specdrift.variant.VariantGenerator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EquivalenceCheckerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static Specification averageSpec() {
        return new Specification(
                "Compute the average of a list of numbers",
                new Signature("calculate_average", List.of(new Parameter("input_numbers", "list[float]")), "float"),
                List.of(new Effect("Read input_numbers"), new Effect("Return the mean value")),
                List.of(new Assertion("len(input_numbers) > 0")));
    }

    private static EquivalenceChecker checker(EquivalenceConfiguration configuration, SandboxExecutor executor) {
        return new EquivalenceChecker(configuration, (a, b) -> 0.5, executor, new JavaImplementationParser(), Runnable::run);
    }

    private static EquivalenceChecker checker(EquivalenceConfiguration configuration) {
        return checker(configuration, (source, functionName, input, timeout) -> {
            throw new ExecutionFailureException(ExecutionFailureException.Reason.LAUNCH_FAILED, "not used");
        });
    }

    @Test
    void shouldTreatNamingVariantsAsEquivalentWhenNormalizing() {
        EquivalenceChecker checker = checker(EquivalenceConfiguration.defaults());
        Specification baseline = averageSpec();

        for (Specification variant : new VariantGenerator().namingVariants(baseline)) {
            assertTrue(checker.specEquivalent(baseline, variant), variant.signature().name());
        }
    }

    @Test
    void shouldDistinguishNamingVariantsWithoutNormalization() {
        EquivalenceChecker checker = checker(EquivalenceConfiguration.defaults().withNormalizeNaming(false));
        Specification baseline = averageSpec();
        List<Specification> variants = new VariantGenerator().namingVariants(baseline);

        assertFalse(checker.specEquivalent(baseline, variants.get(1)));
        assertFalse(checker.specEquivalent(baseline, variants.get(2)));
        assertFalse(checker.specEquivalent(baseline, variants.get(3)));
    }

    @Test
    void shouldIgnoreEffectOrderUnlessRequired() {
        Specification baseline = averageSpec();
        List<Effect> reversed = new ArrayList<>(baseline.effects());
        Collections.reverse(reversed);
        Specification reordered = baseline.withEffects(reversed);

        assertTrue(checker(EquivalenceConfiguration.defaults()).specEquivalent(baseline, reordered));
        assertFalse(checker(EquivalenceConfiguration.defaults().withRequireEffectOrder(true)).specEquivalent(baseline, reordered));
    }

    @Test
    void shouldCompareEffectsAsMultisets() {
        Specification baseline = averageSpec().withEffects(List.of(new Effect("log"), new Effect("log"), new Effect("send")));
        Specification other = averageSpec().withEffects(List.of(new Effect("log"), new Effect("send"), new Effect("send")));

        assertFalse(checker(EquivalenceConfiguration.defaults()).specEquivalent(baseline, other));
    }

    @Test
    void shouldUseSimilarityOnlyForDifferentIntents() {
        Specification baseline = averageSpec();
        Specification reworded = new Specification("Average a list", baseline.signature(), baseline.effects(), baseline.assertions());

        assertFalse(checker(EquivalenceConfiguration.defaults()).specEquivalent(baseline, reworded));
        assertTrue(checker(EquivalenceConfiguration.defaults().withIntentSimilarityThreshold(0.5)).specEquivalent(baseline, reworded));
    }

    @Test
    void shouldRejectSignatureDifferences() {
        EquivalenceChecker checker = checker(EquivalenceConfiguration.defaults());
        Specification baseline = averageSpec();
        Signature signature = baseline.signature();

        assertFalse(checker.specEquivalent(baseline, baseline.withSignature(signature.withName("calculate_median"))));
        assertFalse(checker.specEquivalent(baseline, baseline.withSignature(
                signature.withParameters(List.of(new Parameter("input_numbers", "list[int]"))))));
        assertFalse(checker.specEquivalent(baseline, baseline.withSignature(
                new Signature(signature.name(), signature.parameters(), null))));
    }

    @Test
    void shouldCompareAssertionsAsSets() {
        Specification baseline = averageSpec().withAssertions(List.of(new Assertion("a > 0"), new Assertion("b > 0")));
        Specification swapped = averageSpec().withAssertions(List.of(new Assertion("b > 0"), new Assertion("a > 0")));
        Specification fewer = averageSpec().withAssertions(List.of(new Assertion("a > 0")));

        EquivalenceChecker checker = checker(EquivalenceConfiguration.defaults());
        assertTrue(checker.specEquivalent(baseline, swapped));
        assertFalse(checker.specEquivalent(baseline, fewer));
    }

    @Test
    void shouldRejectNullSpecifications() {
        EquivalenceChecker checker = checker(EquivalenceConfiguration.defaults());

        assertThrows(NullPointerException.class, () -> checker.specEquivalent(null, averageSpec()));
    }

    @Test
    void shouldReportNoEvidenceAsNotEquivalent() {
        EquivalenceChecker checker = checker(EquivalenceConfiguration.defaults());

        assertFalse(checker.codeEquivalentByExecution("int f(int a) { return a; }", "int f(int a) { return a; }", List.of(), TIMEOUT));
    }

    @Test
    void shouldCompareOutputsForEveryInput() throws Exception {
        List<String> calls = new ArrayList<>();
        SandboxExecutor fake = (source, functionName, input, timeout) -> {
            calls.add(functionName + ":" + input);
            double a = input.get("a").asDouble();
            double b = input.get("b").asDouble();
            return MAPPER.valueToTree(source.contains("a - b") ? a - b : a + b);
        };
        EquivalenceChecker checker = checker(EquivalenceConfiguration.defaults(), fake);
        List<JsonNode> inputs = List.of(MAPPER.readTree("{\"a\": 2, \"b\": 0}"), MAPPER.readTree("{\"a\": 1, \"b\": 2}"));

        assertTrue(checker.codeEquivalentByExecution(
                "double add(double a, double b) { return a + b; }",
                "double plus(double a, double b) { return b + a; }",
                inputs,
                TIMEOUT));
        assertEquals(4, calls.size());
        assertEquals("add:{\"a\":2,\"b\":0}", calls.get(0));
        assertEquals("plus:{\"a\":2,\"b\":0}", calls.get(1));

        assertFalse(checker.codeEquivalentByExecution(
                "double add(double a, double b) { return a + b; }",
                "double sub(double a, double b) { return a - b; }",
                inputs,
                TIMEOUT));
    }

    @Test
    void shouldTreatExecutionFailureAsNotEquivalent() throws Exception {
        SandboxExecutor failing = (source, functionName, input, timeout) -> {
            throw new ExecutionFailureException(ExecutionFailureException.Reason.TIMED_OUT, "slow");
        };
        EquivalenceChecker checker = checker(EquivalenceConfiguration.defaults(), failing);

        assertFalse(checker.codeEquivalentByExecution(
                "int f(int a) { return a; }",
                "int f(int a) { return a; }",
                List.of(MAPPER.readTree("{\"a\": 1}")),
                TIMEOUT));
    }

    @Test
    void shouldTreatUnparseableImplementationAsNotEquivalent() throws Exception {
        SandboxExecutor echo = (source, functionName, input, timeout) -> input;
        EquivalenceChecker checker = checker(EquivalenceConfiguration.defaults(), echo);

        assertFalse(checker.codeEquivalentByExecution("int f(int a) { return a; }", "this is not java",
                List.of(MAPPER.readTree("1")), TIMEOUT));
    }

    @Test
    void shouldCompareStraightLineMethodsIgnoringNamingAndStatementOrder() {
        EquivalenceChecker checker = checker(EquivalenceConfiguration.defaults());
        String snake = """
                double scaled_sum(double first_value, double second_value) {
                    double scaled_first = first_value * 2;
                    double scaled_second = second_value * 3;
                    return scaled_first + scaled_second;
                }
                """;
        String camel = """
                double scaledSum(double firstValue, double secondValue) {
                    // scale the second one first
                    double scaledSecond = secondValue * 3;
                    double scaledFirst = firstValue * 2;
                    return scaledFirst + scaledSecond;
                }
                """;

        assertTrue(checker.codeEquivalentStructurally(snake, camel));
        assertFalse(checker(EquivalenceConfiguration.defaults().withNormalizeNaming(false)).codeEquivalentStructurally(snake, camel));
    }

    @Test
    void shouldCompareBranchingMethodsAsWholeTrees() {
        EquivalenceChecker checker = checker(EquivalenceConfiguration.defaults());
        String first = """
                class Limits {
                    int clamp(int value) {
                        if (value > 10) {
                            return 10;
                        }
                        return value;
                    }
                }
                """;
        String sameWithComment = """
                class Limits {
                    /** Caps the value. */
                    int clamp(int value) {
                        if (value > 10) {
                            return 10; // upper bound
                        }
                        return value;
                    }
                }
                """;
        String reordered = """
                class Limits {
                    int clamp(int value) {
                        return value;
                        if (value > 10) {
                            return 10;
                        }
                    }
                }
                """;

        assertTrue(checker.codeEquivalentStructurally(first, sameWithComment));
        assertFalse(checker.codeEquivalentStructurally(first, reordered));
        assertFalse(checker.codeEquivalentStructurally(first, "class {"));
    }
}
