package com.specdrift.analysis;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.specdrift.equivalence.EquivalenceChecker;
import com.specdrift.model.Specification;
import com.specdrift.variant.VariantGenerator;

public class SensitivityAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(SensitivityAnalyzer.class);

    @FunctionalInterface
    public interface Translator<I, O> {
        O translate(I input) throws Exception;
    }

    private final EquivalenceChecker checker;
    private final VariantGenerator variantGenerator;
    private final Executor executor;
    private final WilcoxonSignedRankTest wilcoxon;

    public SensitivityAnalyzer(EquivalenceChecker checker) {
        this(checker, new VariantGenerator(), Runnable::run);
    }

    public SensitivityAnalyzer(EquivalenceChecker checker, VariantGenerator variantGenerator, Executor executor) {
        this.checker = Objects.requireNonNull(checker, "checker");
        this.variantGenerator = Objects.requireNonNull(variantGenerator, "variantGenerator");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.wilcoxon = new WilcoxonSignedRankTest();
    }

    public <I> SensitivityResult measureSpecSensitivity(List<I> inputs, Translator<I, Specification> translator) {
        requireBatch(inputs);
        return measureSpecSensitivity(inputs.get(0), inputs.subList(1, inputs.size()), translator);
    }

    public <I> SensitivityResult measureSpecSensitivity(I baseline, List<I> variants, Translator<I, Specification> translator) {
        Objects.requireNonNull(translator, "translator");
        List<I> inputs = batch(baseline, variants);
        List<Optional<Specification>> outputs = translateAll(inputs, translator);
        Optional<Specification> reference = outputs.get(0);
        if (reference.isEmpty()) {
            log.warn("Baseline translation failed; all {} variants count as non-equivalent", outputs.size() - 1);
        }
        return SensitivityResult.of(compareAll(outputs.subList(1, outputs.size()),
                candidate -> reference.isPresent() && checker.specEquivalent(reference.get(), candidate)));
    }

    public SensitivityResult compareSpecifications(Specification baseline, List<Specification> variantOutputs) {
        Objects.requireNonNull(baseline, "baseline");
        Objects.requireNonNull(variantOutputs, "variantOutputs");
        List<Optional<Specification>> outputs = variantOutputs.stream()
                .map(Optional::ofNullable)
                .collect(Collectors.toList());
        return SensitivityResult.of(compareAll(outputs, candidate -> checker.specEquivalent(baseline, candidate)));
    }

    public SensitivityResult measureCodeSensitivity(List<Specification> specVariants,
            Translator<Specification, String> codeGenerator,
            List<JsonNode> testInputs,
            Duration timeout) {
        requireBatch(specVariants);
        Objects.requireNonNull(codeGenerator, "codeGenerator");
        Objects.requireNonNull(timeout, "timeout");
        List<JsonNode> inputs = testInputs == null ? List.of() : List.copyOf(testInputs);

        List<Optional<String>> outputs = translateAll(specVariants, codeGenerator);
        Optional<String> reference = outputs.get(0);
        if (reference.isEmpty()) {
            log.warn("Baseline code generation failed; all {} variants count as non-equivalent", outputs.size() - 1);
        }
        return SensitivityResult.of(compareAll(outputs.subList(1, outputs.size()), candidate -> {
            if (reference.isEmpty()) {
                return false;
            }
            return inputs.isEmpty()
                    ? checker.codeEquivalentStructurally(reference.get(), candidate)
                    : checker.codeEquivalentByExecution(reference.get(), candidate, inputs, timeout);
        }));
    }

    public SensitivityResult measureVariantSensitivity(Specification baseline,
            int maxVariants,
            Translator<Specification, String> codeGenerator,
            List<JsonNode> testInputs,
            Duration timeout) {
        Objects.requireNonNull(baseline, "baseline");
        List<Specification> variants = variantGenerator.allVariants(baseline, maxVariants);
        log.info("Generated {} variants for {}", variants.size(), baseline.signature().name());
        return measureCodeSensitivity(batch(baseline, variants), codeGenerator, testInputs, timeout);
    }

    public StatisticalTestResult wilcoxonSignedRank(List<Double> baselineScores,
            List<Double> variantScores,
            Alternative alternative) {
        Objects.requireNonNull(baselineScores, "baselineScores");
        Objects.requireNonNull(variantScores, "variantScores");
        return wilcoxon.test(toArray(baselineScores), toArray(variantScores), alternative);
    }

    public StatisticalTestResult wilcoxonSignedRank(List<Double> baselineScores, List<Double> variantScores) {
        return wilcoxonSignedRank(baselineScores, variantScores, Alternative.TWO_SIDED);
    }

    public double aggregateRobustness(List<SensitivityResult> results) {
        if (results == null || results.isEmpty()) {
            return 0.0;
        }
        return results.stream().mapToDouble(SensitivityResult::robustness).average().orElse(0.0);
    }

    public SensitivityComparison compareSensitivity(SensitivityResult reference, SensitivityResult other) {
        return SensitivityComparison.between(Objects.requireNonNull(reference, "reference"),
                Objects.requireNonNull(other, "other"));
    }

    private <I, O> List<Optional<O>> translateAll(List<I> inputs, Translator<I, O> translator) {
        List<CompletableFuture<Optional<O>>> futures = new ArrayList<>(inputs.size());
        for (int i = 0; i < inputs.size(); i++) {
            int index = i;
            I input = inputs.get(i);
            futures.add(CompletableFuture.supplyAsync(() -> translate(index, input, translator), executor));
        }
        return futures.stream().map(CompletableFuture::join).collect(Collectors.toList());
    }

    private <I, O> Optional<O> translate(int index, I input, Translator<I, O> translator) {
        try {
            O output = translator.translate(input);
            if (output == null) {
                log.warn("Translation of input {} produced no output", index);
            }
            return Optional.ofNullable(output);
        } catch (Exception e) {
            log.warn("Translation of input {} failed: {}", index, e.getMessage(), e);
            return Optional.empty();
        }
    }

    private <O> List<Boolean> compareAll(List<Optional<O>> outputs, Predicate<O> comparison) {
        List<CompletableFuture<Boolean>> futures = new ArrayList<>(outputs.size());
        for (Optional<O> output : outputs) {
            futures.add(CompletableFuture.supplyAsync(
                    () -> output.isPresent() && comparison.test(output.get()), executor));
        }
        return futures.stream().map(CompletableFuture::join).collect(Collectors.toList());
    }

    private static <I> List<I> batch(I baseline, List<I> variants) {
        Objects.requireNonNull(variants, "variants");
        List<I> inputs = new ArrayList<>(variants.size() + 1);
        inputs.add(baseline);
        inputs.addAll(variants);
        requireBatch(inputs);
        return inputs;
    }

    private static void requireBatch(List<?> inputs) {
        if (inputs == null || inputs.size() < 2) {
            throw new InvalidInputException("A baseline and at least one variant are required, got "
                    + (inputs == null ? 0 : inputs.size()) + " inputs");
        }
    }

    private static double[] toArray(List<Double> values) {
        double[] array = new double[values.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = Objects.requireNonNull(values.get(i), "score");
        }
        return array;
    }
}
