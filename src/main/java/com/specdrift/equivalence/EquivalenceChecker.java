package com.specdrift.equivalence;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.specdrift.model.Parameter;
import com.specdrift.model.Signature;
import com.specdrift.model.Specification;
import com.specdrift.naming.NamingTransformer;
import com.specdrift.sandbox.ExecutionFailureException;
import com.specdrift.sandbox.ProcessSandboxExecutor;
import com.specdrift.sandbox.SandboxExecutor;
import com.specdrift.structure.IdentifierNormalizer;
import com.specdrift.structure.ImplementationParseException;
import com.specdrift.structure.ImplementationParser;
import com.specdrift.structure.JavaImplementationParser;
import com.specdrift.structure.ParsedImplementation;
import com.specdrift.structure.StructuralComparator;

public class EquivalenceChecker {
    private static final Logger log = LoggerFactory.getLogger(EquivalenceChecker.class);

    private final EquivalenceConfiguration configuration;
    private final TextSimilarity textSimilarity;
    private final SandboxExecutor sandboxExecutor;
    private final ImplementationParser parser;
    private final Executor executionExecutor;
    private final NamingTransformer namingTransformer;
    private final IdentifierNormalizer identifierNormalizer;
    private final StructuralComparator structuralComparator;
    private final OutputComparator outputComparator;

    public EquivalenceChecker() {
        this(EquivalenceConfiguration.defaults());
    }

    public EquivalenceChecker(EquivalenceConfiguration configuration) {
        this(configuration,
                new EmbeddingTextSimilarity(EmbeddingServices.sharedLocalModel()),
                new ProcessSandboxExecutor(),
                new JavaImplementationParser(),
                Runnable::run);
    }

    public EquivalenceChecker(EquivalenceConfiguration configuration,
            TextSimilarity textSimilarity,
            SandboxExecutor sandboxExecutor,
            ImplementationParser parser,
            Executor executionExecutor) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.textSimilarity = Objects.requireNonNull(textSimilarity, "textSimilarity");
        this.sandboxExecutor = Objects.requireNonNull(sandboxExecutor, "sandboxExecutor");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.executionExecutor = Objects.requireNonNull(executionExecutor, "executionExecutor");
        this.namingTransformer = new NamingTransformer();
        this.identifierNormalizer = new IdentifierNormalizer(namingTransformer);
        this.structuralComparator = new StructuralComparator();
        this.outputComparator = new OutputComparator();
        if (configuration.useFormalSolver()) {
            log.warn("No formal solver is available; structural comparison is used instead");
        }
    }

    public EquivalenceConfiguration configuration() {
        return configuration;
    }

    public boolean specEquivalent(Specification first, Specification second) {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");

        if (!intentsMatch(first.intent(), second.intent())) {
            return false;
        }
        if (!signaturesMatch(first.signature(), second.signature())) {
            return false;
        }
        if (!effectsMatch(first.effectDescriptions(), second.effectDescriptions())) {
            return false;
        }
        return assertionsMatch(first.assertionPredicates(), second.assertionPredicates());
    }

    /**
     * True when both implementations produce equivalent outputs for every input. No inputs means
     * no evidence, which is reported as not equivalent.
     */
    public boolean codeEquivalentByExecution(String first, String second, List<JsonNode> testInputs, Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        if (testInputs == null || testInputs.isEmpty()) {
            log.debug("No test inputs supplied; treating implementations as not equivalent");
            return false;
        }

        Optional<String> firstFunction = functionName(first);
        Optional<String> secondFunction = functionName(second);
        if (firstFunction.isEmpty() || secondFunction.isEmpty()) {
            return false;
        }

        for (JsonNode input : testInputs) {
            CompletableFuture<ExecutionAttempt> firstRun = CompletableFuture.supplyAsync(
                    () -> attempt(first, firstFunction.get(), input, timeout), executionExecutor);
            CompletableFuture<ExecutionAttempt> secondRun = CompletableFuture.supplyAsync(
                    () -> attempt(second, secondFunction.get(), input, timeout), executionExecutor);
            ExecutionAttempt firstAttempt = firstRun.join();
            ExecutionAttempt secondAttempt = secondRun.join();

            if (firstAttempt.failure() != null || secondAttempt.failure() != null) {
                return false;
            }
            if (!outputComparator.equivalent(firstAttempt.output(), secondAttempt.output())) {
                log.debug("Outputs differ for input {}: {} vs {}", input, firstAttempt.output(), secondAttempt.output());
                return false;
            }
        }
        return true;
    }

    public boolean codeEquivalentStructurally(String first, String second) {
        ParsedImplementation firstParsed;
        ParsedImplementation secondParsed;
        try {
            firstParsed = parser.parse(first);
            secondParsed = parser.parse(second);
        } catch (ImplementationParseException e) {
            log.debug("Structural comparison skipped: {}", e.getMessage());
            return false;
        }

        if (configuration.normalizeNaming()) {
            identifierNormalizer.normalize(firstParsed.unit());
            identifierNormalizer.normalize(secondParsed.unit());
        }
        return structuralComparator.equivalent(firstParsed, secondParsed);
    }

    private boolean intentsMatch(String first, String second) {
        if (first.equals(second)) {
            return true;
        }
        return textSimilarity.similarity(first, second) >= configuration.intentSimilarityThreshold();
    }

    private boolean signaturesMatch(Signature first, Signature second) {
        if (!name(first.name()).equals(name(second.name()))) {
            return false;
        }
        List<Parameter> firstParameters = first.parameters();
        List<Parameter> secondParameters = second.parameters();
        if (firstParameters.size() != secondParameters.size()) {
            return false;
        }
        for (int i = 0; i < firstParameters.size(); i++) {
            Parameter a = firstParameters.get(i);
            Parameter b = secondParameters.get(i);
            if (!a.type().equals(b.type()) || !name(a.name()).equals(name(b.name()))) {
                return false;
            }
        }
        return Objects.equals(first.returnType(), second.returnType());
    }

    private boolean effectsMatch(List<String> first, List<String> second) {
        if (first.size() != second.size()) {
            return false;
        }
        List<String> a = first.stream().map(this::text).collect(Collectors.toList());
        List<String> b = second.stream().map(this::text).collect(Collectors.toList());
        if (configuration.requireEffectOrder()) {
            return a.equals(b);
        }
        return counts(a).equals(counts(b));
    }

    private boolean assertionsMatch(List<String> first, List<String> second) {
        if (first.size() != second.size()) {
            return false;
        }
        List<String> a = first.stream().map(this::text).collect(Collectors.toList());
        List<String> b = second.stream().map(this::text).collect(Collectors.toList());
        return new HashSet<>(a).equals(new HashSet<>(b));
    }

    private String name(String value) {
        return configuration.normalizeNaming() ? namingTransformer.normalizeName(value) : value;
    }

    private String text(String value) {
        return configuration.normalizeNaming() ? namingTransformer.normalizeText(value) : value;
    }

    private static Map<String, Long> counts(List<String> values) {
        return values.stream().collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));
    }

    private Optional<String> functionName(String source) {
        try {
            Optional<String> name = parser.parse(source).primaryMethodName();
            if (name.isEmpty()) {
                log.debug("Implementation declares no method");
            }
            return name;
        } catch (ImplementationParseException e) {
            log.debug("Implementation does not parse: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private ExecutionAttempt attempt(String source, String functionName, JsonNode input, Duration timeout) {
        try {
            return new ExecutionAttempt(sandboxExecutor.execute(source, functionName, input, timeout), null);
        } catch (ExecutionFailureException e) {
            log.debug("Execution of {} failed ({}): {}", functionName, e.reason(), e.getMessage());
            return new ExecutionAttempt(null, e);
        }
    }

    private record ExecutionAttempt(JsonNode output, ExecutionFailureException failure) {
    }
}
