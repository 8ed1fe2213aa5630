package com.specdrift;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.specdrift.analysis.Alternative;
import com.specdrift.analysis.SensitivityAnalyzer;
import com.specdrift.analysis.SensitivityResult;
import com.specdrift.analysis.StatisticalTestResult;
import com.specdrift.equivalence.EmbeddingServices;
import com.specdrift.equivalence.EmbeddingTextSimilarity;
import com.specdrift.equivalence.EquivalenceChecker;
import com.specdrift.model.Specification;
import com.specdrift.report.GateEvaluation;
import com.specdrift.report.RobustnessQualityGate;
import com.specdrift.report.RobustnessReportWriter;
import com.specdrift.runtime.AppConfig;
import com.specdrift.sandbox.ProcessSandboxExecutor;
import com.specdrift.structure.JavaImplementationParser;
import com.specdrift.variant.VariantGenerator;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "spec-drift",
        mixinStandardHelpOptions = true,
        version = "spec-drift 0.1.0",
        description = "Measures how robust a translation pipeline is to semantically equivalent input variations.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);
    static final int NOT_EQUIVALENT_EXIT_CODE = 1;
    static final int USAGE_EXIT_CODE = 2;
    static final int GATE_FAILED_EXIT_CODE = 3;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", required = true)
    Mode mode;

    @Option(names = "--spec", description = "Specification JSON file (variants mode)")
    Path specPath;

    @Option(names = "--baseline", description = "Baseline specification JSON or Java source file")
    Path baselinePath;

    @Option(names = "--candidate", description = "Candidate specification JSON or Java source file")
    Path candidatePath;

    @Option(names = "--candidates", description = "JSON array of candidate specifications (sensitivity mode)")
    Path candidatesPath;

    @Option(names = "--inputs", description = "JSON array of test inputs (compare-code mode)")
    Path inputsPath;

    @Option(names = "--scores", description = "JSON object {\"baseline\": [...], \"variant\": [...]} (significance mode)")
    Path scoresPath;

    @Option(names = "--alternative", description = "two-sided, less or greater", defaultValue = "two-sided")
    String alternative;

    @Option(names = "--results", description = "JSON array of sensitivity results (report mode)")
    Path resultsPath;

    @Option(names = "--artifacts-dir", description = "Directory for report runs", defaultValue = ".spec-drift/reports")
    Path artifactsDir;

    @Option(names = "--suite-name", description = "Name recorded in report artifacts", defaultValue = "robustness-suite")
    String suiteName;

    @Option(names = "--output", description = "Write the result JSON to this file instead of stdout")
    Path outputPath;

    @Option(names = "--max-variants", description = "Upper bound on generated variants (defaults to config)")
    Integer maxVariants;

    private final ObjectMapper mapper = new ObjectMapper();
    private final OkHttpClient httpClient = new OkHttpClient();

    enum Mode {
        variants,
        compare,
        sensitivity,
        compareCode,
        significance,
        report
    }

    public static void main(String[] args) {
        CommandLine commandLine = new CommandLine(new Main()).setCaseInsensitiveEnumValuesAllowed(true);
        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(Path.of(configPath));
        log.info("Starting spec-drift in {} mode", mode);
        log.info("Using config file: {}", configPath);

        switch (mode) {
            case variants:
                return runVariants(config);
            case compare:
                return runCompare(config);
            case sensitivity:
                return runSensitivity(config);
            case compareCode:
                return runCompareCode(config);
            case significance:
                return runSignificance(config);
            case report:
                return runReport(config);
            default:
                throw new IllegalStateException("Unhandled mode " + mode);
        }
    }

    private int runVariants(AppConfig config) throws IOException {
        if (specPath == null) {
            log.error("--spec is required in variants mode");
            return USAGE_EXIT_CODE;
        }
        Specification spec = mapper.readValue(specPath.toFile(), Specification.class);
        int limit = maxVariants == null ? config.getVariants().getMaxVariants() : maxVariants;
        List<Specification> variants = new VariantGenerator().allVariants(spec, limit);
        log.info("Generated {} variants of {} (limit {})", variants.size(), spec.signature().name(), limit);
        emit(variants);
        return 0;
    }

    private int runCompare(AppConfig config) throws IOException {
        if (baselinePath == null || candidatePath == null) {
            log.error("--baseline and --candidate are required in compare mode");
            return USAGE_EXIT_CODE;
        }
        Specification baseline = mapper.readValue(baselinePath.toFile(), Specification.class);
        Specification candidate = mapper.readValue(candidatePath.toFile(), Specification.class);
        boolean equivalent = checker(config).specEquivalent(baseline, candidate);
        log.info("Specifications equivalent={}", equivalent);
        return equivalent ? 0 : NOT_EQUIVALENT_EXIT_CODE;
    }

    private int runSensitivity(AppConfig config) throws IOException {
        if (baselinePath == null || candidatesPath == null) {
            log.error("--baseline and --candidates are required in sensitivity mode");
            return USAGE_EXIT_CODE;
        }
        Specification baseline = mapper.readValue(baselinePath.toFile(), Specification.class);
        List<Specification> candidates = mapper.readValue(candidatesPath.toFile(), new TypeReference<List<Specification>>() {
        });

        int threads = Math.max(1, config.getAnalysis().getWorkerThreads());
        ExecutorService workers = Executors.newFixedThreadPool(threads);
        try {
            SensitivityAnalyzer analyzer = new SensitivityAnalyzer(checker(config), new VariantGenerator(), workers);
            SensitivityResult result = analyzer.compareSpecifications(baseline, candidates);
            log.info("Sensitivity total={} equivalent={} nonEquivalent={} sensitivity={} robustness={}",
                    result.totalVariants(),
                    result.equivalentCount(),
                    result.nonEquivalentCount(),
                    String.format("%.4f", result.sensitivity()),
                    String.format("%.4f", result.robustness()));
            emit(result);
        } finally {
            workers.shutdownNow();
        }
        return 0;
    }

    private int runCompareCode(AppConfig config) throws IOException {
        if (baselinePath == null || candidatePath == null) {
            log.error("--baseline and --candidate are required in compareCode mode");
            return USAGE_EXIT_CODE;
        }
        String baseline = Files.readString(baselinePath, StandardCharsets.UTF_8);
        String candidate = Files.readString(candidatePath, StandardCharsets.UTF_8);
        EquivalenceChecker checker = checker(config);

        boolean equivalent;
        if (inputsPath == null) {
            equivalent = checker.codeEquivalentStructurally(baseline, candidate);
            log.info("Implementations structurally equivalent={}", equivalent);
        } else {
            List<JsonNode> inputs = mapper.readValue(inputsPath.toFile(), new TypeReference<List<JsonNode>>() {
            });
            equivalent = checker.codeEquivalentByExecution(baseline, candidate, inputs,
                    Duration.ofMillis(config.getSandbox().getTimeoutMs()));
            log.info("Implementations equivalent on {} inputs={}", inputs.size(), equivalent);
        }
        return equivalent ? 0 : NOT_EQUIVALENT_EXIT_CODE;
    }

    private int runSignificance(AppConfig config) throws IOException {
        if (scoresPath == null) {
            log.error("--scores is required in significance mode");
            return USAGE_EXIT_CODE;
        }
        JsonNode scores = mapper.readTree(scoresPath.toFile());
        if (!scores.path("baseline").isArray() || !scores.path("variant").isArray()) {
            log.error("--scores must hold 'baseline' and 'variant' arrays");
            return USAGE_EXIT_CODE;
        }
        List<Double> baseline = mapper.convertValue(scores.path("baseline"), new TypeReference<List<Double>>() {
        });
        List<Double> variant = mapper.convertValue(scores.path("variant"), new TypeReference<List<Double>>() {
        });

        StatisticalTestResult result = new SensitivityAnalyzer(checker(config))
                .wilcoxonSignedRank(baseline, variant, Alternative.fromLabel(alternative));
        log.info("{}: statistic={} p={} significant={}",
                result.testName(),
                result.statistic(),
                String.format("%.4f", result.pValue()),
                result.significant());
        log.info(result.interpretation());
        emit(result);
        return 0;
    }

    private int runReport(AppConfig config) throws IOException {
        if (resultsPath == null) {
            log.error("--results is required in report mode");
            return USAGE_EXIT_CODE;
        }
        List<SensitivityResult> results = mapper.readValue(resultsPath.toFile(), new TypeReference<List<SensitivityResult>>() {
        });
        GateEvaluation evaluation = new RobustnessQualityGate().evaluate(results, config.toGatePolicy());
        Path runDirectory = new RobustnessReportWriter().write(artifactsDir, suiteName, results, evaluation);

        log.info("Quality gate {} averageRobustness={} averageSensitivity={} artifacts={}",
                evaluation.status(),
                String.format("%.4f", evaluation.averageRobustness()),
                String.format("%.4f", evaluation.averageSensitivity()),
                runDirectory);
        evaluation.messages().forEach(message -> log.warn("Gate: {}", message));
        return evaluation.passed() ? 0 : GATE_FAILED_EXIT_CODE;
    }

    private EquivalenceChecker checker(AppConfig config) {
        return new EquivalenceChecker(
                config.toEquivalenceConfiguration(),
                new EmbeddingTextSimilarity(EmbeddingServices.fromEnvironment(httpClient)),
                new ProcessSandboxExecutor(config.getSandbox().getJavaCommand()),
                new JavaImplementationParser(),
                Runnable::run);
    }

    private void emit(Object value) throws IOException {
        if (outputPath == null) {
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value));
            return;
        }
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(outputPath.toFile(), value);
        log.info("Wrote {}", outputPath);
    }

    private AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
        return yamlMapper.readValue(config.toFile(), AppConfig.class);
    }
}
