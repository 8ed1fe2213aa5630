package com.specdrift.report;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.specdrift.analysis.SensitivityResult;

public class RobustnessReportWriter {
    private static final Logger log = LoggerFactory.getLogger(RobustnessReportWriter.class);
    private static final DateTimeFormatter RUN_ID_FORMATTER = DateTimeFormatter.ofPattern("yyyyMMddHHmmss", Locale.ROOT)
            .withZone(ZoneOffset.UTC);

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RobustnessReportWriter() {
        this(new ObjectMapper(), Clock.systemUTC());
    }

    RobustnessReportWriter(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public Path write(Path artifactsRoot, String suiteName, List<SensitivityResult> results, GateEvaluation evaluation)
            throws IOException {
        Instant now = clock.instant();
        Files.createDirectories(artifactsRoot);
        Path runDirectory = artifactsRoot.resolve("run-" + RUN_ID_FORMATTER.format(now));
        Files.createDirectories(runDirectory);

        ReportSummary summary = summarize(suiteName, now, results, evaluation);
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(
                runDirectory.resolve("sensitivity-results.json").toFile(), results);
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(
                runDirectory.resolve("summary.json").toFile(), summary);
        Files.writeString(runDirectory.resolve("report.md"), markdown(summary, results), StandardCharsets.UTF_8);

        log.info("Wrote robustness report {} ({} results, gate {})", runDirectory, results.size(), evaluation.status());
        return runDirectory;
    }

    private ReportSummary summarize(String suiteName, Instant now, List<SensitivityResult> results, GateEvaluation evaluation) {
        int totalVariants = results.stream().mapToInt(SensitivityResult::totalVariants).sum();
        int nonEquivalent = results.stream().mapToInt(SensitivityResult::nonEquivalentCount).sum();
        return new ReportSummary(
                suiteName,
                now.toString(),
                results.size(),
                totalVariants,
                nonEquivalent,
                evaluation.averageRobustness(),
                evaluation.averageSensitivity(),
                evaluation.status(),
                evaluation.messages());
    }

    static String markdown(ReportSummary summary, List<SensitivityResult> results) {
        StringBuilder md = new StringBuilder();
        md.append("# Robustness Report: ").append(summary.suiteName()).append("\n\n");
        md.append("Generated: ").append(summary.generatedAt()).append("\n\n");
        md.append("## Overall Status: ").append(summary.gateStatus()).append("\n\n");
        md.append(String.format(Locale.ROOT, "- Average robustness: %.2f%%\n", summary.averageRobustness() * 100));
        md.append(String.format(Locale.ROOT, "- Average sensitivity: %.2f%%\n", summary.averageSensitivity() * 100));
        md.append("- Variants tested: ").append(summary.totalVariants())
                .append(" (").append(summary.nonEquivalentVariants()).append(" non-equivalent)\n\n");

        md.append("## Results\n\n");
        md.append("| # | Variants | Equivalent | Non-equivalent | Sensitivity | Robustness |\n");
        md.append("|---|----------|------------|----------------|-------------|------------|\n");
        for (int i = 0; i < results.size(); i++) {
            SensitivityResult result = results.get(i);
            md.append(String.format(Locale.ROOT, "| %d | %d | %d | %d | %.2f%% | %.2f%% |\n",
                    i,
                    result.totalVariants(),
                    result.equivalentCount(),
                    result.nonEquivalentCount(),
                    result.sensitivity() * 100,
                    result.robustness() * 100));
        }

        if (!summary.messages().isEmpty()) {
            md.append("\n## Findings\n\n");
            summary.messages().forEach(message -> md.append("- ").append(message).append('\n'));
        }
        return md.toString();
    }
}
