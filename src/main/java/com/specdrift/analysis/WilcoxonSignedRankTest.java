package com.specdrift.analysis;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/**
 * Wilcoxon signed-rank test on paired samples. Zero differences are dropped before ranking and
 * tied magnitudes share their average rank. Small samples without ties or zeros use the exact null
 * distribution; everything else the tie-corrected normal approximation without continuity
 * correction.
 */
public class WilcoxonSignedRankTest {
    public static final String TEST_NAME = "Wilcoxon signed-rank";
    public static final int MINIMUM_SAMPLES = 3;
    static final int EXACT_LIMIT = 50;
    static final double SIGNIFICANCE_LEVEL = 0.05;

    public StatisticalTestResult test(double[] baselineScores, double[] variantScores, Alternative alternative) {
        Objects.requireNonNull(baselineScores, "baselineScores");
        Objects.requireNonNull(variantScores, "variantScores");
        Objects.requireNonNull(alternative, "alternative");
        if (baselineScores.length != variantScores.length) {
            throw new InvalidInputException("Score lists must have the same length ("
                    + baselineScores.length + " vs " + variantScores.length + ")");
        }
        if (baselineScores.length < MINIMUM_SAMPLES) {
            throw new InvalidInputException("At least " + MINIMUM_SAMPLES + " paired samples are required, got "
                    + baselineScores.length);
        }

        double[] differences = new double[baselineScores.length];
        int nonZero = 0;
        for (int i = 0; i < differences.length; i++) {
            double difference = baselineScores[i] - variantScores[i];
            if (Double.isNaN(difference)) {
                throw new InvalidInputException("Scores must be numbers; index " + i + " is NaN");
            }
            if (difference != 0.0) {
                differences[nonZero++] = difference;
            }
        }
        if (nonZero == 0) {
            return new StatisticalTestResult(TEST_NAME, 0.0, 1.0, false,
                    "No differences detected (all paired scores identical)");
        }
        boolean zerosDropped = nonZero < differences.length;
        differences = Arrays.copyOf(differences, nonZero);

        Ranking ranking = rank(differences);
        double plus = 0.0;
        double minus = 0.0;
        for (int i = 0; i < differences.length; i++) {
            if (differences[i] > 0) {
                plus += ranking.ranks[i];
            } else {
                minus += ranking.ranks[i];
            }
        }

        double statistic = alternative == Alternative.TWO_SIDED ? Math.min(plus, minus) : plus;
        double pValue = nonZero <= EXACT_LIMIT && !ranking.tied && !zerosDropped
                ? exactPValue(nonZero, (int) Math.round(plus), alternative)
                : normalPValue(nonZero, plus, ranking.tieCorrection, alternative);
        pValue = Math.max(0.0, Math.min(1.0, pValue));

        boolean significant = pValue < SIGNIFICANCE_LEVEL;
        return new StatisticalTestResult(TEST_NAME, statistic, pValue, significant,
                interpret(alternative, pValue, significant));
    }

    static double exactPValue(int n, int plus, Alternative alternative) {
        int maxSum = n * (n + 1) / 2;
        long[] counts = new long[maxSum + 1];
        counts[0] = 1;
        for (int k = 1; k <= n; k++) {
            for (int sum = maxSum; sum >= k; sum--) {
                counts[sum] += counts[sum - k];
            }
        }
        double total = Math.pow(2.0, n);

        double atMost = 0.0;
        for (int sum = 0; sum <= plus; sum++) {
            atMost += counts[sum];
        }
        double atLeast = 0.0;
        for (int sum = plus; sum <= maxSum; sum++) {
            atLeast += counts[sum];
        }
        atMost /= total;
        atLeast /= total;

        switch (alternative) {
            case LESS:
                return atMost;
            case GREATER:
                return atLeast;
            default:
                return Math.min(1.0, 2.0 * Math.min(atMost, atLeast));
        }
    }

    static double normalPValue(int n, double plus, double tieCorrection, Alternative alternative) {
        double mean = n * (n + 1) / 4.0;
        double variance = n * (n + 1) * (2.0 * n + 1) / 24.0 - tieCorrection / 48.0;
        if (variance <= 0.0) {
            return 1.0;
        }
        double z = (plus - mean) / Math.sqrt(variance);
        switch (alternative) {
            case LESS:
                return normalCdf(z);
            case GREATER:
                return normalCdf(-z);
            default:
                return 2.0 * normalCdf(-Math.abs(z));
        }
    }

    static double normalCdf(double x) {
        return 0.5 * erfc(-x / Math.sqrt(2.0));
    }

    static double erfc(double x) {
        double z = Math.abs(x);
        double t = 1.0 / (1.0 + 0.5 * z);
        double ans = t * Math.exp(-z * z - 1.26551223 + t * (1.00002368 + t * (0.37409196 + t * (0.09678418
                + t * (-0.18628806 + t * (0.27886807 + t * (-1.13520398 + t * (1.48851587
                + t * (-0.82215223 + t * 0.17087277)))))))));
        return x >= 0 ? ans : 2.0 - ans;
    }

    static Ranking rank(double[] differences) {
        int n = differences.length;
        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        Arrays.sort(order, (a, b) -> Double.compare(Math.abs(differences[a]), Math.abs(differences[b])));

        double[] ranks = new double[n];
        boolean tied = false;
        double tieCorrection = 0.0;
        int start = 0;
        while (start < n) {
            int end = start;
            while (end + 1 < n && Math.abs(differences[order[end + 1]]) == Math.abs(differences[order[start]])) {
                end++;
            }
            double averageRank = (start + end + 2) / 2.0;
            for (int i = start; i <= end; i++) {
                ranks[order[i]] = averageRank;
            }
            int size = end - start + 1;
            if (size > 1) {
                tied = true;
                tieCorrection += (double) size * size * size - size;
            }
            start = end + 1;
        }
        return new Ranking(ranks, tied, tieCorrection);
    }

    private static String interpret(Alternative alternative, double pValue, boolean significant) {
        String p = String.format(Locale.ROOT, "%.4f", pValue);
        if (!significant) {
            return "No significant difference (p=" + p + "). Performance is robust to variations.";
        }
        switch (alternative) {
            case LESS:
                return "Variants perform significantly better (p=" + p + ")";
            case GREATER:
                return "Variants perform significantly worse (p=" + p + ")";
            default:
                return "Significant difference detected (p=" + p + "). Variants perform differently from baseline.";
        }
    }

    record Ranking(double[] ranks, boolean tied, double tieCorrection) {
    }
}
