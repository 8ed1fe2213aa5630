package com.specdrift.analysis;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SensitivityResult(
        int totalVariants,
        int equivalentCount,
        int nonEquivalentCount,
        double sensitivity,
        double robustness,
        List<Boolean> perVariantResults) {

    public SensitivityResult {
        perVariantResults = perVariantResults == null ? List.of() : List.copyOf(perVariantResults);
        if (totalVariants < 0 || equivalentCount < 0 || nonEquivalentCount < 0) {
            throw new IllegalArgumentException("counts must not be negative");
        }
        if (equivalentCount + nonEquivalentCount != totalVariants) {
            throw new IllegalArgumentException("equivalent and non-equivalent counts must add up to " + totalVariants);
        }
    }

    public static SensitivityResult of(List<Boolean> perVariantResults) {
        Objects.requireNonNull(perVariantResults, "perVariantResults");
        int total = perVariantResults.size();
        int equivalent = (int) perVariantResults.stream().filter(Boolean.TRUE::equals).count();
        int nonEquivalent = total - equivalent;
        double sensitivity = total == 0 ? 0.0 : (double) nonEquivalent / total;
        return new SensitivityResult(total, equivalent, nonEquivalent, sensitivity, 1.0 - sensitivity, perVariantResults);
    }
}
