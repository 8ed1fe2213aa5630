package com.specdrift.equivalence;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class EmbeddingTextSimilarity implements TextSimilarity {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingTextSimilarity.class);

    private final EmbeddingService embeddingService;
    private final EmbeddingService fallback;

    public EmbeddingTextSimilarity(EmbeddingService embeddingService) {
        this(embeddingService, EmbeddingServices.sharedLocalModel());
    }

    public EmbeddingTextSimilarity(EmbeddingService embeddingService, EmbeddingService fallback) {
        this.embeddingService = Objects.requireNonNull(embeddingService, "embeddingService");
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    @Override
    public double similarity(String first, String second) {
        if (Objects.equals(first, second)) {
            return 1.0;
        }
        float[] a = embeddingService.embed(first);
        float[] b = embeddingService.embed(second);
        if (a.length != b.length) {
            log.warn("Embedding dimensions differ ({} vs {}) from {}; comparing both texts with {}",
                    a.length, b.length, embeddingService.version(), fallback.version());
            a = fallback.embed(first);
            b = fallback.embed(second);
        }
        return cosine(a, b);
    }

    private static double cosine(float[] a, float[] b) {
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        double cosine = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        return Math.max(0.0, Math.min(1.0, cosine));
    }
}
