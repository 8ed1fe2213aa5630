package com.specdrift.equivalence;

@FunctionalInterface
public interface TextSimilarity {
    double similarity(String first, String second);
}
