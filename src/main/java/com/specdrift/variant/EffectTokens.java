package com.specdrift.variant;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import com.specdrift.model.Effect;

record EffectTokens(String text, Set<String> tokens) {
    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "to", "from", "of", "in", "into", "on", "onto", "and", "or",
            "for", "with", "by", "at", "as", "is", "it", "its", "be", "all", "any", "each", "new");

    private static final Set<String> WRITE_STEMS = Set.of(
            "writ", "wrote", "sav", "stor", "updat", "insert", "delet", "remov", "modif", "append",
            "persist", "creat", "overwrit", "mutat");

    private static final Set<String> READ_STEMS = Set.of(
            "read", "load", "fetch", "quer", "select", "get", "retriev", "scan", "look", "parse");

    static EffectTokens of(Effect effect) {
        String text = effect.description().toLowerCase(Locale.ROOT);
        Set<String> tokens = Arrays.stream(text.split("\\W+"))
                .filter(token -> !token.isBlank())
                .collect(Collectors.toUnmodifiableSet());
        return new EffectTokens(text, tokens);
    }

    boolean writes() {
        return tokens.stream().anyMatch(EffectTokens::isWriteVerb);
    }

    boolean reads() {
        return tokens.stream().anyMatch(EffectTokens::isReadVerb);
    }

    boolean mentions(String word) {
        return tokens.stream().anyMatch(token -> token.startsWith(word));
    }

    boolean sharesSubjectWith(EffectTokens other) {
        return tokens.stream()
                .filter(EffectTokens::isSubjectToken)
                .anyMatch(other.tokens::contains);
    }

    private static boolean isSubjectToken(String token) {
        return token.length() > 1 && !STOP_WORDS.contains(token) && !isWriteVerb(token) && !isReadVerb(token);
    }

    private static boolean isWriteVerb(String token) {
        return WRITE_STEMS.stream().anyMatch(token::startsWith);
    }

    private static boolean isReadVerb(String token) {
        return READ_STEMS.stream().anyMatch(token::startsWith);
    }
}
