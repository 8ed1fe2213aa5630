package com.specdrift.naming;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.specdrift.model.NamingStyle;

public class NamingTransformer {
    private static final Pattern CASED_WORD = Pattern.compile("[A-Z]?[a-z]+|[A-Z]+(?=[A-Z][a-z]|\\d|\\W|$)|\\d+");
    private static final Pattern IDENTIFIER = Pattern.compile("\\b[a-zA-Z_][a-zA-Z0-9_]*\\b");

    private static final Set<String> REWRITE_RESERVED = Set.of(
            "len", "is", "not", "and", "or", "in", "True", "False", "None");

    private static final Set<String> NORMALIZE_RESERVED = Set.of(
            "len", "is", "not", "and", "or", "in", "true", "false", "none",
            "if", "else", "for", "while", "def", "class", "return", "import", "from", "as");

    public List<String> parseIdentifier(String name) {
        if (name == null || name.isEmpty()) {
            return List.of();
        }
        if (name.indexOf('_') >= 0) {
            return Arrays.stream(name.split("_"))
                    .filter(word -> !word.isEmpty())
                    .map(word -> word.toLowerCase(Locale.ROOT))
                    .toList();
        }

        List<String> words = new ArrayList<>();
        Matcher matcher = CASED_WORD.matcher(name);
        while (matcher.find()) {
            words.add(matcher.group().toLowerCase(Locale.ROOT));
        }
        if (words.isEmpty()) {
            return List.of(name.toLowerCase(Locale.ROOT));
        }
        return List.copyOf(words);
    }

    public String render(List<String> words, NamingStyle style) {
        if (words.isEmpty()) {
            return "";
        }
        return switch (style) {
            case SNAKE_CASE -> words.stream()
                    .map(word -> word.toLowerCase(Locale.ROOT))
                    .collect(Collectors.joining("_"));
            case CAMEL_CASE -> words.get(0).toLowerCase(Locale.ROOT) + words.stream()
                    .skip(1)
                    .map(NamingTransformer::capitalize)
                    .collect(Collectors.joining());
            case PASCAL_CASE -> words.stream()
                    .map(NamingTransformer::capitalize)
                    .collect(Collectors.joining());
            case SCREAMING_SNAKE_CASE -> words.stream()
                    .map(word -> word.toUpperCase(Locale.ROOT))
                    .collect(Collectors.joining("_"));
        };
    }

    public String convert(String name, NamingStyle style) {
        List<String> words = parseIdentifier(name);
        if (words.isEmpty()) {
            return name;
        }
        return render(words, style);
    }

    public String rewriteIdentifiersInText(String text, NamingStyle style) {
        return replaceIdentifiers(text, word -> REWRITE_RESERVED.contains(word) || word.length() == 1
                ? word
                : convert(word, style));
    }

    public String normalizeText(String text) {
        return replaceIdentifiers(text, word -> {
            String lower = word.toLowerCase(Locale.ROOT);
            if (NORMALIZE_RESERVED.contains(lower)) {
                return lower;
            }
            return word.length() == 1 ? word : convert(word, NamingStyle.SNAKE_CASE);
        });
    }

    public String normalizeName(String name) {
        return convert(name, NamingStyle.SNAKE_CASE);
    }

    private static String replaceIdentifiers(String text, UnaryOperator<String> replacement) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        Matcher matcher = IDENTIFIER.matcher(text);
        StringBuilder builder = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(builder, Matcher.quoteReplacement(replacement.apply(matcher.group())));
        }
        matcher.appendTail(builder);
        return builder.toString();
    }

    private static String capitalize(String word) {
        if (word.isEmpty()) {
            return word;
        }
        return word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1).toLowerCase(Locale.ROOT);
    }
}
