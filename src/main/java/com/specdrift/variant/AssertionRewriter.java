package com.specdrift.variant;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Fixed, ordered table of logically equivalent predicate rewrites. Every rule has an inverse in
 * the table so a rewritten predicate can be brought back to its original form.
 */
public class AssertionRewriter {

    public enum RewriteRule {
        POSITIVE_TO_AT_LEAST_ONE("\\b(\\w+)\\s*>\\s*0(?![.\\w])", "$1 >= 1"),
        AT_LEAST_ONE_TO_POSITIVE("\\b(\\w+)\\s*>=\\s*1(?![.\\w])", "$1 > 0"),
        NON_EMPTY_LENGTH_TO_NOT_EMPTY_LIST("\\blen\\((\\w+)\\)\\s*>\\s*0(?![.\\w])", "$1 != []"),
        NOT_EMPTY_LIST_TO_NON_EMPTY_LENGTH("\\b(\\w+)\\s*!=\\s*\\[\\]", "len($1) > 0"),
        EQUALS_TRUE_TO_BARE("\\b(\\w+)\\s*==\\s*True\\b", "$1"),
        BARE_TO_EQUALS_TRUE("^\\s*(\\w+)\\s*$", "$1 == True"),
        EQUALS_FALSE_TO_NEGATION("\\b(\\w+)\\s*==\\s*False\\b", "not $1"),
        NEGATION_TO_EQUALS_FALSE("(?<!\\bis\\s)\\bnot\\s+(?!in\\b)(\\w+)\\b", "$1 == False") {
            @Override
            boolean accepts(String predicate) {
                return !predicate.toLowerCase(Locale.ROOT).contains("not in");
            }
        };

        private final Pattern pattern;
        private final String replacement;

        RewriteRule(String regex, String replacement) {
            this.pattern = Pattern.compile(regex);
            this.replacement = replacement;
        }

        boolean accepts(String predicate) {
            return true;
        }

        public Optional<String> apply(String predicate) {
            if (!accepts(predicate) || !pattern.matcher(predicate).find()) {
                return Optional.empty();
            }
            return Optional.of(pattern.matcher(predicate).replaceAll(replacement));
        }
    }

    public List<String> rephrase(String predicate) {
        List<String> rewrites = new ArrayList<>();
        for (RewriteRule rule : RewriteRule.values()) {
            rule.apply(predicate)
                    .filter(rewritten -> !rewritten.equals(predicate))
                    .ifPresent(rewrites::add);
        }
        return rewrites;
    }
}
