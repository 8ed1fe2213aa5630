package com.specdrift.variant;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.specdrift.variant.AssertionRewriter.RewriteRule;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AssertionRewriterTest {

    private final AssertionRewriter rewriter = new AssertionRewriter();

    @Test
    void shouldRewriteEachPairAndBack() {
        Map<String, String> pairs = Map.of(
                "count > 0", "count >= 1",
                "len(items) > 0", "items != []",
                "is_valid == True", "is_valid",
                "is_valid == False", "not is_valid");

        pairs.forEach((original, rewritten) -> {
            assertTrue(rewriter.rephrase(original).contains(rewritten), original + " -> " + rewritten);
            assertTrue(rewriter.rephrase(rewritten).contains(original), rewritten + " -> " + original);
        });
    }

    @Test
    void shouldApplyRulesInTableOrder() {
        assertEquals(List.of("count >= 1"), rewriter.rephrase("count > 0"));
        assertEquals("x >= 1 and y >= 1", RewriteRule.POSITIVE_TO_AT_LEAST_ONE.apply("x > 0 and y > 0").orElseThrow());
    }

    @Test
    void shouldNotNegateMembershipOrIdentityTests() {
        assertTrue(rewriter.rephrase("item not in seen").isEmpty());
        assertTrue(rewriter.rephrase("result is not None").isEmpty());
    }

    @Test
    void shouldReturnNothingForUnmatchedPredicate() {
        assertTrue(rewriter.rephrase("a + b == c").isEmpty());
        assertTrue(rewriter.rephrase("total > 0.5").isEmpty());
    }
}
