package com.specdrift.model;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Assertion(
        String predicate,
        String rationale) {

    public Assertion {
        Objects.requireNonNull(predicate, "assertion predicate");
    }

    public Assertion(String predicate) {
        this(predicate, null);
    }

    public Assertion withPredicate(String newPredicate) {
        return new Assertion(newPredicate, rationale);
    }
}
