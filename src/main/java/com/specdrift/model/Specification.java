package com.specdrift.model;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Specification(
        String intent,
        Signature signature,
        List<Effect> effects,
        List<Assertion> assertions) {

    public Specification {
        Objects.requireNonNull(intent, "intent");
        Objects.requireNonNull(signature, "signature");
        effects = effects == null ? List.of() : List.copyOf(effects);
        assertions = assertions == null ? List.of() : List.copyOf(assertions);
    }

    public Specification withSignature(Signature newSignature) {
        return new Specification(intent, newSignature, effects, assertions);
    }

    public Specification withEffects(List<Effect> newEffects) {
        return new Specification(intent, signature, newEffects, assertions);
    }

    public Specification withAssertions(List<Assertion> newAssertions) {
        return new Specification(intent, signature, effects, newAssertions);
    }

    public List<String> effectDescriptions() {
        return effects.stream().map(Effect::description).toList();
    }

    public List<String> assertionPredicates() {
        return assertions.stream().map(Assertion::predicate).toList();
    }
}
