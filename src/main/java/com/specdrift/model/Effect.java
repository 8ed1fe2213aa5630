package com.specdrift.model;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Effect(String description) {

    public Effect {
        Objects.requireNonNull(description, "effect description");
    }
}
