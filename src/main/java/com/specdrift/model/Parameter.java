package com.specdrift.model;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Parameter(
        String name,
        String type,
        String description) {

    public Parameter {
        Objects.requireNonNull(name, "parameter name");
        Objects.requireNonNull(type, "parameter type");
    }

    public Parameter(String name, String type) {
        this(name, type, null);
    }

    public Parameter withName(String newName) {
        return new Parameter(newName, type, description);
    }
}
