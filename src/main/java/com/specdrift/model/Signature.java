package com.specdrift.model;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Signature(
        String name,
        List<Parameter> parameters,
        String returnType) {

    public Signature {
        Objects.requireNonNull(name, "signature name");
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    public Signature withName(String newName) {
        return new Signature(newName, parameters, returnType);
    }

    public Signature withParameters(List<Parameter> newParameters) {
        return new Signature(name, newParameters, returnType);
    }
}
