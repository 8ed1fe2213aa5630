package com.specdrift.structure;

public class ImplementationParseException extends Exception {
    public ImplementationParseException(String message) {
        super(message);
    }
}
