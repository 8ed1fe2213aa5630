package com.specdrift.structure;

public interface ImplementationParser {
    ParsedImplementation parse(String source) throws ImplementationParseException;
}
