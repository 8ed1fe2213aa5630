package com.specdrift.structure;

import java.util.Objects;
import java.util.stream.Collectors;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;

public class JavaImplementationParser implements ImplementationParser {
    public static final String WRAPPER_CLASS = "Candidate";

    private final ParserConfiguration configuration;

    public JavaImplementationParser() {
        this.configuration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
    }

    @Override
    public ParsedImplementation parse(String source) throws ImplementationParseException {
        Objects.requireNonNull(source, "source");

        ParseResult<CompilationUnit> direct = new JavaParser(configuration).parse(source);
        if (direct.isSuccessful() && direct.getResult().isPresent()
                && !direct.getResult().get().getTypes().isEmpty()) {
            return new ParsedImplementation(direct.getResult().get(), false);
        }

        ParseResult<CompilationUnit> wrapped = new JavaParser(configuration)
                .parse("class " + WRAPPER_CLASS + " {\n" + source + "\n}");
        if (wrapped.isSuccessful() && wrapped.getResult().isPresent()) {
            return new ParsedImplementation(wrapped.getResult().get(), true);
        }

        String problems = direct.getProblems().stream()
                .map(problem -> problem.getVerboseMessage())
                .collect(Collectors.joining("; "));
        throw new ImplementationParseException("Unable to parse implementation: "
                + (problems.isBlank() ? "no type or method declarations" : problems));
    }
}
