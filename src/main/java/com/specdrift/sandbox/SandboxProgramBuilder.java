package com.specdrift.sandbox;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.javaparser.JavaParser;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.specdrift.naming.NamingTransformer;
import com.specdrift.sandbox.ExecutionFailureException.Reason;
import com.specdrift.structure.ImplementationParseException;
import com.specdrift.structure.ImplementationParser;
import com.specdrift.structure.ParsedImplementation;

/**
 * Turns a candidate implementation into a single-file program for the {@code java} source
 * launcher. The generated entry class comes first, reads the arguments file named by
 * {@code args[0]}, converts each argument to the declared parameter type with Jackson, invokes
 * the target method reflectively and prints the result as JSON on the last line of stdout.
 */
public class SandboxProgramBuilder {
    static final String MAIN_CLASS = "SandboxMain";

    private static final String MAIN_TEMPLATE = """
            public class %1$s {

                public static void main(String[] args) throws Exception {
                    com.fasterxml.jackson.databind.ObjectMapper mapper = new com.fasterxml.jackson.databind.ObjectMapper();
                    com.fasterxml.jackson.databind.JsonNode arguments = mapper.readTree(new java.io.File(args[0]));
                    String[] names = new String[] { %2$s };
                    java.lang.reflect.Method target = null;
                    for (java.lang.reflect.Method method : %3$s.class.getDeclaredMethods()) {
                        if (method.getName().equals("%4$s") && method.getParameterCount() == names.length) {
                            target = method;
                            break;
                        }
                    }
                    if (target == null) {
                        throw new IllegalStateException("method %4$s not found");
                    }
                    java.lang.reflect.Type[] types = target.getGenericParameterTypes();
                    Object[] values = new Object[names.length];
                    for (int i = 0; i < names.length; i++) {
                        values[i] = mapper.convertValue(arguments.get(names[i]), mapper.getTypeFactory().constructType(types[i]));
                    }
                    target.setAccessible(true);
                    Object receiver = null;
                    if (!java.lang.reflect.Modifier.isStatic(target.getModifiers())) {
                        java.lang.reflect.Constructor<?> constructor = %3$s.class.getDeclaredConstructor();
                        constructor.setAccessible(true);
                        receiver = constructor.newInstance();
                    }
                    Object result = target.invoke(receiver, values);
                    System.out.println();
                    System.out.println(mapper.writeValueAsString(result));
                }
            }
            """;

    private final ImplementationParser parser;
    private final NamingTransformer namingTransformer;
    private final ParserConfiguration configuration;

    public SandboxProgramBuilder(ImplementationParser parser, NamingTransformer namingTransformer) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.namingTransformer = Objects.requireNonNull(namingTransformer, "namingTransformer");
        this.configuration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
    }

    public SandboxProgram build(String source, String functionName, JsonNode input) throws ExecutionFailureException {
        ParsedImplementation parsed;
        try {
            parsed = parser.parse(source).copy();
        } catch (ImplementationParseException e) {
            throw new ExecutionFailureException(Reason.PREPARATION_FAILED, e.getMessage(), e);
        }

        MethodDeclaration method = parsed.findMethod(functionName)
                .orElseThrow(() -> new ExecutionFailureException(Reason.PREPARATION_FAILED,
                        "No method named " + functionName));
        String declaringType = qualifiedTypeName(method)
                .orElseThrow(() -> new ExecutionFailureException(Reason.PREPARATION_FAILED,
                        "Method " + functionName + " is not declared in a named type"));

        List<String> parameterNames = method.getParameters().stream()
                .map(Parameter::getNameAsString)
                .collect(Collectors.toList());
        ObjectNode arguments = bindArguments(parameterNames, input);

        CompilationUnit unit = parsed.unit();
        unit.removePackageDeclaration();
        for (TypeDeclaration<?> type : unit.getTypes()) {
            type.removeModifier(Modifier.Keyword.PUBLIC);
        }

        String mainClass = unit.getTypes().stream().anyMatch(type -> type.getNameAsString().equals(MAIN_CLASS))
                ? MAIN_CLASS + "Launcher"
                : MAIN_CLASS;
        String names = parameterNames.stream()
                .map(name -> "\"" + name + "\"")
                .collect(Collectors.joining(", "));
        String mainSource = String.format(MAIN_TEMPLATE, mainClass, names, declaringType, functionName);
        CompilationUnit mainUnit = new JavaParser(configuration).parse(mainSource).getResult()
                .orElseThrow(() -> new ExecutionFailureException(Reason.PREPARATION_FAILED,
                        "Unable to generate entry class"));
        unit.getTypes().addFirst(mainUnit.getType(0).clone());

        return new SandboxProgram(unit.toString(), mainClass, arguments);
    }

    ObjectNode bindArguments(List<String> parameterNames, JsonNode input) {
        ObjectNode arguments = JsonNodeFactory.instance.objectNode();
        if (input != null && input.isArray()) {
            for (int i = 0; i < parameterNames.size() && i < input.size(); i++) {
                arguments.set(parameterNames.get(i), input.get(i));
            }
            return arguments;
        }
        if (input == null || !input.isObject()) {
            if (parameterNames.size() == 1 && input != null) {
                arguments.set(parameterNames.get(0), input);
            }
            return arguments;
        }

        List<String> keys = new ArrayList<>();
        Iterator<String> fieldNames = input.fieldNames();
        fieldNames.forEachRemaining(keys::add);

        for (int i = 0; i < parameterNames.size(); i++) {
            String name = parameterNames.get(i);
            if (input.has(name)) {
                arguments.set(name, input.get(name));
                continue;
            }
            String normalized = namingTransformer.normalizeName(name);
            Optional<String> sameWords = keys.stream()
                    .filter(key -> namingTransformer.normalizeName(key).equals(normalized))
                    .findFirst();
            if (sameWords.isPresent()) {
                arguments.set(name, input.get(sameWords.get()));
            } else if (i < keys.size()) {
                arguments.set(name, input.get(keys.get(i)));
            }
        }
        return arguments;
    }

    private static Optional<String> qualifiedTypeName(MethodDeclaration method) {
        List<String> names = new ArrayList<>();
        Node current = method.getParentNode().orElse(null);
        while (current != null) {
            if (current instanceof TypeDeclaration) {
                names.add(0, ((TypeDeclaration<?>) current).getNameAsString());
            } else if (!(current instanceof CompilationUnit)) {
                return Optional.empty();
            }
            current = current.getParentNode().orElse(null);
        }
        return names.isEmpty() ? Optional.empty() : Optional.of(String.join(".", names));
    }
}
