package com.specdrift.structure;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.SimpleName;
import com.specdrift.model.NamingStyle;
import com.specdrift.naming.NamingTransformer;

public class IdentifierNormalizer {
    private final NamingTransformer namingTransformer;

    public IdentifierNormalizer(NamingTransformer namingTransformer) {
        this.namingTransformer = Objects.requireNonNull(namingTransformer, "namingTransformer");
    }

    public void normalize(CompilationUnit unit) {
        Set<String> bound = new HashSet<>();
        unit.findAll(MethodDeclaration.class).forEach(method -> bound.add(method.getNameAsString()));
        unit.findAll(Parameter.class).forEach(parameter -> bound.add(parameter.getNameAsString()));
        unit.findAll(VariableDeclarator.class).forEach(variable -> bound.add(variable.getNameAsString()));

        for (SimpleName name : unit.findAll(SimpleName.class)) {
            if (bound.contains(name.getIdentifier()) && isBindingOrUse(name)) {
                name.setIdentifier(namingTransformer.convert(name.getIdentifier(), NamingStyle.SNAKE_CASE));
            }
        }
    }

    private static boolean isBindingOrUse(SimpleName name) {
        Node parent = name.getParentNode().orElse(null);
        return parent instanceof MethodDeclaration
                || parent instanceof Parameter
                || parent instanceof VariableDeclarator
                || parent instanceof NameExpr
                || parent instanceof MethodCallExpr
                || parent instanceof FieldAccessExpr;
    }
}
