package com.specdrift.structure;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;

public record ParsedImplementation(CompilationUnit unit, boolean wrapped) {

    public ParsedImplementation {
        Objects.requireNonNull(unit, "unit");
    }

    public List<MethodDeclaration> methods() {
        return unit.findAll(MethodDeclaration.class);
    }

    public Optional<String> primaryMethodName() {
        return unit.findFirst(MethodDeclaration.class).map(MethodDeclaration::getNameAsString);
    }

    public Optional<MethodDeclaration> findMethod(String name) {
        return unit.findFirst(MethodDeclaration.class, method -> method.getNameAsString().equals(name));
    }

    public Optional<MethodDeclaration> soleMethod() {
        if (unit.getTypes().size() != 1) {
            return Optional.empty();
        }
        TypeDeclaration<?> type = unit.getType(0);
        List<BodyDeclaration<?>> members = type.getMembers();
        if (members.size() != 1 || !members.get(0).isMethodDeclaration()) {
            return Optional.empty();
        }
        return Optional.of(members.get(0).asMethodDeclaration());
    }

    public ParsedImplementation copy() {
        return new ParsedImplementation(unit.clone(), wrapped);
    }
}
