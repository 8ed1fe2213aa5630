package com.specdrift.structure;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.SwitchExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.Statement;

public class StructuralComparator {

    public boolean equivalent(ParsedImplementation first, ParsedImplementation second) {
        Optional<MethodDeclaration> firstMethod = first.soleMethod().filter(StructuralComparator::isStraightLine);
        Optional<MethodDeclaration> secondMethod = second.soleMethod().filter(StructuralComparator::isStraightLine);
        if (firstMethod.isPresent() && secondMethod.isPresent()) {
            return straightLineEquivalent(firstMethod.get(), secondMethod.get());
        }
        return canonical(first.unit()).equals(canonical(second.unit()));
    }

    static boolean isStraightLine(MethodDeclaration method) {
        Optional<BlockStmt> body = method.getBody();
        if (body.isEmpty()) {
            return false;
        }
        boolean branching = body.get().findFirst(Statement.class, statement -> statement.isIfStmt()
                || statement.isForStmt()
                || statement.isForEachStmt()
                || statement.isWhileStmt()
                || statement.isDoStmt()
                || statement.isSwitchStmt()
                || statement.isTryStmt()
                || statement.isSynchronizedStmt()).isPresent();
        return !branching && body.get().findFirst(SwitchExpr.class).isEmpty();
    }

    private boolean straightLineEquivalent(MethodDeclaration first, MethodDeclaration second) {
        return first.getNameAsString().equals(second.getNameAsString())
                && parameterShape(first).equals(parameterShape(second))
                && first.getType().asString().equals(second.getType().asString())
                && statementCounts(first).equals(statementCounts(second));
    }

    private static List<String> parameterShape(MethodDeclaration method) {
        return method.getParameters().stream()
                .map(parameter -> parameter.getType().asString()
                        + (parameter.isVarArgs() ? "..." : "")
                        + " " + parameter.getNameAsString())
                .collect(Collectors.toList());
    }

    private static Map<String, Long> statementCounts(MethodDeclaration method) {
        return method.getBody().orElseThrow().getStatements().stream()
                .map(StructuralComparator::canonical)
                .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));
    }

    static String canonical(Node node) {
        Node copy = node.clone();
        copy.getAllContainedComments().forEach(Comment::remove);
        copy.removeComment();
        return copy.toString();
    }
}
