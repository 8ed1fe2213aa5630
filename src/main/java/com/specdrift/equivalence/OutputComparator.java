package com.specdrift.equivalence;

import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;

public class OutputComparator {
    public static final double TOLERANCE = 1e-6;

    public boolean equivalent(JsonNode first, JsonNode second) {
        if (first == null || second == null) {
            return first == second;
        }
        if (first.equals(second)) {
            return true;
        }
        if (first.isNumber() && second.isNumber()) {
            return numbersEquivalent(first, second);
        }
        if (first.isArray() && second.isArray()) {
            return arraysEquivalent(first, second);
        }
        if (first.isObject() && second.isObject()) {
            return objectsEquivalent(first, second);
        }
        return false;
    }

    private boolean numbersEquivalent(JsonNode first, JsonNode second) {
        if (first.isIntegralNumber() && second.isIntegralNumber()) {
            return first.bigIntegerValue().equals(second.bigIntegerValue());
        }
        return Math.abs(first.doubleValue() - second.doubleValue()) < TOLERANCE;
    }

    private boolean arraysEquivalent(JsonNode first, JsonNode second) {
        if (first.size() != second.size()) {
            return false;
        }
        if (!allNumbers(first) || !allNumbers(second)) {
            return false;
        }
        for (int i = 0; i < first.size(); i++) {
            if (!numbersEquivalent(first.get(i), second.get(i))) {
                return false;
            }
        }
        return true;
    }

    private boolean objectsEquivalent(JsonNode first, JsonNode second) {
        if (!fieldNames(first).equals(fieldNames(second))) {
            return false;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = first.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!equivalent(field.getValue(), second.get(field.getKey()))) {
                return false;
            }
        }
        return true;
    }

    private static boolean allNumbers(JsonNode array) {
        for (JsonNode element : array) {
            if (!element.isNumber()) {
                return false;
            }
        }
        return true;
    }

    private static Set<String> fieldNames(JsonNode node) {
        Set<String> names = new HashSet<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }
}
