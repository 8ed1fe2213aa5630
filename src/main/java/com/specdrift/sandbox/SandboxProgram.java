package com.specdrift.sandbox;

import com.fasterxml.jackson.databind.node.ObjectNode;

public record SandboxProgram(String source, String mainClassName, ObjectNode arguments) {
}
