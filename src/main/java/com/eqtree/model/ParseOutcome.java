package com.eqtree.model;

public sealed interface ParseOutcome {
    record Parsed(Equation equation) implements ParseOutcome {}

    record Failure(int id, FailureKind kind, String detail) implements ParseOutcome {}
}
