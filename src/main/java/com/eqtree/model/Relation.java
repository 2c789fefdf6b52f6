package com.eqtree.model;

import java.util.Optional;

public enum Relation {
    EQ("="),
    GT(">"),
    LT("<"),
    GE(">="),
    LE("<=");

    private final String symbol;

    Relation(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static Optional<Relation> fromSymbol(String symbol) {
        for (Relation relation : values()) {
            if (relation.symbol.equals(symbol)) {
                return Optional.of(relation);
            }
        }
        return Optional.empty();
    }
}
