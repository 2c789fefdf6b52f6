package com.eqtree.parse;

import com.eqtree.model.Relation;

import java.util.List;
import java.util.Optional;

/**
 * Splits a normalized line at its relational operator. Operators are tried in the order
 * {@code >= <= = > <}; the leftmost occurrence of the first operator present decides the split.
 */
public class RelationSplitter {
    private static final List<Relation> PRIORITY = List.of(Relation.GE, Relation.LE, Relation.EQ, Relation.GT, Relation.LT);

    public record Split(Relation relation, String lhs, String rhs) {}

    public Optional<Split> split(String normalized) {
        for (Relation relation : PRIORITY) {
            int index = normalized.indexOf(relation.symbol());
            if (index < 0) {
                continue;
            }
            String lhs = normalized.substring(0, index).strip();
            String rhs = normalized.substring(index + relation.symbol().length()).strip();
            if (lhs.isEmpty() || rhs.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(new Split(relation, lhs, rhs));
        }
        return Optional.empty();
    }
}
