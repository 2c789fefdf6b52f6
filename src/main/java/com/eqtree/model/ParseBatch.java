package com.eqtree.model;

import org.eclipse.collections.api.list.ImmutableList;

/**
 * Result of parsing many lines. Surviving equations keep the id of their source line,
 * so a skipped line leaves a gap in the id sequence.
 */
public record ParseBatch(ImmutableList<Equation> equations, ImmutableList<ParseOutcome.Failure> failures) {
    public int count() {
        return equations.size();
    }
}
