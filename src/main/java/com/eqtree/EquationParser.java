package com.eqtree;

import com.eqtree.classify.EquationClassifier;
import com.eqtree.expr.Canonicalizer;
import com.eqtree.expr.ExpressionNode;
import com.eqtree.expr.VariableCollector;
import com.eqtree.model.Branch;
import com.eqtree.model.Equation;
import com.eqtree.model.EquationType;
import com.eqtree.model.FailureKind;
import com.eqtree.model.ParseBatch;
import com.eqtree.model.ParseOutcome;
import com.eqtree.model.Relation;
import com.eqtree.parse.ExpressionParseException;
import com.eqtree.parse.ExpressionParser;
import com.eqtree.parse.Normalizer;
import com.eqtree.parse.PiecewiseParser;
import com.eqtree.parse.RelationSplitter;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.sorted.MutableSortedSet;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Turns lines of algebraic text into classified {@link Equation} records. Lines are independent
 * of each other and the parser holds no per-line state, so one instance may be shared.
 */
public class EquationParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(EquationParser.class);

    private final Normalizer normalizer = new Normalizer();
    private final RelationSplitter splitter = new RelationSplitter();
    private final ExpressionParser expressionParser = new ExpressionParser();
    private final Canonicalizer canonicalizer = new Canonicalizer();
    private final VariableCollector variableCollector = new VariableCollector();
    private final EquationClassifier classifier = new EquationClassifier();
    private final PiecewiseParser piecewiseParser =
            new PiecewiseParser(normalizer, splitter, expressionParser, canonicalizer);

    public ParseOutcome parseLine(String text, int id) {
        String raw = text == null ? "" : text.strip();
        if (raw.isEmpty()) {
            return new ParseOutcome.Failure(id, FailureKind.BLANK_LINE, "blank line");
        }

        Optional<ImmutableList<Branch>> branches = piecewiseParser.parse(raw);
        if (branches.isPresent()) {
            return new ParseOutcome.Parsed(piecewise(id, raw, branches.get()));
        }

        try {
            String normalized = normalizer.normalize(raw);
            Optional<RelationSplitter.Split> split = splitter.split(normalized);
            if (split.isEmpty()) {
                return new ParseOutcome.Failure(id, FailureKind.RELATION_NOT_FOUND,
                        "no relational operator with two non-empty sides in '" + normalized + "'");
            }
            Relation relation = split.get().relation();
            ExpressionNode lhs = canonicalizer.canonicalize(expressionParser.parse(split.get().lhs()));
            ExpressionNode rhs = canonicalizer.canonicalize(expressionParser.parse(split.get().rhs()));

            MutableSortedSet<String> variables = variableCollector.collect(lhs, rhs);
            EquationType type = classifier.classify(lhs, rhs, relation, variables);
            return new ParseOutcome.Parsed(new Equation(id, raw, variables.toList().toImmutable(), type,
                    relation, lhs, rhs, Lists.immutable.empty()));
        } catch (ExpressionParseException e) {
            return new ParseOutcome.Failure(id, FailureKind.PARSE_ERROR, e.getMessage());
        }
    }

    /**
     * Parses every line, numbering them from 1. Lines that fail are logged and left out.
     */
    public ParseBatch parseMany(Iterable<String> lines) {
        MutableList<Equation> equations = Lists.mutable.empty();
        MutableList<ParseOutcome.Failure> failures = Lists.mutable.empty();
        int id = 0;
        for (String line : lines) {
            id++;
            ParseOutcome outcome = parseLine(line, id);
            if (outcome instanceof ParseOutcome.Parsed parsed) {
                equations.add(parsed.equation());
            } else {
                ParseOutcome.Failure failure = (ParseOutcome.Failure) outcome;
                if (failure.kind() != FailureKind.BLANK_LINE) {
                    LOGGER.debug("Skipping line {} ({}): {}", failure.id(), failure.kind(), failure.detail());
                }
                failures.add(failure);
            }
        }
        LOGGER.debug("Parsed {} of {} lines", equations.size(), id);
        return new ParseBatch(equations.toImmutable(), failures.toImmutable());
    }

    private Equation piecewise(int id, String raw, ImmutableList<Branch> branches) {
        ExpressionNode lhs = new ExpressionNode.FunctionDef(PiecewiseParser.FUNCTION_NAME, PiecewiseParser.VARIABLE);
        ExpressionNode rhs = new ExpressionNode.Piecewise(branches);
        MutableSortedSet<String> variables = variableCollector.collect(lhs, rhs);
        return new Equation(id, raw, variables.toList().toImmutable(), EquationType.PIECEWISE,
                Relation.EQ, lhs, rhs, branches);
    }
}
