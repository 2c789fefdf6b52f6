package com.eqtree.parse;

import com.eqtree.expr.Canonicalizer;
import com.eqtree.expr.ExpressionNode;
import com.eqtree.model.Branch;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code f(x) = { expr , cond ; expr , cond ; ... }}. Branches are separated by
 * {@code ;} and each branch is split at its last comma. A branch that fails to parse keeps its
 * place as a pair of opaque constants holding the source text.
 */
public class PiecewiseParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(PiecewiseParser.class);

    private static final Pattern DEFINITION =
            Pattern.compile("f\\s*\\(\\s*x\\s*\\)\\s*=\\s*\\{\\s*(.+)\\s*}\\s*", Pattern.CASE_INSENSITIVE);

    public static final String FUNCTION_NAME = "f";
    public static final String VARIABLE = "x";

    private final Normalizer normalizer;
    private final RelationSplitter splitter;
    private final ExpressionParser parser;
    private final Canonicalizer canonicalizer;

    public PiecewiseParser(Normalizer normalizer, RelationSplitter splitter, ExpressionParser parser,
                           Canonicalizer canonicalizer) {
        this.normalizer = normalizer;
        this.splitter = splitter;
        this.parser = parser;
        this.canonicalizer = canonicalizer;
    }

    /**
     * @return the branches, or empty when the line is not a piecewise definition or has no usable branch
     */
    public Optional<ImmutableList<Branch>> parse(String line) {
        Matcher m = DEFINITION.matcher(line.strip());
        if (!m.matches()) {
            return Optional.empty();
        }
        MutableList<Branch> branches = Lists.mutable.empty();
        for (String part : m.group(1).strip().split(";")) {
            String branch = part.strip();
            int comma = branch.lastIndexOf(',');
            if (branch.isEmpty() || comma < 0) {
                continue;
            }
            branches.add(branch(branch.substring(0, comma).strip(), branch.substring(comma + 1).strip()));
        }
        return branches.isEmpty() ? Optional.empty() : Optional.of(branches.toImmutable());
    }

    private Branch branch(String expressionText, String conditionText) {
        try {
            ExpressionNode expression = canonicalizer.canonicalize(parser.parse(normalizer.normalize(expressionText)));
            return new Branch(condition(conditionText), expression);
        } catch (ExpressionParseException e) {
            LOGGER.debug("Keeping unparsed branch '{}' , '{}': {}", expressionText, conditionText, e.getMessage());
            return new Branch(new ExpressionNode.Opaque(conditionText), new ExpressionNode.Opaque(expressionText));
        }
    }

    private ExpressionNode condition(String text) {
        String normalized = normalizer.normalize(text);
        RelationSplitter.Split split = splitter.split(normalized)
                .orElseThrow(() -> new ExpressionParseException("No relation in condition '" + text + "'"));
        return canonicalizer.canonicalize(new ExpressionNode.Relational(
                split.relation(), parser.parse(split.lhs()), parser.parse(split.rhs())));
    }
}
