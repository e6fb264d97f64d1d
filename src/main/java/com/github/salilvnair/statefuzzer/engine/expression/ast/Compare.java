package com.github.salilvnair.statefuzzer.engine.expression.ast;

import java.util.List;

/**
 * Comparison chain: {@code left op[0] comparators[0] op[1] comparators[1] ...}.
 * Each comparator is the right operand of one pair and the left operand of the next.
 */
public record Compare(
        ExpressionNode left,
        List<ComparisonOperator> operators,
        List<ExpressionNode> comparators
) implements ExpressionNode {

    public Compare {
        if (operators.size() != comparators.size()) {
            throw new IllegalArgumentException("Comparison chain needs one comparator per operator");
        }
        operators = List.copyOf(operators);
        comparators = List.copyOf(comparators);
    }
}
