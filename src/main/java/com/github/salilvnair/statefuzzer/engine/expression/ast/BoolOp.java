package com.github.salilvnair.statefuzzer.engine.expression.ast;

import java.util.List;

public record BoolOp(
        BooleanOperator operator,
        List<ExpressionNode> operands
) implements ExpressionNode {

    public BoolOp {
        operands = List.copyOf(operands);
    }
}
