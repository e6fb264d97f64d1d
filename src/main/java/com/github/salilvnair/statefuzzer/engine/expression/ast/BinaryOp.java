package com.github.salilvnair.statefuzzer.engine.expression.ast;

public record BinaryOp(
        ArithmeticOperator operator,
        ExpressionNode left,
        ExpressionNode right
) implements ExpressionNode {
}
