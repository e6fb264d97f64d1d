package com.github.salilvnair.statefuzzer.engine.expression.ast;

/**
 * Parsed form of a restricted expression. Interpreted by direct tree walking.
 */
public sealed interface ExpressionNode permits Literal, Identifier, BinaryOp, Compare, BoolOp {
}
