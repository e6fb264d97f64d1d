package com.github.salilvnair.statefuzzer.engine.expression.ast;

public record Literal(Object value) implements ExpressionNode {
}
