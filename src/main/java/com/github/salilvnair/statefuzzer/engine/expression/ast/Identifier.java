package com.github.salilvnair.statefuzzer.engine.expression.ast;

public record Identifier(String name) implements ExpressionNode {
}
