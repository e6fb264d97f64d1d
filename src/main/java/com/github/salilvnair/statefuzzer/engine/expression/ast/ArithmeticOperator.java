package com.github.salilvnair.statefuzzer.engine.expression.ast;

public enum ArithmeticOperator {
    ADD("+"),
    SUB("-");

    private final String symbol;

    ArithmeticOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
