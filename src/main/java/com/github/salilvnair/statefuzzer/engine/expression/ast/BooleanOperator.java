package com.github.salilvnair.statefuzzer.engine.expression.ast;

public enum BooleanOperator {
    AND("and"),
    OR("or");

    private final String keyword;

    BooleanOperator(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
