package com.github.salilvnair.statefuzzer.engine.expression.parser;

public enum TokenType {
    NUMBER,
    STRING,
    NAME,
    PLUS,
    MINUS,
    COMPARISON,
    LPAREN,
    RPAREN,
    END
}
