package com.github.salilvnair.statefuzzer.engine.expression.parser;

public record Token(TokenType type, String text, Object value, int position) {

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean isName(String name) {
        return type == TokenType.NAME && text.equals(name);
    }
}
