package com.github.salilvnair.statefuzzer.engine.expression.parser;

import com.github.salilvnair.statefuzzer.engine.exception.UnsupportedExpressionException;

import java.util.ArrayList;
import java.util.List;

public final class ExpressionTokenizer {

    private final String source;
    private int pos;

    public ExpressionTokenizer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                tokens.add(new Token(TokenType.END, "", null, pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() {
        char c = source.charAt(pos);
        int start = pos;
        if (Character.isDigit(c)) {
            return number();
        }
        if (Character.isLetter(c) || c == '_') {
            while (pos < source.length()
                    && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
                pos++;
            }
            String name = source.substring(start, pos);
            return new Token(TokenType.NAME, name, name, start);
        }
        if (c == '\'' || c == '"') {
            return string(c);
        }
        switch (c) {
            case '+':
                pos++;
                return new Token(TokenType.PLUS, "+", null, start);
            case '-':
                pos++;
                return new Token(TokenType.MINUS, "-", null, start);
            case '(':
                pos++;
                return new Token(TokenType.LPAREN, "(", null, start);
            case ')':
                pos++;
                return new Token(TokenType.RPAREN, ")", null, start);
            case '<':
            case '>':
            case '=':
            case '!':
                return comparison();
            default:
                throw new UnsupportedExpressionException(source, start, "unexpected character '" + c + "'");
        }
    }

    private Token comparison() {
        int start = pos;
        char c = source.charAt(pos++);
        boolean followedByEquals = pos < source.length() && source.charAt(pos) == '=';
        if (followedByEquals) {
            pos++;
            return new Token(TokenType.COMPARISON, c + "=", null, start);
        }
        if (c == '<' || c == '>') {
            return new Token(TokenType.COMPARISON, String.valueOf(c), null, start);
        }
        // lone '=' is assignment, lone '!' is negation: neither belongs to the grammar
        throw new UnsupportedExpressionException(source, start, "unexpected operator '" + c + "'");
    }

    private Token number() {
        int start = pos;
        while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
            pos++;
        }
        boolean decimal = false;
        if (pos < source.length() && source.charAt(pos) == '.') {
            decimal = true;
            pos++;
            int fractionStart = pos;
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                pos++;
            }
            if (fractionStart == pos) {
                throw new UnsupportedExpressionException(source, start, "malformed number");
            }
        }
        if (pos < source.length() && (Character.isLetter(source.charAt(pos)) || source.charAt(pos) == '_')) {
            throw new UnsupportedExpressionException(source, start, "malformed number");
        }
        String text = source.substring(start, pos);
        Object value;
        try {
            value = decimal ? (Object) Double.parseDouble(text) : (Object) Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new UnsupportedExpressionException(source, start, "number out of range");
        }
        return new Token(TokenType.NUMBER, text, value, start);
    }

    private Token string(char quote) {
        int start = pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos++);
            if (c == quote) {
                return new Token(TokenType.STRING, source.substring(start, pos), sb.toString(), start);
            }
            if (c == '\\') {
                if (pos >= source.length()) {
                    break;
                }
                char escaped = source.charAt(pos++);
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case '\\', '\'', '"' -> sb.append(escaped);
                    default -> throw new UnsupportedExpressionException(source, pos - 2,
                            "unsupported escape '\\" + escaped + "'");
                }
                continue;
            }
            sb.append(c);
        }
        throw new UnsupportedExpressionException(source, start, "unterminated string literal");
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }
}
