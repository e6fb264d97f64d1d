package com.github.salilvnair.statefuzzer.engine.expression.parser;

import com.github.salilvnair.statefuzzer.engine.exception.UnsupportedExpressionException;
import com.github.salilvnair.statefuzzer.engine.expression.ast.ArithmeticOperator;
import com.github.salilvnair.statefuzzer.engine.expression.ast.BinaryOp;
import com.github.salilvnair.statefuzzer.engine.expression.ast.BoolOp;
import com.github.salilvnair.statefuzzer.engine.expression.ast.BooleanOperator;
import com.github.salilvnair.statefuzzer.engine.expression.ast.Compare;
import com.github.salilvnair.statefuzzer.engine.expression.ast.ComparisonOperator;
import com.github.salilvnair.statefuzzer.engine.expression.ast.ExpressionNode;
import com.github.salilvnair.statefuzzer.engine.expression.ast.Identifier;
import com.github.salilvnair.statefuzzer.engine.expression.ast.Literal;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive descent parser for the model expression language.
 * <p>
 * Precedence, lowest first: {@code or}, {@code and}, comparison chains, {@code + -}.
 * Parentheses group. Nothing else is accepted.
 */
public final class ExpressionParser {

    private static final Set<String> TRUE_LITERALS = Set.of("True", "true");
    private static final Set<String> FALSE_LITERALS = Set.of("False", "false");
    private static final Set<String> ABSENT_LITERALS = Set.of("None", "null");
    private static final Set<String> RESERVED = Set.of(
            "and", "or", "not", "in", "is", "if", "else", "lambda", "for");

    private final String source;
    private final List<Token> tokens;
    private int index;

    private ExpressionParser(String source) {
        this.source = source;
        this.tokens = new ExpressionTokenizer(source).tokenize();
    }

    public static ExpressionNode parse(String source) {
        if (source == null || source.isBlank()) {
            throw new UnsupportedExpressionException(String.valueOf(source), 0, "empty expression");
        }
        ExpressionParser parser = new ExpressionParser(source);
        ExpressionNode node = parser.orExpression();
        Token trailing = parser.peek();
        if (!trailing.is(TokenType.END)) {
            throw parser.unsupported(trailing, "unexpected token '" + trailing.text() + "'");
        }
        return node;
    }

    private ExpressionNode orExpression() {
        List<ExpressionNode> operands = new ArrayList<>();
        operands.add(andExpression());
        while (peek().isName(BooleanOperator.OR.keyword())) {
            index++;
            operands.add(andExpression());
        }
        return operands.size() == 1 ? operands.get(0) : new BoolOp(BooleanOperator.OR, operands);
    }

    private ExpressionNode andExpression() {
        List<ExpressionNode> operands = new ArrayList<>();
        operands.add(comparison());
        while (peek().isName(BooleanOperator.AND.keyword())) {
            index++;
            operands.add(comparison());
        }
        return operands.size() == 1 ? operands.get(0) : new BoolOp(BooleanOperator.AND, operands);
    }

    private ExpressionNode comparison() {
        ExpressionNode left = additive();
        List<ComparisonOperator> operators = new ArrayList<>();
        List<ExpressionNode> comparators = new ArrayList<>();
        while (peek().is(TokenType.COMPARISON)) {
            Token op = tokens.get(index++);
            operators.add(ComparisonOperator.fromSymbol(op.text())
                    .orElseThrow(() -> unsupported(op, "unknown comparison '" + op.text() + "'")));
            comparators.add(additive());
        }
        return operators.isEmpty() ? left : new Compare(left, operators, comparators);
    }

    private ExpressionNode additive() {
        ExpressionNode left = unary();
        while (peek().is(TokenType.PLUS) || peek().is(TokenType.MINUS)) {
            ArithmeticOperator operator = tokens.get(index++).is(TokenType.PLUS)
                    ? ArithmeticOperator.ADD
                    : ArithmeticOperator.SUB;
            left = new BinaryOp(operator, left, unary());
        }
        return left;
    }

    private ExpressionNode unary() {
        Token token = peek();
        if (token.is(TokenType.MINUS)) {
            Token next = index + 1 < tokens.size() ? tokens.get(index + 1) : token;
            if (!next.is(TokenType.NUMBER)) {
                throw unsupported(token, "unary minus is only allowed before a numeric literal");
            }
            index += 2;
            return new Literal(negate(next.value()));
        }
        return primary();
    }

    private ExpressionNode primary() {
        Token token = tokens.get(index);
        switch (token.type()) {
            case NUMBER:
            case STRING:
                index++;
                return new Literal(token.value());
            case NAME:
                index++;
                return name(token);
            case LPAREN:
                index++;
                ExpressionNode inner = orExpression();
                Token closing = peek();
                if (!closing.is(TokenType.RPAREN)) {
                    throw unsupported(closing, "expected ')'");
                }
                index++;
                return inner;
            case END:
                throw unsupported(token, "unexpected end of expression");
            default:
                throw unsupported(token, "unexpected token '" + token.text() + "'");
        }
    }

    private ExpressionNode name(Token token) {
        String text = token.text();
        if (TRUE_LITERALS.contains(text)) {
            return new Literal(Boolean.TRUE);
        }
        if (FALSE_LITERALS.contains(text)) {
            return new Literal(Boolean.FALSE);
        }
        if (ABSENT_LITERALS.contains(text)) {
            return new Literal(null);
        }
        if (RESERVED.contains(text)) {
            throw unsupported(token, "keyword '" + text + "' is not supported here");
        }
        Token next = peek();
        if (next.is(TokenType.LPAREN)) {
            throw unsupported(next, "function calls are not supported");
        }
        return new Identifier(text);
    }

    private static Object negate(Object number) {
        if (number instanceof Long l) {
            return -l;
        }
        return -((Double) number);
    }

    private Token peek() {
        return tokens.get(index);
    }

    private UnsupportedExpressionException unsupported(Token token, String reason) {
        return new UnsupportedExpressionException(source, token.position(), reason);
    }
}
