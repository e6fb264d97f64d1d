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
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ExpressionParserTest {

    @Test
    void parsesChainedComparisonIntoSingleCompareNode() {
        ExpressionNode node = ExpressionParser.parse("0 <= balance <= 100");

        Compare compare = assertInstanceOf(Compare.class, node);
        assertEquals(new Literal(0L), compare.left());
        assertEquals(List.of(ComparisonOperator.LTE, ComparisonOperator.LTE), compare.operators());
        assertEquals(List.of(new Identifier("balance"), new Literal(100L)), compare.comparators());
    }

    @Test
    void flattensRepeatedBooleanOperators() {
        BoolOp node = assertInstanceOf(BoolOp.class, ExpressionParser.parse("a and b and c"));

        assertEquals(BooleanOperator.AND, node.operator());
        assertEquals(3, node.operands().size());
    }

    @Test
    void arithmeticIsLeftAssociative() {
        BinaryOp node = assertInstanceOf(BinaryOp.class, ExpressionParser.parse("a - b + 1"));

        assertEquals(ArithmeticOperator.ADD, node.operator());
        BinaryOp left = assertInstanceOf(BinaryOp.class, node.left());
        assertEquals(ArithmeticOperator.SUB, left.operator());
    }

    @Test
    void parenthesesDoNotProduceANode() {
        assertEquals(new Identifier("gate"), ExpressionParser.parse("((gate))"));
    }

    @Test
    void negativeLiteralAfterBinaryMinus() {
        BinaryOp node = assertInstanceOf(BinaryOp.class, ExpressionParser.parse("balance - -5"));

        assertEquals(new Literal(-5L), node.right());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "   ",
            "not gate",
            "balance * 2",
            "balance / 2",
            "balance % 2",
            "balance = 1",
            "!gate",
            "len(name)",
            "state.balance",
            "items[0]",
            "'unterminated",
            "balance >",
            "(balance > 1",
            "balance 1",
            "-balance",
            "1.",
            "12abc",
            "x if y else z",
            "a in b"
    })
    void rejectsEverythingOutsideTheGrammar(String expression) {
        assertThrows(UnsupportedExpressionException.class, () -> ExpressionParser.parse(expression));
    }

    @Test
    void rejectsNullExpression() {
        assertThrows(UnsupportedExpressionException.class, () -> ExpressionParser.parse(null));
    }
}
