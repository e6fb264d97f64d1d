package com.github.salilvnair.statefuzzer.engine.expression;

import com.github.salilvnair.statefuzzer.config.StateFuzzerConfig;
import com.github.salilvnair.statefuzzer.engine.exception.StateFuzzerErrorCode;
import com.github.salilvnair.statefuzzer.engine.exception.StateFuzzerException;
import com.github.salilvnair.statefuzzer.engine.expression.ast.BinaryOp;
import com.github.salilvnair.statefuzzer.engine.expression.ast.BoolOp;
import com.github.salilvnair.statefuzzer.engine.expression.ast.BooleanOperator;
import com.github.salilvnair.statefuzzer.engine.expression.ast.Compare;
import com.github.salilvnair.statefuzzer.engine.expression.ast.ExpressionNode;
import com.github.salilvnair.statefuzzer.engine.expression.ast.Identifier;
import com.github.salilvnair.statefuzzer.engine.expression.ast.Literal;
import com.github.salilvnair.statefuzzer.engine.expression.helper.ValueOperations;
import com.github.salilvnair.statefuzzer.engine.expression.parser.ExpressionParser;
import com.github.salilvnair.statefuzzer.engine.expression.type.MissingIdentifierPolicy;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Evaluates model expressions (preconditions, update guards, invariants) against a
 * variable scope. Expressions are parsed once and cached; malformed ones raise
 * {@link com.github.salilvnair.statefuzzer.engine.exception.UnsupportedExpressionException}.
 */
@Component
public class ExpressionEvaluator {

    private final MissingIdentifierPolicy missingIdentifierPolicy;
    private final Map<String, ExpressionNode> compiled = new ConcurrentHashMap<>();

    @Autowired
    public ExpressionEvaluator(StateFuzzerConfig config) {
        this(config.getExpression().getMissingIdentifier());
    }

    public ExpressionEvaluator(MissingIdentifierPolicy missingIdentifierPolicy) {
        this.missingIdentifierPolicy = missingIdentifierPolicy == null
                ? MissingIdentifierPolicy.ABSENT
                : missingIdentifierPolicy;
    }

    public Object evaluate(String expression, Map<String, Object> scope) {
        return evaluate(compile(expression), scope);
    }

    public boolean test(String expression, Map<String, Object> scope) {
        return ValueOperations.isTruthy(evaluate(expression, scope));
    }

    public ExpressionNode compile(String expression) {
        ExpressionNode cached = expression == null ? null : compiled.get(expression);
        if (cached != null) {
            return cached;
        }
        ExpressionNode node = ExpressionParser.parse(expression);
        compiled.putIfAbsent(expression, node);
        return node;
    }

    public Object evaluate(ExpressionNode node, Map<String, Object> scope) {
        if (node instanceof Literal literal) {
            return literal.value();
        }
        if (node instanceof Identifier identifier) {
            return resolve(identifier.name(), scope);
        }
        if (node instanceof BinaryOp op) {
            Object left = evaluate(op.left(), scope);
            Object right = evaluate(op.right(), scope);
            return ValueOperations.arithmetic(op.operator(), left, right);
        }
        if (node instanceof BoolOp op) {
            List<Object> values = new ArrayList<>(op.operands().size());
            for (ExpressionNode operand : op.operands()) {
                values.add(evaluate(operand, scope));
            }
            if (op.operator() == BooleanOperator.AND) {
                return values.stream().allMatch(ValueOperations::isTruthy);
            }
            return values.stream().anyMatch(ValueOperations::isTruthy);
        }
        if (node instanceof Compare chain) {
            Object left = evaluate(chain.left(), scope);
            for (int i = 0; i < chain.operators().size(); i++) {
                Object right = evaluate(chain.comparators().get(i), scope);
                if (!ValueOperations.compare(chain.operators().get(i), left, right)) {
                    return false;
                }
                left = right;
            }
            return true;
        }
        throw new IllegalStateException("Unknown expression node " + node);
    }

    private Object resolve(String name, Map<String, Object> scope) {
        if (scope != null && scope.containsKey(name)) {
            return ValueOperations.normalize(scope.get(name));
        }
        if (missingIdentifierPolicy == MissingIdentifierPolicy.FAIL) {
            throw new StateFuzzerException(
                    StateFuzzerErrorCode.UNKNOWN_IDENTIFIER,
                    "Identifier '" + name + "' is not defined in scope " + (scope == null ? "{}" : scope.keySet()));
        }
        return null;
    }
}
