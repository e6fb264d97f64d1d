package com.github.salilvnair.statefuzzer.engine.action.model;

import com.github.salilvnair.statefuzzer.engine.expression.helper.ValueOperations;

/**
 * One storage write performed by a declarative action. The operand is {@code value}
 * unless {@code valueFrom} names a generated parameter.
 */
public record StateUpdateDirective(
        String target,
        String op,
        Object value,
        String valueFrom,
        String condition
) {
    public StateUpdateDirective {
        value = ValueOperations.normalize(value);
    }

    public boolean guarded() {
        return condition != null && !condition.isBlank();
    }

    public boolean readsParameter() {
        return valueFrom != null;
    }
}
