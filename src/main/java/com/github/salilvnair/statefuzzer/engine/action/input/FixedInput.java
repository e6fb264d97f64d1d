package com.github.salilvnair.statefuzzer.engine.action.input;

import com.github.salilvnair.statefuzzer.engine.expression.helper.ValueOperations;

import java.util.random.RandomGenerator;

public record FixedInput(Object value) implements InputSpec {

    public FixedInput {
        value = ValueOperations.normalize(value);
    }

    @Override
    public Object generate(RandomGenerator random) {
        return value;
    }
}
