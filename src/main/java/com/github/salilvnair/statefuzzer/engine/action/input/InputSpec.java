package com.github.salilvnair.statefuzzer.engine.action.input;

import java.util.random.RandomGenerator;

/**
 * How one action parameter is produced: passed through as a literal, or drawn from an
 * inclusive integer range.
 */
public sealed interface InputSpec permits FixedInput, RangeInput {

    Object generate(RandomGenerator random);
}
