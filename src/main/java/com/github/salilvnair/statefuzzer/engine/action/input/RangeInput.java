package com.github.salilvnair.statefuzzer.engine.action.input;

import java.util.random.RandomGenerator;

public record RangeInput(long lo, long hi) implements InputSpec {

    public RangeInput {
        if (lo > hi) {
            throw new IllegalArgumentException("Range lower bound " + lo + " exceeds upper bound " + hi);
        }
    }

    @Override
    public Object generate(RandomGenerator random) {
        if (lo == hi) {
            return lo;
        }
        if (hi == Long.MAX_VALUE) {
            return lo == Long.MIN_VALUE ? random.nextLong() : random.nextLong(lo - 1, hi) + 1;
        }
        return random.nextLong(lo, hi + 1);
    }
}
