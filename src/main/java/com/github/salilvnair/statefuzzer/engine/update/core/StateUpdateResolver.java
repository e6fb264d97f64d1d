package com.github.salilvnair.statefuzzer.engine.update.core;

public interface StateUpdateResolver {

    String op();

    Object resolve(Object currentValue, Object operand);
}
