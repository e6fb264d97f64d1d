package com.github.salilvnair.statefuzzer.engine.update.type;

public enum StateUpdateOp {
    SET,
    ADD,
    SUB
}
