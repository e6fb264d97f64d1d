package com.github.salilvnair.statefuzzer.engine.update.provider;

import com.github.salilvnair.statefuzzer.engine.expression.helper.ValueOperations;
import com.github.salilvnair.statefuzzer.engine.update.core.StateUpdateResolver;
import com.github.salilvnair.statefuzzer.engine.update.type.StateUpdateOp;
import org.springframework.stereotype.Component;

@Component
public class SubStateUpdateResolver implements StateUpdateResolver {

    @Override
    public String op() {
        return StateUpdateOp.SUB.name();
    }

    @Override
    public Object resolve(Object currentValue, Object operand) {
        return ValueOperations.subtract(currentValue, operand);
    }
}
