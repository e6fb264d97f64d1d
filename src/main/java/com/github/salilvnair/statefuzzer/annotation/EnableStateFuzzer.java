package com.github.salilvnair.statefuzzer.annotation;

import com.github.salilvnair.statefuzzer.config.StateFuzzerAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(StateFuzzerAutoConfiguration.class)
public @interface EnableStateFuzzer {
}
