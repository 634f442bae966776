package com.gridcalc.config;

import com.gridcalc.formula.functions.FunctionRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Shared engine collaborators. Tests swap the clock and RNG for fixed ones.
 */
@Configuration
public class EngineConfig {

    @Bean
    public FunctionRegistry functionRegistry() {
        return new FunctionRegistry();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * One RNG per sheet so that sheets never share random state.
     */
    @Bean
    public Supplier<Random> randomSupplier() {
        return Random::new;
    }
}
