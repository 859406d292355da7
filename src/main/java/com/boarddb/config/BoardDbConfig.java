package com.boarddb.config;

import com.boarddb.core.scanner.DefconfigEvaluator;
import com.boarddb.core.scanner.EvaluatorFactory;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class BoardDbConfig {

    @Bean
    @ConditionalOnMissingBean
    public EvaluatorFactory evaluatorFactory() {
        return DefconfigEvaluator::new;
    }

    /**
     * In-memory registry for CLI runs; replaced when an exporting registry is on the classpath.
     */
    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
