package com.phillippitts.essaydefense.service.correlation;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the correlation fallback chain.
 */
@Configuration
public class CorrelationConfig {

    @Bean
    public MatcherChain matcherChain() {
        return MatcherChain.defaultChain();
    }
}
