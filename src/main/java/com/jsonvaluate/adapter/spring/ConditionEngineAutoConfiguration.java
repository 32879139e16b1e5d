package com.jsonvaluate.adapter.spring;

import com.jsonvaluate.config.ConditionLoader;
import com.jsonvaluate.config.RuleBook;
import com.jsonvaluate.config.RuleSetConfig;
import com.jsonvaluate.core.ConditionEngine;
import com.jsonvaluate.operator.CustomOperator;
import com.jsonvaluate.operator.OperatorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the condition engine.
 */
@Configuration
@ConditionalOnProperty(prefix = "jsonvaluate", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(ConditionEngineProperties.class)
public class ConditionEngineAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ConditionEngineAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public OperatorRegistry operatorRegistry(ObjectProvider<CustomOperator> customOperators) {
        OperatorRegistry registry = new OperatorRegistry();
        customOperators.orderedStream().forEach(registry::register);
        log.info("Created OperatorRegistry with custom operators: {}", registry.list());
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public ConditionEngine conditionEngine(OperatorRegistry operatorRegistry) {
        return new ConditionEngine(operatorRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "jsonvaluate", name = "config-path")
    public RuleBook ruleBook(ConditionEngineProperties properties, ConditionEngine conditionEngine) {
        log.info("Creating RuleBook from: {}", properties.getConfigPath());
        RuleSetConfig ruleSet = ConditionLoader.loadRuleSet(properties.getConfigPath());
        return new RuleBook(ruleSet, conditionEngine);
    }
}
