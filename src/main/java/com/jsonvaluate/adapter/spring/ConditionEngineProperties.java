package com.jsonvaluate.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the condition engine.
 */
@ConfigurationProperties(prefix = "jsonvaluate")
public class ConditionEngineProperties {

    /**
     * Whether the condition engine is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to a rule set file. When set, a RuleBook bean is created.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }
}
