package com.jsonvaluate.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jsonvaluate.condition.Condition;
import com.jsonvaluate.condition.ConditionGroup;
import com.jsonvaluate.condition.ConditionLink;
import com.jsonvaluate.condition.ConditionNode;
import com.jsonvaluate.condition.Logic;
import com.jsonvaluate.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps the wire representation of conditions onto condition structures.
 * <p>
 * Tree nodes use the fields {@code logic}, {@code children}, {@code key}, {@code operator}
 * and {@code value}. Chains use {@code conditions}, whose links carry {@code key},
 * {@code operator}, {@code value}, {@code group} and {@code next_logic}.
 * A map holding {@code conditions} is read as a chain, anything else as a tree.
 */
public class ConditionLoader {

    private static final Logger log = LoggerFactory.getLogger(ConditionLoader.class);

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private ConditionLoader() {
    }

    // JSON

    /**
     * Parse a JSON condition of either representation.
     */
    public static Condition fromJson(String json) {
        return parse(readJson(json));
    }

    /**
     * Parse a JSON condition tree.
     */
    public static ConditionNode treeFromJson(String json) {
        return parseTree(readJson(json));
    }

    /**
     * Parse a JSON condition chain.
     */
    public static ConditionGroup chainFromJson(String json) {
        return parseChain(readJson(json));
    }

    private static Map<String, Object> readJson(String json) {
        if (json == null || json.isBlank()) {
            throw new ConfigurationException("Condition JSON is empty");
        }
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid condition JSON: " + e.getOriginalMessage(), e);
        }
    }

    // YAML rule sets

    /**
     * Load a rule set from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the rule set file
     * @return Loaded rule set
     */
    public static RuleSetConfig loadRuleSet(String path) {
        log.info("Loading rule set from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseRuleSet(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load rule set from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    /**
     * Parse a rule set from YAML. The document may nest everything under a
     * top-level {@code jsonvaluate} key.
     */
    public static RuleSetConfig parseRuleSet(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Object loaded = yaml.load(inputStream);
        if (loaded == null) {
            throw new ConfigurationException("Rule set file is empty");
        }
        Map<String, Object> root = asMap(loaded, "rule set");

        Map<String, Object> section = root.containsKey("jsonvaluate")
                ? asMap(root.get("jsonvaluate"), "jsonvaluate")
                : root;

        String name = getString(section, "name", "default");
        String version = getString(section, "version", "1.0");

        List<RuleConfig> rules = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Object rulesObj = section.get("rules");
        if (rulesObj != null) {
            List<Object> ruleList = asList(rulesObj, "rules");
            for (int i = 0; i < ruleList.size(); i++) {
                Map<String, Object> ruleMap = asMap(ruleList.get(i), "rules[" + i + "]");
                String ruleName = getString(ruleMap, "name", "rule-" + i);
                if (!seen.add(ruleName)) {
                    throw new ConfigurationException("Duplicate rule name: " + ruleName);
                }
                String description = getString(ruleMap, "description", null);
                Object conditionObj = ruleMap.get("condition");
                Condition condition = conditionObj == null
                        ? ConditionNode.empty()
                        : parse(asMap(conditionObj, "rule '" + ruleName + "' condition"));
                rules.add(new RuleConfig(ruleName, description, condition));
                log.debug("Parsed rule: name={}, condition={}", ruleName, condition);
            }
        }

        if (rules.isEmpty()) {
            log.warn("Rule set '{}' defines no rules", name);
        }

        log.info("Loaded rule set: {} v{} with {} rules", name, version, rules.size());
        return new RuleSetConfig(name, version, rules);
    }

    // Wire maps

    /**
     * Parse a condition of either representation from its wire map.
     */
    public static Condition parse(Map<String, Object> map) {
        if (map == null) {
            return ConditionNode.empty();
        }
        return map.containsKey("conditions") ? parseChain(map) : parseTree(map);
    }

    /**
     * Parse a condition tree node from its wire map.
     */
    public static ConditionNode parseTree(Map<String, Object> map) {
        if (map == null) {
            return ConditionNode.empty();
        }

        Logic logic = parseLogic(map.get("logic"), "logic");

        List<ConditionNode> children = null;
        Object childrenObj = map.get("children");
        if (childrenObj != null) {
            List<Object> childList = asList(childrenObj, "children");
            children = new ArrayList<>(childList.size());
            for (Object child : childList) {
                children.add(parseTree(asMap(child, "children element")));
            }
        }

        return new ConditionNode(
                logic,
                children,
                getString(map, "key", null),
                getString(map, "operator", null),
                map.get("value"));
    }

    /**
     * Parse a condition chain from its wire map.
     */
    public static ConditionGroup parseChain(Map<String, Object> map) {
        if (map == null || map.get("conditions") == null) {
            return ConditionGroup.empty();
        }

        List<Object> linkList = asList(map.get("conditions"), "conditions");
        List<ConditionLink> links = new ArrayList<>(linkList.size());
        for (Object link : linkList) {
            links.add(parseLink(asMap(link, "conditions element")));
        }
        return new ConditionGroup(links);
    }

    private static ConditionLink parseLink(Map<String, Object> map) {
        Object nextLogicObj = map.containsKey("next_logic") ? map.get("next_logic") : map.get("nextLogic");
        Logic nextLogic = parseLogic(nextLogicObj, "next_logic");

        ConditionGroup group = null;
        Object groupObj = map.get("group");
        if (groupObj != null) {
            group = parseChain(asMap(groupObj, "group"));
        }

        return new ConditionLink(
                getString(map, "key", null),
                getString(map, "operator", null),
                map.get("value"),
                group,
                nextLogic);
    }

    private static Logic parseLogic(Object value, String field) {
        if (value == null || value.toString().isBlank()) {
            return null;
        }
        return Logic.parse(value.toString())
                .orElseThrow(() -> new ConfigurationException(
                        "Invalid " + field + " '" + value + "': expected AND or OR"));
    }

    // Helper methods

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String context) {
        if (value instanceof Map<?, ?>) {
            return (Map<String, Object>) value;
        }
        throw new ConfigurationException(context + " must be an object, got: " + value);
    }

    @SuppressWarnings("unchecked")
    private static List<Object> asList(Object value, String context) {
        if (value instanceof List<?>) {
            return (List<Object>) value;
        }
        throw new ConfigurationException(context + " must be a list, got: " + value);
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }
}
