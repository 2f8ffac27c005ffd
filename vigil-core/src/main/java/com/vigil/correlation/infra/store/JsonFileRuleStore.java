package com.vigil.correlation.infra.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vigil.correlation.api.RuleStore;
import com.vigil.correlation.api.exceptions.RuleLoadException;
import com.vigil.correlation.api.model.Rule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Rule store backed by a JSON file, re-read on every load so that a reload
 * picks up edits.
 *
 * <p>The file holds either an array of rules or an object with a
 * {@code rules} array:
 * <pre>{@code
 * [
 *   {
 *     "id": "failed-logon-burst",
 *     "name": "Failed logon burst",
 *     "priority": 90,
 *     "severity": "high",
 *     "type": "threshold",
 *     "enabled": true,
 *     "time_window_minutes": 15,
 *     "conditions": [
 *       {"field_name": "event_id", "operator": "equals", "value": "4625"}
 *     ],
 *     "metadata": {"category": "authentication"}
 *   }
 * ]
 * }</pre>
 */
public class JsonFileRuleStore implements RuleStore {

    private static final Logger logger = Logger.getLogger(JsonFileRuleStore.class.getName());

    private final Path rulesPath;
    private final ObjectMapper objectMapper;

    public JsonFileRuleStore(Path rulesPath) {
        this.rulesPath = rulesPath;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public List<Rule> loadEnabledRules() throws RuleLoadException {
        List<Rule> rules = readRules();
        validate(rules);
        List<Rule> enabled = RuleOrdering.enabledInLoadOrder(rules);
        logger.info(String.format("Loaded %d rules (%d enabled) from %s",
                rules.size(), enabled.size(), rulesPath));
        return enabled;
    }

    private List<Rule> readRules() throws RuleLoadException {
        if (!Files.isReadable(rulesPath)) {
            throw new RuleLoadException("Rules file is not readable: " + rulesPath);
        }
        try {
            JsonNode root = objectMapper.readTree(Files.readString(rulesPath));
            JsonNode array = root != null && root.isObject() ? root.get("rules") : root;
            if (array == null || !array.isArray()) {
                throw new RuleLoadException("Expected a JSON array of rules in " + rulesPath);
            }
            return objectMapper.convertValue(array,
                    objectMapper.getTypeFactory().constructCollectionType(List.class, Rule.class));
        } catch (JsonProcessingException e) {
            throw new RuleLoadException("Malformed rules file " + rulesPath + ": " + e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new RuleLoadException("Invalid rule definition in " + rulesPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new RuleLoadException("Failed to read rules file " + rulesPath, e);
        }
    }

    private void validate(List<Rule> rules) throws RuleLoadException {
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < rules.size(); i++) {
            Rule rule = rules.get(i);
            if (rule == null) {
                throw new RuleLoadException("Rule at index " + i + " is null");
            }
            if (rule.id().isBlank()) {
                throw new RuleLoadException("Rule at index " + i + " has an empty id");
            }
            if (!seen.add(rule.id())) {
                throw new RuleLoadException("Duplicate rule id: " + rule.id());
            }
        }
    }
}
