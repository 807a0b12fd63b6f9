package com.labelaudit.compliance.service.rules;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.labelaudit.compliance.exception.RuleCatalogueException;
import com.labelaudit.compliance.model.FieldName;
import com.labelaudit.compliance.model.Requirement;
import com.labelaudit.compliance.service.validation.FieldValidator;
import com.labelaudit.compliance.service.validation.FieldValidators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads the rule catalogue JSON:
 *
 * <pre>
 * { "version": "lm-2011.1",
 *   "fields": { "mrp": { "requirement": "required", "validator": "currency" }, ... } }
 * </pre>
 *
 * Every defect is reported as a {@link RuleCatalogueException}; there is no fallback
 * catalogue.
 */
public class RuleCatalogueLoader {
    private static final Logger log = LoggerFactory.getLogger(RuleCatalogueLoader.class);

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    public RuleCatalogueLoader(ObjectMapper objectMapper, ResourceLoader resourceLoader) {
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
    }

    public RuleCatalogue load(String location) {
        if (location == null || location.isBlank()) {
            throw new RuleCatalogueException("No rule catalogue location configured");
        }
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new RuleCatalogueException("Rule catalogue not found at " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            RuleCatalogue catalogue = parse(in, location);
            log.info("Loaded rule catalogue {} from {}: {} fields, {} required",
                    catalogue.getVersion(), location, catalogue.getRules().size(), catalogue.getRequiredCount());
            return catalogue;
        } catch (IOException e) {
            throw new RuleCatalogueException("Cannot read rule catalogue at " + location + ": " + e.getMessage(), e);
        }
    }

    RuleCatalogue parse(InputStream in, String origin) {
        JsonNode root;
        try {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            throw new RuleCatalogueException("Rule catalogue " + origin + " is not valid JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new RuleCatalogueException("Rule catalogue " + origin + " is empty");
        }

        String version = root.path("version").asText("");
        JsonNode fields = root.path("fields");
        if (!fields.isObject()) {
            throw new RuleCatalogueException("Rule catalogue " + origin + " has no 'fields' object");
        }

        List<FieldRule> rules = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> it = fields.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            rules.add(toRule(origin, e.getKey(), e.getValue()));
        }
        return new RuleCatalogue(version, rules);
    }

    private static FieldRule toRule(String origin, String key, JsonNode node) {
        FieldName field = FieldName.fromKey(key)
                .orElseThrow(() -> new RuleCatalogueException("Rule catalogue " + origin + ": unknown field '" + key + "'"));
        String req = node.path("requirement").asText(null);
        Requirement requirement = Requirement.fromKey(req)
                .orElseThrow(() -> new RuleCatalogueException(
                        "Rule catalogue " + origin + ": field '" + key + "' has unknown requirement '" + req + "'"));
        String validatorId = node.path("validator").asText(null);
        FieldValidator validator = FieldValidators.byId(validatorId)
                .orElseThrow(() -> new RuleCatalogueException(
                        "Rule catalogue " + origin + ": field '" + key + "' has unknown validator '" + validatorId + "'"));
        return new FieldRule(field, requirement, validator);
    }
}
