package com.ufilename.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ufilename.core.policy.NamingException;
import com.ufilename.core.policy.PolicyConfig;

import java.util.LinkedHashMap;
import java.util.Objects;

/**
 * JSON text to and from {@link PolicyConfig}.
 *
 * Field order survives both directions, so a config read and written back
 * produces the same document (modulo whitespace).
 */
public class PolicyConfigCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> CONFIG_MAP = new TypeReference<>() {};

    private final ObjectMapper json;

    public PolicyConfigCodec(ObjectMapper objectMapper) {
        this.json = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * @throws NamingException INVALID_CONFIG for malformed JSON or a non-object document
     */
    public PolicyConfig read(String text) {
        JsonNode node;
        try {
            node = json.readTree(text);
        } catch (JsonProcessingException e) {
            throw new NamingException(NamingException.Kind.INVALID_CONFIG,
                    "Policy config is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new NamingException(NamingException.Kind.INVALID_CONFIG,
                    "Policy config must be a JSON object");
        }
        return PolicyConfig.of(json.convertValue(node, CONFIG_MAP));
    }

    public String write(PolicyConfig config) {
        try {
            return json.writeValueAsString(config.asMap());
        } catch (JsonProcessingException e) {
            throw new NamingException(NamingException.Kind.INVALID_CONFIG,
                    "Policy config could not be serialized: " + config, e);
        }
    }
}
