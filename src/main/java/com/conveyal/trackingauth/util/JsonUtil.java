package com.conveyal.trackingauth.util;

import com.conveyal.trackingauth.AuthServerException;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import spark.ResponseTransformer;

/**
 * The tracking server speaks JSON with snake_case property names, so all of our own response models are serialized
 * the same way. Unknown properties are ignored because upstream entities carry many fields we never look at.
 */
public abstract class JsonUtil {

    public static final ObjectMapper objectMapper = getObjectMapper();
    public static final ResponseTransformer toJson = objectMapper::writeValueAsString;

    public static ObjectMapper getObjectMapper () {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        return objectMapper;
    }

    public static ObjectNode objectNode () {
        return objectMapper.createObjectNode();
    }

    public static ArrayNode arrayNode () {
        return objectMapper.createArrayNode();
    }

    public static String toJsonString (Object object) {
        try {
            return objectMapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw AuthServerException.internal("Could not serialize response.");
        }
    }

    /**
     * Parse a JSON document received from a client or from the tracking server.
     * @throws AuthServerException INVALID_REQUEST if the text is not valid JSON.
     */
    public static JsonNode parse (String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw AuthServerException.invalidRequest("Malformed JSON: " + e.getOriginalMessage());
        }
    }

    /** Parse a document that must be a JSON object, as the tracking server's responses always are. */
    public static ObjectNode parseObject (String json) {
        JsonNode node = parse(json);
        if (node == null || !node.isObject()) {
            throw AuthServerException.invalidRequest("Expected a JSON object.");
        }
        return (ObjectNode) node;
    }

}
