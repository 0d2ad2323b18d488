package com.conveyal.trackingauth.authorization;

import com.conveyal.trackingauth.AuthServerException;
import com.conveyal.trackingauth.util.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Search pagination tokens, in the format the tracking server issues and accepts: Base64 of a JSON object holding
 * the offset of the first row of the next page. Logged model tokens also carry the search arguments, which the
 * tracking server checks against the request the token is replayed with.
 * Because the format is shared, a token produced while filtering a page can be sent straight back upstream.
 */
public abstract class PageToken {

    public static String encode (int offset) {
        return encode(JsonUtil.objectNode().put("offset", offset));
    }

    public static String encodeWithQuery (int offset, SearchQuery query) {
        ObjectNode token = JsonUtil.objectNode().put("offset", offset);
        ArrayNode experimentIds = token.putArray("experiment_ids");
        query.experimentIds.forEach(experimentIds::add);
        if (query.filter == null) {
            token.putNull("filter_string");
        } else {
            token.put("filter_string", query.filter);
        }
        if (query.orderBy == null) {
            token.putNull("order_by");
        } else {
            token.set("order_by", query.orderBy);
        }
        return encode(token);
    }

    /**
     * @return the offset carried by the token, zero for a null or empty token.
     * @throws AuthServerException INVALID_REQUEST if the token cannot be decoded.
     */
    public static int offsetOf (String token) {
        if (token == null || token.isEmpty()) return 0;
        JsonNode json;
        try {
            json = JsonUtil.parse(new String(Base64.getDecoder().decode(token), StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            throw AuthServerException.invalidRequest("Invalid page token, could not base64-decode.");
        }
        JsonNode offset = json.get("offset");
        if (offset == null || !offset.canConvertToInt() || offset.asInt() < 0) {
            throw AuthServerException.invalidRequest("Invalid page token, offset is missing or not a valid integer.");
        }
        return offset.asInt();
    }

    private static String encode (ObjectNode token) {
        return Base64.getEncoder().encodeToString(JsonUtil.toJsonString(token).getBytes(StandardCharsets.UTF_8));
    }

}
