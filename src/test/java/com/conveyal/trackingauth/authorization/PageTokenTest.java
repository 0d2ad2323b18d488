package com.conveyal.trackingauth.authorization;

import com.conveyal.trackingauth.AuthServerException;
import com.conveyal.trackingauth.util.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class PageTokenTest {

    @Test
    public void missingTokenStartsAtTheBeginning () {
        assertEquals(0, PageToken.offsetOf(null));
        assertEquals(0, PageToken.offsetOf(""));
    }

    @Test
    public void readsTokensInTheTrackingServerFormat () {
        String token = Base64.getEncoder().encodeToString("{\"offset\": 25}".getBytes(StandardCharsets.UTF_8));
        assertEquals(25, PageToken.offsetOf(token));
        assertEquals(7, PageToken.offsetOf(PageToken.encode(7)));
    }

    @Test
    public void loggedModelTokensCarryTheSearchArguments () {
        SearchQuery query = new SearchQuery(10, "name = 'x'", null, null, List.of("1", "2"));
        String token = PageToken.encodeWithQuery(30, query);
        JsonNode decoded = JsonUtil.parse(new String(Base64.getDecoder().decode(token), StandardCharsets.UTF_8));
        assertEquals(30, decoded.get("offset").asInt());
        assertEquals("name = 'x'", decoded.get("filter_string").asText());
        assertEquals(2, decoded.get("experiment_ids").size());
        assertEquals(true, decoded.get("order_by").isNull());
        assertEquals(30, PageToken.offsetOf(token));
    }

    @Test
    public void malformedTokensAreInvalidRequests () {
        AuthServerException notBase64 = assertThrows(AuthServerException.class, () -> PageToken.offsetOf("%%%"));
        assertEquals(AuthServerException.Type.INVALID_REQUEST, notBase64.type);
        String noOffset = Base64.getEncoder().encodeToString("{}".getBytes(StandardCharsets.UTF_8));
        assertThrows(AuthServerException.class, () -> PageToken.offsetOf(noOffset));
        String negative = Base64.getEncoder().encodeToString("{\"offset\":-1}".getBytes(StandardCharsets.UTF_8));
        assertThrows(AuthServerException.class, () -> PageToken.offsetOf(negative));
    }

}
