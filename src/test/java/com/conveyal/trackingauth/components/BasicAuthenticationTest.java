package com.conveyal.trackingauth.components;

import com.conveyal.trackingauth.AuthServerException;
import com.conveyal.trackingauth.AuthenticatedUser;
import com.conveyal.trackingauth.authorization.ApiRequest;
import com.conveyal.trackingauth.persistence.InMemoryPermissionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class BasicAuthenticationTest {

    private InMemoryPermissionStore store;
    private BasicAuthentication authentication;

    @BeforeEach
    public void setUp () {
        store = new InMemoryPermissionStore();
        store.createUser("alice", "pass:word", false);
        store.createUser("root", "root-password", true);
        authentication = new BasicAuthentication(store);
    }

    @Test
    public void acceptsValidCredentials () {
        AuthenticatedUser alice = authentication.authenticate(withAuthorization("Basic " + encode("alice:pass:word")));
        assertEquals("alice", alice.username);
        AuthenticatedUser root = authentication.authenticate(withAuthorization("basic " + encode("root:root-password")));
        assertTrue(root.admin);
    }

    @Test
    public void rejectsMissingOrMalformedCredentials () {
        assertRejected(ApiRequest.builder("GET", "/api/2.0/mlflow/experiments/search").build());
        assertRejected(withAuthorization("Bearer abc"));
        assertRejected(withAuthorization("Basic !!!not-base64"));
        assertRejected(withAuthorization("Basic " + encode("no-colon")));
        assertRejected(withAuthorization("Basic " + encode("alice:wrong")));
        assertRejected(withAuthorization("Basic " + encode("nobody:pass:word")));
    }

    private void assertRejected (ApiRequest request) {
        AuthServerException e = assertThrows(AuthServerException.class, () -> authentication.authenticate(request));
        assertEquals(401, e.httpCode);
        assertEquals(BasicAuthentication.NOT_AUTHENTICATED_MESSAGE, e.message);
    }

    private static ApiRequest withAuthorization (String header) {
        return ApiRequest.builder("GET", "/api/2.0/mlflow/experiments/search").header("Authorization", header).build();
    }

    private static String encode (String credentials) {
        return Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

}
