package com.conveyal.trackingauth;

import com.conveyal.trackingauth.authorization.Permission;
import com.conveyal.trackingauth.components.AuthenticationType;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class AuthConfigTest {

    @Test
    public void readsEveryProperty () {
        Properties properties = TestAuthComponents.properties(5000, "Session");
        properties.setProperty("default-permission", "no_permissions");
        AuthConfig config = new AuthConfig(properties);
        assertEquals(0, config.serverPort());
        assertEquals("http://localhost:5000", config.trackingServerUri());
        assertEquals(Permission.NO_PERMISSIONS, config.defaultPermission());
        assertEquals(AuthenticationType.SESSION, config.authenticationType());
        assertEquals(3600, config.sessionLifetimeSeconds());
        assertEquals("test-session", config.sessionCookieName());
        assertEquals(TestAuthComponents.ADMIN_USERNAME, config.adminUsername());
    }

    @Test
    public void unknownAuthenticatorsAreNamedInTheError () {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> AuthenticationType.forConfigValue("kerberos"));
        assertThat(e.getMessage(), containsString("basic"));
        assertThat(e.getMessage(), containsString("kerberos"));
    }

}
