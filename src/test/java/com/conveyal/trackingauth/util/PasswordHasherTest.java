package com.conveyal.trackingauth.util;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.matchesPattern;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PasswordHasherTest {

    @Test
    public void hashesAreSaltedAndVerifiable () {
        String first = PasswordHasher.hash("correct horse");
        String second = PasswordHasher.hash("correct horse");
        assertThat(first, startsWith("pbkdf2-sha256$"));
        assertNotEquals(first, second);
        assertTrue(PasswordHasher.matches("correct horse", first));
        assertTrue(PasswordHasher.matches("correct horse", second));
        assertFalse(PasswordHasher.matches("battery staple", first));
    }

    @Test
    public void foreignHashesNeverMatch () {
        assertFalse(PasswordHasher.matches("x", "x"));
        assertFalse(PasswordHasher.matches("x", "bcrypt$10$abc$def"));
        assertFalse(PasswordHasher.matches("x", "pbkdf2-sha256$many$abc$def"));
        assertFalse(PasswordHasher.matches(null, PasswordHasher.hash("x")));
    }

    @Test
    public void tokensAreUrlSafe () {
        String token = PasswordHasher.generateToken();
        assertThat(token, matchesPattern("[A-Za-z0-9_-]{43}"));
        assertNotEquals(token, PasswordHasher.generateToken());
    }

}
