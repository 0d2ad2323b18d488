package com.conveyal.trackingauth.util;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.security.spec.KeySpec;
import java.util.Base64;

/**
 * Salted PBKDF2 password hashing. The salt and the iteration count travel with the hash in a single string so that
 * the parameters can be raised later without invalidating stored passwords:
 * <pre>pbkdf2-sha256$iterations$salt$hash</pre>
 */
public abstract class PasswordHasher {

    private static final String ALGORITHM = "PBKDF2WithHmacSHA256";
    private static final String PREFIX = "pbkdf2-sha256";
    private static final int ITERATIONS = 65536;
    // 256 bit key length is 32 bytes.
    private static final int KEY_LENGTH_BITS = 256;
    private static final int SALT_BYTES = 32;

    private static final SecureRandom random = new SecureRandom();

    public static String hash (String password) {
        byte[] salt = new byte[SALT_BYTES];
        random.nextBytes(salt);
        byte[] hash = hashWithSalt(password, salt, ITERATIONS);
        Base64.Encoder encoder = Base64.getEncoder();
        return String.join("$", PREFIX, Integer.toString(ITERATIONS),
                encoder.encodeToString(salt), encoder.encodeToString(hash));
    }

    /** @return false for a wrong password and for anything that is not a hash produced by this class. */
    public static boolean matches (String password, String storedHash) {
        if (password == null || storedHash == null) return false;
        String[] parts = storedHash.split("\\$");
        if (parts.length != 4 || !PREFIX.equals(parts[0])) return false;
        try {
            int iterations = Integer.parseInt(parts[1]);
            byte[] salt = Base64.getDecoder().decode(parts[2]);
            byte[] expected = Base64.getDecoder().decode(parts[3]);
            return MessageDigest.isEqual(expected, hashWithSalt(password, salt, iterations));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Random URL-safe token used for session identifiers. Basic Base64 is avoided because it contains characters
     * that are invalid in URLs and cookies.
     */
    public static String generateToken () {
        byte[] tokenBytes = new byte[32];
        random.nextBytes(tokenBytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(tokenBytes);
    }

    private static byte[] hashWithSalt (String password, byte[] salt, int iterations) {
        try {
            // Note Java char is 16-bit Unicode (not byte, which requires a specific encoding like UTF8).
            KeySpec keySpec = new PBEKeySpec(password.toCharArray(), salt, iterations, KEY_LENGTH_BITS);
            SecretKeyFactory keyFactory = SecretKeyFactory.getInstance(ALGORITHM);
            return keyFactory.generateSecret(keySpec).getEncoded();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Password hashing is unavailable in this JVM.", e);
        }
    }

}
