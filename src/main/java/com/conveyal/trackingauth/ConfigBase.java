package com.conveyal.trackingauth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileReader;
import java.io.Reader;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reads typed configuration options out of a Properties object and reports every missing or malformed option at once,
 * instead of failing on the first one. Subclasses expose the options through the Config interfaces declared by the
 * Components and HttpControllers that need them.
 *
 * There are no defaults: every option must be given, in the properties file or by one of the overrides described on
 * the constructor. The example auth.properties in the repo lists them all.
 */
public class ConfigBase {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigBase.class);

    /** Environment variables and system properties only override options when their name starts with this. */
    public static final String PROPERTY_PREFIX = "tracking-auth-";

    // Only read through the *Prop methods, which record problems.
    private final Properties properties;

    protected final Set<String> keysWithErrors = new TreeSet<>();

    /**
     * Options from the file are overridden by environment variables, which are in turn overridden by system
     * properties. Override names are matched ignoring case and treating dots, underscores and dashes alike, so the
     * server port can be given as TRACKING_AUTH_SERVER_PORT=5001 or -Dtracking.auth.server.port=5001.
     */
    protected ConfigBase (Properties properties) {
        this.properties = properties;
        applyOverrides(System.getenv(), "the environment");
        applyOverrides(System.getProperties(), "system properties");
    }

    protected static Properties propsFromFile (String filename) {
        try (Reader propsReader = new FileReader(filename)) {
            Properties properties = new Properties();
            properties.load(propsReader);
            return properties;
        } catch (Exception e) {
            throw new RuntimeException("Could not load configuration properties from " + filename, e);
        }
    }

    /** @return null after recording the problem if the option is missing. */
    protected String strProp (String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            LOG.error("Missing configuration option {}", key);
            keysWithErrors.add(key);
        }
        return value;
    }

    protected int intProp (String key) {
        return (int) integerProp(key, Integer.MIN_VALUE, Integer.MAX_VALUE);
    }

    protected long longProp (String key) {
        return integerProp(key, Long.MIN_VALUE, Long.MAX_VALUE);
    }

    /** @return zero after recording the problem if the option is missing, malformed or out of range. */
    private long integerProp (String key, long min, long max) {
        String value = strProp(key);
        if (value == null) return 0;
        try {
            long parsed = Long.parseLong(value.trim());
            if (parsed >= min && parsed <= max) return parsed;
            invalidProp(key, "out of range: " + value);
        } catch (NumberFormatException e) {
            invalidProp(key, "not an integer: " + value);
        }
        return 0;
    }

    /** Record an option that is present but unacceptable. It is reported along with the missing ones. */
    protected void invalidProp (String key, String problem) {
        LOG.error("Value of configuration option '{}' is not valid: {}", key, problem);
        keysWithErrors.add(key);
    }

    /** Call once every option has been read. */
    protected void exitIfErrors () {
        if (!keysWithErrors.isEmpty()) {
            LOG.error("You must provide valid values for these configuration options: {}",
                    String.join(", ", keysWithErrors));
            System.exit(1);
        }
    }

    // Values are not logged, some of them are passwords.
    private void applyOverrides (Map<?, ?> source, String sourceDescription) {
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            String name = String.valueOf(entry.getKey()).toLowerCase(Locale.ROOT).replaceAll("[._-]", "-");
            if (!name.startsWith(PROPERTY_PREFIX)) continue;
            String key = name.substring(PROPERTY_PREFIX.length());
            boolean replacing = properties.containsKey(key);
            properties.setProperty(key, String.valueOf(entry.getValue()));
            LOG.info("Configuration option {} {} from {}.", key, replacing ? "overridden" : "set", sourceDescription);
        }
    }

}
