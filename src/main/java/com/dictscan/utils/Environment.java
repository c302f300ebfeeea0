package com.dictscan.utils;

import com.dictscan.ahocorasick.DuplicatePolicy;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Helper to read deployment settings.
 * An environment variable wins over the system property of the same setting.
 */
public class Environment {
    private static final Logger log = LoggerFactory.getLogger(Environment.class);

    public static final String DUPLICATES_ENV = "DICTSCAN_DUPLICATES";
    public static final String DUPLICATES_PROPERTY = "dictscan.duplicates";

    /**
     * Default duplicate policy for new automaton builders.
     * @throws IllegalArgumentException if the configured value is not a policy name
     */
    public static DuplicatePolicy duplicatePolicy() {
        Optional<String> s = lookup(DUPLICATES_ENV, DUPLICATES_PROPERTY);
        DuplicatePolicy policy = s.map(Environment::parseDuplicatePolicy).orElse(DuplicatePolicy.OVERWRITE);
        log.debug("Using duplicate policy {}", policy);
        return policy;
    }

    /** Case-insensitive, surrounding whitespace ignored. */
    public static DuplicatePolicy parseDuplicatePolicy(String value) {
        if (StringUtils.isBlank(value)) {
            throw new IllegalArgumentException("Duplicate policy cannot be blank");
        }
        try {
            return DuplicatePolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown duplicate policy '" + value + "', expected one of "
                    + StringUtils.join(DuplicatePolicy.values(), ", ").toLowerCase(Locale.ROOT), e);
        }
    }

    static Optional<String> lookup(String envName, String propertyName) {
        return Stream.of(System.getenv(envName), System.getProperty(propertyName)).filter(StringUtils::isNotEmpty).findFirst();
    }

    private Environment() {
    }

}
