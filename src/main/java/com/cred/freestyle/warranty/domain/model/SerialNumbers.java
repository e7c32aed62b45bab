package com.cred.freestyle.warranty.domain.model;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Normalization and format rules for serial numbers.
 * Every serial entering the ledger passes through {@link #normalize(String)}.
 *
 * @author Warranty Platform Team
 */
public final class SerialNumbers {

    public static final int MAX_LENGTH = 64;

    private static final Pattern WELL_FORMED = Pattern.compile("^[A-Z0-9][A-Z0-9._/-]{0," + (MAX_LENGTH - 1) + "}$");

    private SerialNumbers() {
    }

    /**
     * Trim and upper-case a raw serial number.
     *
     * @param raw Raw input (may be null)
     * @return Normalized serial, or empty if the input is null or blank
     */
    public static Optional<String> normalize(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(trimmed.toUpperCase(Locale.ROOT));
    }

    /**
     * Check whether an already-normalized serial number is well formed.
     */
    public static boolean isWellFormed(String normalized) {
        return normalized != null && WELL_FORMED.matcher(normalized).matches();
    }
}
