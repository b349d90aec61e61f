package dev.mars.pgshift.db.util;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

/**
 * Utility class for PostgreSQL identifiers and revision slugs.
 *
 * <p>PostgreSQL has specific rules for identifiers (table names, schema names):
 * <ul>
 *   <li>Maximum length: 63 characters</li>
 *   <li>Must start with a letter (a-z) or underscore (_)</li>
 *   <li>Can contain letters, digits (0-9), and underscores</li>
 *   <li>Cannot be reserved names (pg_*, information_schema)</li>
 * </ul>
 *
 * <p>Revision slugs follow the same alphabet, lower-cased, so that revision ids can be used
 * as file names on every platform.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
public final class SqlIdentifiers {
    private static final Logger logger = LoggerFactory.getLogger(SqlIdentifiers.class);

    /**
     * PostgreSQL maximum identifier length.
     * @see <a href="https://www.postgresql.org/docs/current/sql-syntax-lexical.html#SQL-SYNTAX-IDENTIFIERS">PostgreSQL Documentation</a>
     */
    public static final int MAX_IDENTIFIER_LENGTH = 63;

    /**
     * Maximum slug length; leaves room for the numeric revision prefix.
     */
    public static final int MAX_SLUG_LENGTH = 48;

    private static final String IDENTIFIER_PATTERN = "^[a-zA-Z_][a-zA-Z0-9_]*$";

    // "_" + 8 hex chars
    private static final int HASH_SUFFIX_LENGTH = 9;

    private SqlIdentifiers() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Validates that an identifier meets PostgreSQL requirements.
     *
     * @param identifier The identifier to validate
     * @param identifierType Type of identifier for error messages (e.g., "schema", "table")
     * @throws IllegalArgumentException if validation fails
     */
    public static void validate(String identifier, String identifierType) {
        if (identifier == null || identifier.trim().isEmpty()) {
            throw new IllegalArgumentException(identifierType + " name cannot be null or empty");
        }

        String trimmed = identifier.trim();

        if (trimmed.length() > MAX_IDENTIFIER_LENGTH) {
            throw new IllegalArgumentException(
                String.format("%s name '%s' exceeds PostgreSQL maximum length of %d characters (length: %d)",
                    identifierType, trimmed, MAX_IDENTIFIER_LENGTH, trimmed.length()));
        }

        if (!trimmed.matches(IDENTIFIER_PATTERN)) {
            throw new IllegalArgumentException(
                String.format("Invalid %s name: '%s'. Must start with letter or underscore, " +
                    "followed by alphanumeric characters or underscores only.",
                    identifierType, trimmed));
        }

        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.startsWith("pg_") || lower.equals("information_schema")) {
            throw new IllegalArgumentException(
                String.format("Reserved %s name: '%s'. Cannot use PostgreSQL system names " +
                    "(pg_*, information_schema).",
                    identifierType, trimmed));
        }
    }

    /**
     * Checks if an identifier is valid without throwing an exception.
     */
    public static boolean isValid(String identifier) {
        try {
            validate(identifier, "Identifier");
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Turns a free-text migration message into a revision slug.
     *
     * <p>Example: {@code "Rename purchased_item.quantity_unit to unit"} becomes
     * {@code "rename_purchased_item_quantity_unit_to_unit"}.
     *
     * @param message the human-readable migration description
     * @return the slug, empty if the message has no letters or digits
     */
    public static String slugify(String message) {
        if (message == null) {
            return "";
        }
        String slug = message.trim().toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9]+", "_")
            .replaceAll("^_+|_+$", "");
        return truncateWithHash(slug, MAX_SLUG_LENGTH);
    }

    /**
     * Truncates a long identifier, appending an 8-char MD5 suffix of the full value so that
     * distinct inputs stay distinct.
     *
     * @param identifier The identifier to truncate
     * @param maxLength maximum length of the result
     * @return the identifier unchanged if short enough, otherwise the truncated form
     */
    public static String truncateWithHash(String identifier, int maxLength) {
        if (identifier == null || identifier.length() <= maxLength) {
            return identifier;
        }

        String md5Hash;
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            byte[] hashBytes = md.digest(identifier.getBytes(StandardCharsets.UTF_8));

            StringBuilder hexString = new StringBuilder();
            for (byte b : hashBytes) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) {
                    hexString.append('0');
                }
                hexString.append(hex);
            }
            md5Hash = hexString.substring(0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 algorithm not available", e);
        }

        String truncatedBase = identifier.substring(0, maxLength - HASH_SUFFIX_LENGTH);
        String result = truncatedBase + "_" + md5Hash;

        logger.debug("Truncated identifier from '{}' (length: {}) to '{}'",
            identifier, identifier.length(), result);

        return result;
    }
}
