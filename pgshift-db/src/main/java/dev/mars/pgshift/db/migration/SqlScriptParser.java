package dev.mars.pgshift.db.migration;

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


import java.util.ArrayList;
import java.util.List;

/**
 * Splits a migration script into individual SQL statements.
 *
 * <p>Semicolons inside single-quoted strings (including {@code E'...'} strings with backslash
 * escapes), double-quoted identifiers, dollar-quoted bodies
 * ({@code $$ ... $$}, {@code $tag$ ... $tag$}) and comments do not terminate a statement, so
 * {@code DO $$ BEGIN ... END $$;} blocks and PL/pgSQL functions survive intact. Chunks that
 * contain nothing but comments and whitespace are dropped.
 */
public final class SqlScriptParser {

    private SqlScriptParser() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static List<String> split(String content) {
        List<String> statements = new ArrayList<>();
        StringBuilder currentStatement = new StringBuilder();
        boolean hasCode = false;

        int i = 0;
        while (i < content.length()) {
            char c = content.charAt(i);

            // Single-line comments
            if (c == '-' && i + 1 < content.length() && content.charAt(i + 1) == '-') {
                while (i < content.length() && content.charAt(i) != '\n') {
                    currentStatement.append(content.charAt(i));
                    i++;
                }
                continue;
            }

            // Multi-line comments
            if (c == '/' && i + 1 < content.length() && content.charAt(i + 1) == '*') {
                int end = content.indexOf("*/", i + 2);
                int stop = end < 0 ? content.length() : end + 2;
                currentStatement.append(content, i, stop);
                i = stop;
                continue;
            }

            // Dollar-quoted strings
            if (c == '$') {
                String openTag = dollarTagAt(content, i);
                if (openTag != null) {
                    int close = content.indexOf(openTag, i + openTag.length());
                    int stop = close < 0 ? content.length() : close + openTag.length();
                    currentStatement.append(content, i, stop);
                    hasCode = true;
                    i = stop;
                    continue;
                }
            }

            // Single-quoted strings and double-quoted identifiers; doubled quotes are escapes
            if (c == '\'' || c == '"') {
                boolean backslashEscapes = c == '\'' && isEscapeStringPrefix(content, i);
                int stop = i + 1;
                while (stop < content.length()) {
                    if (backslashEscapes && content.charAt(stop) == '\\') {
                        stop += 2;
                        continue;
                    }
                    if (content.charAt(stop) == c) {
                        if (stop + 1 < content.length() && content.charAt(stop + 1) == c) {
                            stop += 2;
                            continue;
                        }
                        stop++;
                        break;
                    }
                    stop++;
                }
                currentStatement.append(content, i, Math.min(stop, content.length()));
                hasCode = true;
                i = stop;
                continue;
            }

            if (c == ';') {
                addStatement(statements, currentStatement, hasCode);
                currentStatement = new StringBuilder();
                hasCode = false;
                i++;
                continue;
            }

            if (!Character.isWhitespace(c)) {
                hasCode = true;
            }
            currentStatement.append(c);
            i++;
        }

        addStatement(statements, currentStatement, hasCode);
        return statements;
    }

    private static void addStatement(List<String> statements, StringBuilder statement, boolean hasCode) {
        String trimmed = statement.toString().trim();
        if (hasCode && !trimmed.isEmpty()) {
            statements.add(trimmed);
        }
    }

    /**
     * True when the quote at {@code quote} opens an escape string constant, {@code E'...'}.
     */
    private static boolean isEscapeStringPrefix(String content, int quote) {
        if (quote == 0) {
            return false;
        }
        char prefix = content.charAt(quote - 1);
        if (prefix != 'E' && prefix != 'e') {
            return false;
        }
        if (quote == 1) {
            return true;
        }
        char before = content.charAt(quote - 2);
        return !(Character.isLetterOrDigit(before) || before == '_' || before == '$');
    }

    /**
     * Returns the dollar-quote tag starting at {@code start} ({@code $$} or {@code $name$}), or null
     * if the dollar sign does not open a quoted body.
     */
    private static String dollarTagAt(String content, int start) {
        int i = start + 1;
        while (i < content.length()) {
            char ch = content.charAt(i);
            if (ch == '$') {
                return content.substring(start, i + 1);
            }
            boolean valid = Character.isLetter(ch) || ch == '_' || (i > start + 1 && Character.isDigit(ch));
            if (!valid) {
                return null;
            }
            i++;
        }
        return null;
    }
}
