package io.github.yok.csvimporter.schema;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns CSV header names into identifiers that are valid for the destination database.
 *
 * <p>
 * {@link #sanitize(String)} is pure and idempotent. The rules applied, in order:
 * </p>
 * <ol>
 * <li>surrounding whitespace is removed;</li>
 * <li>every character outside the allowed set becomes {@code _};</li>
 * <li>an empty result becomes {@code col};</li>
 * <li>a leading digit gets the prefix {@code col_};</li>
 * <li>a reserved word gets the suffix {@code _};</li>
 * <li>the result is cut to the maximum identifier length.</li>
 * </ol>
 *
 * <p>
 * {@link #sanitizeAll(List)} additionally resolves collisions by appending {@code _2},
 * {@code _3}, ... in header order. Sanitized names are still quoted whenever they are rendered into
 * SQL.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class IdentifierSanitizer {

    private static final String EMPTY_NAME = "col";
    private static final String DIGIT_PREFIX = "col_";

    private final IdentifierRules rules;

    /**
     * Sanitizes a single identifier.
     *
     * @param name raw name, may be {@code null}
     * @return sanitized identifier
     */
    public String sanitize(String name) {
        String trimmed = name == null ? "" : name.strip();
        StringBuilder sb = new StringBuilder(trimmed.length());
        trimmed.codePoints().forEach(cp -> {
            if (rules.isAllowed(cp)) {
                sb.appendCodePoint(cp);
            } else {
                sb.append('_');
            }
        });

        String result = sb.length() == 0 ? EMPTY_NAME : sb.toString();
        if (Character.isDigit(result.codePointAt(0))) {
            result = DIGIT_PREFIX + result;
        }
        if (rules.isReserved(result)) {
            result = result + "_";
        }
        return truncate(result);
    }

    /**
     * Sanitizes a list of column names and makes the results unique.
     *
     * <p>
     * Uniqueness is case-insensitive. The first occurrence keeps its name; later ones receive the
     * smallest free numeric suffix starting at {@code _2}.
     * </p>
     *
     * @param names raw names in column order
     * @return sanitized, unique names in the same order
     */
    public List<String> sanitizeAll(List<String> names) {
        List<String> result = new ArrayList<>(names.size());
        Set<String> used = new HashSet<>();
        for (String name : names) {
            String base = sanitize(name);
            String candidate = base;
            int suffix = 2;
            while (!used.add(candidate.toLowerCase(Locale.ROOT))) {
                candidate = withSuffix(base, suffix++);
            }
            if (!candidate.equals(name)) {
                log.debug("Column name '{}' sanitized to '{}'", name, candidate);
            }
            result.add(candidate);
        }
        return result;
    }

    private String withSuffix(String base, int suffix) {
        String tail = "_" + suffix;
        int room = rules.getMaxLength() - tail.length();
        String head = base.length() > room ? base.substring(0, room) : base;
        return head + tail;
    }

    private String truncate(String value) {
        if (value.length() <= rules.getMaxLength()) {
            return value;
        }
        String cut = value.substring(0, rules.getMaxLength());
        if (Character.isHighSurrogate(cut.charAt(cut.length() - 1))) {
            cut = cut.substring(0, cut.length() - 1);
        }
        if (rules.isReserved(cut)) {
            cut = cut.substring(0, cut.length() - 1) + "_";
        }
        return cut;
    }
}
