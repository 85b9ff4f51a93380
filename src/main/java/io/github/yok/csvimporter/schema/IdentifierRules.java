package io.github.yok.csvimporter.schema;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Identifier constraints of a destination database.
 *
 * <p>
 * Supplied by the dialect handler and consumed by {@link IdentifierSanitizer}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public final class IdentifierRules {

    /**
     * Letters, digits and underscore in any script.
     */
    public static final String UNICODE_WORD_CHARACTERS = "[\\p{L}\\p{N}_]";

    /**
     * ASCII letters, digits and underscore.
     */
    public static final String ASCII_WORD_CHARACTERS = "[A-Za-z0-9_]";

    // Maximum identifier length in characters
    private final int maxLength;

    // Single-character pattern of characters allowed in an identifier
    private final Pattern allowedCharacter;

    // Reserved words, lower-cased
    private final Set<String> reservedWords;

    /**
     * Creates identifier rules.
     *
     * @param maxLength maximum identifier length, at least 8
     * @param allowedCharacter regular expression matching one allowed character
     * @param reservedWords reserved words (any case)
     */
    public IdentifierRules(int maxLength, String allowedCharacter, Set<String> reservedWords) {
        Preconditions.checkArgument(maxLength >= 8, "maxLength too small: %s", maxLength);
        this.maxLength = maxLength;
        this.allowedCharacter = Pattern.compile(allowedCharacter);
        this.reservedWords = reservedWords.stream().map(w -> w.toLowerCase(Locale.ROOT))
                .collect(ImmutableSet.toImmutableSet());
    }

    /**
     * Returns whether the code point may appear in an identifier.
     *
     * @param codePoint Unicode code point
     * @return {@code true} if allowed
     */
    public boolean isAllowed(int codePoint) {
        return allowedCharacter.matcher(new String(Character.toChars(codePoint))).matches();
    }

    /**
     * Returns whether the word is reserved, ignoring case.
     *
     * @param word candidate identifier
     * @return {@code true} if reserved
     */
    public boolean isReserved(String word) {
        return reservedWords.contains(word.toLowerCase(Locale.ROOT));
    }

    /**
     * Returns a copy of these rules with additional reserved words.
     *
     * @param words extra reserved words
     * @return new rules
     */
    public IdentifierRules withReservedWords(Set<String> words) {
        return new IdentifierRules(maxLength, allowedCharacter.pattern(),
                ImmutableSet.<String>builder().addAll(reservedWords).addAll(words.stream()
                        .map(w -> w.toLowerCase(Locale.ROOT)).collect(Collectors.toSet()))
                        .build());
    }
}
