package io.relaydb.tag;

import java.util.Optional;

/**
 * Grammar for indexable tag names: exactly one character (one Unicode code point).
 */
public final class TagName {

    private TagName() {
    }

    /**
     * Returns the name if it is a single-character tag name, otherwise empty.
     */
    public static Optional<String> singleChar(String candidate) {
        if (candidate == null || candidate.isEmpty()) {
            return Optional.empty();
        }
        if (candidate.codePointCount(0, candidate.length()) != 1) {
            return Optional.empty();
        }
        return Optional.of(candidate);
    }

    public static boolean isSingleChar(String candidate) {
        return singleChar(candidate).isPresent();
    }
}
