package io.relaydb.tag;

import java.util.Objects;

/**
 * An indexable tag extracted from an event: a single-character name and its stored value.
 */
public record EventTag(String name, TagValue value) {

    public EventTag {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }

    public static EventTag of(String name, String rawValue) {
        return new EventTag(name, TagValue.of(rawValue));
    }
}
