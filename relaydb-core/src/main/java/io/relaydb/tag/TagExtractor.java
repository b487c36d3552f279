package io.relaydb.tag;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Extracts indexable tags from stored event content.
 *
 * <p>The content is a JSON object whose {@code tags} field is an array of arrays of
 * strings. A tag is kept when it has at least two elements and its first element is a
 * single-character name ({@link TagName}); the second element becomes the value.
 * Other tags are ignored. Duplicate {@code (name, value)} pairs within one event are
 * returned once, in first-seen order.
 *
 * <p>This class is thread-safe.
 */
public final class TagExtractor {
    private static final ObjectMapper DEFAULT_MAPPER = JsonMapper.builder().build();

    private final ObjectMapper mapper;

    public TagExtractor() {
        this(DEFAULT_MAPPER);
    }

    public TagExtractor(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Decodes UTF-8 JSON content and returns its indexable tags.
     *
     * @throws EventContentException if the content is not a valid event document
     */
    public List<EventTag> extract(byte[] content) {
        Objects.requireNonNull(content, "content");
        JsonNode root;
        try {
            root = mapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new EventContentException("Event content is not valid JSON", e);
        } catch (IOException e) {
            throw new EventContentException("Failed to read event content", e);
        }
        return extract(root);
    }

    public List<EventTag> extract(String content) {
        Objects.requireNonNull(content, "content");
        try {
            return extract(mapper.readTree(content));
        } catch (JsonProcessingException e) {
            throw new EventContentException("Event content is not valid JSON", e);
        }
    }

    private List<EventTag> extract(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new EventContentException("Event content must be a JSON object");
        }
        JsonNode tags = root.get("tags");
        if (tags == null || !tags.isArray()) {
            throw new EventContentException("Event content has no tags array");
        }
        Set<EventTag> result = new LinkedHashSet<>();
        for (JsonNode tag : tags) {
            List<String> elements = readElements(tag);
            if (elements.size() < 2) {
                continue;
            }
            String name = elements.get(0);
            if (!TagName.isSingleChar(name)) {
                continue;
            }
            result.add(EventTag.of(name, elements.get(1)));
        }
        return List.copyOf(result);
    }

    private static List<String> readElements(JsonNode tag) {
        if (!tag.isArray()) {
            throw new EventContentException("Tag must be an array of strings: " + tag);
        }
        List<String> elements = new ArrayList<>(tag.size());
        for (JsonNode element : tag) {
            if (!element.isTextual()) {
                throw new EventContentException("Tag must be an array of strings: " + tag);
            }
            elements.add(element.textValue());
        }
        return elements;
    }
}
