package io.planbridge.core.markup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Generic element produced by the {@link MarkupTreeBuilder}.
///
/// @param name element name, not null
/// @param attributes attributes in document order with entities decoded, not null
/// @param children child elements in document order, not null
/// @param text concatenated direct text content with entities decoded, not null
/// @param line 1-based line of the start tag
public record MarkupNode(
        String name,
        Map<String, String> attributes,
        List<MarkupNode> children,
        String text,
        int line) {

    public MarkupNode {
        Objects.requireNonNull(name, "name must not be null");
        attributes =
                attributes == null || attributes.isEmpty()
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        children = children == null ? List.of() : List.copyOf(children);
        text = text != null ? text : "";
    }

    public String attribute(String attributeName) {
        return attributes.get(attributeName);
    }

    /// Returns the first child with the given name.
    ///
    /// @param childName element name to look for
    /// @return first matching child, empty if none
    public Optional<MarkupNode> child(String childName) {
        for (MarkupNode child : children) {
            if (child.name.equals(childName)) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    public List<MarkupNode> children(String childName) {
        List<MarkupNode> matches = new ArrayList<>();
        for (MarkupNode child : children) {
            if (child.name.equals(childName)) {
                matches.add(child);
            }
        }
        return matches;
    }

    public String trimmedText() {
        return text.strip();
    }

    /// Trimmed text of the first child with the given name, or empty.
    public Optional<String> childText(String childName) {
        return child(childName).map(MarkupNode::trimmedText);
    }
}
