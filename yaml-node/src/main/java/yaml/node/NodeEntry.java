package yaml.node;

import java.util.Objects;

/// A key/value pair of a map node.
///
/// The pair itself is immutable but both components are live handles: mutating
/// `value()` mutates the map that holds this entry.
///
/// @param key the key handle
/// @param value the value handle
public record NodeEntry(Node key, Node value) {
    public NodeEntry {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }
}
