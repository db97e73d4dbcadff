package yaml.node;

/// The shape tag of a [Node].
///
/// A defined node is always exactly one of [#NULL], [#SCALAR], [#SEQUENCE] or
/// [#MAP]. [#UNDEFINED] is reported by handles that refer to no storage, such as
/// the result of looking up a missing key with [Node#get(Object)].
public enum NodeType {
    /// The handle refers to no storage.
    UNDEFINED,
    /// No payload. The state of a freshly constructed node.
    NULL,
    /// A single textual value.
    SCALAR,
    /// An ordered list of child nodes.
    SEQUENCE,
    /// An ordered list of key/value pairs.
    MAP
}
