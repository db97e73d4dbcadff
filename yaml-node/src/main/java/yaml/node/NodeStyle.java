package yaml.node;

/// Presentation hint for container nodes, consumed only by emitters.
///
/// Style never takes part in equality or conversion.
public enum NodeStyle {
    /// Let the emitter decide. [NodeWriter] treats this as [#BLOCK].
    DEFAULT,
    /// One entry per line, nesting by indentation.
    BLOCK,
    /// Inline `[a, b]` and `{k: v}` notation.
    FLOW
}
