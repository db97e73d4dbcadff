package yaml.node;

/// Thrown by [NodeBuilder] when a parser delivers an event sequence that cannot
/// form a document, such as an unbalanced end event or an alias to an unknown anchor.
@SuppressWarnings("serial")
public final class NodeEventException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /// Creates a new NodeEventException with the given message.
    /// @param message the error message
    public NodeEventException(String message) {
        super(message);
    }
}
