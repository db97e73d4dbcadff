package yaml.node;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Builds a node tree from the event stream of an external parser.
///
/// The parser reports each node as it is read. Scalars and Null are single
/// events; containers are bracketed by start and end events. Inside a map the
/// children alternate key, value, key, value. A node event may carry an anchor
/// name, and [#onAlias(String)] reuses the anchored handle, so aliases in the
/// document become aliased storage in the tree.
///
/// ```java
/// // a: [1, 2]
/// // b: *ref
/// Node root = new NodeBuilder()
///     .onMapStart(NodeStyle.BLOCK, null)
///     .onScalar("a", null)
///     .onSequenceStart(NodeStyle.FLOW, "ref")
///     .onScalar("1", null).onScalar("2", null)
///     .onSequenceEnd()
///     .onScalar("b", null)
///     .onAlias("ref")
///     .onMapEnd()
///     .root();
/// ```
///
/// A builder produces one document and is not thread safe.
public final class NodeBuilder {

    private static final Logger LOG = Logger.getLogger(NodeBuilder.class.getName());

    /// An open container plus the key waiting for its value, when the container is a map.
    private static final class Frame {
        final Node container;
        Node pendingKey;

        Frame(Node container) {
            this.container = container;
        }
    }

    private final Deque<Frame> open = new ArrayDeque<>();
    private final Map<String, Node> anchors = new HashMap<>();
    private Node root;

    /// Reports a Null node.
    ///
    /// @param anchor the anchor name, or `null`
    /// @return this builder
    public NodeBuilder onNull(String anchor) {
        attach(new Node(), anchor);
        return this;
    }

    /// Reports a Scalar node.
    ///
    /// @param text the scalar text as read
    /// @param anchor the anchor name, or `null`
    /// @return this builder
    public NodeBuilder onScalar(String text, String anchor) {
        attach(Node.scalarOf(Objects.requireNonNull(text, "text must not be null")), anchor);
        return this;
    }

    /// Reports a node that repeats an anchored one.
    ///
    /// @param anchor the anchor name
    /// @return this builder
    /// @throws NodeEventException if no node carries `anchor`
    public NodeBuilder onAlias(String anchor) {
        final var target = anchors.get(Objects.requireNonNull(anchor, "anchor must not be null"));
        if (target == null) {
            throw new NodeEventException("Alias to unknown anchor \"" + anchor + "\"");
        }
        attach(target, null);
        return this;
    }

    /// Opens a Sequence.
    ///
    /// @param style the presentation style read from the source
    /// @param anchor the anchor name, or `null`
    /// @return this builder
    public NodeBuilder onSequenceStart(NodeStyle style, String anchor) {
        return start(NodeType.SEQUENCE, style, anchor);
    }

    /// Closes the innermost Sequence.
    ///
    /// @return this builder
    /// @throws NodeEventException if the innermost open container is not a Sequence
    public NodeBuilder onSequenceEnd() {
        return end(NodeType.SEQUENCE);
    }

    /// Opens a Map.
    ///
    /// @param style the presentation style read from the source
    /// @param anchor the anchor name, or `null`
    /// @return this builder
    public NodeBuilder onMapStart(NodeStyle style, String anchor) {
        return start(NodeType.MAP, style, anchor);
    }

    /// Closes the innermost Map.
    ///
    /// @return this builder
    /// @throws NodeEventException if the innermost open container is not a Map or
    ///         a key is still waiting for its value
    public NodeBuilder onMapEnd() {
        final var frame = open.peek();
        if (frame != null && frame.pendingKey != null) {
            throw new NodeEventException("Map ended after key \"" + frame.pendingKey.scalar() + "\" without a value");
        }
        return end(NodeType.MAP);
    }

    /// {@return the finished document root}
    ///
    /// @throws NodeEventException if no node was reported or a container is still open
    public Node root() {
        if (root == null) {
            throw new NodeEventException("No document was built");
        }
        if (!open.isEmpty()) {
            throw new NodeEventException(open.size() + " container(s) still open");
        }
        return root;
    }

    private NodeBuilder start(NodeType type, NodeStyle style, String anchor) {
        final var container = new Node(type);
        container.setStyle(Objects.requireNonNull(style, "style must not be null"));
        attach(container, anchor);
        open.push(new Frame(container));
        LOG.finer(() -> "Opened " + type + " at depth " + open.size());
        return this;
    }

    private NodeBuilder end(NodeType type) {
        final var frame = open.peek();
        if (frame == null || frame.container.type() != type) {
            throw new NodeEventException(type + " end without matching start");
        }
        open.pop();
        LOG.finer(() -> "Closed " + type + " with " + frame.container.size() + " children");
        return this;
    }

    private void attach(Node node, String anchor) {
        if (anchor != null) {
            anchors.put(anchor, node);
        }
        final var frame = open.peek();
        if (frame == null) {
            if (root != null) {
                throw new NodeEventException("Document already has a root node");
            }
            root = node;
            return;
        }
        final var container = frame.container;
        if (container.isSequence()) {
            container.push(node);
        } else if (frame.pendingKey == null) {
            frame.pendingKey = node;
        } else {
            container.forceInsert(frame.pendingKey, node);
            frame.pendingKey = null;
        }
    }
}
