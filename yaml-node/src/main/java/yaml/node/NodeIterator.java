package yaml.node;

import java.util.ConcurrentModificationException;

/// A forward cursor over the children of one node, obtained from
/// [Node#begin()] and [Node#end()].
///
/// Over a Map the cursor yields each pair's key and value. Over a Sequence
/// [#key()] is a Scalar holding the element's index and [#value()] is the
/// element. Other shapes have no children, so `begin()` equals `end()`.
///
/// ```java
/// for (NodeIterator it = node.begin(); !it.equals(node.end()); it.advance()) {
///     System.out.println(it.key().scalar() + " -> " + it.value().scalar());
/// }
/// ```
///
/// The cursor is bound to the storage the node had when it was created. Adding
/// or removing children of that storage while the cursor is in use is a caller
/// error; the cursor detects it and throws [ConcurrentModificationException].
/// Writing through the returned child handles is fine.
public final class NodeIterator {

    private final NodeData source;
    private int position;
    private final int expectedModCount;

    NodeIterator(NodeData source, int position) {
        this.source = source;
        this.position = position;
        this.expectedModCount = source == null ? 0 : source.modCount;
    }

    private NodeIterator(NodeIterator other) {
        this.source = other.source;
        this.position = other.position;
        this.expectedModCount = other.expectedModCount;
    }

    /// {@return the index of the current child}
    public int position() {
        return position;
    }

    /// {@return the key of the current Map pair, or a Scalar holding the current
    /// Sequence index} An undefined handle when the cursor is past the end.
    public Node key() {
        checkForComodification();
        if (!inRange()) {
            return Node.undefined(position);
        }
        if (source.type == NodeType.MAP) {
            return source.pairs.get(position).key();
        }
        return Node.scalarOf(Integer.toString(position));
    }

    /// {@return the value of the current Map pair, or the current Sequence element}
    /// An undefined handle when the cursor is past the end.
    public Node value() {
        checkForComodification();
        if (!inRange()) {
            return Node.undefined(position);
        }
        if (source.type == NodeType.MAP) {
            return source.pairs.get(position).value();
        }
        return source.items.get(position);
    }

    /// {@return the current value; same as [#value()]}
    public Node get() {
        return value();
    }

    /// Moves to the next child.
    ///
    /// @return this cursor
    public NodeIterator advance() {
        checkForComodification();
        position++;
        return this;
    }

    /// Moves to the next child.
    ///
    /// @return a cursor still at the position this one had before moving
    public NodeIterator postAdvance() {
        final var previous = new NodeIterator(this);
        advance();
        return previous;
    }

    /// Two cursors are equal when they walk the same storage and stand at the same
    /// position. Cursors over different nodes are never equal.
    @Override
    public boolean equals(Object obj) {
        return obj instanceof NodeIterator other
                && source == other.source
                && position == other.position;
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(source) + position;
    }

    @Override
    public String toString() {
        return "NodeIterator[" + (source == null ? NodeType.UNDEFINED : source.type) + " @" + position + "]";
    }

    private boolean inRange() {
        return source != null && position >= 0 && position < source.size();
    }

    private void checkForComodification() {
        if (source != null && source.modCount != expectedModCount) {
            throw new ConcurrentModificationException(
                    "node changed while iterating: " + source.type);
        }
    }
}
