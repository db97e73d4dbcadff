package yaml.node;

import yaml.node.convert.Conversions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// A handle onto one node of a mutable YAML document tree.
///
/// A node is Null, a Scalar, a Sequence or a Map (see [NodeType]). Handles alias
/// storage: copying a reference is a handle copy, [#set(Object)] with a `Node`
/// argument makes this handle share the argument's storage, and the child
/// handles returned by indexing and iteration are the ones stored in the parent,
/// so writing through them writes into the parent tree.
///
/// ## Failure policy
/// No operation throws because of the document's content. Conversions fall back
/// to empty or default results, mutations that cannot apply return `false`, and
/// lookups that cannot resolve return an undefined handle ([#isDefined()] is
/// `false`). Each such case is reported on this class's logger with its
/// [NodeFault].
///
/// ## Auto-vivification
/// [#getOrCreate(Object)], [#push(Object)], [#forceInsert(Object, Object)] and
/// [#begin()] turn a Null node into the container they need, and
/// [#getOrCreate(Object)] grows maps and sequences to reach the requested key.
/// [#get(Object)], [#iterator()] and [#entries()] never mutate.
///
/// ## Example Usage
/// ```java
/// Node config = new Node();
/// config.getOrCreate("server").getOrCreate("port").set(8080);
/// config.getOrCreate("server").getOrCreate("hosts").push("a.example");
///
/// int port = config.get("server").get("port").as(Integer.class, 80);
/// for (NodeEntry entry : config.get("server").entries()) {
///     System.out.println(entry.key().scalar());
/// }
/// ```
///
/// Nodes are not thread safe. Callers serialise access to aliased storage.
public final class Node implements Iterable<Node> {

    private static final Logger LOG = Logger.getLogger(Node.class.getName());

    // structural hash depth; equal nodes agree at every finite depth
    private static final int HASH_DEPTH = 4;

    /// `null` for an undefined handle
    private NodeData data;

    /// the key whose lookup produced this undefined handle, for diagnostics
    private final String missingKey;

    /// Creates a Null node.
    public Node() {
        this(new NodeData(NodeType.NULL));
    }

    /// Creates an empty node of the given shape.
    ///
    /// `UNDEFINED` yields an undefined handle.
    ///
    /// @param type the shape
    /// @throws NullPointerException if `type` is `null`
    public Node(NodeType type) {
        this(type == NodeType.UNDEFINED ? null : new NodeData(Objects.requireNonNull(type, "type must not be null")));
    }

    Node(NodeData data) {
        this.data = data;
        this.missingKey = null;
    }

    private Node(String missingKey) {
        this.data = null;
        this.missingKey = missingKey;
    }

    /// Creates a node holding the encoding of `value`.
    ///
    /// A `Node` argument yields a new handle sharing its storage. A value the
    /// conversion engine cannot encode yields a Null node and a
    /// [NodeFault#CONVERSION_FAILURE] diagnostic.
    ///
    /// @param value the value, may be `null`
    /// @return the node
    public static Node of(Object value) {
        if (value instanceof Node node) {
            return new Node(node.data);
        }
        final var encoded = Conversions.encode(value);
        if (encoded.isEmpty()) {
            LOG.warning(() -> NodeFault.CONVERSION_FAILURE.describe("of",
                    "cannot encode " + value.getClass().getName() + ", using Null"));
            return new Node();
        }
        return encoded.get();
    }

    /// Creates a Scalar node holding `text` verbatim, without consulting the
    /// conversion engine.
    ///
    /// @param text the scalar text
    /// @return the node
    public static Node scalarOf(String text) {
        return new Node(NodeData.scalar(Objects.requireNonNull(text, "text must not be null")));
    }

    static Node undefined(Object key) {
        return new Node(String.valueOf(key));
    }

    // Types ---------------------------------------------------------------------------

    /// {@return the shape of this node, `UNDEFINED` for a handle without storage}
    public NodeType type() {
        return data == null ? NodeType.UNDEFINED : data.type;
    }

    /// {@return `true` unless this handle refers to no storage}
    public boolean isDefined() {
        return data != null;
    }

    /// {@return `true` if this node is Null}
    public boolean isNull() {
        return type() == NodeType.NULL;
    }

    /// {@return `true` if this node is a Scalar}
    public boolean isScalar() {
        return type() == NodeType.SCALAR;
    }

    /// {@return `true` if this node is a Sequence}
    public boolean isSequence() {
        return type() == NodeType.SEQUENCE;
    }

    /// {@return `true` if this node is a Map}
    public boolean isMap() {
        return type() == NodeType.MAP;
    }

    /// {@return `true` if this node is defined and not Null}
    public boolean hasValue() {
        return isDefined() && !isNull();
    }

    // Style ---------------------------------------------------------------------------

    /// {@return the presentation hint, `DEFAULT` for an undefined handle}
    public NodeStyle style() {
        return data == null ? NodeStyle.DEFAULT : data.style;
    }

    /// Sets the presentation hint. Only containers are affected when emitted.
    ///
    /// @param style the new style
    /// @return `false` if this handle is undefined
    /// @throws NullPointerException if `style` is `null`
    public boolean setStyle(NodeStyle style) {
        Objects.requireNonNull(style, "style must not be null");
        if (data == null) {
            return invalid("setStyle");
        }
        data.style = style;
        return true;
    }

    // Equality ------------------------------------------------------------------------

    /// Structural equality: same shape, same scalar text, and pairwise equal
    /// children in the same order. Style is ignored. Two undefined handles are equal.
    ///
    /// @param other the node to compare with
    /// @return `true` if both nodes hold the same value
    public boolean is(Node other) {
        if (other == null) {
            return false;
        }
        return sameValue(data, other.data, new IdentityHashMap<>());
    }

    /// {@return `true` if both handles refer to the same storage}
    ///
    /// @param other the node to compare with
    public boolean isSameNode(Node other) {
        return other != null && data != null && data == other.data;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Node other && is(other);
    }

    @Override
    public int hashCode() {
        return structuralHash(data, HASH_DEPTH);
    }

    // Assignment ----------------------------------------------------------------------

    /// Assigns a value to this node.
    ///
    /// A `Node` argument makes this handle share the argument's storage. Any other
    /// value is encoded and written into this node's storage in place, so every
    /// handle sharing that storage sees it. When the assignment cannot happen the
    /// prior value is kept.
    ///
    /// @param value the value, may be `null` (assigns Null)
    /// @return `false` if this handle or a `Node` argument is undefined, or `value` cannot be encoded
    public boolean set(Object value) {
        if (data == null) {
            LOG.warning(() -> NodeFault.INVALID_HANDLE.describe("set",
                    "node for key \"" + missingKey + "\" is undefined, won't assign any value"));
            return false;
        }
        if (value instanceof Node other) {
            if (other.data == null) {
                return invalid("set");
            }
            data = other.data;
            return true;
        }
        final var encoded = Conversions.encode(value);
        if (encoded.isEmpty()) {
            LOG.warning(() -> NodeFault.CONVERSION_FAILURE.describe("set",
                    "cannot encode " + value.getClass().getName() + ", keeping prior value"));
            return false;
        }
        final var style = data.style;
        data.adopt(encoded.get().data);
        data.style = style;
        return true;
    }

    /// Clears this node to Null.
    ///
    /// @return `false` if this handle is undefined
    public boolean reset() {
        return reset(new Node());
    }

    /// Overwrites this node's storage with a structural copy of `other`.
    ///
    /// Unlike [#set(Object)] this copies: later changes to `other` are not seen here.
    ///
    /// @param other the node to copy
    /// @return `false` if this handle or `other` is undefined
    /// @throws NullPointerException if `other` is `null`
    public boolean reset(Node other) {
        Objects.requireNonNull(other, "other must not be null");
        if (data == null || other.data == null) {
            return invalid("reset");
        }
        copyInto(other.data, data, new IdentityHashMap<>());
        data.modCount++;
        return true;
    }

    // Access --------------------------------------------------------------------------

    /// Decodes this node as `type`.
    ///
    /// @param type the target type
    /// @param <T> the target type
    /// @return the value, or empty if this node does not hold a `T`
    public <T> Optional<T> asOptional(Class<T> type) {
        final var decoded = Conversions.decode(this, type);
        if (decoded.isEmpty()) {
            LOG.fine(() -> NodeFault.CONVERSION_FAILURE.describe("as",
                    type() + " node is not a " + type.getSimpleName()));
        }
        return decoded;
    }

    /// Decodes this node as `type`, falling back to `defaultValue`.
    ///
    /// @param type the target type
    /// @param defaultValue returned when decoding fails
    /// @param <T> the target type
    /// @return the decoded value or `defaultValue`
    public <T> T as(Class<T> type, T defaultValue) {
        return asOptional(type).orElse(defaultValue);
    }

    /// Decodes this node as `type`, falling back to the natural zero of `type`
    /// (see [Conversions#zeroValue(Class)]), or `null` when it has none.
    ///
    /// @param type the target type
    /// @param <T> the target type
    /// @return the decoded value or the zero value
    public <T> T as(Class<T> type) {
        return as(type, Conversions.zeroValue(type));
    }

    /// Decodes this Sequence into a list.
    ///
    /// @param elementType the type of every element
    /// @param <E> the element type
    /// @return the list, or empty if this is not a sequence of `E`
    public <E> Optional<List<E>> asList(Class<E> elementType) {
        return Conversions.decodeList(this, elementType);
    }

    /// Decodes this Map into an insertion-ordered map; the last duplicate key wins.
    ///
    /// @param keyType the type of every key
    /// @param valueType the type of every value
    /// @param <K> the key type
    /// @param <V> the value type
    /// @return the map, or empty if this is not a map of `K` to `V`
    public <K, V> Optional<Map<K, V>> asMap(Class<K> keyType, Class<V> valueType) {
        return Conversions.decodeMap(this, keyType, valueType);
    }

    /// {@return `true` if this node decodes as `type`} Has no side effects.
    ///
    /// @param type the target type
    public boolean canConvertTo(Class<?> type) {
        return Conversions.decode(this, type).isPresent();
    }

    /// {@return the raw text of a Scalar, otherwise the empty string}
    public String scalar() {
        return isScalar() ? data.text : "";
    }

    /// {@return this node rendered as YAML text, for diagnostics}
    ///
    /// @see NodeWriter#write(Node)
    public String content() {
        return NodeWriter.write(this);
    }

    @Override
    public String toString() {
        return content();
    }

    // Size and Iteration --------------------------------------------------------------

    /// {@return the number of elements of a Sequence or pairs of a Map, otherwise 0}
    public int size() {
        return data == null ? 0 : data.size();
    }

    /// {@return a cursor at the first child}
    ///
    /// A Null node is first converted to an empty Sequence, the same way indexing
    /// grows a Null node. Use [#iterator()] or [#entries()] to iterate without
    /// that side effect.
    public NodeIterator begin() {
        if (isNull()) {
            data.becomeEmpty(NodeType.SEQUENCE);
        }
        return new NodeIterator(data, 0);
    }

    /// {@return a cursor one past the last child}
    public NodeIterator end() {
        return new NodeIterator(data, size());
    }

    /// Iterates the elements of a Sequence or the values of a Map in order.
    /// Other shapes iterate nothing. Does not mutate this node.
    ///
    /// @return an iterator over child value handles
    @Override
    public Iterator<Node> iterator() {
        final var cursor = new NodeIterator(data, 0);
        final var end = size();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return cursor.position() < end;
            }

            @Override
            public Node next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                final var value = cursor.value();
                cursor.advance();
                return value;
            }
        };
    }

    /// {@return the (key, value) pairs of this node in order}
    ///
    /// Map pairs are returned as stored. Sequence elements are paired with a
    /// Scalar holding their index. Other shapes yield nothing. Does not mutate
    /// this node.
    public Iterable<NodeEntry> entries() {
        return () -> {
            final var cursor = new NodeIterator(data, 0);
            final var end = size();
            return new Iterator<>() {
                @Override
                public boolean hasNext() {
                    return cursor.position() < end;
                }

                @Override
                public NodeEntry next() {
                    if (!hasNext()) {
                        throw new NoSuchElementException();
                    }
                    final var entry = new NodeEntry(cursor.key(), cursor.value());
                    cursor.advance();
                    return entry;
                }
            };
        };
    }

    // Sequence ------------------------------------------------------------------------

    /// Appends a value, converting a Null node to a Sequence first.
    ///
    /// A `Node` argument is appended as the same handle, so the sequence aliases it.
    ///
    /// @param element the value to append
    /// @return `false` if this node is undefined, not a Sequence, or `element` cannot be encoded
    public boolean push(Object element) {
        if (data == null) {
            LOG.warning(() -> NodeFault.INVALID_HANDLE.describe("push",
                    "node for key \"" + missingKey + "\" is undefined, can't push any value onto it"));
            return false;
        }
        if (data.type != NodeType.NULL && data.type != NodeType.SEQUENCE) {
            LOG.warning(() -> NodeFault.SHAPE_MISMATCH.describe("push",
                    "can't push onto a " + data.type + " node"));
            return false;
        }
        final var child = childFor("push", element);
        if (child == null) {
            return false;
        }
        if (data.type == NodeType.NULL) {
            data.becomeEmpty(NodeType.SEQUENCE);
        }
        data.items.add(child);
        data.modCount++;
        return true;
    }

    // Map -----------------------------------------------------------------------------

    /// Appends a key/value pair without looking for an existing key, so duplicate
    /// keys are kept.
    ///
    /// A Null node becomes a Map. A Sequence becomes a Map keyed by its indices
    /// before the pair is appended.
    ///
    /// @param key the key
    /// @param value the value
    /// @return `false` if this node is undefined or a Scalar, or either argument cannot be encoded
    public boolean forceInsert(Object key, Object value) {
        if (data == null) {
            return invalid("forceInsert");
        }
        if (data.type == NodeType.SCALAR) {
            LOG.warning(() -> NodeFault.SHAPE_MISMATCH.describe("forceInsert", "can't insert into a SCALAR node"));
            return false;
        }
        final var keyNode = childFor("forceInsert", key);
        final var valueNode = childFor("forceInsert", value);
        if (keyNode == null || valueNode == null) {
            return false;
        }
        toMap();
        data.pairs.add(new NodeEntry(keyNode, valueNode));
        data.modCount++;
        return true;
    }

    // Indexing ------------------------------------------------------------------------

    /// Returns the child at `key`, creating whatever is needed to reach it.
    ///
    /// - A Null node becomes a Map.
    /// - On a Map, an absent key is appended with a Null value, whose handle is returned.
    /// - On a Sequence, `key` must be an integral value (or a node decoding to one)
    ///   that is not negative; the sequence is padded with Null elements up to and
    ///   including that index.
    /// - A Scalar, an unusable key or an undefined handle yields an undefined handle.
    ///
    /// @param key the map key or sequence index
    /// @return the child handle, possibly undefined
    public Node getOrCreate(Object key) {
        if (data == null) {
            LOG.warning(() -> NodeFault.INVALID_HANDLE.describe("getOrCreate",
                    "node for key \"" + missingKey + "\" is undefined"));
            return undefined(key);
        }
        switch (data.type) {
            case NULL, MAP -> {
                if (data.type == NodeType.MAP) {
                    final var found = findPair(key);
                    if (found >= 0) {
                        return data.pairs.get(found).value();
                    }
                }
                // encode before growing so a bad key leaves a Null node untouched
                final var keyNode = childFor("getOrCreate", key);
                if (keyNode == null) {
                    return undefined(key);
                }
                if (data.type == NodeType.NULL) {
                    data.becomeEmpty(NodeType.MAP);
                }
                final var value = new Node();
                data.pairs.add(new NodeEntry(keyNode, value));
                data.modCount++;
                return value;
            }
            case SEQUENCE -> {
                final var index = indexOf(key);
                if (index < 0) {
                    LOG.warning(() -> NodeFault.SHAPE_MISMATCH.describe("getOrCreate",
                            "\"" + key + "\" is not a sequence index"));
                    return undefined(key);
                }
                if (index >= data.items.size()) {
                    while (data.items.size() <= index) {
                        data.items.add(new Node());
                    }
                    data.modCount++;
                }
                return data.items.get(index);
            }
            default -> {
                LOG.warning(() -> NodeFault.SHAPE_MISMATCH.describe("getOrCreate",
                        "can't index a " + data.type + " node with \"" + key + "\""));
                return undefined(key);
            }
        }
    }

    /// Returns the existing child at `key` without changing anything.
    ///
    /// @param key the map key or sequence index
    /// @return the child handle, or an undefined handle if there is none
    public Node get(Object key) {
        switch (type()) {
            case MAP -> {
                final var found = findPair(key);
                if (found >= 0) {
                    return data.pairs.get(found).value();
                }
            }
            case SEQUENCE -> {
                final var index = indexOf(key);
                if (index >= 0 && index < data.items.size()) {
                    return data.items.get(index);
                }
            }
            default -> {
                // nothing to look up in
            }
        }
        LOG.fine(() -> "No child \"" + key + "\" in " + type() + " node");
        return undefined(key);
    }

    /// Removes the first pair whose key matches (Map) or the element at the index (Sequence).
    ///
    /// @param key the map key or sequence index
    /// @return `true` if something was removed
    public boolean remove(Object key) {
        switch (type()) {
            case MAP -> {
                final var found = findPair(key);
                if (found >= 0) {
                    data.pairs.remove(found);
                    data.modCount++;
                    return true;
                }
            }
            case SEQUENCE -> {
                final var index = indexOf(key);
                if (index >= 0 && index < data.items.size()) {
                    data.items.remove(index);
                    data.modCount++;
                    return true;
                }
            }
            default -> {
                // nothing to remove from
            }
        }
        return false;
    }

    // Internals -----------------------------------------------------------------------

    private boolean invalid(String operation) {
        LOG.warning(() -> NodeFault.INVALID_HANDLE.describe(operation, "node is undefined"));
        return false;
    }

    /// Turns an argument into a child handle, or returns `null` after logging.
    private static Node childFor(String operation, Object value) {
        if (value instanceof Node node) {
            if (node.data == null) {
                LOG.warning(() -> NodeFault.INVALID_HANDLE.describe(operation, "argument node is undefined"));
                return null;
            }
            return node;
        }
        final var encoded = Conversions.encode(value);
        if (encoded.isEmpty()) {
            LOG.warning(() -> NodeFault.CONVERSION_FAILURE.describe(operation,
                    "cannot encode " + value.getClass().getName()));
            return null;
        }
        return encoded.get();
    }

    private void toMap() {
        switch (data.type) {
            case NULL -> data.becomeEmpty(NodeType.MAP);
            case SEQUENCE -> data.sequenceToMap();
            default -> {
                // already a map
            }
        }
    }

    /// Position of the first pair whose key matches, or -1.
    ///
    /// Node, `null` and container keys match structurally. Any other key matches a
    /// stored key that decodes to an equal value, so `1` finds the key `"1"`.
    private int findPair(Object key) {
        final var structural = structuralKey(key);
        final var pairs = data.pairs;
        for (int i = 0; i < pairs.size(); i++) {
            final var candidate = pairs.get(i).key();
            final var matches = structural != null
                    ? candidate.is(structural)
                    : Conversions.decode(candidate, key.getClass()).map(key::equals).orElse(false);
            if (matches) {
                return i;
            }
        }
        return -1;
    }

    private static Node structuralKey(Object key) {
        if (key instanceof Node node) {
            return node;
        }
        if (key == null) {
            return new Node();
        }
        if (key instanceof Map<?, ?> || key instanceof Iterable<?> || key.getClass().isArray()) {
            return Conversions.encode(key).orElseGet(() -> undefined(key));
        }
        return null;
    }

    /// The sequence index denoted by `key`, or -1.
    private static int indexOf(Object key) {
        if (key instanceof Integer || key instanceof Long || key instanceof Short || key instanceof Byte) {
            final long index = ((Number) key).longValue();
            return index >= 0 && index <= Integer.MAX_VALUE ? (int) index : -1;
        }
        if (key instanceof Node node) {
            return node.asOptional(Integer.class).filter(i -> i >= 0).orElse(-1);
        }
        return -1;
    }

    private static boolean sameValue(NodeData a, NodeData b, Map<NodeData, Set<NodeData>> assumed) {
        if (a == b) {
            return true;
        }
        if (a == null || b == null || a.type != b.type) {
            return false;
        }
        switch (a.type) {
            case NULL -> {
                return true;
            }
            case SCALAR -> {
                return a.text.equals(b.text);
            }
            default -> {
                if (a.size() != b.size()) {
                    return false;
                }
                // coinductive: a pair already under comparison is taken as equal
                final var seen = assumed.computeIfAbsent(a, k -> Collections.newSetFromMap(new IdentityHashMap<>()));
                if (!seen.add(b)) {
                    return true;
                }
                if (a.type == NodeType.SEQUENCE) {
                    for (int i = 0; i < a.items.size(); i++) {
                        if (!sameValue(a.items.get(i).data, b.items.get(i).data, assumed)) {
                            return false;
                        }
                    }
                    return true;
                }
                for (int i = 0; i < a.pairs.size(); i++) {
                    final var left = a.pairs.get(i);
                    final var right = b.pairs.get(i);
                    if (!sameValue(left.key().data, right.key().data, assumed)
                            || !sameValue(left.value().data, right.value().data, assumed)) {
                        return false;
                    }
                }
                return true;
            }
        }
    }

    private static int structuralHash(NodeData data, int depth) {
        if (data == null) {
            return 0;
        }
        var hash = data.type.hashCode();
        switch (data.type) {
            case SCALAR -> hash = 31 * hash + data.text.hashCode();
            case SEQUENCE -> {
                hash = 31 * hash + data.items.size();
                if (depth > 0) {
                    for (final var item : data.items) {
                        hash = 31 * hash + structuralHash(item.data, depth - 1);
                    }
                }
            }
            case MAP -> {
                hash = 31 * hash + data.pairs.size();
                if (depth > 0) {
                    for (final var pair : data.pairs) {
                        hash = 31 * hash + structuralHash(pair.key().data, depth - 1);
                        hash = 31 * hash + structuralHash(pair.value().data, depth - 1);
                    }
                }
            }
            default -> {
                // NULL carries no payload
            }
        }
        return hash;
    }

    private static NodeData deepCopy(NodeData source, Map<NodeData, NodeData> copies) {
        final var existing = copies.get(source);
        if (existing != null) {
            return existing;
        }
        final var copy = new NodeData(source.type);
        copyInto(source, copy, copies);
        return copy;
    }

    /// Fills `target` with a copy of `source`. References back to `source` inside
    /// the tree become references to `target`.
    private static void copyInto(NodeData source, NodeData target, Map<NodeData, NodeData> copies) {
        copies.put(source, target);
        final var type = source.type;
        final var text = source.text;
        final var style = source.style;
        List<Node> items = List.of();
        List<NodeEntry> pairs = List.of();
        switch (type) {
            case SEQUENCE -> {
                items = new ArrayList<>(source.items.size());
                for (final var item : source.items) {
                    items.add(new Node(deepCopy(item.data, copies)));
                }
            }
            case MAP -> {
                pairs = new ArrayList<>(source.pairs.size());
                for (final var pair : source.pairs) {
                    pairs.add(new NodeEntry(new Node(deepCopy(pair.key().data, copies)),
                            new Node(deepCopy(pair.value().data, copies))));
                }
            }
            default -> {
                // NULL and SCALAR carry no children
            }
        }
        target.type = type;
        target.text = text;
        target.style = style;
        target.items = items;
        target.pairs = pairs;
    }
}
