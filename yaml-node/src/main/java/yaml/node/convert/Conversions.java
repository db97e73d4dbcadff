package yaml.node.convert;

import yaml.node.Node;
import yaml.node.NodeType;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/// The conversion engine between Java values and [Node] trees.
///
/// Holds a process-wide registry of [NodeConverter]s keyed by the Java type they
/// handle, pre-populated with [ScalarConverters]. Beyond the registry:
///
/// | Java value | Node |
/// |------------|------|
/// | `null` | Null |
/// | `Node` | the same handle |
/// | `Enum` | Scalar holding `name()` |
/// | `Map<?, ?>` | Map, keys and values encoded recursively, in iteration order |
/// | `Iterable<?>`, arrays | Sequence, elements encoded recursively |
///
/// Values with no exact registration fall back to the first registered
/// converter, in registration order, whose type is a supertype of the value.
///
/// Every method reports failure through an empty `Optional` and never throws
/// for values it cannot handle. A converter that throws is treated as one that
/// returned empty.
///
/// ## Example Usage
/// ```java
/// Node node = Conversions.encode(Map.of("ports", List.of(80, 443))).orElseThrow();
/// List<Integer> ports = Conversions.decodeList(node.get("ports"), Integer.class).orElse(List.of());
/// ```
public final class Conversions {

    private static final Logger LOG = Logger.getLogger(Conversions.class.getName());

    private static final Map<Class<?>, NodeConverter<?>> CONVERTERS = new ConcurrentHashMap<>(ScalarConverters.defaults());

    // registration order of the keys in CONVERTERS; a replaced converter keeps its slot
    private static final CopyOnWriteArrayList<Class<?>> ORDER = new CopyOnWriteArrayList<>(ScalarConverters.defaults().keySet());

    private Conversions() {
        // Static utility class
    }

    /// Registers (or replaces) the converter for `type`.
    ///
    /// Primitive class tokens are registered under their wrapper type.
    ///
    /// @param type the Java type handled by `converter`
    /// @param converter the converter
    /// @param <T> the Java type
    /// @throws NullPointerException if either argument is `null`
    public static <T> void register(Class<T> type, NodeConverter<T> converter) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(converter, "converter must not be null");
        LOG.fine(() -> "Registering converter for " + type.getName());
        final var key = wrap(type);
        CONVERTERS.put(key, converter);
        ORDER.addIfAbsent(key);
    }

    /// {@return the converter registered for exactly `type`, if any}
    ///
    /// @param type the Java type
    /// @param <T> the Java type
    @SuppressWarnings("unchecked")
    public static <T> Optional<NodeConverter<T>> converterFor(Class<T> type) {
        Objects.requireNonNull(type, "type must not be null");
        return Optional.ofNullable((NodeConverter<T>) CONVERTERS.get(wrap(type)));
    }

    /// Encodes a Java value into a fresh node tree.
    ///
    /// @param value the value, may be `null`
    /// @return the node, or empty if `value` (or anything nested in it) has no encoding
    public static Optional<Node> encode(Object value) {
        if (value == null) {
            return Optional.of(new Node());
        }
        if (value instanceof Node node) {
            return Optional.of(node);
        }
        final var exact = CONVERTERS.get(value.getClass());
        if (exact != null) {
            return encodeWith(exact, value);
        }
        if (value instanceof Enum<?> constant) {
            return Optional.of(Node.scalarOf(constant.name()));
        }
        if (value instanceof Map<?, ?> map) {
            return encodeMap(map);
        }
        if (value instanceof Iterable<?> iterable) {
            return encodeSequence(iterable);
        }
        if (value.getClass().isArray()) {
            final var length = Array.getLength(value);
            final var elements = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                elements.add(Array.get(value, i));
            }
            return encodeSequence(elements);
        }
        for (final var type : ORDER) {
            final var converter = CONVERTERS.get(type);
            if (converter != null && type.isInstance(value)) {
                return encodeWith(converter, value);
            }
        }
        LOG.fine(() -> "No converter can encode " + value.getClass().getName());
        return Optional.empty();
    }

    /// Decodes a node into a value of `type`.
    ///
    /// Decoding `Node.class` returns the node itself. Undefined and Null nodes
    /// never decode to anything else.
    ///
    /// @param node the node to decode
    /// @param type the target type; primitive class tokens decode to their wrapper
    /// @param <T> the target type
    /// @return the value, or empty if the node does not hold a `T`
    /// @throws NullPointerException if `type` is `null`
    @SuppressWarnings("unchecked")
    public static <T> Optional<T> decode(Node node, Class<T> type) {
        Objects.requireNonNull(type, "type must not be null");
        final var target = (Class<T>) wrap(type);
        if (node == null || !node.isDefined()) {
            return Optional.empty();
        }
        if (target == Node.class) {
            return Optional.of(target.cast(node));
        }
        final var converter = (NodeConverter<T>) CONVERTERS.get(target);
        if (converter != null) {
            try {
                return Objects.requireNonNullElse(converter.decode(node), Optional.empty());
            } catch (RuntimeException e) {
                LOG.log(Level.FINE, e, () -> "CONVERSION_FAILURE in decode: converter for "
                        + target.getName() + " threw " + e);
                return Optional.empty();
            }
        }
        if (target.isEnum() && node.isScalar()) {
            for (final var constant : target.getEnumConstants()) {
                if (((Enum<?>) constant).name().equals(node.scalar())) {
                    return Optional.of(constant);
                }
            }
            return Optional.empty();
        }
        LOG.fine(() -> "No converter can decode " + type.getName());
        return Optional.empty();
    }

    /// Decodes a sequence node into an unmodifiable list.
    ///
    /// @param node the sequence node
    /// @param elementType the type of every element
    /// @param <E> the element type
    /// @return the list, or empty if `node` is not a sequence or any element fails to decode
    public static <E> Optional<List<E>> decodeList(Node node, Class<E> elementType) {
        Objects.requireNonNull(elementType, "elementType must not be null");
        if (node == null || !node.isSequence()) {
            return Optional.empty();
        }
        final var result = new ArrayList<E>(node.size());
        for (final var element : node) {
            final var decoded = decode(element, elementType);
            if (decoded.isEmpty()) {
                return Optional.empty();
            }
            result.add(decoded.get());
        }
        return Optional.of(Collections.unmodifiableList(result));
    }

    /// Decodes a map node into an unmodifiable, insertion-ordered map.
    ///
    /// When the node holds duplicate keys the last pair wins.
    ///
    /// @param node the map node
    /// @param keyType the type of every key
    /// @param valueType the type of every value
    /// @param <K> the key type
    /// @param <V> the value type
    /// @return the map, or empty if `node` is not a map or any key or value fails to decode
    public static <K, V> Optional<Map<K, V>> decodeMap(Node node, Class<K> keyType, Class<V> valueType) {
        Objects.requireNonNull(keyType, "keyType must not be null");
        Objects.requireNonNull(valueType, "valueType must not be null");
        if (node == null || !node.isMap()) {
            return Optional.empty();
        }
        final var result = new LinkedHashMap<K, V>();
        for (final var entry : node.entries()) {
            final var key = decode(entry.key(), keyType);
            final var value = decode(entry.value(), valueType);
            if (key.isEmpty() || value.isEmpty()) {
                return Optional.empty();
            }
            result.put(key.get(), value.get());
        }
        return Optional.of(Collections.unmodifiableMap(result));
    }

    /// {@return a plain Java view of `node`}
    ///
    /// | Node | Java |
    /// |------|------|
    /// | Undefined, Null | `null` |
    /// | Scalar | `String` |
    /// | Sequence | `List<Object>` (unmodifiable) |
    /// | Map | `Map<Object, Object>` (unmodifiable, insertion-ordered, last duplicate wins) |
    ///
    /// @param node the node to convert
    public static Object toUntyped(Node node) {
        if (node == null) {
            return null;
        }
        return switch (node.type()) {
            case UNDEFINED, NULL -> null;
            case SCALAR -> node.scalar();
            case SEQUENCE -> {
                final var list = new ArrayList<>(node.size());
                for (final var element : node) {
                    list.add(toUntyped(element));
                }
                yield Collections.unmodifiableList(list);
            }
            case MAP -> {
                final var map = new LinkedHashMap<>();
                for (final var entry : node.entries()) {
                    map.put(toUntyped(entry.key()), toUntyped(entry.value()));
                }
                yield Collections.unmodifiableMap(map);
            }
        };
    }

    /// {@return the natural zero of `type`, or `null` if it has none}
    ///
    /// Numbers are zero, `Boolean` is `false`, `Character` is `'\0'` and `String` is empty.
    ///
    /// @param type the type
    /// @param <T> the type
    @SuppressWarnings("unchecked")
    public static <T> T zeroValue(Class<T> type) {
        Objects.requireNonNull(type, "type must not be null");
        final var target = wrap(type);
        final Object zero;
        if (target == Integer.class) {
            zero = 0;
        } else if (target == Long.class) {
            zero = 0L;
        } else if (target == Short.class) {
            zero = (short) 0;
        } else if (target == Byte.class) {
            zero = (byte) 0;
        } else if (target == Double.class) {
            zero = 0.0d;
        } else if (target == Float.class) {
            zero = 0.0f;
        } else if (target == Boolean.class) {
            zero = Boolean.FALSE;
        } else if (target == Character.class) {
            zero = '\0';
        } else if (target == String.class) {
            zero = "";
        } else if (target == BigInteger.class) {
            zero = BigInteger.ZERO;
        } else if (target == BigDecimal.class) {
            zero = BigDecimal.ZERO;
        } else {
            zero = null;
        }
        return (T) zero;
    }

    @SuppressWarnings("unchecked")
    private static Optional<Node> encodeWith(NodeConverter<?> converter, Object value) {
        try {
            return Objects.requireNonNullElse(((NodeConverter<Object>) converter).encode(value), Optional.empty());
        } catch (RuntimeException e) {
            LOG.log(Level.FINE, e, () -> "CONVERSION_FAILURE in encode: converter for "
                    + value.getClass().getName() + " threw " + e);
            return Optional.empty();
        }
    }

    private static Optional<Node> encodeMap(Map<?, ?> map) {
        final var node = new Node(NodeType.MAP);
        for (final var entry : map.entrySet()) {
            final var key = encode(entry.getKey());
            final var value = encode(entry.getValue());
            if (key.isEmpty() || value.isEmpty()) {
                return Optional.empty();
            }
            node.forceInsert(key.get(), value.get());
        }
        return Optional.of(node);
    }

    private static Optional<Node> encodeSequence(Iterable<?> elements) {
        final var node = new Node(NodeType.SEQUENCE);
        for (final var element : elements) {
            final var encoded = encode(element);
            if (encoded.isEmpty()) {
                return Optional.empty();
            }
            node.push(encoded.get());
        }
        return Optional.of(node);
    }

    private static Class<?> wrap(Class<?> type) {
        if (!type.isPrimitive()) {
            return type;
        }
        if (type == int.class) return Integer.class;
        if (type == long.class) return Long.class;
        if (type == boolean.class) return Boolean.class;
        if (type == double.class) return Double.class;
        if (type == float.class) return Float.class;
        if (type == short.class) return Short.class;
        if (type == byte.class) return Byte.class;
        if (type == char.class) return Character.class;
        return type;
    }
}
