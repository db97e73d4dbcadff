package yaml.node.convert;

import yaml.node.Node;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/// Encodes values of one Java type into nodes and decodes them back.
///
/// Both directions are fallible and report failure as an empty `Optional`.
/// Implementations must not throw. Register them with
/// [Conversions#register(Class, NodeConverter)].
///
/// ## Example
/// ```java
/// Conversions.register(Duration.class, NodeConverter.scalar(
///     Duration::toString,
///     text -> {
///         try {
///             return Optional.of(Duration.parse(text));
///         } catch (DateTimeParseException e) {
///             return Optional.empty();
///         }
///     }));
/// ```
///
/// @param <T> the Java type handled by this converter
public interface NodeConverter<T> {

    /// {@return the node representation of `value`, or empty if it cannot be encoded}
    ///
    /// The returned node must be freshly built; [Node#set(Object)] takes over its storage.
    ///
    /// @param value the value to encode. Non-null.
    Optional<Node> encode(T value);

    /// {@return the value represented by `node`, or empty if it cannot be decoded}
    ///
    /// @param node a defined node
    Optional<T> decode(Node node);

    /// {@return a converter for types that live in a single scalar}
    ///
    /// Decoding is only attempted on scalar nodes; anything else decodes to empty.
    ///
    /// @param format renders a value as scalar text
    /// @param parse reads scalar text, returning empty when the text does not fit
    /// @param <T> the Java type
    static <T> NodeConverter<T> scalar(Function<? super T, String> format,
                                       Function<String, Optional<T>> parse) {
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(parse, "parse must not be null");
        return new NodeConverter<>() {
            @Override
            public Optional<Node> encode(T value) {
                final var text = format.apply(value);
                return text == null ? Optional.empty() : Optional.of(Node.scalarOf(text));
            }

            @Override
            public Optional<T> decode(Node node) {
                if (!node.isScalar()) {
                    return Optional.empty();
                }
                return parse.apply(node.scalar());
            }
        };
    }
}
