package yaml.node;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/// Renders a node tree as YAML text.
///
/// The writer reads nodes only through [Node#type()], [Node#scalar()],
/// [Node#size()], [Node#entries()] and [Node#style()], the same surface an
/// external emitter would use. It produces diagnostic output, not a
/// configurable serialisation:
///
/// - Null renders as `~`;
/// - scalars are plain unless that would be ambiguous, then double-quoted;
/// - non-empty `BLOCK` and `DEFAULT` containers put one entry per line;
/// - `FLOW` containers, empty containers, container keys and everything nested
///   in a flow container render inline as `[a, b]` and `{k: v}`;
/// - a container that contains itself renders the repeat as `*cycle`.
///
/// ## Example
/// ```java
/// Node node = new Node();
/// node.getOrCreate("name").set("Alice");
/// node.getOrCreate("tags").push("a");
/// node.get("tags").push("b");
/// System.out.println(NodeWriter.write(node));
/// // name: Alice
/// // tags:
/// //   - a
/// //   - b
/// ```
public final class NodeWriter {

    private static final int DEFAULT_INDENT = 2;
    private static final String CYCLE = "*cycle";
    private static final String INDICATORS = "-?:,[]{}#&*!|>'\"%@`";
    private static final String FLOW_INDICATORS = ",[]{}";
    private static final Set<String> NULL_WORDS = Set.of("~", "null", "Null", "NULL");

    private final int indent;
    private final List<Node> ancestors = new ArrayList<>();
    private int flowDepth;

    private NodeWriter(int indent) {
        this.indent = indent;
    }

    /// {@return `node` rendered as YAML with two-space indentation}
    ///
    /// An undefined node renders as the empty string.
    ///
    /// @param node the node to render. Non-null.
    public static String write(Node node) {
        return write(node, DEFAULT_INDENT);
    }

    /// {@return `node` rendered as YAML}
    ///
    /// @param node the node to render. Non-null.
    /// @param indent spaces per nesting level of block mappings. At least one.
    /// @throws NullPointerException if `node` is `null`
    /// @throws IllegalArgumentException if `indent` is less than one
    public static String write(Node node, int indent) {
        Objects.requireNonNull(node, "node must not be null");
        if (indent < 1) {
            throw new IllegalArgumentException("indent must be at least 1");
        }
        if (!node.isDefined()) {
            return "";
        }
        final var writer = new NodeWriter(indent);
        if (!isBlock(node)) {
            return writer.flow(node);
        }
        final var out = new StringBuilder();
        writer.block(node, 0, out);
        out.setLength(out.length() - 1); // trim final newline
        return out.toString();
    }

    private static boolean isBlock(Node node) {
        return (node.isSequence() || node.isMap())
                && node.size() > 0
                && node.style() != NodeStyle.FLOW;
    }

    private boolean isAncestor(Node node) {
        for (final var ancestor : ancestors) {
            if (ancestor.isSameNode(node)) {
                return true;
            }
        }
        return false;
    }

    /// Writes a non-empty block container, every line indented by `col` and
    /// terminated by a newline.
    private void block(Node node, int col, StringBuilder out) {
        ancestors.add(node);
        final var pad = " ".repeat(col);
        if (node.isSequence()) {
            for (final var item : node) {
                out.append(pad).append("- ");
                if (isBlock(item) && !isAncestor(item)) {
                    // the nested container's first line shares the dash line
                    final var nested = new StringBuilder();
                    block(item, col + 2, nested);
                    out.append(nested, col + 2, nested.length());
                } else {
                    out.append(flow(item)).append('\n');
                }
            }
        } else {
            for (final var entry : node.entries()) {
                out.append(pad).append(flowKey(entry.key())).append(':');
                final var value = entry.value();
                if (isBlock(value) && !isAncestor(value)) {
                    out.append('\n');
                    block(value, col + indent, out);
                } else {
                    out.append(' ').append(flow(value)).append('\n');
                }
            }
        }
        ancestors.remove(ancestors.size() - 1);
    }

    private String flowKey(Node key) {
        return key.isScalar() ? plainOrQuoted(key.scalar(), false) : flow(key);
    }

    /// Renders a node on a single line.
    private String flow(Node node) {
        if (isAncestor(node)) {
            return CYCLE;
        }
        switch (node.type()) {
            case UNDEFINED, NULL -> {
                return "~";
            }
            case SCALAR -> {
                return plainOrQuoted(node.scalar(), flowDepth > 0);
            }
            default -> {
                ancestors.add(node);
                flowDepth++;
                final var parts = new ArrayList<String>(node.size());
                if (node.isSequence()) {
                    for (final var item : node) {
                        parts.add(flow(item));
                    }
                } else {
                    for (final var entry : node.entries()) {
                        parts.add(flow(entry.key()) + ": " + flow(entry.value()));
                    }
                }
                flowDepth--;
                ancestors.remove(ancestors.size() - 1);
                final var joined = String.join(", ", parts);
                return node.isSequence() ? "[" + joined + "]" : "{" + joined + "}";
            }
        }
    }

    static String plainOrQuoted(String text, boolean inFlow) {
        return isPlainSafe(text, inFlow) ? text : quoted(text);
    }

    private static boolean isPlainSafe(String text, boolean inFlow) {
        if (text.isEmpty() || NULL_WORDS.contains(text)) {
            return false;
        }
        if (text.charAt(0) == ' ' || text.charAt(text.length() - 1) == ' ' || text.endsWith(":")) {
            return false;
        }
        final char first = text.charAt(0);
        if (INDICATORS.indexOf(first) >= 0) {
            final var dashLike = first == '-' || first == '?' || first == ':';
            if (!dashLike || text.length() == 1 || text.charAt(1) == ' ') {
                return false;
            }
        }
        if (text.contains(": ") || text.contains(" #")) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (c < 0x20 || c == 0x7f) {
                return false;
            }
            if (inFlow && FLOW_INDICATORS.indexOf(c) >= 0) {
                return false;
            }
        }
        return true;
    }

    private static String quoted(String text) {
        final var out = new StringBuilder(text.length() + 2).append('"');
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> {
                    if (c < 0x20 || c == 0x7f) {
                        out.append(String.format("\\u%04x", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        return out.append('"').toString();
    }
}
