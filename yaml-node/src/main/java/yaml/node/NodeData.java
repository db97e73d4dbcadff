package yaml.node;

import java.util.ArrayList;
import java.util.List;

/// Shared storage behind one or more [Node] handles.
///
/// Exactly one of `text`, `items` or `pairs` is meaningful, chosen by `type`.
/// `modCount` moves on every structural change so live cursors can fail fast.
final class NodeData {

    NodeType type;
    String text = "";
    NodeStyle style = NodeStyle.DEFAULT;
    List<Node> items = List.of();
    List<NodeEntry> pairs = List.of();
    int modCount;

    NodeData(NodeType type) {
        becomeEmpty(type);
    }

    static NodeData scalar(String text) {
        final var data = new NodeData(NodeType.SCALAR);
        data.text = text;
        return data;
    }

    /// Clears the payload and switches to an empty node of `newType`.
    void becomeEmpty(NodeType newType) {
        type = newType;
        text = "";
        items = newType == NodeType.SEQUENCE ? new ArrayList<>() : List.of();
        pairs = newType == NodeType.MAP ? new ArrayList<>() : List.of();
        modCount++;
    }

    /// Takes over the payload of `other`. The child lists are shared, not copied,
    /// so callers pass storage nobody else holds.
    void adopt(NodeData other) {
        type = other.type;
        text = other.text;
        style = other.style;
        items = other.items;
        pairs = other.pairs;
        modCount++;
    }

    /// Converts a sequence into a map keyed by element index.
    void sequenceToMap() {
        final var converted = new ArrayList<NodeEntry>(items.size());
        for (int i = 0; i < items.size(); i++) {
            converted.add(new NodeEntry(new Node(scalar(Integer.toString(i))), items.get(i)));
        }
        type = NodeType.MAP;
        items = List.of();
        pairs = converted;
        modCount++;
    }

    int size() {
        return switch (type) {
            case SEQUENCE -> items.size();
            case MAP -> pairs.size();
            default -> 0;
        };
    }
}
