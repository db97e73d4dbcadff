package yaml.node;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class NodeEqualityTest extends YamlNodeTestBase {

    @Test
    void scalarsCompareByText() {
        assertThat(Node.scalarOf("1").is(Node.of(1))).isTrue();
        assertThat(Node.scalarOf("1").is(Node.scalarOf("1.0"))).isFalse();
    }

    @Test
    void shapesMustMatch() {
        assertThat(new Node().is(Node.scalarOf(""))).isFalse();
        assertThat(new Node(NodeType.SEQUENCE).is(new Node(NodeType.MAP))).isFalse();
        assertThat(new Node().is(new Node())).isTrue();
        assertThat(new Node(NodeType.UNDEFINED).is(new Node(NodeType.UNDEFINED))).isTrue();
        assertThat(new Node().is(null)).isFalse();
    }

    @Test
    void containersCompareChildrenInOrder() {
        assertThat(Node.of(List.of(1, 2)).is(Node.of(List.of(1, 2)))).isTrue();
        assertThat(Node.of(List.of(1, 2)).is(Node.of(List.of(2, 1)))).isFalse();
        assertThat(Node.of(List.of(1, 2)).is(Node.of(List.of(1)))).isFalse();
    }

    @Test
    void mapPairOrderMatters() {
        final var ab = new Node();
        ab.forceInsert("a", 1);
        ab.forceInsert("b", 2);
        final var ba = new Node();
        ba.forceInsert("b", 2);
        ba.forceInsert("a", 1);

        assertThat(ab.is(ba)).isFalse();
        assertThat(ab.is(Node.of(Map.of("a", 1)))).isFalse();
    }

    @Test
    void styleIsIgnored() {
        final var flow = Node.of(List.of(1));
        flow.setStyle(NodeStyle.FLOW);
        final var block = Node.of(List.of(1));
        block.setStyle(NodeStyle.BLOCK);

        assertThat(flow.is(block)).isTrue();
        assertThat(flow).isEqualTo(block).hasSameHashCodeAs(block);
    }

    @Test
    void equalTreesHaveEqualHashCodes() {
        final var a = Node.of(Map.of("k", List.of(1, Map.of("deep", List.of(List.of("x"))))));
        final var b = Node.of(Map.of("k", List.of(1, Map.of("deep", List.of(List.of("x"))))));

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
    }

    @Test
    void isSameNodeIsIdentityOfStorage() {
        final var a = Node.of(List.of(1));
        final var b = Node.of(List.of(1));

        assertThat(a.is(b)).isTrue();
        assertThat(a.isSameNode(b)).isFalse();
        assertThat(a.isSameNode(Node.of(a))).isTrue();
        assertThat(new Node(NodeType.UNDEFINED).isSameNode(new Node(NodeType.UNDEFINED))).isFalse();
    }

    @Test
    void cyclicTreesCompareWithoutLooping() {
        final var a = new Node();
        a.push("x");
        a.push(a);
        final var b = new Node();
        b.push("x");
        b.push(b);

        assertThat(a.is(b)).isTrue();
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
    }

    @Test
    void cyclicTreesWithDifferentPayloadDiffer() {
        final var a = new Node();
        a.push("x");
        a.push(a);
        final var b = new Node();
        b.push("y");
        b.push(b);

        assertThat(a.is(b)).isFalse();
    }
}
