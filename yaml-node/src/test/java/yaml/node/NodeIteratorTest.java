package yaml.node;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.*;

class NodeIteratorTest extends YamlNodeTestBase {

    private static Node orderedMap() {
        final var node = new Node();
        node.getOrCreate("k1").set("v1");
        node.getOrCreate("k2").set("v2");
        node.getOrCreate("k3").set("v3");
        return node;
    }

    @Test
    void cursorWalksMapInInsertionOrder() {
        final var node = orderedMap();
        final var keys = new ArrayList<String>();
        final var values = new ArrayList<String>();

        for (var it = node.begin(); !it.equals(node.end()); it.advance()) {
            keys.add(it.key().scalar());
            values.add(it.value().scalar());
        }

        assertThat(keys).containsExactly("k1", "k2", "k3");
        assertThat(values).containsExactly("v1", "v2", "v3");
    }

    @Test
    void cursorOverSequenceReportsIndexKeys() {
        final var node = Node.of(List.of("a", "b"));
        final var it = node.begin();

        assertThat(it.key().scalar()).isEqualTo("0");
        assertThat(it.get().scalar()).isEqualTo("a");
        it.advance();
        assertThat(it.key().as(Integer.class, -1)).isEqualTo(1);
        assertThat(it.value().scalar()).isEqualTo("b");
        it.advance();
        assertThat(it).isEqualTo(node.end());
    }

    @Test
    void cursorPastEndYieldsUndefined() {
        final var node = Node.of(List.of("a"));
        final var end = node.end();

        assertThat(end.key().isDefined()).isFalse();
        assertThat(end.value().isDefined()).isFalse();
    }

    @Test
    void postAdvanceReturnsPreviousPosition() {
        final var node = Node.of(List.of("a", "b", "c"));
        final var it = node.begin();

        final var previous = it.postAdvance();

        assertThat(previous.position()).isZero();
        assertThat(previous.value().scalar()).isEqualTo("a");
        assertThat(it.position()).isEqualTo(1);
        assertThat(it.value().scalar()).isEqualTo("b");
    }

    @Test
    void advanceReturnsSameCursor() {
        final var node = Node.of(List.of("a", "b"));
        final var it = node.begin();

        assertThat(it.advance()).isSameAs(it);
    }

    @Test
    void cursorsOverDifferentNodesAreNeverEqual() {
        final var a = Node.of(List.of(1));
        final var b = Node.of(List.of(1));

        assertThat(a.begin()).isNotEqualTo(b.begin());
        assertThat(a.begin()).isEqualTo(a.begin());
        assertThat(a.begin()).hasSameHashCodeAs(a.begin());
    }

    @Test
    void cursorsThroughAliasedHandlesAreEqual() {
        final var a = Node.of(List.of(1));
        final var alias = Node.of(a);

        assertThat(alias.begin()).isEqualTo(a.begin());
    }

    @Test
    void beginEqualsEndOnScalar() {
        final var node = Node.scalarOf("s");

        assertThat(node.begin()).isEqualTo(node.end());
        assertThat(node.isScalar()).isTrue();
    }

    @Test
    void beginEqualsEndOnUndefined() {
        final var node = new Node(NodeType.UNDEFINED);

        assertThat(node.begin()).isEqualTo(node.end());
    }

    @Test
    void beginOnNullVivifiesEmptySequence() {
        final var node = new Node();

        final var it = node.begin();

        assertThat(node.isSequence()).isTrue();
        assertThat(it).isEqualTo(node.end());
    }

    @Test
    void iteratorDoesNotVivify() {
        final var node = new Node();

        assertThat(node.iterator().hasNext()).isFalse();
        assertThat(node.entries().iterator().hasNext()).isFalse();
        assertThat(node.isNull()).isTrue();
    }

    @Test
    void iterableYieldsValues() {
        final var node = orderedMap();
        final var values = new ArrayList<String>();

        for (final var value : node) {
            values.add(value.scalar());
        }

        assertThat(values).containsExactly("v1", "v2", "v3");
    }

    @Test
    void entriesPairSequenceElementsWithIndex() {
        final var node = Node.of(List.of("x", "y"));
        final var pairs = new ArrayList<String>();

        for (final var entry : node.entries()) {
            pairs.add(entry.key().scalar() + "=" + entry.value().scalar());
        }

        assertThat(pairs).containsExactly("0=x", "1=y");
    }

    @Test
    void entriesKeepDuplicateKeys() {
        final var node = new Node();
        node.forceInsert("k", 1);
        node.forceInsert("k", 2);

        assertThat(node.entries()).hasSize(2);
    }

    @Test
    void valuesFromCursorWriteIntoParent() {
        final var node = orderedMap();

        node.begin().value().set("changed");

        assertThat(node.get("k1").scalar()).isEqualTo("changed");
    }

    @Test
    void structuralChangeDuringIterationFailsFast() {
        final var node = Node.of(List.of(1, 2));
        final var it = node.begin();

        node.push(3);

        assertThatThrownBy(it::value).isInstanceOf(ConcurrentModificationException.class);
    }

    @Test
    void iteratorFailsFastOnRemoval() {
        final var node = Node.of(List.of(1, 2, 3));
        final var values = node.iterator();
        values.next();

        node.remove(0);

        assertThatThrownBy(values::next).isInstanceOf(ConcurrentModificationException.class);
    }

    @Test
    void exhaustedIteratorThrows() {
        final var values = Node.of(List.of()).iterator();

        assertThatThrownBy(values::next).isInstanceOf(NoSuchElementException.class);
    }
}
