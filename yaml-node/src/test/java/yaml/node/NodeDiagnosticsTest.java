package yaml.node;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.*;

/// Failed operations never throw; they report a [NodeFault] on the `yaml.node.Node` logger.
class NodeDiagnosticsTest extends YamlNodeTestBase {

    private static final Logger NODE_LOG = Logger.getLogger(Node.class.getName());

    private final List<LogRecord> records = new CopyOnWriteArrayList<>();
    private final Handler capture = new Handler() {
        @Override
        public void publish(LogRecord record) {
            records.add(record);
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }
    };

    @BeforeEach
    void attach() {
        NODE_LOG.addHandler(capture);
    }

    @AfterEach
    void detach() {
        NODE_LOG.removeHandler(capture);
    }

    private List<String> warnings() {
        return records.stream()
                .filter(r -> r.getLevel() == Level.WARNING)
                .map(LogRecord::getMessage)
                .toList();
    }

    @Test
    void pushOntoMapReportsShapeMismatch() {
        final var node = Node.of(Map.of("k", "v"));

        node.push("x");

        assertThat(warnings()).singleElement().asString()
                .startsWith("SHAPE_MISMATCH in push");
    }

    @Test
    void writingThroughUndefinedReportsInvalidHandle() {
        final var missing = Node.scalarOf("s").getOrCreate("key");
        records.clear();

        missing.set(1);

        assertThat(warnings()).singleElement().asString()
                .startsWith("INVALID_HANDLE in set")
                .contains("\"key\"");
    }

    @Test
    void unencodableValueReportsConversionFailure() {
        final var node = new Node();

        node.push(new Object());

        assertThat(warnings()).singleElement().asString()
                .startsWith("CONVERSION_FAILURE in push");
        assertThat(node.isNull()).isTrue();
    }

    @Test
    void nonIndexKeyOnSequenceReportsShapeMismatch() {
        Node.of(List.of(1)).getOrCreate("name");

        assertThat(warnings()).singleElement().asString()
                .startsWith("SHAPE_MISMATCH in getOrCreate");
    }

    @Test
    void successfulOperationsStayQuiet() {
        final var node = new Node();
        node.getOrCreate("a").push(1);
        node.get("a").get(0).as(Integer.class, 0);

        assertThat(warnings()).isEmpty();
    }
}
