package yaml.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.TestFactory;
import yaml.node.convert.Conversions;

import java.io.IOException;
import java.util.Objects;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import static org.assertj.core.api.Assertions.assertThat;

/// Runs the documents in `node-fixtures.json` through [Node#of] and checks the
/// resulting tree and its YAML rendering.
class NodeFixturesTest extends YamlNodeLoggingConfig {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TestFactory
    Stream<DynamicTest> fixtures() throws IOException {
        final JsonNode root;
        try (var in = Objects.requireNonNull(
                NodeFixturesTest.class.getResourceAsStream("/node-fixtures.json"), "node-fixtures.json")) {
            root = MAPPER.readTree(in);
        }
        return StreamSupport.stream(root.spliterator(), false).map(fixture -> {
            final var description = fixture.get("description").asText();
            return DynamicTest.dynamicTest(description, () -> {
                final var document = MAPPER.convertValue(fixture.get("document"), Object.class);

                final var node = Node.of(document);

                assertThat(node.size()).isEqualTo(fixture.get("size").asInt());
                assertThat(NodeWriter.write(node)).isEqualTo(fixture.get("yaml").asText());
                assertThat(Node.of(Conversions.toUntyped(node))).isEqualTo(node);
            });
        });
    }
}
