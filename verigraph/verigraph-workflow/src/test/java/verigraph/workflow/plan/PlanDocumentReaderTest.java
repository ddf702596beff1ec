package verigraph.workflow.plan;

import com.google.common.io.Resources;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import verigraph.workflow.Block;
import verigraph.workflow.BlockKind;
import verigraph.workflow.Quantifier;
import verigraph.workflow.Scene;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PlanDocumentReaderTest {
  private final PlanDocumentReader reader = new PlanDocumentReader();

  @Test
  void readsNestedPlan() throws IOException {
    List<PlanNode> roots = readResource("plans/mnist-robustness.vcl-plan");

    assertThat(roots).hasSize(2);
    PlanNode.QueryNode first = (PlanNode.QueryNode) roots.get(0);
    assertThat(first.subqueries()).containsExactly(
            PlanNode.Subquery.of("robust-query-1.txt"),
            PlanNode.Subquery.of("robust-query-2.txt")).inOrder();

    PlanNode.ConjunctNode conjunct = (PlanNode.ConjunctNode) roots.get(1);
    assertThat(conjunct.children()).hasSize(2);
    PlanNode.QueryNode anonymous = (PlanNode.QueryNode) conjunct.children().get(0);
    assertThat(anonymous.subqueries()).containsExactly(PlanNode.Subquery.anonymous());

    PlanNode.DisjunctNode disjunct = (PlanNode.DisjunctNode) conjunct.children().get(1);
    assertThat(disjunct.children().get(1)).isEqualTo(PlanNode.unrecognized("Trivial"));
  }

  @Test
  void readPlanParsesIntoBlocks() throws IOException {
    PropertyPlan plan = PropertyPlan.builder()
            .title("MNIST Property")
            .quantifier(Quantifier.ForAll)
            .roots(readResource("plans/mnist-robustness.vcl-plan"))
            .build();
    Scene scene = new Scene();

    PlanParseResult result = new PlanParser(scene).parseProperty(plan);

    List<Integer> sequenceNumbers = scene.blocks().stream()
            .filter(block -> block.kind() == BlockKind.Query)
            .map(block -> block.sequenceNumber().getAsInt())
            .collect(Collectors.toList());
    assertThat(sequenceNumbers).containsExactly(1, 2, 3, 4).inOrder();
    assertThat(result.malformedNodes()).hasSize(1);
    assertThat(result.malformedNodes().get(0).path()).isEqualTo("[1, 1, 1]");

    Block or = scene.children(result.propertyIds().get(0)).get(0);
    assertThat(or.kind()).isEqualTo(BlockKind.LogicalOr);
    List<Block> orChildren = scene.children(or.id());
    assertThat(orChildren.stream().map(Block::kind).collect(Collectors.toList()))
            .containsExactly(BlockKind.Query, BlockKind.Query, BlockKind.LogicalAnd).inOrder();
  }

  @Test
  void missingListsAreEmpty() throws IOException {
    assertThat(readResource("plans/empty-plan.vcl-plan")).isEmpty();
  }

  @Test
  void readsPropertyFromFile(@TempDir Path tempDir) throws IOException {
    Path document = tempDir.resolve("p.vcl-plan");
    Files.writeString(document, "{\"queryMetaData\": {\"contents\": {\"contents\": {\"unDisjunctAll\": ["
            + "{\"tag\": \"Query\", \"contents\": {\"queries\": {\"unDisjunctAll\": [\"q.txt\"]}}}]}}}}");

    PropertyPlan plan = reader.readProperty(document, "from file", Quantifier.Exists);

    assertThat(plan.title()).isEqualTo("from file");
    assertThat(plan.negated()).isFalse();
    assertThat(plan.roots()).containsExactly(PlanNode.query(PlanNode.Subquery.of("q.txt")));
  }

  @Test
  void rejectsDocumentsWithoutAPlanRoot() throws IOException {
    assertThrows(PlanFormatException.class, () -> readResource("plans/no-root.vcl-plan"));
    assertThrows(PlanFormatException.class, () -> reader.readRoots(stream("{\"queryMetaData\": [")));
    assertThrows(PlanFormatException.class, () -> reader.readRoots(stream("")));
  }

  private List<PlanNode> readResource(String name) throws IOException {
    try (InputStream in = Resources.getResource(name).openStream()) {
      return reader.readRoots(in);
    }
  }

  private static InputStream stream(String json) {
    return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
  }
}
