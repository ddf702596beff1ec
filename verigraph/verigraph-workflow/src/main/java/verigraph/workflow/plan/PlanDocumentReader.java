package verigraph.workflow.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Streams;
import verigraph.workflow.Quantifier;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the JSON plan document written by the verifier. The document nests tagged items:
 * <pre>{@code
 * {"queryMetaData": {"contents": {"contents": {"unDisjunctAll": [
 *   {"tag": "Query", "contents": {"queries": {"unDisjunctAll": ["q1.txt", "q2.txt"]}}},
 *   {"tag": "Conjunct", "contents": {"unConjunctAll": [ ... ]}}
 * ]}}}}
 * }</pre>
 * Missing lists are treated as empty; items with a missing or unknown tag are kept as
 * {@link PlanNode.UnrecognizedNode}s so the parser can report them.
 */
public class PlanDocumentReader {
  static final String ROOT_POINTER = "/queryMetaData/contents/contents";

  private final ObjectMapper objectMapper;

  public PlanDocumentReader() {
    this(new ObjectMapper());
  }

  public PlanDocumentReader(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public PropertyPlan readProperty(Path document, String title, Quantifier quantifier) throws IOException {
    return PropertyPlan.builder()
            .title(title)
            .quantifier(quantifier)
            .roots(readRoots(document))
            .build();
  }

  public ImmutableList<PlanNode> readRoots(Path document) throws IOException {
    try (InputStream in = Files.newInputStream(document)) {
      return readRoots(in);
    }
  }

  /**
   * @throws PlanFormatException if the input is not JSON, or has no plan root
   */
  public ImmutableList<PlanNode> readRoots(InputStream in) throws IOException {
    JsonNode tree;
    try {
      tree = objectMapper.readTree(in);
    } catch (JsonProcessingException e) {
      throw new PlanFormatException("Plan document is not valid JSON", e);
    }
    return readRoots(tree);
  }

  public ImmutableList<PlanNode> readRoots(JsonNode document) {
    JsonNode root = document == null ? null : document.at(ROOT_POINTER);
    if (root == null || !root.isObject()) {
      throw new PlanFormatException("Plan document has no object at " + ROOT_POINTER);
    }
    return readItems(root.path("unDisjunctAll"));
  }

  private static ImmutableList<PlanNode> readItems(JsonNode items) {
    return Streams.stream(items.elements())
            .map(PlanDocumentReader::readItem)
            .collect(ImmutableList.toImmutableList());
  }

  private static PlanNode readItem(JsonNode item) {
    String tag = item.path("tag").asText("");
    JsonNode contents = item.path("contents");
    switch (tag) {
      case "Query":
        return PlanNode.query(Streams.stream(contents.path("queries").path("unDisjunctAll").elements())
                .map(query -> query.isTextual() ? PlanNode.Subquery.of(query.asText()) : PlanNode.Subquery.anonymous())
                .collect(ImmutableList.toImmutableList()));
      case "Disjunct":
        return PlanNode.disjunct(readItems(contents.path("unDisjunctAll")));
      case "Conjunct":
        return PlanNode.conjunct(readItems(contents.path("unConjunctAll")));
      default:
        return PlanNode.unrecognized(tag);
    }
  }
}
