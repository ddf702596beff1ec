package verigraph.workflow.plan;

import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import verigraph.workflow.Block;
import verigraph.workflow.BlockKind;
import verigraph.workflow.BlockPayload;
import verigraph.workflow.Scene;
import verigraph.workflow.UnknownBlockIdException;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Turns verification plans into blocks of a {@link Scene}.
 * <p/>
 * A list of sibling items becomes a single connector (OR for disjunctions, AND for conjunctions) with one child per
 * item, unless there is only one item, which is attached directly to the parent. Every subquery of a query node becomes
 * its own Query block, numbered in creation order across the whole scene.
 * <p/>
 * The parser only adds and connects blocks; positions and statuses are left to the layout and status components.
 */
public class PlanParser {
  private static final Logger LOG = LoggerFactory.getLogger(PlanParser.class);

  private final Scene scene;

  public PlanParser(Scene scene) {
    this.scene = scene;
  }

  public PlanParseResult parse(List<PropertyPlan> plans) {
    ImmutablePlanParseResult.Builder result = ImmutablePlanParseResult.builder();
    for (PropertyPlan plan : plans) {
      int propertyId = scene.addProperty(BlockPayload.property(plan.quantifier(), plan.title(), plan.negated()));
      result.addPropertyIds(propertyId);
      result.addAllMalformedNodes(parseTree(propertyId, plan.roots(), plan.rootConnective()));
    }
    PlanParseResult parsed = result.build();
    LOG.debug("Parsed {} propert(ies) into {} block(s)", parsed.propertyIds().size(), scene.size());
    return parsed;
  }

  public PlanParseResult parseProperty(PropertyPlan plan) {
    return parse(ImmutableList.of(plan));
  }

  /**
   * Adds the blocks for a list of sibling plan items beneath an existing block.
   *
   * @return diagnostics for any items that were skipped
   * @throws UnknownBlockIdException if the parent does not exist
   */
  public List<MalformedPlanNode> parseTree(int parentId, List<PlanNode> items, Connective connective) {
    Block property = scene.owningProperty(parentId)
            .orElseThrow(() -> new IllegalStateException("Block " + parentId + " is not beneath a property"));
    TreeBuilder builder = new TreeBuilder(property.propertyPayload());
    builder.parseTree(parentId, items, connective, ImmutableList.of());
    return builder.malformedNodes;
  }

  private class TreeBuilder {
    private final BlockPayload.PropertyPayload property;
    private final List<MalformedPlanNode> malformedNodes = new ArrayList<>();

    TreeBuilder(BlockPayload.PropertyPayload property) {
      this.property = property;
    }

    void parseTree(int parentId, List<PlanNode> items, Connective connective, List<Integer> path) {
      if (items.isEmpty()) return;
      if (items.size() == 1) {
        parseNode(parentId, items.get(0), append(path, 0));
        return;
      }
      BlockKind connectorKind = connective.connectorKind();
      int connectorId = attach(parentId, connectorKind, BlockPayload.connector(connectorKind));
      for (int i = 0; i < items.size(); i++) {
        parseNode(connectorId, items.get(i), append(path, i));
      }
    }

    private int attach(int parentId, BlockKind kind, BlockPayload payload) {
      int id = scene.addBlock(kind, OptionalInt.empty(), payload);
      scene.connect(parentId, id);
      return id;
    }

    private void parseNode(int parentId, PlanNode node, List<Integer> path) {
      node.visit(new PlanNode.Visitor<Void>() {
        @Override
        public Void onQuery(PlanNode.QueryNode query) {
          for (PlanNode.Subquery subquery : query.subqueries()) {
            attach(parentId, BlockKind.Query,
                    BlockPayload.query(property.negated(), subquery.sourceReference().orElse(null)));
          }
          return null;
        }

        @Override
        public Void onDisjunct(PlanNode.DisjunctNode disjunct) {
          parseTree(parentId, disjunct.children(), Connective.Disjunction, path);
          return null;
        }

        @Override
        public Void onConjunct(PlanNode.ConjunctNode conjunct) {
          parseTree(parentId, conjunct.children(), Connective.Conjunction, path);
          return null;
        }

        @Override
        public Void onUnrecognized(PlanNode.UnrecognizedNode unrecognized) {
          MalformedPlanNode malformed = ImmutableMalformedPlanNode.builder()
                  .propertyTitle(property.title())
                  .path(path.toString())
                  .tag(unrecognized.tag())
                  .build();
          LOG.warn(malformed.message());
          malformedNodes.add(malformed);
          return null;
        }
      });
    }
  }

  private static List<Integer> append(List<Integer> path, int index) {
    return ImmutableList.<Integer>builder().addAll(path).add(index).build();
  }
}
