package verigraph.workflow.plan;

import org.immutables.value.Value;

import java.util.List;

@Value.Immutable
public interface PlanParseResult {
  /**
   * Ids of the property blocks created, in plan order.
   */
  List<Integer> propertyIds();

  List<MalformedPlanNode> malformedNodes();

  default boolean isClean() {
    return malformedNodes().isEmpty();
  }
}
