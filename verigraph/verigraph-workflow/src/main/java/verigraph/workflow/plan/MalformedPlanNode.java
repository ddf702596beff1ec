package verigraph.workflow.plan;

import org.immutables.value.Value;

/**
 * Diagnostic for a plan item that could not be turned into blocks.
 */
@Value.Immutable
public interface MalformedPlanNode {
  String propertyTitle();

  /**
   * Child indexes from the property's root items down to the offending node, e.g. {@code [1, 0]}.
   */
  String path();

  String tag();

  @Value.Lazy
  default String message() {
    return "Skipped unrecognized plan node '" + tag() + "' at " + path() + " of property '" + propertyTitle() + "'";
  }
}
