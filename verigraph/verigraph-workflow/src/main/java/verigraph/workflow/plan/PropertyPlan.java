package verigraph.workflow.plan;

import org.immutables.value.Value;
import verigraph.workflow.Quantifier;

import java.util.List;

/**
 * The verification plan for one property: its top-level items, combined by {@link #rootConnective}.
 */
@Value.Immutable
public interface PropertyPlan {
  static ImmutablePropertyPlan.Builder builder() {
    return ImmutablePropertyPlan.builder();
  }

  String title();

  Quantifier quantifier();

  /**
   * Whether the property's queries are refutations (rendered "¬Query n"). Universal properties are negated unless
   * stated otherwise.
   */
  @Value.Default
  default boolean negated() {
    return quantifier() == Quantifier.ForAll;
  }

  List<PlanNode> roots();

  @Value.Default
  default Connective rootConnective() {
    return Connective.Disjunction;
  }
}
