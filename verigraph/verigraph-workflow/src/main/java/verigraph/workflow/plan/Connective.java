package verigraph.workflow.plan;

import verigraph.workflow.BlockKind;

/**
 * How sibling plan items combine, and so which connector block joins them when there is more than one.
 */
public enum Connective {
  Disjunction(BlockKind.LogicalOr),
  Conjunction(BlockKind.LogicalAnd);

  private final BlockKind connectorKind;

  Connective(BlockKind connectorKind) {
    this.connectorKind = connectorKind;
  }

  public BlockKind connectorKind() {
    return connectorKind;
  }
}
