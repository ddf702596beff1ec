package verigraph.workflow;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Applies verifier outcomes to queries and re-derives the status of every ancestor connector and property.
 * <p/>
 * Each call evaluates all affected blocks against the pending outcome before writing anything back, then publishes a
 * single status notification.
 */
public class StatusPropagator {
  private static final Logger LOG = LoggerFactory.getLogger(StatusPropagator.class);

  private final Scene scene;
  private final boolean propagateConnectorStatus;

  public StatusPropagator(Scene scene, WorkflowConfig.StatusSettings settings) {
    this.scene = scene;
    this.propagateConnectorStatus = settings.propagateConnectorStatus();
  }

  /**
   * A universal property fails as soon as one of its queries is disproven; an existential property holds as soon as
   * one of its queries is verified. Nothing else resolves a property.
   */
  public static Status propertyStatus(Quantifier quantifier, Collection<Status> queryStatuses) {
    switch (quantifier) {
      case ForAll:
        return queryStatuses.contains(Status.Disproven) ? Status.Disproven : Status.Unknown;
      case Exists:
        return queryStatuses.contains(Status.Verified) ? Status.Verified : Status.Unknown;
      default:
        throw new AssertionError("Unhandled quantifier: " + quantifier);
    }
  }

  public static Status disjunctionStatus(Collection<Status> childStatuses) {
    if (childStatuses.contains(Status.Verified)) return Status.Verified;
    if (!childStatuses.isEmpty() && childStatuses.stream().allMatch(Status.Disproven::equals)) return Status.Disproven;
    return Status.Unknown;
  }

  public static Status conjunctionStatus(Collection<Status> childStatuses) {
    if (childStatuses.contains(Status.Disproven)) return Status.Disproven;
    if (!childStatuses.isEmpty() && childStatuses.stream().allMatch(Status.Verified::equals)) return Status.Verified;
    return Status.Unknown;
  }

  /**
   * Records a verifier outcome for a query (replacing any earlier one; {@link Status#Unknown} resets it) and
   * re-evaluates its ancestors.
   *
   * @return the ids of blocks whose status changed
   * @throws UnknownBlockIdException if there is no such block
   * @throws IllegalArgumentException if the block is not a query
   */
  public Set<Integer> updateStatus(int queryId, Status outcome) {
    Block query = scene.block(queryId);
    checkArgument(query.kind() == BlockKind.Query, "Outcomes can only be recorded for queries, not %s", query);

    Map<Integer, Status> pending = new LinkedHashMap<>();
    pending.put(queryId, outcome);
    evaluateAncestors(queryId, pending);

    Set<Integer> changed = scene.applyStatuses(pending);
    LOG.debug("{} -> {}: {} block(s) changed status", query.title(), outcome, changed.size());
    return changed;
  }

  /**
   * Re-evaluates a block and all of its ancestors, e.g. after some of its descendants were removed.
   *
   * @return the ids of blocks whose status changed
   */
  public Set<Integer> refreshFrom(int blockId) {
    Block block = scene.block(blockId);
    Map<Integer, Status> pending = new LinkedHashMap<>();
    if (block.kind() != BlockKind.Query) pending.put(blockId, evaluate(block, pending));
    evaluateAncestors(blockId, pending);
    return scene.applyStatuses(pending);
  }

  /**
   * Re-evaluates every connector and property from the current query statuses.
   *
   * @return the ids of blocks whose status changed
   */
  public Set<Integer> refreshAll() {
    Map<Integer, Status> pending = new LinkedHashMap<>();
    for (Block property : scene.properties()) {
      // reversed pre-order puts every block after all of its descendants
      List<Block> bottomUp = Lists.reverse(scene.descendants(property.id()).collect(Collectors.toList()));
      for (Block block : bottomUp) {
        if (block.kind().isConnector()) pending.put(block.id(), evaluate(block, pending));
      }
      pending.put(property.id(), evaluate(property, pending));
    }
    return scene.applyStatuses(pending);
  }

  private void evaluateAncestors(int blockId, Map<Integer, Status> pending) {
    scene.ancestors(blockId).forEach(ancestor -> pending.put(ancestor.id(), evaluate(ancestor, pending)));
  }

  private Status evaluate(Block block, Map<Integer, Status> pending) {
    switch (block.kind()) {
      case Property:
        List<Status> queryStatuses = scene.descendants(block.id())
                .filter(descendant -> descendant.kind() == BlockKind.Query)
                .map(query -> statusOf(query, pending))
                .collect(Collectors.toList());
        return propertyStatus(block.propertyPayload().quantifier(), queryStatuses);
      case LogicalOr:
        return propagateConnectorStatus ? disjunctionStatus(childStatuses(block, pending)) : Status.Unknown;
      case LogicalAnd:
        return propagateConnectorStatus ? conjunctionStatus(childStatuses(block, pending)) : Status.Unknown;
      case Query:
        return statusOf(block, pending);
      case Witness:
        return Status.Unknown;
      default:
        throw new AssertionError("Unhandled block kind: " + block.kind());
    }
  }

  private List<Status> childStatuses(Block block, Map<Integer, Status> pending) {
    ImmutableList<Block> children = scene.children(block.id());
    return children.stream().map(child -> statusOf(child, pending)).collect(Collectors.toList());
  }

  private static Status statusOf(Block block, Map<Integer, Status> pending) {
    return pending.getOrDefault(block.id(), block.status());
  }
}
