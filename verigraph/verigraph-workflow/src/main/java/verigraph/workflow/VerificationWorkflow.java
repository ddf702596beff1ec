package verigraph.workflow;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import verigraph.util.geometry.Rectangle;
import verigraph.workflow.plan.PlanParseResult;
import verigraph.workflow.plan.PlanParser;
import verigraph.workflow.plan.PropertyPlan;

import javax.annotation.Nullable;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Entry point for a host application: wires a {@link Scene} to its parser, layout, status propagation and edge
 * routing, and keeps positions and statuses consistent after every operation.
 * <p/>
 * Presentation code subscribes to {@link #scene()} for change notifications and reads edge curves from
 * {@link #edgeRouter()}. All calls must come from one thread.
 */
public class VerificationWorkflow {
  private static final Logger LOG = LoggerFactory.getLogger(VerificationWorkflow.class);

  private final Scene scene = new Scene();
  private final WorkflowConfig config;
  private final PlanParser parser;
  private final WorkflowLayout layout;
  private final StatusPropagator statusPropagator;
  private final EdgeRouter edgeRouter;

  public VerificationWorkflow() {
    this(WorkflowConfig.load());
  }

  public VerificationWorkflow(WorkflowConfig config) {
    this.config = config;
    parser = new PlanParser(scene);
    layout = new WorkflowLayout(scene, config.layout());
    statusPropagator = new StatusPropagator(scene, config.status());
    edgeRouter = new EdgeRouter(scene, config);
    scene.subscribe(edgeRouter);
  }

  public Scene scene() {
    return scene;
  }

  public WorkflowConfig config() {
    return config;
  }

  public WorkflowLayout layout() {
    return layout;
  }

  public EdgeRouter edgeRouter() {
    return edgeRouter;
  }

  /**
   * Replaces the current workflow with the blocks for the given plans, laid out once all of them are parsed.
   */
  public PlanParseResult load(List<PropertyPlan> plans) {
    scene.clear();
    PlanParseResult result = parser.parse(plans);
    layout.layout();
    LOG.info("Loaded {} propert(ies), {} block(s), {} malformed plan node(s)",
            result.propertyIds().size(), scene.size(), result.malformedNodes().size());
    return result;
  }

  public int addProperty(BlockPayload.PropertyPayload property) {
    int id = scene.addProperty(property);
    layout.layout();
    return id;
  }

  public int addProperty(Quantifier quantifier, String title) {
    return addProperty(BlockPayload.property(quantifier, title));
  }

  public int addQuery(int parentId, boolean negated, @Nullable String sourceReference) {
    int id = scene.addQuery(parentId, negated, sourceReference);
    layout.recenterChildren(parentId);
    statusPropagator.refreshFrom(parentId);
    return id;
  }

  public int addConnector(int parentId, BlockKind connectorKind) {
    int id = scene.addConnector(parentId, connectorKind);
    layout.recenterChildren(parentId);
    statusPropagator.refreshFrom(parentId);
    return id;
  }

  public int addWitness(int queryId, boolean counterexample, @Nullable String dataReference) {
    int id = scene.addWitness(queryId, counterexample, dataReference);
    layout.recenterChildren(queryId);
    return id;
  }

  /**
   * Attaches a witness to the query with the given sequence number. For negated queries the witness is a
   * counterexample.
   *
   * @throws UnknownBlockIdException if no query has that sequence number
   */
  public int attachWitness(int sequenceNumber, @Nullable String dataReference) {
    Block query = scene.queryBySequence(sequenceNumber);
    return addWitness(query.id(), query.queryPayload().negated(), dataReference);
  }

  /**
   * @return the ids of blocks whose status changed
   * @throws UnknownBlockIdException if no query has the result's sequence number
   */
  public Set<Integer> applyResult(QueryResult result) {
    Block query = scene.queryBySequence(result.sequenceNumber());
    return statusPropagator.updateStatus(query.id(), result.outcome());
  }

  /**
   * Applies results in the order given. Every sequence number is resolved before any result is applied.
   */
  public Set<Integer> applyResults(Iterable<QueryResult> results) {
    ImmutableList<QueryResult> batch = ImmutableList.copyOf(results);
    for (QueryResult result : batch) {
      scene.queryBySequence(result.sequenceNumber());
    }
    Set<Integer> changed = new LinkedHashSet<>();
    for (QueryResult result : batch) {
      changed.addAll(applyResult(result));
    }
    return ImmutableSet.copyOf(changed);
  }

  /**
   * Removes a block and its subtree, then re-centers its former siblings and re-derives the statuses above it.
   */
  public Set<Integer> removeBlock(int blockId) {
    Optional<Integer> parentId = scene.block(blockId).parentId();
    Set<Integer> removed = scene.removeBlock(blockId);
    if (parentId.isPresent()) {
      layout.recenterChildren(parentId.get());
      statusPropagator.refreshFrom(parentId.get());
    } else {
      layout.layout();
    }
    return removed;
  }

  public void clear() {
    scene.clear();
  }

  public Optional<Rectangle> bounds() {
    return layout.bounds();
  }
}
