package verigraph.workflow;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import verigraph.util.geometry.Point;

import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The aggregate root of one verification workflow: owns every {@link Block} and {@link Edge}, indexed by integer id.
 * <p/>
 * The structure is a forest of trees rooted at {@link BlockKind#Property Property} blocks. A non-property block is
 * attached to exactly one parent, either when it is created or later through {@link #connect}; until then it is
 * unattached and takes no part in layout or status propagation. Removing a block removes its whole subtree along with
 * every edge touching it. Block ids, edge ids and query sequence numbers are monotonic, and only reset by {@link #clear}.
 * <p/>
 * Not thread-safe: all calls must come from a single owning thread.
 */
public class Scene {
  private static final Logger LOG = LoggerFactory.getLogger(Scene.class);

  private final Map<Integer, Block> blocks = new LinkedHashMap<>();
  private final Map<Integer, Edge> edges = new LinkedHashMap<>();
  private final Map<Integer, Integer> queryIdsBySequence = new HashMap<>();
  private final List<SceneListener> listeners = new ArrayList<>();
  private int nextBlockId;
  private int nextEdgeId;
  private int nextQuerySequence;

  public int addProperty(Quantifier quantifier, String title) {
    return addProperty(BlockPayload.property(quantifier, title));
  }

  public int addProperty(BlockPayload.PropertyPayload payload) {
    return addBlock(BlockKind.Property, OptionalInt.empty(), payload);
  }

  /**
   * Adds a query under a property or logical connector, assigning it the next global sequence number.
   */
  public int addQuery(int parentId, boolean negated, @Nullable String sourceReference) {
    return addBlock(BlockKind.Query, OptionalInt.of(parentId), BlockPayload.query(negated, sourceReference));
  }

  public int addWitness(int queryId, boolean counterexample, @Nullable String dataReference) {
    return addBlock(BlockKind.Witness, OptionalInt.of(queryId), BlockPayload.witness(counterexample, dataReference));
  }

  public int addConnector(int parentId, BlockKind connectorKind) {
    return addBlock(connectorKind, OptionalInt.of(parentId), BlockPayload.connector(connectorKind));
  }

  /**
   * Creates a block and, when a parent is given, connects it beneath that parent (after any existing children).
   * Without a parent the block is left unattached until it is passed to {@link #connect}.
   *
   * @throws UnknownBlockIdException if the parent does not exist
   * @throws InvalidConnectionException if a block of this kind may not be placed there
   */
  public int addBlock(BlockKind kind, OptionalInt parentId, BlockPayload payload) {
    checkArgument(kind == payload.kind(), "Payload %s does not describe a %s block", payload, kind);
    Block parent = null;
    if (parentId.isPresent()) {
      parent = block(parentId.getAsInt());
      checkNesting(parent, kind);
    }

    int id = nextBlockId++;
    OptionalInt sequenceNumber = kind == BlockKind.Query ? OptionalInt.of(++nextQuerySequence) : OptionalInt.empty();
    Block block = new Block(id, payload, sequenceNumber);
    blocks.put(id, block);
    sequenceNumber.ifPresent(sequence -> queryIdsBySequence.put(sequence, id));
    if (parent != null) link(parent, block);

    LOG.debug("Added {}", block);
    notifyListeners(listener -> listener.onBlockAdded(id));
    return id;
  }

  /**
   * Connects an unattached block beneath a parent.
   *
   * @return the id of the new edge
   * @throws UnknownBlockIdException if either block does not exist
   * @throws InvalidConnectionException if either socket is missing or occupied, the kinds may not be nested, or the
   *     parent lies beneath the child
   */
  public int connect(int parentId, int childId) {
    Block parent = block(parentId);
    Block child = block(childId);
    if (parentId == childId) throw new InvalidConnectionException("Cannot connect block %s to itself", parentId);

    parent.socket(SocketDirection.Output)
            .orElseThrow(() -> new InvalidConnectionException("%s has no output socket", parent));
    Socket input = child.socket(SocketDirection.Input)
            .orElseThrow(() -> new InvalidConnectionException("%s has no input socket", child));
    if (!input.acceptsEdge() || child.parentId().isPresent()) {
      throw new InvalidConnectionException("%s is already attached to parent %s", child, child.parentId().orElse(null));
    }
    checkNesting(parent, child.kind());
    if (ancestors(parentId).anyMatch(ancestor -> ancestor.id() == childId)) {
      throw new InvalidConnectionException("Cannot attach %s beneath its own descendant %s", child, parent);
    }

    Edge edge = link(parent, child);
    LOG.debug("Connected {} beneath {}", child, parent);
    notifyListeners(listener -> listener.onEdgeAdded(edge.id()));
    return edge.id();
  }

  /**
   * Removes a block together with all of its descendants and every edge touching any of them.
   *
   * @return the ids of all removed blocks, the given block first
   */
  public Set<Integer> removeBlock(int blockId) {
    Block root = block(blockId);
    ImmutableSet<Integer> removedIds = Stream.concat(Stream.of(root), descendants(blockId))
            .map(Block::id)
            .collect(ImmutableSet.toImmutableSet());
    List<Edge> removedEdges = edges.values().stream()
            .filter(edge -> removedIds.contains(edge.sourceBlockId()) || removedIds.contains(edge.targetBlockId()))
            .collect(Collectors.toList());

    for (Edge edge : removedEdges) {
      edges.remove(edge.id());
      blocks.get(edge.sourceBlockId()).socket(SocketDirection.Output).ifPresent(socket -> socket.detach(edge.id()));
      blocks.get(edge.targetBlockId()).socket(SocketDirection.Input).ifPresent(socket -> socket.detach(edge.id()));
    }
    root.parentId().ifPresent(parentId -> blocks.get(parentId).removeChild(blockId));
    for (Integer removedId : removedIds) {
      Block removed = blocks.remove(removedId);
      removed.sequenceNumber().ifPresent(queryIdsBySequence::remove);
    }

    LOG.debug("Removed {} block(s) and {} edge(s) beneath {}", removedIds.size(), removedEdges.size(), root);
    notifyListeners(listener -> listener.onBlocksRemoved(removedIds));
    return removedIds;
  }

  /**
   * Destroys every block and edge, and resets the block, edge and query-sequence counters to zero.
   */
  public void clear() {
    blocks.clear();
    edges.clear();
    queryIdsBySequence.clear();
    nextBlockId = 0;
    nextEdgeId = 0;
    nextQuerySequence = 0;
    LOG.debug("Cleared scene");
    notifyListeners(SceneListener::onCleared);
  }

  public SceneListener.Subscription subscribe(SceneListener listener) {
    listeners.add(listener);
    return () -> listeners.remove(listener);
  }

  /**
   * @throws UnknownBlockIdException if there is no such block
   */
  public Block block(int blockId) {
    Block block = blocks.get(blockId);
    if (block == null) throw new UnknownBlockIdException(blockId);
    return block;
  }

  public Optional<Block> findBlock(int blockId) {
    return Optional.ofNullable(blocks.get(blockId));
  }

  public boolean contains(int blockId) {
    return blocks.containsKey(blockId);
  }

  /**
   * All blocks, in creation order.
   */
  public Collection<Block> blocks() {
    return Collections.unmodifiableCollection(blocks.values());
  }

  public Collection<Edge> edges() {
    return Collections.unmodifiableCollection(edges.values());
  }

  public Optional<Edge> edge(int edgeId) {
    return Optional.ofNullable(edges.get(edgeId));
  }

  public ImmutableList<Block> properties() {
    return blocks.values().stream()
            .filter(block -> block.kind() == BlockKind.Property)
            .collect(ImmutableList.toImmutableList());
  }

  public ImmutableList<Block> children(int blockId) {
    return block(blockId).childIds().stream()
            .map(blocks::get)
            .collect(ImmutableList.toImmutableList());
  }

  /**
   * All blocks beneath the given block, depth-first in layout order (each parent before its children).
   */
  public Stream<Block> descendants(int blockId) {
    List<Block> found = new ArrayList<>();
    Deque<Integer> pending = new ArrayDeque<>(block(blockId).childIds().reverse());
    while (!pending.isEmpty()) {
      Block next = blocks.get(pending.pop());
      found.add(next);
      next.childIds().reverse().forEach(pending::push);
    }
    return found.stream();
  }

  /**
   * The chain of parents above the given block, nearest first.
   */
  public Stream<Block> ancestors(int blockId) {
    List<Block> chain = new ArrayList<>();
    Optional<Integer> parentId = block(blockId).parentId();
    while (parentId.isPresent()) {
      Block parent = blocks.get(parentId.get());
      chain.add(parent);
      parentId = parent.parentId();
    }
    return chain.stream();
  }

  public Optional<Block> owningProperty(int blockId) {
    Block block = block(blockId);
    if (block.kind() == BlockKind.Property) return Optional.of(block);
    return ancestors(blockId).filter(ancestor -> ancestor.kind() == BlockKind.Property).findFirst();
  }

  public ImmutableList<Edge> edgesTouching(int blockId) {
    Block block = block(blockId);
    return block.kind().sockets().stream()
            .flatMap(direction -> block.socket(direction).stream())
            .flatMap(socket -> socket.edgeIds().stream())
            .map(edges::get)
            .collect(ImmutableList.toImmutableList());
  }

  public Optional<Block> findQuery(int sequenceNumber) {
    return Optional.ofNullable(queryIdsBySequence.get(sequenceNumber)).map(blocks::get);
  }

  /**
   * @throws UnknownBlockIdException if no query with that sequence number exists
   */
  public Block queryBySequence(int sequenceNumber) {
    return findQuery(sequenceNumber).orElseThrow(() -> UnknownBlockIdException.forQuerySequence(sequenceNumber));
  }

  /**
   * The sequence number given to the most recently created query, or 0 if none was created since the last clear.
   */
  public int lastQuerySequence() {
    return nextQuerySequence;
  }

  public int size() {
    return blocks.size();
  }

  public boolean isEmpty() {
    return blocks.isEmpty();
  }

  Set<Integer> applyPositions(Map<Integer, Point> positions) {
    positions.keySet().forEach(this::block);
    Set<Integer> changed = new LinkedHashSet<>();
    positions.forEach((blockId, position) -> {
      if (blocks.get(blockId).setPosition(position)) changed.add(blockId);
    });
    if (!changed.isEmpty()) {
      ImmutableSet<Integer> changedIds = ImmutableSet.copyOf(changed);
      notifyListeners(listener -> listener.onPositionsChanged(changedIds));
    }
    return changed;
  }

  Set<Integer> applyStatuses(Map<Integer, Status> statuses) {
    statuses.keySet().forEach(this::block);
    Set<Integer> changed = new LinkedHashSet<>();
    statuses.forEach((blockId, status) -> {
      if (blocks.get(blockId).setStatus(status)) changed.add(blockId);
    });
    if (!changed.isEmpty()) {
      ImmutableSet<Integer> changedIds = ImmutableSet.copyOf(changed);
      notifyListeners(listener -> listener.onStatusChanged(changedIds));
    }
    return changed;
  }

  private Edge link(Block parent, Block child) {
    Edge edge = Edge.of(nextEdgeId++, parent.id(), child.id());
    edges.put(edge.id(), edge);
    parent.socket(SocketDirection.Output).orElseThrow().attach(edge.id());
    child.socket(SocketDirection.Input).orElseThrow().attach(edge.id());
    child.setParent(parent.id());
    parent.addChild(child.id());
    return edge;
  }

  private static void checkNesting(Block parent, BlockKind childKind) {
    if (!childKind.canBeNestedUnder(parent.kind())) {
      throw new InvalidConnectionException("A %s block cannot be attached beneath %s", childKind, parent);
    }
  }

  private void notifyListeners(Consumer<SceneListener> notification) {
    for (SceneListener listener : ImmutableList.copyOf(listeners)) {
      notification.accept(listener);
    }
  }
}
