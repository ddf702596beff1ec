package verigraph.workflow;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import verigraph.util.geometry.Point;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * A node in the verification workflow tree. Blocks are created and owned by a {@link Scene}; their structure changes
 * only through the scene, their {@link #position} only through {@link WorkflowLayout}, and their {@link #status} only
 * through {@link StatusPropagator}.
 */
public final class Block {
  private final int id;
  private final BlockPayload payload;
  private final OptionalInt sequenceNumber;
  private final String title;
  private final Map<SocketDirection, Socket> sockets = new EnumMap<>(SocketDirection.class);
  private final List<Integer> childIds = new ArrayList<>();
  private Integer parentId;
  private Point position = Point.ORIGIN;
  private Status status = Status.Unknown;

  Block(int id, BlockPayload payload, OptionalInt sequenceNumber) {
    checkArgument(sequenceNumber.isPresent() == (payload.kind() == BlockKind.Query),
            "Only queries carry a sequence number: %s", payload);
    this.id = id;
    this.payload = payload;
    this.sequenceNumber = sequenceNumber;
    this.title = payload.visit(new TitleRenderer(sequenceNumber));
    for (SocketDirection direction : payload.kind().sockets()) {
      sockets.put(direction, new Socket(id, direction));
    }
  }

  public int id() {
    return id;
  }

  public BlockKind kind() {
    return payload.kind();
  }

  public BlockPayload payload() {
    return payload;
  }

  public String title() {
    return title;
  }

  /**
   * The global creation-order number of a {@link BlockKind#Query Query}; empty for every other kind.
   */
  public OptionalInt sequenceNumber() {
    return sequenceNumber;
  }

  public Optional<Integer> parentId() {
    return Optional.ofNullable(parentId);
  }

  /**
   * Children in insertion order, which is also their left-to-right layout order.
   */
  public ImmutableList<Integer> childIds() {
    return ImmutableList.copyOf(childIds);
  }

  public boolean hasChildren() {
    return !childIds.isEmpty();
  }

  public Point position() {
    return position;
  }

  public Status status() {
    return status;
  }

  public Optional<Socket> socket(SocketDirection direction) {
    return Optional.ofNullable(sockets.get(direction));
  }

  public BlockPayload.PropertyPayload propertyPayload() {
    checkState(kind() == BlockKind.Property, "Not a property: %s", this);
    return (BlockPayload.PropertyPayload) payload;
  }

  public BlockPayload.QueryPayload queryPayload() {
    checkState(kind() == BlockKind.Query, "Not a query: %s", this);
    return (BlockPayload.QueryPayload) payload;
  }

  public BlockPayload.WitnessPayload witnessPayload() {
    checkState(kind() == BlockKind.Witness, "Not a witness: %s", this);
    return (BlockPayload.WitnessPayload) payload;
  }

  void setParent(int parentId) {
    this.parentId = parentId;
  }

  void addChild(int childId) {
    childIds.add(childId);
  }

  void removeChild(int childId) {
    childIds.remove(Integer.valueOf(childId));
  }

  boolean setPosition(Point position) {
    if (position.equals(this.position)) return false;
    this.position = position;
    return true;
  }

  boolean setStatus(Status status) {
    checkArgument(kind().carriesStatus() || status == Status.Unknown, "%s blocks do not carry a status", kind());
    if (status == this.status) return false;
    this.status = status;
    return true;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
            .add("id", id)
            .add("kind", kind())
            .add("title", title)
            .add("parent", parentId)
            .add("status", status)
            .toString();
  }

  private static class TitleRenderer implements BlockPayload.Visitor<String> {
    private final OptionalInt sequenceNumber;

    TitleRenderer(OptionalInt sequenceNumber) {
      this.sequenceNumber = sequenceNumber;
    }

    @Override
    public String onProperty(BlockPayload.PropertyPayload property) {
      return property.title();
    }

    @Override
    public String onQuery(BlockPayload.QueryPayload query) {
      return (query.negated() ? "¬" : "") + "Query " + sequenceNumber.getAsInt();
    }

    @Override
    public String onWitness(BlockPayload.WitnessPayload witness) {
      return witness.counterexample() ? "Counter Example" : "Witness";
    }

    @Override
    public String onConnector(BlockPayload.ConnectorPayload connector) {
      return connector.kind() == BlockKind.LogicalAnd ? "AND" : "OR";
    }
  }
}
