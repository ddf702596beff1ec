package verigraph.workflow;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;

import java.util.LinkedHashSet;
import java.util.Set;

import static com.google.common.base.Preconditions.checkState;

public final class Socket {
  private final int blockId;
  private final SocketDirection direction;
  private final Set<Integer> edgeIds = new LinkedHashSet<>();

  Socket(int blockId, SocketDirection direction) {
    this.blockId = blockId;
    this.direction = direction;
  }

  public int blockId() {
    return blockId;
  }

  public SocketDirection direction() {
    return direction;
  }

  public ImmutableSet<Integer> edgeIds() {
    return ImmutableSet.copyOf(edgeIds);
  }

  public boolean isConnected() {
    return !edgeIds.isEmpty();
  }

  /**
   * Input sockets accept a single edge; output sockets fan out to any number of children.
   */
  public boolean acceptsEdge() {
    return direction == SocketDirection.Output || edgeIds.isEmpty();
  }

  void attach(int edgeId) {
    checkState(acceptsEdge(), "Socket is already connected: %s", this);
    edgeIds.add(edgeId);
  }

  void detach(int edgeId) {
    edgeIds.remove(edgeId);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
            .add("block", blockId)
            .add("direction", direction)
            .add("edges", edgeIds)
            .toString();
  }
}
