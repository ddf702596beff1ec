package verigraph.workflow;

import org.immutables.value.Value;
import verigraph.util.annotations.Tuple;

/**
 * A directed connector from the {@link SocketDirection#Output Output} socket of a parent block to the
 * {@link SocketDirection#Input Input} socket of one of its children. Edges are owned by the {@link Scene}; sockets only
 * refer to them by id.
 */
@Value.Immutable
@Tuple
public interface Edge {
  static Edge of(int id, int sourceBlockId, int targetBlockId) {
    return ImmutableEdge.of(id, sourceBlockId, targetBlockId);
  }

  int id();

  int sourceBlockId();

  int targetBlockId();
}
