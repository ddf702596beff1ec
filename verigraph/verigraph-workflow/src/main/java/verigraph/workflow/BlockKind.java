package verigraph.workflow;

import com.google.common.collect.Sets;

import java.util.EnumSet;
import java.util.Set;

/**
 * The kinds of node in a verification workflow, with the sockets each one carries and the kinds it may be nested under.
 */
public enum BlockKind {
  Property(EnumSet.of(SocketDirection.Output)),
  Query(EnumSet.of(SocketDirection.Input, SocketDirection.Output)),
  Witness(EnumSet.of(SocketDirection.Input)),
  LogicalAnd(EnumSet.of(SocketDirection.Input, SocketDirection.Output)),
  LogicalOr(EnumSet.of(SocketDirection.Input, SocketDirection.Output));

  private final Set<SocketDirection> sockets;

  BlockKind(EnumSet<SocketDirection> sockets) {
    this.sockets = Sets.immutableEnumSet(sockets);
  }

  public Set<SocketDirection> sockets() {
    return sockets;
  }

  public boolean isConnector() {
    return this == LogicalAnd || this == LogicalOr;
  }

  /**
   * Whether the status of this kind of block is derived from the blocks beneath it (or, for queries, reported).
   */
  public boolean carriesStatus() {
    return this != Witness;
  }

  public boolean canBeNestedUnder(BlockKind parent) {
    switch (this) {
      case Property:
        return false;
      case Query:
      case LogicalAnd:
      case LogicalOr:
        return parent == Property || parent.isConnector();
      case Witness:
        return parent == Query;
      default:
        throw new AssertionError("Unhandled block kind: " + this);
    }
  }
}
