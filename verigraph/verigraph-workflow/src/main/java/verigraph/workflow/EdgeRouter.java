package verigraph.workflow;

import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import verigraph.util.geometry.CubicPath;
import verigraph.util.geometry.Point;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Computes the curve drawn for each edge, from the output socket of its parent to the input socket of its child.
 * <p/>
 * As a {@link SceneListener}, keeps one cached path per edge up to date as blocks are added, moved and removed.
 */
public class EdgeRouter implements SceneListener {
  private static final Logger LOG = LoggerFactory.getLogger(EdgeRouter.class);
  private static final double ZERO_DELTA_DIVISOR = 0.00001;

  private final Scene scene;
  private final WorkflowConfig.LayoutSettings layout;
  private final double roundness;
  private final Map<Integer, CubicPath> paths = new LinkedHashMap<>();

  public EdgeRouter(Scene scene, WorkflowConfig config) {
    this.scene = scene;
    this.layout = config.layout();
    this.roundness = config.edges().controlPointRoundness();
  }

  /**
   * Routes a curve between two socket anchors. The control points pull horizontally toward each other; when the curve
   * has to fold back against the socket's direction, they are mirrored and pushed vertically apart by
   * {@code roundness}.
   */
  public static CubicPath route(Point source, SocketDirection sourceDirection, Point destination, double roundness) {
    double dist = (destination.x() - source.x()) * 0.5;
    double startDx = dist;
    double startDy = 0;
    double endDx = -dist;
    double endDy = 0;

    boolean foldsBack = (source.x() > destination.x() && sourceDirection == SocketDirection.Output)
            || (source.x() < destination.x() && sourceDirection == SocketDirection.Input);
    if (foldsBack) {
      startDx = -startDx;
      endDx = -endDx;
      startDy = sign(source.y() - destination.y()) * roundness;
      endDy = sign(destination.y() - source.y()) * roundness;
    }

    return CubicPath.of(source, source.translate(startDx, startDy), destination.translate(endDx, endDy), destination);
  }

  /**
   * -1, 1, or 0 for a zero delta.
   */
  static double sign(double delta) {
    return delta / (delta != 0 ? Math.abs(delta) : ZERO_DELTA_DIVISOR);
  }

  /**
   * Output sockets sit at the bottom-center of a block, input sockets at its top-center.
   */
  public Point socketAnchor(Block block, SocketDirection direction) {
    Point position = block.position();
    switch (direction) {
      case Output:
        return position.translate(layout.blockWidth() / 2, layout.blockHeight());
      case Input:
        return position.right(layout.blockWidth() / 2);
      default:
        throw new AssertionError("Unhandled socket direction: " + direction);
    }
  }

  public CubicPath route(Edge edge) {
    Point source = socketAnchor(scene.block(edge.sourceBlockId()), SocketDirection.Output);
    Point destination = socketAnchor(scene.block(edge.targetBlockId()), SocketDirection.Input);
    return route(source, SocketDirection.Output, destination, roundness);
  }

  public Optional<CubicPath> path(int edgeId) {
    return Optional.ofNullable(paths.get(edgeId));
  }

  public ImmutableMap<Integer, CubicPath> paths() {
    return ImmutableMap.copyOf(paths);
  }

  public void rerouteAll() {
    paths.clear();
    scene.edges().forEach(this::reroute);
  }

  @Override
  public void onBlockAdded(int blockId) {
    scene.edgesTouching(blockId).forEach(this::reroute);
  }

  @Override
  public void onEdgeAdded(int edgeId) {
    scene.edge(edgeId).ifPresent(this::reroute);
  }

  @Override
  public void onPositionsChanged(Set<Integer> blockIds) {
    scene.edges().stream()
            .filter(edge -> blockIds.contains(edge.sourceBlockId()) || blockIds.contains(edge.targetBlockId()))
            .forEach(this::reroute);
  }

  @Override
  public void onBlocksRemoved(Set<Integer> blockIds) {
    int before = paths.size();
    paths.keySet().removeIf(edgeId -> scene.edge(edgeId).isEmpty());
    LOG.debug("Dropped {} path(s) of removed edges", before - paths.size());
  }

  @Override
  public void onCleared() {
    paths.clear();
  }

  private void reroute(Edge edge) {
    paths.put(edge.id(), route(edge));
  }
}
