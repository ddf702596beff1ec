package verigraph.workflow;

import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import verigraph.util.geometry.Dimension;
import verigraph.util.geometry.Point;
import verigraph.util.geometry.Rectangle;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Deterministic centered-tree layout. Properties stack vertically in a fixed column; each row of children is centered
 * beneath its parent; witnesses hang directly below their query.
 * <p/>
 * Positions depend only on the tree's shape and the insertion order of children, so {@link #layout} is idempotent.
 */
public class WorkflowLayout {
  private static final Logger LOG = LoggerFactory.getLogger(WorkflowLayout.class);

  private final Scene scene;
  private final WorkflowConfig.LayoutSettings settings;

  public WorkflowLayout(Scene scene, WorkflowConfig.LayoutSettings settings) {
    this.scene = scene;
    this.settings = settings;
  }

  /**
   * The x coordinates of a row of {@code count} equally-sized blocks, centered beneath a parent at {@code parentX}.
   */
  public static ImmutableList<Double> centeredRow(double parentX, int count, double width, double spacing) {
    checkArgument(count >= 0, "Negative count: %s", count);
    double totalWidth = count * width + (count - 1) * spacing;
    double startX = parentX - (totalWidth - width) / 2;
    ImmutableList.Builder<Double> xs = ImmutableList.builderWithExpectedSize(count);
    for (int i = 0; i < count; i++) {
      xs.add(startX + i * (width + spacing));
    }
    return xs.build();
  }

  /**
   * Computes the position of every block without touching the scene.
   */
  public Map<Integer, Point> computePositions() {
    Map<Integer, Point> positions = new LinkedHashMap<>();
    List<Block> properties = scene.properties();
    for (int i = 0; i < properties.size(); i++) {
      Block property = properties.get(i);
      Point position = Point.of(settings.propertyX(), settings.startY() + i * settings.propertySpacingY());
      positions.put(property.id(), position);
      placeChildren(property, position, positions);
    }
    return positions;
  }

  /**
   * Moves every block to its computed position.
   *
   * @return the ids of blocks whose position changed
   */
  public Set<Integer> layout() {
    Set<Integer> moved = scene.applyPositions(computePositions());
    LOG.debug("Laid out {} block(s), {} moved", scene.size(), moved.size());
    return moved;
  }

  /**
   * Re-centers the row of children beneath one block (and everything below them), leaving the block itself in place.
   *
   * @return the ids of blocks whose position changed
   */
  public Set<Integer> recenterChildren(int parentId) {
    Block parent = scene.block(parentId);
    Map<Integer, Point> positions = new LinkedHashMap<>();
    placeChildren(parent, parent.position(), positions);
    return scene.applyPositions(positions);
  }

  public Dimension blockSize() {
    return Dimension.of(settings.blockWidth(), settings.blockHeight());
  }

  /**
   * The smallest rectangle enclosing every block, or empty when the scene has no blocks.
   */
  public Optional<Rectangle> bounds() {
    Dimension blockSize = blockSize();
    return scene.blocks().stream()
            .map(block -> Rectangle.of(block.position(), blockSize))
            .reduce(Rectangle::union);
  }

  private void placeChildren(Block parent, Point parentPosition, Map<Integer, Point> positions) {
    List<Block> children = scene.children(parent.id());
    if (children.isEmpty()) return;

    if (parent.kind() == BlockKind.Query) {
      // witnesses stack straight down
      for (int i = 0; i < children.size(); i++) {
        Point position = parentPosition.down((i + 1) * settings.witnessYOffset());
        positions.put(children.get(i).id(), position);
        placeChildren(children.get(i), position, positions);
      }
      return;
    }

    List<Double> xs = centeredRow(parentPosition.x(), children.size(), settings.blockWidth(), settings.querySpacing());
    double y = parentPosition.y() + settings.queryYOffset();
    for (int i = 0; i < children.size(); i++) {
      Point position = Point.of(xs.get(i), y);
      positions.put(children.get(i).id(), position);
      placeChildren(children.get(i), position, positions);
    }
  }
}
