package verigraph.util.geometry;

import org.immutables.value.Value;
import verigraph.util.annotations.Tuple;

import static com.google.common.base.Preconditions.checkArgument;

@Value.Immutable
@Tuple
public interface Rectangle extends Translatable<Rectangle> {
  static Rectangle of(Point topLeft, Dimension dimension) {
    return of(topLeft, topLeft.translate(dimension.width(), dimension.height()));
  }

  static Rectangle of(Point topLeft, Point bottomRight) {
    return ImmutableRectangle.of(topLeft, bottomRight);
  }

  /**
   * The smallest rectangle containing every given point.
   */
  static Rectangle enclosing(Point first, Point... rest) {
    Point topLeft = first;
    Point bottomRight = first;
    for (Point point : rest) {
      topLeft = topLeft.min(point);
      bottomRight = bottomRight.max(point);
    }
    return of(topLeft, bottomRight);
  }

  Point topLeft();
  Point bottomRight();

  default double width() {
    return bottomRight().x() - topLeft().x();
  }

  default double height() {
    return bottomRight().y() - topLeft().y();
  }

  default Dimension dimension() {
    return Dimension.of(width(), height());
  }

  default Point center() {
    return dimension().center(topLeft());
  }

  @Override
  default Rectangle translate(double x, double y) {
    return of(topLeft().translate(x, y), bottomRight().translate(x, y));
  }

  default Rectangle union(Rectangle other) {
    return of(topLeft().min(other.topLeft()), bottomRight().max(other.bottomRight()));
  }

  default boolean contains(Point point) {
    return point.x() >= topLeft().x() && point.x() <= bottomRight().x()
            && point.y() >= topLeft().y() && point.y() <= bottomRight().y();
  }

  default boolean contains(Rectangle rectangle) {
    return contains(rectangle.topLeft()) && contains(rectangle.bottomRight());
  }

  default boolean intersects(Rectangle other) {
    return !isDisjoint(other);
  }

  default boolean isDisjoint(Rectangle other) {
    return bottomRight().x() < other.topLeft().x()
            || other.bottomRight().x() < topLeft().x()
            || bottomRight().y() < other.topLeft().y()
            || other.bottomRight().y() < topLeft().y();
  }

  @Value.Check
  default void checkOrientations() {
    checkArgument(topLeft().y() <= bottomRight().y() && topLeft().x() <= bottomRight().x(),
            "top/bottom or left/right are reversed: %s", this);
  }
}
