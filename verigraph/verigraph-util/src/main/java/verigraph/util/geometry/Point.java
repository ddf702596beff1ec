package verigraph.util.geometry;

import org.immutables.value.Value;
import verigraph.util.annotations.Tuple;

/**
 * A position in scene coordinates: x grows rightwards, y grows downwards.
 */
@Value.Immutable
@Tuple
public interface Point extends Translatable<Point> {
  Point ORIGIN = Point.of(0, 0);

  static Point of(double x, double y) {
    return ImmutablePoint.of(x, y);
  }

  double x();
  double y();

  @Override
  default Point translate(double x, double y) {
    return x == 0 && y == 0 ? this : Point.of(x() + x, y() + y);
  }

  default Point withX(double x) {
    return x == x() ? this : of(x, y());
  }

  default Point withY(double y) {
    return y == y() ? this : of(x(), y);
  }

  /**
   * @return (min(x, other.x), min(y, other.y))
   */
  default Point min(Point other) {
    return Point.of(Math.min(x(), other.x()), Math.min(y(), other.y()));
  }

  /**
   * @return (max(x, other.x), max(y, other.y))
   */
  default Point max(Point other) {
    return Point.of(Math.max(x(), other.x()), Math.max(y(), other.y()));
  }
}
