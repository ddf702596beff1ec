package verigraph.util.geometry;

import org.immutables.value.Value;
import verigraph.util.annotations.Tuple;

import java.awt.geom.CubicCurve2D;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A single cubic Bézier segment from {@link #start} to {@link #end}.
 */
@Value.Immutable
@Tuple
public interface CubicPath {
  static CubicPath of(Point start, Point control1, Point control2, Point end) {
    return ImmutableCubicPath.of(start, control1, control2, end);
  }

  Point start();
  Point control1();
  Point control2();
  Point end();

  /**
   * The point at parameter {@code t} along the curve, where 0 is the start and 1 the end.
   */
  default Point pointAt(double t) {
    checkArgument(t >= 0 && t <= 1, "t must be within [0, 1]: %s", t);
    double u = 1 - t;
    double a = u * u * u;
    double b = 3 * u * u * t;
    double c = 3 * u * t * t;
    double d = t * t * t;
    return Point.of(
            a * start().x() + b * control1().x() + c * control2().x() + d * end().x(),
            a * start().y() + b * control1().y() + c * control2().y() + d * end().y());
  }

  /**
   * Anchor for an edge label.
   */
  default Point midpoint() {
    return pointAt(0.5);
  }

  /**
   * The bounding box of the control polygon, which always contains the curve.
   */
  default Rectangle bounds() {
    return Rectangle.enclosing(start(), control1(), control2(), end());
  }

  default CubicCurve2D toCurve2D() {
    return new CubicCurve2D.Double(
            start().x(), start().y(),
            control1().x(), control1().y(),
            control2().x(), control2().y(),
            end().x(), end().y());
  }
}
