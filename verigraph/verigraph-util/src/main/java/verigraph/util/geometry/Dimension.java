package verigraph.util.geometry;

import org.immutables.value.Value;
import verigraph.util.annotations.Tuple;

import static com.google.common.base.Preconditions.checkArgument;

@Value.Immutable
@Tuple
public interface Dimension {
  static Dimension of(double width, double height) {
    return ImmutableDimension.of(width, height);
  }

  double width();
  double height();

  default Point center(Point topLeft) {
    return topLeft.translate(width() / 2, height() / 2);
  }

  @Value.Check
  default void checkNonNegative() {
    checkArgument(width() >= 0 && height() >= 0, "Dimensions cannot be negative: %s", this);
  }
}
