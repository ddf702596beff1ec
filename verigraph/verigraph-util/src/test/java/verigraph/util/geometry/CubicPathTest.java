package verigraph.util.geometry;

import org.junit.jupiter.api.Test;

import java.awt.geom.CubicCurve2D;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CubicPathTest {
  private static final CubicPath ARCH = CubicPath.of(
          Point.of(0, 0), Point.of(0, 100), Point.of(100, 100), Point.of(100, 0));

  @Test
  void endpointsAndMidpoint() {
    assertThat(ARCH.pointAt(0)).isEqualTo(ARCH.start());
    assertThat(ARCH.pointAt(1)).isEqualTo(ARCH.end());
    assertThat(ARCH.midpoint()).isEqualTo(Point.of(50, 75));
    assertThrows(IllegalArgumentException.class, () -> ARCH.pointAt(1.5));
  }

  @Test
  void boundsCoverTheControlPolygon() {
    Rectangle bounds = ARCH.bounds();

    assertThat(bounds).isEqualTo(Rectangle.of(Point.of(0, 0), Point.of(100, 100)));
    for (double t = 0; t <= 1; t += 0.125) {
      assertThat(bounds.contains(ARCH.pointAt(t))).isTrue();
    }
  }

  @Test
  void convertsToAwtCurve() {
    CubicCurve2D curve = ARCH.toCurve2D();

    assertThat(curve.getX1()).isEqualTo(0.0);
    assertThat(curve.getCtrlY1()).isEqualTo(100.0);
    assertThat(curve.getCtrlX2()).isEqualTo(100.0);
    assertThat(curve.getX2()).isEqualTo(100.0);
    assertThat(curve.getY2()).isEqualTo(0.0);
  }
}
