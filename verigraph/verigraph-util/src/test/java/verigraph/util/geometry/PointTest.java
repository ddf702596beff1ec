package verigraph.util.geometry;

import org.junit.jupiter.api.Test;

import static com.google.common.truth.Truth.assertThat;

class PointTest {
  @Test
  void translation() {
    Point p = Point.of(1.5, -2);

    assertThat(p.right(2).down(3)).isEqualTo(Point.of(3.5, 1));
    assertThat(p.left(1.5).up(1)).isEqualTo(Point.of(0, -3));
    assertThat(p.translate(0, 0)).isSameInstanceAs(p);
  }

  @Test
  void componentwiseExtremes() {
    Point a = Point.of(1, 9);
    Point b = Point.of(4, -3);

    assertThat(a.min(b)).isEqualTo(Point.of(1, -3));
    assertThat(a.max(b)).isEqualTo(Point.of(4, 9));
  }
}
