package verigraph.util.geometry;

public interface Translatable<T extends Translatable<T>> {
  T translate(double x, double y);

  default T right(double x) {
    return translate(x, 0);
  }

  default T left(double x) {
    return right(-x);
  }

  default T down(double y) {
    return translate(0, y);
  }

  default T up(double y) {
    return down(-y);
  }
}
