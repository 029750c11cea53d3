package dev.librarian.classification;

/** Bounds of the 0..5 confidence scale. */
public final class Confidence {

  public static final int MIN = 0;
  public static final int MAX = 5;

  private Confidence() {
    // constants
  }

  /** Truncates toward zero, then clamps to [0, 5]. */
  public static int clamp(double value) {
    if (Double.isNaN(value)) {
      return MIN;
    }
    int truncated = (int) value;
    return Math.max(MIN, Math.min(MAX, truncated));
  }
}
