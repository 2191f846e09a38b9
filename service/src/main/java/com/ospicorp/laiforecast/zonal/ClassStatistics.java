package com.ospicorp.laiforecast.zonal;

/**
 * LAI summary of one vegetation class. Every value but {@code count} is NaN when the class has
 * no contributing pixels; check {@link #isDefined()} first.
 */
public record ClassStatistics(
    int count,
    double mean,
    double std,
    double min,
    double q1,
    double median,
    double q3,
    double max
) {

  public static final ClassStatistics EMPTY = new ClassStatistics(0, Double.NaN, Double.NaN,
      Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN);

  public ClassStatistics {
    if (count < 0) {
      throw new IllegalArgumentException("count must be >= 0: " + count);
    }
  }

  public static ClassStatistics of(int count, double mean, double std) {
    if (count == 0) {
      return EMPTY;
    }
    return new ClassStatistics(count, mean, std, Double.NaN, Double.NaN, Double.NaN, Double.NaN,
        Double.NaN);
  }

  public boolean isDefined() {
    return count > 0;
  }
}
