package com.ospicorp.netloadramp.ramp.model.enums;

import java.util.Locale;

/**
 * Statistic applied to the values of a column when rows are collapsed, either across
 * Monte-Carlo years or into a coarser time step. NaN values are skipped.
 */
public enum Aggregation {
  MEAN,
  MIN,
  MAX,
  SUM;

  public double apply(double[] values, int from, int to) {
    double acc = this == MIN ? Double.POSITIVE_INFINITY
        : this == MAX ? Double.NEGATIVE_INFINITY : 0d;
    int count = 0;
    for (int i = from; i < to; i++) {
      double v = values[i];
      if (Double.isNaN(v)) {
        continue;
      }
      count++;
      switch (this) {
        case MIN -> acc = Math.min(acc, v);
        case MAX -> acc = Math.max(acc, v);
        case MEAN, SUM -> acc += v;
      }
    }
    if (count == 0) {
      return Double.NaN;
    }
    return this == MEAN ? acc / count : acc;
  }

  public String prefix() {
    return name().toLowerCase(Locale.ROOT);
  }
}
