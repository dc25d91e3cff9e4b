package com.ospicorp.netloadramp.ramp.service;

import com.ospicorp.netloadramp.ramp.model.TableAttributes;
import com.ospicorp.netloadramp.ramp.model.TimeSeriesTable;
import com.ospicorp.netloadramp.ramp.model.enums.Aggregation;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses the Monte-Carlo year dimension of a table into summary statistics.
 */
public final class Synthesizer {
  private Synthesizer() {
  }

  /**
   * For every value column, emits its mean over Monte-Carlo years, named
   * {@code <prefixForMeans>_<column>} (or {@code <column>} when the prefix is empty), followed
   * by one {@code <fun>_<column>} column per additional statistic.
   */
  public static TimeSeriesTable synthesize(TimeSeriesTable table, String prefixForMeans,
      Aggregation... additional) {
    List<String> keyColumns = table.idColumns().stream()
        .filter(c -> !TimeSeriesTable.MC_YEAR.equals(c))
        .toList();

    Map<List<Object>, List<Integer>> groups = new LinkedHashMap<>();
    for (int i = 0; i < table.rowCount(); i++) {
      groups.computeIfAbsent(table.key(i, keyColumns), k -> new ArrayList<>()).add(i);
    }

    Map<String, List<Object>> ids = new LinkedHashMap<>();
    keyColumns.forEach(c -> ids.put(c, new ArrayList<>(groups.size())));
    for (List<Object> key : groups.keySet()) {
      for (int k = 0; k < keyColumns.size(); k++) {
        ids.get(keyColumns.get(k)).add(key.get(k));
      }
    }

    Map<String, double[]> values = new LinkedHashMap<>();
    for (String column : table.valueColumns()) {
      double[] cells = table.column(column);
      values.put(meanName(prefixForMeans, column), aggregate(cells, groups, Aggregation.MEAN));
      for (Aggregation fun : additional) {
        values.put(fun.prefix() + "_" + column, aggregate(cells, groups, fun));
      }
    }

    TableAttributes attributes = table.attributes() != null
        ? table.attributes().withSynthesis(true)
        : null;
    return TimeSeriesTable.of(keyColumns, ids, values, attributes);
  }

  private static String meanName(String prefix, String column) {
    return prefix == null || prefix.isEmpty() ? column : prefix + "_" + column;
  }

  private static double[] aggregate(double[] cells, Map<List<Object>, List<Integer>> groups,
      Aggregation fun) {
    double[] out = new double[groups.size()];
    int g = 0;
    for (List<Integer> rows : groups.values()) {
      double[] members = new double[rows.size()];
      for (int i = 0; i < members.length; i++) {
        members[i] = cells[rows.get(i)];
      }
      out[g++] = fun.apply(members, 0, members.length);
    }
    return out;
  }
}
