package com.ospicorp.netloadramp.ramp.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable column-oriented table of simulation results.
 *
 * <p>Identifier columns ({@code area}, {@code mcYear}, {@code timeId}, ...) hold strings or
 * integral numbers and together identify a row. Value columns hold doubles, a missing value
 * being {@code NaN}. Every transformation returns a new table.
 */
public final class TimeSeriesTable implements SimulationData {

  public static final String TIME_ID = "timeId";
  public static final String MC_YEAR = "mcYear";
  public static final Set<String> TIME_COLUMNS =
      Set.of(TIME_ID, "time", "day", "week", "month", "hour");

  private static final Comparator<Object> ID_ORDER = TimeSeriesTable::compareIds;

  private final List<String> idColumns;
  private final Map<String, List<Object>> ids;
  private final Map<String, double[]> values;
  private final int rowCount;
  private final TableAttributes attributes;

  private TimeSeriesTable(List<String> idColumns, Map<String, List<Object>> ids,
      Map<String, double[]> values, int rowCount, TableAttributes attributes) {
    this.idColumns = List.copyOf(idColumns);
    this.ids = ids;
    this.values = values;
    this.rowCount = rowCount;
    this.attributes = attributes;
  }

  public static Builder builder(List<String> idColumns, List<String> valueColumns) {
    return new Builder(idColumns, valueColumns);
  }

  /**
   * Assembles a table from prepared columns. Id columns must be given in the order of
   * {@code idColumns}, value columns in insertion order; all must have the same length.
   */
  public static TimeSeriesTable of(List<String> idColumns, Map<String, List<Object>> ids,
      Map<String, double[]> values, TableAttributes attributes) {
    int rows = -1;
    Map<String, List<Object>> idCopy = new LinkedHashMap<>();
    for (String column : idColumns) {
      List<Object> cells = ids.get(column);
      if (cells == null) {
        throw new IllegalArgumentException("No values for id column " + column);
      }
      rows = checkLength(column, cells.size(), rows);
      idCopy.put(column, Collections.unmodifiableList(new ArrayList<>(cells)));
    }
    Map<String, double[]> valueCopy = new LinkedHashMap<>();
    for (var e : values.entrySet()) {
      if (idCopy.containsKey(e.getKey())) {
        throw new IllegalArgumentException("Column " + e.getKey() + " is both id and value");
      }
      rows = checkLength(e.getKey(), e.getValue().length, rows);
      valueCopy.put(e.getKey(), e.getValue().clone());
    }
    return new TimeSeriesTable(idColumns, idCopy, valueCopy, Math.max(rows, 0), attributes);
  }

  private static int checkLength(String column, int length, int expected) {
    if (expected >= 0 && length != expected) {
      throw new IllegalArgumentException(
          "Column " + column + " has " + length + " rows, expected " + expected);
    }
    return length;
  }

  @Override
  public TableAttributes attributes() {
    return attributes;
  }

  public List<String> idColumns() {
    return idColumns;
  }

  public List<String> valueColumns() {
    return List.copyOf(values.keySet());
  }

  public int rowCount() {
    return rowCount;
  }

  public boolean isEmpty() {
    return rowCount == 0;
  }

  public boolean hasColumn(String name) {
    return ids.containsKey(name) || values.containsKey(name);
  }

  public boolean hasIdColumn(String name) {
    return ids.containsKey(name);
  }

  public double[] column(String name) {
    double[] column = values.get(name);
    if (column == null) {
      throw new IllegalArgumentException("Unknown value column " + name);
    }
    return column.clone();
  }

  public double value(String column, int row) {
    double[] cells = values.get(column);
    if (cells == null) {
      throw new IllegalArgumentException("Unknown value column " + column);
    }
    return cells[row];
  }

  public List<Object> idColumn(String name) {
    List<Object> cells = ids.get(name);
    if (cells == null) {
      throw new IllegalArgumentException("Unknown id column " + name);
    }
    return cells;
  }

  public Object id(String column, int row) {
    return idColumn(column).get(row);
  }

  /** Identifier values of {@code row} restricted to {@code columns}, in that order. */
  public List<Object> key(int row, List<String> columns) {
    List<Object> key = new ArrayList<>(columns.size());
    for (String column : columns) {
      key.add(idColumn(column).get(row));
    }
    return key;
  }

  /** Identifier columns that are not time columns, i.e. the ones naming an entity. */
  public List<String> entityColumns() {
    return idColumns.stream().filter(c -> !TIME_COLUMNS.contains(c)).toList();
  }

  public TimeSeriesTable withAttributes(TableAttributes newAttributes) {
    return new TimeSeriesTable(idColumns, ids, values, rowCount, newAttributes);
  }

  /** Appends {@code name}, or replaces it in place when it already exists. */
  public TimeSeriesTable withColumn(String name, double[] column) {
    if (ids.containsKey(name)) {
      throw new IllegalArgumentException("Cannot overwrite id column " + name);
    }
    checkLength(name, column.length, rowCount);
    Map<String, double[]> copy = new LinkedHashMap<>(values);
    copy.put(name, column.clone());
    return new TimeSeriesTable(idColumns, ids, copy, rowCount, attributes);
  }

  /** Keeps all identifier columns and exactly {@code columns}, in that order. */
  public TimeSeriesTable select(List<String> columns) {
    Map<String, double[]> copy = new LinkedHashMap<>();
    for (String column : columns) {
      double[] cells = values.get(column);
      if (cells == null) {
        throw new IllegalArgumentException("Unknown value column " + column);
      }
      copy.put(column, cells);
    }
    return new TimeSeriesTable(idColumns, ids, copy, rowCount, attributes);
  }

  public TimeSeriesTable renamed(Map<String, String> renames) {
    Map<String, double[]> copy = new LinkedHashMap<>();
    for (var e : values.entrySet()) {
      copy.put(renames.getOrDefault(e.getKey(), e.getKey()), e.getValue());
    }
    if (copy.size() != values.size()) {
      throw new IllegalArgumentException("Renaming produces duplicate columns: " + renames);
    }
    return new TimeSeriesTable(idColumns, ids, copy, rowCount, attributes);
  }

  /** Stable sort on the given identifier columns, compared left to right. */
  public TimeSeriesTable sortedBy(List<String> columns) {
    Integer[] order = new Integer[rowCount];
    for (int i = 0; i < rowCount; i++) {
      order[i] = i;
    }
    List<List<Object>> keyColumns = columns.stream().map(this::idColumn).toList();
    Arrays.sort(order, (a, b) -> {
      for (List<Object> cells : keyColumns) {
        int cmp = ID_ORDER.compare(cells.get(a), cells.get(b));
        if (cmp != 0) {
          return cmp;
        }
      }
      return 0;
    });

    Map<String, List<Object>> sortedIds = new LinkedHashMap<>();
    for (var e : ids.entrySet()) {
      List<Object> cells = new ArrayList<>(rowCount);
      for (Integer i : order) {
        cells.add(e.getValue().get(i));
      }
      sortedIds.put(e.getKey(), Collections.unmodifiableList(cells));
    }
    Map<String, double[]> sortedValues = new LinkedHashMap<>();
    for (var e : values.entrySet()) {
      double[] cells = new double[rowCount];
      for (int i = 0; i < rowCount; i++) {
        cells[i] = e.getValue()[order[i]];
      }
      sortedValues.put(e.getKey(), cells);
    }
    return new TimeSeriesTable(idColumns, sortedIds, sortedValues, rowCount, attributes);
  }

  /** Rows as ordered maps, identifiers first; NaN values become null. */
  public List<Map<String, Object>> rows() {
    List<Map<String, Object>> rows = new ArrayList<>(rowCount);
    for (int i = 0; i < rowCount; i++) {
      Map<String, Object> row = new LinkedHashMap<>();
      for (String column : idColumns) {
        row.put(column, ids.get(column).get(i));
      }
      for (var e : values.entrySet()) {
        double v = e.getValue()[i];
        row.put(e.getKey(), Double.isNaN(v) ? null : v);
      }
      rows.add(row);
    }
    return rows;
  }

  /** Integral numbers become {@code Long} so that keys compare and hash consistently. */
  public static Object normalizeId(Object value) {
    if (value instanceof Number number) {
      double d = number.doubleValue();
      if (d == Math.rint(d) && !Double.isInfinite(d)) {
        return number.longValue();
      }
      return d;
    }
    return value;
  }

  static int compareIds(Object a, Object b) {
    if (a == b) {
      return 0;
    }
    if (a == null) {
      return -1;
    }
    if (b == null) {
      return 1;
    }
    if (a instanceof Long x && b instanceof Long y) {
      return Long.compare(x, y);
    }
    if (a instanceof Number x && b instanceof Number y) {
      return Double.compare(x.doubleValue(), y.doubleValue());
    }
    if (a instanceof Number) {
      return -1;
    }
    if (b instanceof Number) {
      return 1;
    }
    return a.toString().compareTo(b.toString());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TimeSeriesTable other)) {
      return false;
    }
    if (rowCount != other.rowCount || !idColumns.equals(other.idColumns)
        || !ids.equals(other.ids) || !values.keySet().equals(other.values.keySet())
        || !Objects.equals(attributes, other.attributes)) {
      return false;
    }
    // key order matters for value columns
    if (!valueColumns().equals(other.valueColumns())) {
      return false;
    }
    for (var e : values.entrySet()) {
      if (!Arrays.equals(e.getValue(), other.values.get(e.getKey()))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(idColumns, ids, valueColumns(), attributes, rowCount);
    for (double[] cells : values.values()) {
      result = 31 * result + Arrays.hashCode(cells);
    }
    return result;
  }

  @Override
  public String toString() {
    return "TimeSeriesTable{type=" + (attributes != null ? attributes.type() : null)
        + ", ids=" + idColumns + ", columns=" + values.keySet() + ", rows=" + rowCount + '}';
  }

  public static final class Builder {
    private final List<String> idColumns;
    private final List<String> valueColumns;
    private final Map<String, List<Object>> ids = new LinkedHashMap<>();
    private final Map<String, List<Double>> values = new LinkedHashMap<>();
    private TableAttributes attributes;

    private Builder(List<String> idColumns, List<String> valueColumns) {
      this.idColumns = List.copyOf(idColumns);
      this.valueColumns = List.copyOf(valueColumns);
      idColumns.forEach(c -> ids.put(c, new ArrayList<>()));
      valueColumns.forEach(c -> values.put(c, new ArrayList<>()));
    }

    public Builder attributes(TableAttributes tableAttributes) {
      this.attributes = tableAttributes;
      return this;
    }

    /** Adds a row: identifier cells first, then value cells, in column order. */
    public Builder row(Object... cells) {
      return row(Arrays.asList(cells));
    }

    public Builder row(List<?> cells) {
      int expected = idColumns.size() + valueColumns.size();
      if (cells.size() != expected) {
        throw new IllegalArgumentException(
            "Row has " + cells.size() + " cells, expected " + expected);
      }
      for (int i = 0; i < idColumns.size(); i++) {
        ids.get(idColumns.get(i)).add(normalizeId(cells.get(i)));
      }
      for (int i = 0; i < valueColumns.size(); i++) {
        Object cell = cells.get(idColumns.size() + i);
        values.get(valueColumns.get(i)).add(toDouble(valueColumns.get(i), cell));
      }
      return this;
    }

    private static double toDouble(String column, Object cell) {
      if (cell == null) {
        return Double.NaN;
      }
      if (cell instanceof Number number) {
        return number.doubleValue();
      }
      throw new IllegalArgumentException(
          "Column " + column + " holds a non-numeric value: " + cell);
    }

    public TimeSeriesTable build() {
      Map<String, double[]> columns = new LinkedHashMap<>();
      for (var e : values.entrySet()) {
        columns.put(e.getKey(), e.getValue().stream().mapToDouble(Double::doubleValue).toArray());
      }
      return of(idColumns, ids, columns, attributes);
    }
  }
}
