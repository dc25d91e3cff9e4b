package com.ospicorp.netloadramp.ramp.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TimeSeriesTableTest {

  private static TimeSeriesTable table() {
    return TimeSeriesTable.builder(List.of("area", "timeId"), List.of("a", "b"))
        .row("fr", 2, 1, 10)
        .row("de", 1, 2, 20)
        .row("fr", 1, 3, null)
        .build();
  }

  @Test
  void sortsOnIdentifiersLeftToRight() {
    var sorted = table().sortedBy(List.of("area", "timeId"));

    assertEquals(List.of("de", "fr", "fr"), sorted.idColumn("area"));
    assertEquals(List.of(1L, 1L, 2L), sorted.idColumn("timeId"));
    assertArrayEquals(new double[] {2, 3, 1}, sorted.column("a"));
  }

  @Test
  void numericIdentifiersCompareNumerically() {
    var sorted = TimeSeriesTable.builder(List.of("timeId"), List.of("a"))
        .row(10, 1)
        .row(9, 2)
        .build()
        .sortedBy(List.of("timeId"));

    assertEquals(List.of(9L, 10L), sorted.idColumn("timeId"));
  }

  @Test
  void transformationsLeaveSourceUntouched() {
    var source = table();

    var changed = source.withColumn("c", new double[] {1, 2, 3})
        .select(List.of("c", "a"))
        .renamed(Map.of("c", "z"));

    assertEquals(List.of("a", "b"), source.valueColumns());
    assertEquals(List.of("z", "a"), changed.valueColumns());
    assertEquals(List.of("area", "timeId"), changed.idColumns());
  }

  @Test
  void missingValuesBecomeNullInRows() {
    var rows = table().rows();

    assertThat(rows.get(2)).containsEntry("area", "fr").containsEntry("a", 3d);
    assertThat(rows.get(2).get("b")).isNull();
    assertThat(rows.get(0).keySet()).containsExactly("area", "timeId", "a", "b");
  }

  @Test
  void entityColumnsExcludeTimeColumns() {
    var t = TimeSeriesTable.builder(List.of("area", "mcYear", "timeId", "time"), List.of())
        .build();
    assertEquals(List.of("area", "mcYear"), t.entityColumns());
  }

  @Test
  void rejectsMalformedInput() {
    var builder = TimeSeriesTable.builder(List.of("area"), List.of("a"));
    assertThrows(IllegalArgumentException.class, () -> builder.row("fr"));
    assertThrows(IllegalArgumentException.class, () -> builder.row("fr", "x"));
    assertThrows(IllegalArgumentException.class,
        () -> table().withColumn("area", new double[3]));
    assertThrows(IllegalArgumentException.class, () -> table().select(List.of("nope")));
  }
}
