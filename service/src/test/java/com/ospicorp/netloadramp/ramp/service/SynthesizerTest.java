package com.ospicorp.netloadramp.ramp.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.netloadramp.ramp.model.TimeSeriesTable;
import com.ospicorp.netloadramp.ramp.model.enums.Aggregation;
import java.util.List;
import org.junit.jupiter.api.Test;

class SynthesizerTest {

  private static TimeSeriesTable table() {
    return TimeSeriesTable.builder(List.of("area", "mcYear", "timeId"), List.of("x"))
        .row("fr", 1, 1, 2)
        .row("fr", 1, 2, 4)
        .row("fr", 2, 1, 6)
        .row("fr", 2, 2, null)
        .build();
  }

  @Test
  void meansArePrefixedAndFollowedByStatistics() {
    var out = Synthesizer.synthesize(table(), "avg", Aggregation.MIN, Aggregation.MAX);

    assertEquals(List.of("area", "timeId"), out.idColumns());
    assertEquals(List.of("avg_x", "min_x", "max_x"), out.valueColumns());
    assertArrayEquals(new double[] {4, 4}, out.column("avg_x"));
    assertArrayEquals(new double[] {2, 4}, out.column("min_x"));
    assertArrayEquals(new double[] {6, 4}, out.column("max_x"));
  }

  @Test
  void emptyPrefixKeepsColumnName() {
    var out = Synthesizer.synthesize(table(), "");
    assertEquals(List.of("x"), out.valueColumns());
  }
}
