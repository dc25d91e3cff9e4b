package com.ospicorp.netloadramp.ramp.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.netloadramp.ramp.model.TimeSeriesTable;
import java.util.List;
import org.junit.jupiter.api.Test;

class ProductionNetLoadResolverTest {

  private final NetLoadResolver resolver = new ProductionNetLoadResolver();

  private static TimeSeriesTable production() {
    return TimeSeriesTable.builder(List.of("area", "timeId"),
            List.of("LOAD", "ROW BAL.", "PSP", "MISC. NDG", "H. ROR", "WIND", "SOLAR",
                "mustRunTotal"))
        .row("fr", 1, 1000, 10, 20, 30, 40, 50, 60, 70)
        .build();
  }

  @Test
  void subtractsNonDispatchableProductionAndMustRun() {
    var out = resolver.addNetLoad(production(), false);
    assertEquals(720d, out.value(NetLoadResolver.NET_LOAD, 0));
  }

  @Test
  void mustRunCanBeIgnored() {
    var out = resolver.addNetLoad(production(), true);
    assertEquals(790d, out.value(NetLoadResolver.NET_LOAD, 0));
  }

  @Test
  void reportsEveryMissingColumn() {
    var table = TimeSeriesTable.builder(List.of("area", "timeId"), List.of("LOAD", "PSP"))
        .row("fr", 1, 10, 1)
        .build();

    var ex = assertThrows(MissingColumnException.class, () -> resolver.addNetLoad(table, true));

    assertThat(ex.columns())
        .containsExactly("ROW BAL.", "MISC. NDG", "H. ROR", "WIND", "SOLAR");
    assertThat(ex.getMessage()).startsWith("Columns 'ROW BAL.', 'MISC. NDG'");
    assertEquals(MissingColumnException.MISSING_COLUMN, ex.errorCode());
  }
}
