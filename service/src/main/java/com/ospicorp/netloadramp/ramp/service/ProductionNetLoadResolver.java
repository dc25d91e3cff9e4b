package com.ospicorp.netloadramp.ramp.service;

import com.ospicorp.netloadramp.ramp.model.TimeSeriesTable;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Net load as consumption minus the production that cannot be dispatched:
 * {@code LOAD - ROW BAL. - PSP - MISC. NDG - H. ROR - WIND - SOLAR [- mustRunTotal]}.
 */
@Component
public class ProductionNetLoadResolver implements NetLoadResolver {
  private static final Logger log = LoggerFactory.getLogger(ProductionNetLoadResolver.class);

  static final String LOAD = "LOAD";
  static final String MUST_RUN_TOTAL = "mustRunTotal";
  static final List<String> SUBTRACTED =
      List.of("ROW BAL.", "PSP", "MISC. NDG", "H. ROR", "WIND", "SOLAR");

  @Override
  public TimeSeriesTable addNetLoad(TimeSeriesTable table, boolean ignoreMustRun) {
    List<String> subtracted = new ArrayList<>(SUBTRACTED);
    if (!ignoreMustRun) {
      subtracted.add(MUST_RUN_TOTAL);
    }

    List<String> missing = new ArrayList<>();
    if (!table.hasColumn(LOAD)) {
      missing.add(LOAD);
    }
    subtracted.stream().filter(c -> !table.hasColumn(c)).forEach(missing::add);
    if (!missing.isEmpty()) {
      throw new MissingColumnException(missing);
    }

    double[] netLoad = table.column(LOAD);
    for (String column : subtracted) {
      double[] cells = table.column(column);
      for (int i = 0; i < netLoad.length; i++) {
        netLoad[i] -= cells[i];
      }
    }
    log.info("Derived {} for {} rows of {} (ignoreMustRun={})", NET_LOAD, table.rowCount(),
        table.attributes() != null ? table.attributes().type() : null, ignoreMustRun);
    return table.withColumn(NET_LOAD, netLoad);
  }
}
