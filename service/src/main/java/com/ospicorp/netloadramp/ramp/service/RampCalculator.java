package com.ospicorp.netloadramp.ramp.service;

import static com.ospicorp.netloadramp.ramp.service.NetLoadResolver.NET_LOAD;

import com.ospicorp.netloadramp.ramp.model.TableAttributes;
import com.ospicorp.netloadramp.ramp.model.TimeSeriesTable;
import com.ospicorp.netloadramp.ramp.model.enums.TableType;
import com.ospicorp.netloadramp.ramp.model.enums.TimeStep;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Hourly ramps of an area or district table: the step-to-step variation of its net load, of
 * its balance, and of their sum.
 */
@Component
public class RampCalculator {
  private static final Logger log = LoggerFactory.getLogger(RampCalculator.class);

  public static final String BALANCE = "BALANCE";
  public static final String NET_LOAD_RAMP = "netLoadRamp";
  public static final String BALANCE_RAMP = "balanceRamp";
  public static final String AREA_RAMP = "areaRamp";
  public static final List<String> RAMP_COLUMNS = List.of(NET_LOAD_RAMP, BALANCE_RAMP, AREA_RAMP);

  private final NetLoadResolver netLoadResolver;

  public RampCalculator(NetLoadResolver netLoadResolver) {
    this.netLoadResolver = netLoadResolver;
  }

  /**
   * Returns the input, completed with {@code netLoad} when it had to be derived, and the
   * hourly ramp table holding the input identifiers plus {@code netLoadRamp},
   * {@code balanceRamp} and {@code areaRamp}.
   */
  public Computation compute(TimeSeriesTable table, boolean ignoreMustRun) {
    checkHourlyDetail(table);
    if (!table.hasColumn(BALANCE)) {
      throw new MissingColumnException(List.of(BALANCE));
    }
    if (!table.hasIdColumn(TimeSeriesTable.TIME_ID)) {
      throw new MissingColumnException(List.of(TimeSeriesTable.TIME_ID));
    }

    TimeSeriesTable resolved = table;
    if (!table.hasColumn(NET_LOAD)) {
      resolved = netLoadResolver.addNetLoad(table, ignoreMustRun);
    }

    TimeSeriesTable x = resolved.select(List.of(BALANCE, NET_LOAD))
        .sortedBy(seriesOrder(resolved));

    double[] netLoadRamp = lagDifference(x.column(NET_LOAD));
    double[] balanceRamp = lagDifference(x.column(BALANCE));
    resetSeriesStarts(x, netLoadRamp, balanceRamp);

    double[] areaRamp = new double[x.rowCount()];
    for (int i = 0; i < areaRamp.length; i++) {
      areaRamp[i] = netLoadRamp[i] + balanceRamp[i];
    }

    TimeSeriesTable ramps = x.withColumn(NET_LOAD_RAMP, netLoadRamp)
        .withColumn(BALANCE_RAMP, balanceRamp)
        .withColumn(AREA_RAMP, areaRamp)
        .select(RAMP_COLUMNS)
        .withAttributes(TableAttributes.hourly(TableType.NET_LOAD_RAMP,
            table.attributes() != null ? table.attributes().options() : null));
    log.debug("Computed hourly ramps for {} rows", ramps.rowCount());
    return new Computation(resolved, ramps);
  }

  private static void checkHourlyDetail(TimeSeriesTable table) {
    TableAttributes attributes = table.attributes();
    if (attributes == null) {
      return;
    }
    if (attributes.timeStep() != null && attributes.timeStep() != TimeStep.HOURLY) {
      throw new InvalidSimulationDataException(
          "Ramps need hourly data, got " + attributes.timeStep().code() + " data.",
          InvalidSimulationDataException.NOT_HOURLY_DETAIL);
    }
    if (attributes.synthesis()) {
      throw new InvalidSimulationDataException(
          "Ramps need detailed Monte-Carlo data, got synthetic data.",
          InvalidSimulationDataException.NOT_HOURLY_DETAIL);
    }
  }

  // entity identifiers first, then timeId, then the other time columns
  static List<String> seriesOrder(TimeSeriesTable table) {
    List<String> order = new ArrayList<>(table.entityColumns());
    order.add(TimeSeriesTable.TIME_ID);
    table.idColumns().stream().filter(c -> !order.contains(c)).forEach(order::add);
    return order;
  }

  // value minus the preceding row, the first row taking 0 as predecessor
  static double[] lagDifference(double[] values) {
    double[] out = new double[values.length];
    double prev = 0d;
    for (int i = 0; i < values.length; i++) {
      out[i] = values[i] - prev;
      prev = values[i];
    }
    return out;
  }

  /**
   * Zeroes the ramps of the first row of every entity series. {@code table} is sorted in
   * {@link #seriesOrder} order, so a series starts wherever the non-time identifiers change.
   */
  static void resetSeriesStarts(TimeSeriesTable table, double[]... ramps) {
    List<String> entity = table.entityColumns();
    List<Object> previous = null;
    for (int i = 0; i < table.rowCount(); i++) {
      List<Object> current = table.key(i, entity);
      if (i == 0 || !Objects.equals(previous, current)) {
        for (double[] ramp : ramps) {
          ramp[i] = 0d;
        }
      }
      previous = current;
    }
  }

  public record Computation(TimeSeriesTable resolvedInput, TimeSeriesTable ramps) {}
}
