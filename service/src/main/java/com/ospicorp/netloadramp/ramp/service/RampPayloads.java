package com.ospicorp.netloadramp.ramp.service;

import com.ospicorp.netloadramp.ramp.model.RampRequest;
import com.ospicorp.netloadramp.ramp.model.RampResponse;
import com.ospicorp.netloadramp.ramp.model.SimulationData;
import com.ospicorp.netloadramp.ramp.model.SimulationDataList;
import com.ospicorp.netloadramp.ramp.model.SimulationOptions;
import com.ospicorp.netloadramp.ramp.model.TableAttributes;
import com.ospicorp.netloadramp.ramp.model.TableDto;
import com.ospicorp.netloadramp.ramp.model.TimeSeriesTable;
import com.ospicorp.netloadramp.ramp.model.enums.TimeStep;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Conversions between the wire payloads and {@link SimulationData}.
 */
public final class RampPayloads {
  private RampPayloads() {
  }

  /**
   * Builds the data of a request. Tables get {@code attached} as their simulation options;
   * the options of the request itself are passed separately to the computation.
   */
  public static SimulationData toData(RampRequest request, SimulationOptions attached) {
    if (request.table() != null) {
      if (request.areas() != null || request.districts() != null) {
        throw new IllegalArgumentException("table cannot be combined with areas or districts");
      }
      return toTable(request.table(), attached);
    }
    TimeSeriesTable areas = request.areas() != null ? toTable(request.areas(), attached) : null;
    TimeSeriesTable districts =
        request.districts() != null ? toTable(request.districts(), attached) : null;
    return new SimulationDataList(areas, districts,
        new TableAttributes(null, TimeStep.HOURLY, false, attached));
  }

  public static TimeSeriesTable toTable(TableDto dto, SimulationOptions attached) {
    TimeStep timeStep = parseTimeStep(dto.timeStep());
    boolean synthesis = Boolean.TRUE.equals(dto.synthesis());
    TimeSeriesTable.Builder builder = TimeSeriesTable.builder(dto.idColumns(), dto.columns())
        .attributes(new TableAttributes(dto.type(), timeStep, synthesis, attached));
    for (List<Object> row : dto.rows()) {
      builder.row(row);
    }
    return builder.build();
  }

  public static RampResponse toResponse(SimulationData ramps) {
    TableAttributes attributes = ramps.attributes();
    String timeStep = attributes.timeStep().code();
    if (ramps instanceof SimulationDataList list) {
      return new RampResponse(timeStep, attributes.synthesis(), null,
          list.areas() != null ? toDto(list.areas()) : null,
          list.districts() != null ? toDto(list.districts()) : null);
    }
    return new RampResponse(timeStep, attributes.synthesis(), toDto((TimeSeriesTable) ramps),
        null, null);
  }

  public static TableDto toDto(TimeSeriesTable table) {
    List<String> columns = table.valueColumns();
    List<List<Object>> rows = new ArrayList<>(table.rowCount());
    for (Map<String, Object> row : table.rows()) {
      rows.add(new ArrayList<>(row.values()));
    }
    TableAttributes attributes = table.attributes();
    return new TableDto(
        attributes != null ? attributes.type() : null,
        attributes != null && attributes.timeStep() != null ? attributes.timeStep().code() : null,
        attributes != null ? attributes.synthesis() : null,
        table.idColumns(),
        columns,
        table.rowCount(),
        rows);
  }

  /** All rows of the result, area and district tables one after the other. */
  public static List<Map<String, Object>> toRows(SimulationData ramps) {
    if (ramps instanceof SimulationDataList list) {
      List<Map<String, Object>> rows = new ArrayList<>();
      if (list.areas() != null) {
        rows.addAll(list.areas().rows());
      }
      if (list.districts() != null) {
        rows.addAll(list.districts().rows());
      }
      return rows;
    }
    return ((TimeSeriesTable) ramps).rows();
  }

  /** Null means hourly; unknown codes raise {@link IllegalArgumentException}. */
  public static TimeStep parseTimeStep(String value) {
    if (value == null || value.isBlank()) {
      return TimeStep.HOURLY;
    }
    return TimeStep.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
