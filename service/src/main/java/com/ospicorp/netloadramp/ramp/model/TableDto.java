package com.ospicorp.netloadramp.ramp.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.netloadramp.ramp.model.enums.TableType;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * Wire form of a table: column names plus rows as tuples, identifier cells first.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TableDto(
    @NotNull TableType type,
    @JsonProperty("time_step") String timeStep,
    Boolean synthesis,
    @JsonProperty("id_columns") @NotEmpty List<String> idColumns,
    @NotNull List<String> columns,
    @JsonProperty("row_count") Integer rowCount,
    @NotNull List<List<Object>> rows
) {}
