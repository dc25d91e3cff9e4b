package com.ospicorp.netloadramp.ramp.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RampResponse(
    @JsonProperty("time_step") String timeStep,
    boolean synthesis,
    TableDto table,
    TableDto areas,
    TableDto districts
) {}
