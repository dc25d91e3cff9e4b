package com.ospicorp.netloadramp.ramp.model;

import jakarta.validation.Valid;

/**
 * Either {@code table} alone, or {@code areas} and/or {@code districts}.
 */
public record RampRequest(
    @Valid TableDto table,
    @Valid TableDto areas,
    @Valid TableDto districts,
    SimulationOptions options
) {}
