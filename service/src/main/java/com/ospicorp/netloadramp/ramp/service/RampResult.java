package com.ospicorp.netloadramp.ramp.service;

import com.ospicorp.netloadramp.ramp.model.SimulationData;

/**
 * Output of a ramp computation together with its input, which holds a derived
 * {@code netLoad} column wherever the original data had none.
 */
public record RampResult(SimulationData resolvedInput, SimulationData ramps) {}
