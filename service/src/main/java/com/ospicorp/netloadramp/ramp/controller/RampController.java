package com.ospicorp.netloadramp.ramp.controller;

import com.ospicorp.netloadramp.ramp.model.RampRequest;
import com.ospicorp.netloadramp.ramp.model.RampResponse;
import com.ospicorp.netloadramp.ramp.model.SimulationData;
import com.ospicorp.netloadramp.ramp.model.SimulationOptions;
import com.ospicorp.netloadramp.ramp.model.enums.TimeStep;
import com.ospicorp.netloadramp.ramp.service.NetLoadRampService;
import com.ospicorp.netloadramp.ramp.service.RampPayloads;
import com.ospicorp.netloadramp.ramp.service.RampResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.Comparator;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/ramps")
@Validated
@Tag(name = "Ramps")
public class RampController {
  private static final MediaType CSV_MEDIA_TYPE = MediaType.valueOf("text/csv");

  private final NetLoadRampService service;
  private final SimulationOptions defaultOptions;

  public RampController(NetLoadRampService service, SimulationOptions defaultOptions) {
    this.service = service;
    this.defaultOptions = defaultOptions;
  }

  @PostMapping
  @Operation(summary = "Compute ramps",
      description = "Net load, balance and area ramps of area and/or district hourly data, "
          + "optionally resampled and synthesized over Monte-Carlo years.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Ramps",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = RampResponse.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = org.springframework.http.ProblemDetail.class)))
  })
  public ResponseEntity<?> compute(@RequestBody @Valid RampRequest request,
      @RequestParam(name = "time_step", defaultValue = "hourly")
          @Parameter(description = "Time step of the result", example = "annual") String timeStep,
      @RequestParam(defaultValue = "false")
          @Parameter(description = "Summarize Monte-Carlo years") boolean synthesis,
      @RequestParam(name = "ignore_must_run", defaultValue = "false")
          @Parameter(description = "Leave must-run production out of the net load") boolean ignoreMustRun,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {

    TimeStep step = parseTimeStep(timeStep);
    MediaType contentType = selectMediaType(format, accept);

    SimulationData data = RampPayloads.toData(request, defaultOptions);
    RampResult result = service.computeRamp(data, step, synthesis, ignoreMustRun,
        request.options());

    Object body = contentType.isCompatibleWith(CSV_MEDIA_TYPE)
        ? RampPayloads.toRows(result.ramps())
        : RampPayloads.toResponse(result.ramps());
    return ResponseEntity.ok().contentType(contentType).body(body);
  }

  private static TimeStep parseTimeStep(String value) {
    try {
      return RampPayloads.parseTimeStep(value);
    } catch (IllegalArgumentException ex) {
      throw new InvalidParameterException("time_step",
          "Invalid time step. Supported values: hourly,daily,weekly,monthly,annual.", 1002);
    }
  }

  private static MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CSV_MEDIA_TYPE;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw new InvalidParameterException("format",
          "Invalid format value. Supported values: json,csv.", 1007);
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes = MediaType.parseMediaTypes(accept);
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    MimeTypeUtils.sortBySpecificity(mediaTypes);
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(CSV_MEDIA_TYPE)) {
        return CSV_MEDIA_TYPE;
      }
    }
    return MediaType.APPLICATION_JSON;
  }
}
