package com.ospicorp.tsforecast.web;

import com.ospicorp.tsforecast.common.InvalidParameterException;
import com.ospicorp.tsforecast.forecast.model.AutoSelection;
import com.ospicorp.tsforecast.forecast.model.ComparisonReport;
import com.ospicorp.tsforecast.forecast.model.ForecastResult;
import com.ospicorp.tsforecast.forecast.model.ModelConfiguration;
import com.ospicorp.tsforecast.forecast.model.ModelDescriptor;
import com.ospicorp.tsforecast.forecast.model.ValidationResult;
import com.ospicorp.tsforecast.forecast.service.ModelManager;
import com.ospicorp.tsforecast.series.model.DataInput;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.headers.Header;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/models")
@Validated
@Tag(name = "Models")
public class ModelController {
  private static final MediaType CSV_MEDIA_TYPE = CsvHttpMessageConverter.TEXT_CSV;

  private final ModelManager manager;
  private final FitAdmissionControl admission;

  public ModelController(ModelManager manager, FitAdmissionControl admission) {
    this.manager = manager;
    this.admission = admission;
  }

  @PostMapping("/fit")
  @Operation(summary = "Fit a model and forecast",
      description = "Fits the configured model to the data and forecasts forecast_periods steps.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Fitted values, forecast and metrics",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = ForecastResult.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Invalid data or parameters"),
      @ApiResponse(responseCode = "422", description = "Model could not be fitted",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "429", description = "Too many concurrent fits",
          headers = @Header(name = "Retry-After", description = "Seconds to wait",
              schema = @Schema(type = "integer")),
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<?> fit(@Valid @RequestBody ForecastRequest request,
      @RequestParam(name = "format", required = false)
          @Parameter(description = "Response format", example = "csv") String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    MediaType contentType = selectMediaType(format, accept);
    ForecastResult result = admission.run(
        () -> manager.fitAndForecast(request.data(), request.modelConfiguration()));
    if (contentType.isCompatibleWith(CSV_MEDIA_TYPE)) {
      return ResponseEntity.ok().contentType(CSV_MEDIA_TYPE).body(ForecastRow.of(result));
    }
    return ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(result);
  }

  @PostMapping("/compare")
  @Operation(summary = "Compare models",
      description = "Fits every configuration on the same data and ranks them by RMSE.")
  public ComparisonReport compare(@Valid @RequestBody CompareRequest request) {
    return admission.run(() -> manager.compareConfigurations(request.data(), request.models()));
  }

  @GetMapping("/available")
  @Operation(summary = "List available models")
  public Map<String, ModelDescriptor> available() {
    return manager.availableModels();
  }

  @PostMapping("/auto-select")
  @Operation(summary = "Recommend a model for the data")
  public AutoSelection autoSelect(@RequestBody DataInput data) {
    return manager.autoSelect(data);
  }

  @PostMapping("/validate-parameters")
  @Operation(summary = "Validate a model configuration")
  public ValidationResult validate(@RequestBody ModelConfiguration configuration) {
    return manager.validate(configuration);
  }

  private static MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CSV_MEDIA_TYPE;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw new InvalidParameterException("Invalid format value. Supported values: json,csv.",
          "format");
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
