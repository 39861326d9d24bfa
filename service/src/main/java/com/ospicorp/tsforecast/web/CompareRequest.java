package com.ospicorp.tsforecast.web;

import com.ospicorp.tsforecast.forecast.model.ModelConfiguration;
import com.ospicorp.tsforecast.series.model.DataInput;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record CompareRequest(
    @NotNull DataInput data,
    @NotEmpty List<ModelConfiguration> models
) {}
