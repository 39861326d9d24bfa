package com.ospicorp.tsforecast.analysis.model;

import java.util.List;

public record DecompositionResult(
    List<Double> trend,
    List<Double> seasonal,
    List<Double> residual,
    List<Double> original,
    List<Object> dates,
    String method,
    int period
) {}
