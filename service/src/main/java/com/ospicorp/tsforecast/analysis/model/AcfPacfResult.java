package com.ospicorp.tsforecast.analysis.model;

public record AcfPacfResult(Correlogram acf, Correlogram pacf) {}
