package com.charthost.chart.dto;

public record ChartRequest(String symbol) {}
