package com.charthost.chart.dto;

import java.util.List;

public record BatchChartRequest(List<String> symbols) {}
