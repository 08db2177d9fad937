package com.charthost.chart.dto;

public record UploadResultDTO(String ticker, String filename, String url) {}
