package com.charthost.chart.dto;

/** Base64 image upload straight into the relational store. */
public record ImageUploadRequest(String ticker, String imageBase64) {}
