package com.charthost.chart.controller;

import com.charthost.common.identity.TickerResolver;
import com.charthost.common.model.Ticker;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Builds the externally visible URL of a chart served from the file store.
 */
@Component
public class PublicUrls {

    private final String baseUrl;

    public PublicUrls(@Value("${chart.public-base-url:http://localhost:3000}") String baseUrl) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public String staticChart(Ticker ticker) {
        return baseUrl + "/static/" + TickerResolver.deriveKey(ticker).filename();
    }
}
