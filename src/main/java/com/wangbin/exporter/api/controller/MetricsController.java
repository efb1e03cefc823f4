package com.wangbin.exporter.api.controller;

import com.wangbin.exporter.monitor.metrics.ExporterMetricsService;
import com.wangbin.exporter.monitor.metrics.PrometheusTextWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Prometheus 抓取接口
 */
@RestController
@RequiredArgsConstructor
public class MetricsController {

    private final ExporterMetricsService exporterMetricsService;

    @GetMapping("/metrics")
    public ResponseEntity<String> metrics() {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_TYPE, PrometheusTextWriter.CONTENT_TYPE)
                .body(exporterMetricsService.scrape());
    }
}
