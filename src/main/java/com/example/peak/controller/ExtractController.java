package com.example.peak.controller;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.peak.model.ExtractResult;
import com.example.peak.service.ExtractService;

@RestController
@RequestMapping("/peak")
public class ExtractController {

    private static final Logger log = LoggerFactory.getLogger(ExtractController.class);

    private final ExtractService extractService;

    public ExtractController(ExtractService extractService) {
        this.extractService = extractService;
    }

    /**
     * body: { text, filename, clientTaxId, cfg } -> { platform, row, errors }
     */
    @PostMapping("/extract")
    public ResponseEntity<ExtractResult> extract(@RequestBody Map<String, Object> body) {
        if (body == null || !(body.get("text") instanceof String)) {
            throw new IllegalArgumentException("text is required");
        }

        String text = (String) body.get("text");
        String filename = str(body.get("filename"));
        String clientTaxId = str(body.get("clientTaxId"));

        ExtractResult res = extractService.extractRow(text, filename, clientTaxId, cfg(body));
        log.info("extract done: file={} platform={} errors={}", filename, res.platform, res.errors.size());
        return ResponseEntity.ok(res);
    }

    /**
     * body: { row, platform, text, filename, clientTaxId, cfg } -> 잠금된 행
     */
    @PostMapping("/finalize")
    @SuppressWarnings("unchecked")
    public ResponseEntity<Map<String, Object>> finalizeRow(@RequestBody Map<String, Object> body) {
        if (body == null || !(body.get("row") instanceof Map)) {
            throw new IllegalArgumentException("row is required");
        }

        Map<String, Object> row = (Map<String, Object>) body.get("row");
        Map<String, Object> out = extractService.finalizeRow(row,
                str(body.get("platform")),
                str(body.get("text")),
                str(body.get("filename")),
                str(body.get("clientTaxId")),
                cfg(body));
        return ResponseEntity.ok(out);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> cfg(Map<String, Object> body) {
        Object cfg = body.get("cfg");
        return cfg instanceof Map ? (Map<String, Object>) cfg : Map.of();
    }

    private String str(Object v) {
        return v == null ? "" : String.valueOf(v);
    }
}
