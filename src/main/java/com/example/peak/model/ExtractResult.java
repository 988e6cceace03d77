package com.example.peak.model;

import java.util.List;
import java.util.Map;

public class ExtractResult {
    public Platform platform;
    public Map<String, Object> row;     // 스키마 잠금된 행
    public List<String> errors;          // 검증 오류 (치명적이지 않음)

    public ExtractResult() {}

    public ExtractResult(Platform platform, Map<String, Object> row, List<String> errors) {
        this.platform = platform;
        this.row = row;
        this.errors = errors;
    }
}
