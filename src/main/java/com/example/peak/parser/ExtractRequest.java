package com.example.peak.parser;

import com.example.peak.model.ExtractOptions;
import com.example.peak.model.Platform;

import lombok.Getter;

/**
 * extractor / 보강 단계에 넘기는 입력 묶음.
 * 호출부마다 시그니처를 맞춰 보는 대신 항상 같은 형태로 전달한다.
 */
@Getter
public class ExtractRequest {

    private final String text;
    private final String filename;
    private final String clientTaxId;
    private final ExtractOptions options;
    private final Platform platformHint;

    public ExtractRequest(String text, String filename, String clientTaxId, ExtractOptions options, Platform platformHint) {
        this.text = text == null ? "" : text;
        this.filename = filename == null ? "" : filename;
        this.clientTaxId = clientTaxId == null ? "" : clientTaxId.trim();
        this.options = options == null ? ExtractOptions.defaults() : options;
        this.platformHint = platformHint == null ? Platform.UNKNOWN : platformHint;
    }

    /** 같은 요청, 본문만 교체 (복구 단계에서 검증 오류를 덧붙일 때) */
    public ExtractRequest withText(String newText) {
        return new ExtractRequest(newText, filename, clientTaxId, options, platformHint);
    }
}
