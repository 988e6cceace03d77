package com.example.peak.parser;

import com.example.peak.model.PeakRow;

public interface RowExtractor {

    /** 진단 메타 _extraction_method 에 남길 이름 */
    String method();

    /**
     * 문서 본문 -> 정리 전 행. 최종 정리(잠금/WHT/지갑)는 하지 않는다.
     */
    PeakRow extract(ExtractRequest request);
}
