package com.example.peak.service;

import java.util.Map;

import com.example.peak.model.CollaboratorResult;
import com.example.peak.parser.ExtractRequest;

/**
 * 외부 보강 단계 (AI 등). 돌려주는 patch 는 RowMerger 규칙으로만 병합된다.
 * 실패는 예외 대신 {@link CollaboratorResult#failed} 로 돌려주는 것을 권장하지만,
 * 던져도 호출부에서 잡아 진단 메타로 남긴다.
 */
public interface RowEnhancer {

    CollaboratorResult<Map<String, Object>> enhance(ExtractRequest request);

    /** 보강 기능 없음 */
    RowEnhancer DISABLED = request -> CollaboratorResult.unavailable();
}
