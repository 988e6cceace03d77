package com.example.peak.service;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.example.peak.classify.PlatformClassifier;
import com.example.peak.config.PipelineSettings;
import com.example.peak.model.CollaboratorResult;
import com.example.peak.model.ExtractOptions;
import com.example.peak.model.ExtractResult;
import com.example.peak.model.PeakColumn;
import com.example.peak.model.PeakRow;
import com.example.peak.model.Platform;
import com.example.peak.parser.ExtractRequest;
import com.example.peak.parser.RowExtractor;
import com.example.peak.parser.RowExtractorRegistry;

/**
 * 문서 1건 -> PEAK 행 1개.
 * 분류 -> extractor -> (보강) -> 검증 -> (복구 1회) -> 거래처 코드 -> 최종 정리/잠금
 */
@Service
public class ExtractService {

    private static final Logger log = LoggerFactory.getLogger(ExtractService.class);

    static final String DIAG_METHOD = "_extraction_method";
    static final String DIAG_AI_ERRORS = "_ai_errors";

    private final PlatformClassifier classifier;
    private final RowExtractorRegistry registry;
    private final RowEnhancer enhancer;
    private final VendorCodeLookup vendorCodeLookup;
    private final RowValidator validator;
    private final RowFinalizer finalizer;
    private final ClientIdentityResolver identityResolver;
    private final PipelineSettings settings;

    public ExtractService(PlatformClassifier classifier,
                          RowExtractorRegistry registry,
                          RowEnhancer enhancer,
                          VendorCodeLookup vendorCodeLookup,
                          RowValidator validator,
                          RowFinalizer finalizer,
                          ClientIdentityResolver identityResolver,
                          PipelineSettings settings) {
        this.classifier = classifier;
        this.registry = registry;
        this.enhancer = enhancer;
        this.vendorCodeLookup = vendorCodeLookup;
        this.validator = validator;
        this.finalizer = finalizer;
        this.identityResolver = identityResolver;
        this.settings = settings;
    }

    public ExtractResult extractRow(String text, String filename, String clientTaxId, Map<String, ?> cfg) {
        String t = text == null ? "" : text;
        String fn = filename == null ? "" : filename;
        ExtractOptions opts = ExtractOptions.from(cfg);

        String ctax = identityResolver.resolveClientTaxId(clientTaxId, opts, t);

        // 1) 분류
        String platformRaw = classify(t, fn);
        Platform platform = Platform.fromLabel(platformRaw);
        String route = platform == Platform.UNKNOWN ? "GENERIC" : platform.name();
        log.info("Platform classified: {} -> route={} (file={})", platformRaw, route, fn);

        ExtractRequest request = new ExtractRequest(t, fn, ctax, opts, platform);

        // 2) extractor
        PeakRow row = runExtractor(platform, request);

        // 2.1) 최소 기본값
        if (!row.isSet(PeakColumn.A_SEQ)) row.set(PeakColumn.A_SEQ, "");
        row.setIfBlank(PeakColumn.M_QTY, "1");

        if (settings.isStoreClassifierMeta()) {
            row.putDiagnostic("_platform", platform.name());
            row.putDiagnostic("_platform_route", route);
            row.putDiagnostic("_platform_raw", platformRaw);
            row.putDiagnostic("_filename", fn);
        }

        // 3) 보강 (광고 플랫폼 제외, 명시적으로 켰을 때만)
        boolean enhanceable = !platform.isAds();
        if (enhanceable && settings.isEnableAiExtract()) {
            CollaboratorResult<Map<String, Object>> r = callEnhancer("ai_enhance", request);
            if (r.isFound()) {
                RowMerger.merge(row, r.value(), settings.isAiFillMissing());
                String method = row.diagnosticText(DIAG_METHOD);
                if (!method.isEmpty()) row.putDiagnostic(DIAG_METHOD, method + "+ai");
            } else if (r.isFailed()) {
                log.warn("AI enhancement failed (file={}): {}", fn, r.error());
                recordError(row, r.error());
            }
        }

        // 4) 검증
        List<String> errors = validator.validate(row);

        // 5) 복구 (문서당 최대 1회)
        if (!errors.isEmpty() && enhanceable && settings.isAiRepairPass()) {
            String prompt = t + "\n\n# VALIDATION_ERRORS\n" + String.join("\n", errors);
            CollaboratorResult<Map<String, Object>> r = callEnhancer("ai_repair", request.withText(prompt));
            if (r.isFound()) {
                RowMerger.merge(row, r.value(), false);
                errors = validator.validate(row);
            } else if (r.isFailed()) {
                log.warn("AI repair failed (file={}): {}", fn, r.error());
                recordError(row, r.error());
            }
        }

        // 6) 거래처 코드 (Cxxxxx)
        applyVendorCode(row, ctax);

        // 7) 최종 정리 + 잠금
        Map<String, Object> locked = finalizer.finalizeRow(row, platform, t, fn, ctax, opts);
        if (!errors.isEmpty()) {
            log.info("row has validation errors (file={}): {}", fn, errors);
        }
        return new ExtractResult(platform, locked, errors);
    }

    /**
     * 이미 추출된 행을 다시 정리만 한다. platformLabel 이 없으면 행의 _platform 메타 사용
     */
    public Map<String, Object> finalizeRow(Map<String, ?> rawRow, String platformLabel, String text, String filename,
                                           String clientTaxId, Map<String, ?> cfg) {
        PeakRow row = PeakRow.fromMap(rawRow);
        String label = platformLabel == null || platformLabel.isBlank() ? row.diagnosticText("_platform") : platformLabel;
        return finalizer.finalizeRow(row, Platform.fromLabel(label), text, filename, clientTaxId, ExtractOptions.from(cfg));
    }

    private String classify(String text, String filename) {
        try {
            PlatformClassifier.Classified c = classifier.classify(text, filename);
            if (c == null || c.label == null || c.label.isBlank()) return "UNKNOWN";
            return c.label.trim();
        } catch (RuntimeException e) {
            log.error("classify failed (file={})", filename, e);
            return "UNKNOWN";
        }
    }

    private PeakRow runExtractor(Platform platform, ExtractRequest request) {
        RowExtractor extractor = registry.get(platform);
        try {
            PeakRow row = extractor.extract(request);
            if (row == null) row = new PeakRow();
            row.putDiagnostic(DIAG_METHOD, registry.methodFor(platform));
            return row;
        } catch (RuntimeException e) {
            log.error("Extractor error (platform={}, file={})", platform, request.getFilename(), e);
            PeakRow row = registry.generic().extract(request);
            row.putDiagnostic("_extractor_error", PeakRow.bound(e.getClass().getSimpleName() + ": " + e.getMessage()));
            row.putDiagnostic(DIAG_METHOD, "generic_error_fallback");
            return row;
        }
    }

    private CollaboratorResult<Map<String, Object>> callEnhancer(String stage, ExtractRequest request) {
        try {
            CollaboratorResult<Map<String, Object>> r = enhancer.enhance(request);
            return r == null ? CollaboratorResult.noAnswer() : r;
        } catch (RuntimeException e) {
            return CollaboratorResult.failed(stage, e);
        }
    }

    /**
     * 거래처 코드는 "C" 로 시작하고 5자 이상일 때만 채택
     */
    void applyVendorCode(PeakRow row, String clientTaxId) {
        if (clientTaxId == null || clientTaxId.isBlank()) return;

        String vtax = row.get(PeakColumn.E_TAX_ID_13).trim();
        String vname = row.get(PeakColumn.D_VENDOR_CODE).trim();

        CollaboratorResult<String> r;
        try {
            r = vendorCodeLookup.lookup(clientTaxId, vtax, vname);
        } catch (RuntimeException e) {
            r = CollaboratorResult.failed("vendor_lookup", e);
        }
        if (r == null) return;

        if (r.isFailed()) {
            log.warn("vendor code lookup failed: {}", r.error());
            recordError(row, r.error());
            return;
        }

        String code = r.orElse("").trim();
        if (code.startsWith("C") && code.length() >= 5) {
            row.set(PeakColumn.D_VENDOR_CODE, code);
            if (settings.isStoreVendorMeta()) {
                row.putDiagnostic("_client_tax_id_used", clientTaxId);
                row.putDiagnostic("_vendor_tax_id_used", vtax);
                row.putDiagnostic("_vendor_code_resolved", code);
            }
        }
    }

    private void recordError(PeakRow row, String message) {
        if (settings.isStoreAiErrorMeta()) {
            row.appendDiagnostic(DIAG_AI_ERRORS, message);
        }
    }
}
