package com.example.peak.model;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 파이프라인 작업용 행.
 * - values      : 22개 스키마 컬럼. 키가 없으면 "아직 설정 안 됨", "" 이면 "의도적으로 빈 값"
 * - hints       : extractor 가 넘겨주는 보조 신호 (seller_id, shop_name, subtotal_ex_vat ...)
 * - diagnostics : "_" 로 시작하는 진단 메타. 스키마 잠금 후에도 그대로 유지
 *
 * 문서 1건당 1개 인스턴스. 스레드 간 공유하지 않는다.
 */
public class PeakRow {

    public static final int MAX_DIAGNOSTIC_LENGTH = 500;

    private final EnumMap<PeakColumn, String> values = new EnumMap<>(PeakColumn.class);
    private final Map<String, String> hints = new LinkedHashMap<>();
    private final Map<String, Object> diagnostics = new LinkedHashMap<>();

    public PeakRow() {
    }

    /**
     * 느슨한 Map(extractor/외부 patch/HTTP 요청)을 행으로 변환
     */
    public static PeakRow fromMap(Map<String, ?> raw) {
        PeakRow row = new PeakRow();
        if (raw == null) return row;

        for (Map.Entry<String, ?> e : raw.entrySet()) {
            String k = e.getKey();
            if (k == null || k.isEmpty()) continue;
            Object v = e.getValue();

            PeakColumn col = PeakColumn.fromKey(k);
            if (col != null) {
                row.set(col, v == null ? "" : String.valueOf(v));
            } else if (PeakColumn.isInternalKey(k)) {
                if (v != null) row.diagnostics.put(k, v);
            } else if (v != null) {
                row.hints.put(k, String.valueOf(v));
            }
        }
        return row;
    }

    // -------------------- 컬럼 --------------------

    /** 설정 안 된 컬럼은 "" */
    public String get(PeakColumn col) {
        String v = values.get(col);
        return v == null ? "" : v;
    }

    public boolean isSet(PeakColumn col) {
        return values.containsKey(col);
    }

    public boolean isBlank(PeakColumn col) {
        return get(col).isBlank();
    }

    public PeakRow set(PeakColumn col, String value) {
        values.put(col, value == null ? "" : value);
        return this;
    }

    public PeakRow setIfBlank(PeakColumn col, String value) {
        if (isBlank(col) && value != null && !value.isBlank()) {
            values.put(col, value);
        }
        return this;
    }

    // -------------------- hints --------------------

    /** 주어진 키 순서대로 첫 번째 비어있지 않은 hint */
    public String hint(String... keys) {
        for (String k : keys) {
            String v = hints.get(k);
            if (v != null && !v.isBlank()) return v.trim();
        }
        return "";
    }

    public PeakRow putHint(String key, String value) {
        if (key != null && value != null) hints.put(key, value);
        return this;
    }

    // -------------------- diagnostics --------------------

    public PeakRow putDiagnostic(String key, Object value) {
        if (key == null || value == null) return this;
        String k = PeakColumn.isInternalKey(key) ? key : PeakColumn.INTERNAL_PREFIX + key;
        diagnostics.put(k, value);
        return this;
    }

    /** 목록형 진단값에 메시지 추가 (길이 제한) */
    @SuppressWarnings("unchecked")
    public PeakRow appendDiagnostic(String key, String message) {
        String k = PeakColumn.isInternalKey(key) ? key : PeakColumn.INTERNAL_PREFIX + key;
        Object cur = diagnostics.get(k);
        List<String> list;
        if (cur instanceof List) {
            list = (List<String>) cur;
        } else {
            list = new ArrayList<>();
            diagnostics.put(k, list);
        }
        list.add(bound(message));
        return this;
    }

    public Object diagnostic(String key) {
        return diagnostics.get(key);
    }

    public String diagnosticText(String key) {
        Object v = diagnostics.get(key);
        return v == null ? "" : String.valueOf(v);
    }

    // -------------------- 복사 / 잠금 --------------------

    public PeakRow copy() {
        PeakRow c = new PeakRow();
        c.values.putAll(values);
        c.hints.putAll(hints);
        for (Map.Entry<String, Object> e : diagnostics.entrySet()) {
            Object v = e.getValue();
            c.diagnostics.put(e.getKey(), v instanceof List ? new ArrayList<>((List<?>) v) : v);
        }
        return c;
    }

    /**
     * 스키마 잠금: 22개 컬럼(순서 고정) + "_" 진단 키만 남긴다. hints 는 버린다.
     */
    public Map<String, Object> toLockedMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        for (PeakColumn col : PeakColumn.values()) {
            out.put(col.key(), get(col));
        }
        for (Map.Entry<String, Object> e : diagnostics.entrySet()) {
            if (PeakColumn.isInternalKey(e.getKey())) out.put(e.getKey(), e.getValue());
        }
        return out;
    }

    public static String bound(String message) {
        if (message == null) return "";
        return message.length() > MAX_DIAGNOSTIC_LENGTH ? message.substring(0, MAX_DIAGNOSTIC_LENGTH) : message;
    }

    @Override
    public String toString() {
        return "PeakRow" + values + " hints=" + hints.keySet() + " diag=" + diagnostics.keySet();
    }
}
