package com.example.peak.service;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import com.example.peak.model.PeakColumn;
import com.example.peak.model.PeakRow;

/**
 * 외부 보강 patch 병합 규칙.
 * T_note / U_group / K_account 는 정책 소유 컬럼이라 patch 로 절대 바꾸지 않는다.
 */
public final class RowMerger {

    public static final Set<PeakColumn> PROTECTED = EnumSet.of(PeakColumn.T_NOTE, PeakColumn.U_GROUP, PeakColumn.K_ACCOUNT);

    private RowMerger() {
    }

    /**
     * @param fillMissing true 면 비어 있는 컬럼만 채움 ("0", "0.00" 도 빈 값 취급), false 면 덮어쓰기
     */
    public static void merge(PeakRow base, Map<String, ?> patch, boolean fillMissing) {
        if (patch == null || patch.isEmpty()) return;

        for (Map.Entry<String, ?> e : patch.entrySet()) {
            String k = e.getKey();
            Object v = e.getValue();
            if (k == null || k.isEmpty() || v == null) continue;
            String s = String.valueOf(v);
            if (s.isEmpty()) continue;

            PeakColumn col = PeakColumn.fromKey(k);
            if (col != null) {
                if (PROTECTED.contains(col)) continue;
                if (!fillMissing || isEmptyish(base.get(col))) base.set(col, s);
            } else if (PeakColumn.isInternalKey(k)) {
                if (!fillMissing || base.diagnostic(k) == null) base.putDiagnostic(k, v);
            }
            // 그 외 키는 버린다
        }
    }

    static boolean isEmptyish(String v) {
        if (v == null) return true;
        String s = v.trim();
        return s.isEmpty() || s.equals("0") || s.equals("0.00");
    }
}
