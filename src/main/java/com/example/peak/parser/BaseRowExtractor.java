package com.example.peak.parser;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.peak.model.PeakRow;
import com.example.peak.utils.MoneyUtils;
import com.example.peak.utils.TaxIdUtils;

public abstract class BaseRowExtractor implements RowExtractor {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    // -------------------- 공용 패턴 --------------------
    protected static final Pattern RE_MONEY = Pattern.compile("(-?\\d{1,3}(?:,\\d{3})*(?:\\.\\d{1,2})?|-?\\d+(?:\\.\\d{1,2})?)");
    protected static final Pattern RE_TAX_ID_13_ANY = Pattern.compile("(?<!\\d)(\\d{13})(?!\\d)");
    protected static final Pattern RE_BRANCH = Pattern.compile("(?:branch|สาขา)\\s*(?:no\\.?)?\\s*[:\\-]?\\s*(\\d{1,5})", Pattern.CASE_INSENSITIVE);

    private static final Pattern RE_WS = Pattern.compile("[ \\t\\x0B\\f\\r]+");

    // -------------------- 추상 메서드 --------------------
    @Override
    public abstract PeakRow extract(ExtractRequest request);

    // -------------------- 공용 텍스트 유틸 --------------------

    /** 태국 숫자 변환 + 줄 안의 연속 공백 정리 (줄바꿈은 유지) */
    protected String normalizeText(String text) {
        if (text == null) return "";
        return RE_WS.matcher(TaxIdUtils.thaiDigitsToArabic(text)).replaceAll(" ");
    }

    /** 첫 번째 매칭의 지정 그룹. 없으면 null */
    protected String extract(String src, Pattern p, int groupIndex) {
        if (src == null || p == null) return null;
        Matcher m = p.matcher(src);
        if (!m.find()) return null;

        int groupCount = m.groupCount();
        if (groupIndex <= groupCount && groupIndex > 0) {
            return Optional.ofNullable(m.group(groupIndex)).orElse("").trim();
        }
        // 그룹이 없으면 전체 매칭
        return groupCount >= 1
                ? Optional.ofNullable(m.group(1)).orElse("").trim()
                : m.group().trim();
    }

    protected String extract(String src, Pattern p) {
        return extract(src, p, 1);
    }

    /**
     * 키워드 뒤 window 자 안의 첫 금액 (소수점 있는 값 우선). 없으면 ""
     */
    protected String amountNearKeyword(String text, Pattern keyword, int window) {
        if (text == null || text.isEmpty()) return "";
        Matcher m = keyword.matcher(text);
        if (!m.find()) return "";

        int end = Math.min(text.length(), m.end() + window);
        Matcher nums = RE_MONEY.matcher(text.substring(m.end(), end));

        String first = null;
        while (nums.find()) {
            String n = nums.group(1);
            if (n.contains(".")) return MoneyUtils.normalizeAmount(n);
            if (first == null) first = n;
        }
        return first == null ? "" : MoneyUtils.normalizeAmount(first);
    }

    /**
     * 판매자 납세자번호: 라벨 우선, 없으면 우리 회사 번호가 아닌 첫 13자리
     */
    protected String vendorTaxId(String text, Pattern labeled, String clientTaxId) {
        String v = labeled == null ? null : extract(text, labeled);
        if (v != null && !v.isEmpty()) {
            try {
                return TaxIdUtils.normalizeTaxId(v);
            } catch (IllegalArgumentException e) {
                log.debug("labeled tax id ignored: {}", e.getMessage());
            }
        }

        String ctax = TaxIdUtils.digitsOnly(clientTaxId);
        Matcher m = RE_TAX_ID_13_ANY.matcher(text == null ? "" : text);
        while (m.find()) {
            String x = m.group(1);
            if (!ctax.isEmpty() && x.equals(ctax)) continue;
            return x;
        }
        return "";
    }

    /** 지점번호 5자리, 없으면 본점 00000 */
    protected String branch(String text) {
        String b = extract(text, RE_BRANCH);
        return TaxIdUtils.padBranch(b);
    }

    // -------------------- 공용 헬퍼 --------------------
    protected String firstNonNull(String... arr) {
        for (String s : arr) if (s != null && !s.isBlank()) return s.trim();
        return null;
    }

    protected String safe(String s) {
        if (s == null) return "";
        s = s.trim();
        if (s.equalsIgnoreCase("null")) return "";
        return s;
    }
}
