package com.example.peak.service;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.example.peak.config.PipelineSettings;
import com.example.peak.model.ExtractOptions;
import com.example.peak.model.PeakColumn;
import com.example.peak.model.PeakRow;
import com.example.peak.utils.MoneyUtils;

/**
 * 원천징수세(WHT) 정책.
 * - WHT 출처: 기존 값 > 본문 감지 > (옵션) 세전 금액 * 세율 계산
 * - WHT 가 있으면 R_paid_amount = 총액(VAT 포함) - WHT
 * - S_pnd 는 비어 있을 때만 채운다
 */
@Service
public class WhtPolicyEngine {

    private static final Logger log = LoggerFactory.getLogger(WhtPolicyEngine.class);

    public static final String DIAG_GROSS_BEFORE_WHT = "_gross_amount_before_wht";

    // "หักภาษี ณ ที่จ่าย 3% จำนวน 4,414.88"
    private static final Pattern RE_WHT_TH = Pattern.compile(
            "(?:หักภาษี\\s*ณ\\s*ที่จ่าย|ภาษีหัก\\s*ณ\\s*ที่จ่าย)[^\\d%]{0,40}(\\d{1,2}(?:\\.\\d+)?)\\s*%[^\\d]{0,40}([\\d,]+\\.\\d{2}|\\d+)",
            Pattern.CASE_INSENSITIVE);
    // "Withholding tax 3% 4,414.88" / "withheld tax at the rate of 3% amounting to ฿4,414.88"
    private static final Pattern RE_WHT_EN = Pattern.compile(
            "(?:withholding|withheld)\\s*tax[^\\d%]{0,40}(\\d{1,2}(?:\\.\\d+)?)\\s*%[^\\d]{0,40}([\\d,]+\\.\\d{2}|\\d+)",
            Pattern.CASE_INSENSITIVE);

    private final PipelineSettings settings;

    public WhtPolicyEngine(PipelineSettings settings) {
        this.settings = settings;
    }

    /** 본문에서 감지한 WHT (세율은 진단용) */
    public static class Detection {
        public final double rate;
        public final double amount;

        public Detection(double rate, double amount) {
            this.rate = rate;
            this.amount = amount;
        }
    }

    public void apply(PeakRow row, ExtractOptions opts, String text) {
        ExtractOptions o = opts == null ? ExtractOptions.defaults() : opts;

        double vat = parseVatRate(row.get(PeakColumn.O_VAT_RATE));
        double curWht = MoneyUtils.toAmount(row.get(PeakColumn.P_WHT));
        double gross = resolveGross(row);
        double subtotalEx = MoneyUtils.toAmount(row.hint("subtotal_ex_vat"));

        // 1) 본문 감지
        boolean detected = false;
        if (o.isAutoDetectWht() && (o.isWhtOverrideExisting() || curWht <= 0)) {
            Detection d = detect(text);
            if (d != null && d.amount > 0) {
                curWht = MoneyUtils.clampRound2(d.amount);
                row.set(PeakColumn.P_WHT, MoneyUtils.format2(curWht));
                detected = true;
                if (settings.isStoreWhtMeta()) {
                    row.putDiagnostic("_wht_detected_rate", String.format(Locale.ROOT, "%.4f", d.rate));
                    row.putDiagnostic("_wht_detected_amount", MoneyUtils.format2(d.amount));
                }
            }
        }

        // 2) 계산 fallback (세전 금액 기준)
        boolean calculated = false;
        if (!detected && o.isCalculateWht() && curWht <= 0) {
            double base = 0.0;
            if (subtotalEx > 0) {
                base = subtotalEx;
            } else if (gross > 0) {
                base = vat > 0 ? gross / (1.0 + vat) : gross;
            }
            if (base > 0) {
                double wht = MoneyUtils.clampRound2(base * o.getWhtRate());
                if (wht > 0) {
                    row.set(PeakColumn.P_WHT, MoneyUtils.format2(wht));
                    curWht = wht;
                    calculated = true;
                }
                if (settings.isStoreWhtMeta()) {
                    row.putDiagnostic("_wht_calc_rate", String.format(Locale.ROOT, "%.4f", o.getWhtRate()));
                    row.putDiagnostic("_wht_calc_base_ex_vat", MoneyUtils.format2(base));
                }
            }
        }

        // 3) WHT 있음 -> 순지급액
        if (curWht > 0) {
            if (!detected && !calculated) {
                row.set(PeakColumn.P_WHT, MoneyUtils.format2(curWht));
            }
            if (gross > 0) {
                if (settings.isStoreWhtMeta()) {
                    row.putDiagnostic(DIAG_GROSS_BEFORE_WHT, MoneyUtils.format2(gross));
                }
                row.set(PeakColumn.R_PAID_AMOUNT, MoneyUtils.format2(gross - curWht));
            }
            row.setIfBlank(PeakColumn.S_PND, o.getPndWhenWht());
            log.debug("wht applied: wht={} gross={} detected={} calculated={}", curWht, gross, detected, calculated);
            return;
        }

        // 4) WHT 없음: 계산도 꺼져 있으면 잔여 값 제거
        if (!o.isCalculateWht()) {
            row.set(PeakColumn.P_WHT, "");
        }
        row.setIfBlank(PeakColumn.S_PND, o.getPndWhenNoWht());
    }

    /**
     * 총액(VAT 포함): 이미 한 번 정책을 거친 행이면 기록된 원래 총액,
     * 아니면 R_paid_amount -> N_unit_price -> subtotal + vat hint
     */
    double resolveGross(PeakRow row) {
        double before = MoneyUtils.toAmount(row.diagnosticText(DIAG_GROSS_BEFORE_WHT));
        if (before > 0) return before;

        double gross = MoneyUtils.toAmount(row.get(PeakColumn.R_PAID_AMOUNT));
        if (gross <= 0) gross = MoneyUtils.toAmount(row.get(PeakColumn.N_UNIT_PRICE));
        if (gross <= 0) {
            double subtotal = MoneyUtils.toAmount(row.hint("subtotal_ex_vat"));
            double vatAmt = MoneyUtils.toAmount(row.hint("vat_amount"));
            if (subtotal > 0 && vatAmt > 0) gross = subtotal + vatAmt;
        }
        return gross;
    }

    public Detection detect(String text) {
        if (text == null || text.isEmpty()) return null;
        for (Pattern p : List.of(RE_WHT_TH, RE_WHT_EN)) {
            Matcher m = p.matcher(text);
            if (m.find()) {
                double rate = MoneyUtils.toAmount(m.group(1)) / 100.0;
                double amount = MoneyUtils.toAmount(m.group(2));
                return new Detection(rate, amount);
            }
        }
        return null;
    }

    /**
     * "7%" -> 0.07, "NO" -> 0.0, "7" -> 0.07, "0.07" -> 0.07
     */
    public static double parseVatRate(String v) {
        if (v == null) return 0.0;
        String s = v.trim().toUpperCase();
        if (s.isEmpty()) return 0.0;
        switch (s) {
            case "NO", "NONE", "0", "0%", "EXEMPT":
                return 0.0;
            default:
                break;
        }
        if (s.endsWith("%")) {
            return MoneyUtils.toAmount(s.substring(0, s.length() - 1)) / 100.0;
        }
        double x = MoneyUtils.toAmount(s);
        return x > 1.0 ? x / 100.0 : x;
    }
}
