package com.example.peak.utils;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 금액 계산은 모두 소수 둘째 자리, 음수 없음.
 * 0.005 경계에서 이진 부동소수 오차를 피하려고 1e-9 를 더한 뒤 반올림한다.
 */
public class MoneyUtils {

    private static final double EPSILON = 1e-9;

    /** "4,414.88" / "฿4,414.88" / "THB 100" -> double. 못 읽거나 유한수가 아니면 0 */
    public static double toAmount(String raw) {
        if (raw == null) return 0.0;
        String s = raw.replace(",", "").replace("฿", "").replace("THB", "").trim();
        if (s.isEmpty()) return 0.0;
        try {
            double x = Double.parseDouble(s);
            return Double.isFinite(x) ? x : 0.0;
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    public static double round2(double v) {
        if (!Double.isFinite(v)) return 0.0;
        return BigDecimal.valueOf(v + EPSILON).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    /** 반올림 + 음수는 0 */
    public static double clampRound2(double v) {
        return v <= 0 ? 0.0 : round2(v);
    }

    public static String format2(double v) {
        return BigDecimal.valueOf(clampRound2(v)).setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    /** 읽을 수 없거나 음수면 "" */
    public static String normalizeAmount(String raw) {
        if (raw == null || raw.isBlank()) return "";
        String s = raw.replace(",", "").replace("฿", "").replace("THB", "").trim();
        try {
            double x = Double.parseDouble(s);
            return x < 0 || !Double.isFinite(x) ? "" : format2(x);
        } catch (NumberFormatException e) {
            return "";
        }
    }
}
