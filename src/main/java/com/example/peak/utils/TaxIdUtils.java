package com.example.peak.utils;

public class TaxIdUtils {

    private static final String THAI_DIGITS = "๐๑๒๓๔๕๖๗๘๙";

    /**
     * 태국 숫자(๐-๙) -> 아라비아 숫자
     */
    public static String thaiDigitsToArabic(String raw) {
        if (raw == null || raw.isEmpty()) return "";
        StringBuilder sb = new StringBuilder(raw.length());
        for (char ch : raw.toCharArray()) {
            int idx = THAI_DIGITS.indexOf(ch);
            sb.append(idx >= 0 ? (char) ('0' + idx) : ch);
        }
        return sb.toString();
    }

    /** 숫자만 남기기 (태국 숫자 포함) */
    public static String digitsOnly(String raw) {
        if (raw == null) return "";
        return thaiDigitsToArabic(raw).replaceAll("\\D", "");
    }

    /**
     * 13자리 납세자번호 정규화. 유효하지 않으면 IllegalArgumentException 발생
     */
    public static String normalizeTaxId(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("tax id is null");
        }
        String digits = digitsOnly(raw);
        if (digits.length() != 13) {
            throw new IllegalArgumentException("tax id must be 13 digits. input=" + raw);
        }
        return digits;
    }

    public static boolean isTaxId13(String raw) {
        return raw != null && raw.trim().matches("\\d{13}");
    }

    public static boolean isBranch5(String raw) {
        return raw != null && raw.trim().matches("\\d{5}");
    }

    /** "1" -> "00001", 없으면 본점 "00000" */
    public static String padBranch(String raw) {
        String digits = digitsOnly(raw);
        if (digits.isEmpty()) return "00000";
        if (digits.length() > 5) digits = digits.substring(0, 5);
        return "0".repeat(5 - digits.length()) + digits;
    }
}
