package com.example.peak.utils;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class DateUtils {

    public static final DateTimeFormatter YYYYMMDD =
            DateTimeFormatter.ofPattern("uuuuMMdd").withResolverStyle(ResolverStyle.STRICT);

    // 시도해볼 날짜 포맷들
    private static final List<DateTimeFormatter> DATE_FORMATTERS = List.of(
            strict(DateTimeFormatter.ofPattern("uuuu-M-d")),        // 2025-12-03
            strict(DateTimeFormatter.ofPattern("uuuu/M/d")),        // 2025/12/03
            strict(DateTimeFormatter.ofPattern("uuuu.M.d")),        // 2025.12.03
            strict(DateTimeFormatter.ofPattern("uuuuMMdd")),        // 20251203
            strict(new DateTimeFormatterBuilder().parseCaseInsensitive()
                    .appendPattern("MMM d, uuuu").toFormatter(Locale.ENGLISH))   // Dec 3, 2025
    );

    // "Invoice Date: 2025-12-03" / "วันที่ใบกำกับ: 2025-12-03"
    private static final Pattern RE_DATE_LABELED = Pattern.compile(
            "(?:Invoice\\s*Date|วันที่(?:ใบกำกับ|เอกสาร|ออกเอกสาร)|Date)\\s*[:：]?\\s*(20\\d{2})[-/](\\d{2})[-/](\\d{2})",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern RE_DATE_ISO = Pattern.compile("\\b(20\\d{2})[-/](\\d{2})[-/](\\d{2})\\b");

    public static LocalDate parseFlexibleDate(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("date text is empty");
        }

        String value = text.trim();

        for (DateTimeFormatter formatter : DATE_FORMATTERS) {
            try {
                return LocalDate.parse(value, formatter);
            } catch (DateTimeParseException ignored) {
                // 실패하면 다음 포맷 시도
            }
        }

        // 모든 포맷이 실패하면 예외 던지기
        throw new IllegalArgumentException("unsupported date format: " + value);
    }

    /**
     * 문서용 날짜: 지원 포맷 + 2000~2099 년이면 yyyyMMdd, 아니면 ""
     */
    public static String toDocDate(String text) {
        try {
            LocalDate date = parseFlexibleDate(text);
            if (date.getYear() < 2000 || date.getYear() > 2099) return "";
            return toYyyymmdd(date);
        } catch (IllegalArgumentException e) {
            return "";
        }
    }

    // 2월 30일 같은 날짜를 말일로 보정하지 않음
    private static DateTimeFormatter strict(DateTimeFormatter f) {
        return f.withResolverStyle(ResolverStyle.STRICT);
    }

    public static String toYyyymmdd(LocalDate date) {
        return date == null ? "" : date.format(YYYYMMDD);
    }

    public static boolean isValidYyyymmdd(String s) {
        if (s == null || !s.trim().matches("\\d{8}")) return false;
        try {
            LocalDate.parse(s.trim(), YYYYMMDD);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    /**
     * 2000~2099 년, 실제 존재하는 날짜만 yyyyMMdd 로. 아니면 ""
     */
    public static String yyyymmddFromParts(String y, String m, String d) {
        try {
            int yy = Integer.parseInt(y);
            int mm = Integer.parseInt(m);
            int dd = Integer.parseInt(d);
            if (yy < 2000 || yy > 2099) return "";
            return toYyyymmdd(LocalDate.of(yy, mm, dd));
        } catch (RuntimeException e) {
            return "";
        }
    }

    /**
     * 문서 본문에서만 날짜를 찾는다. 파일명에서 추측하지 않는다.
     */
    public static String docDateFromText(String text) {
        if (text == null || text.isEmpty()) return "";

        Matcher m = RE_DATE_LABELED.matcher(text);
        if (m.find()) {
            String v = yyyymmddFromParts(m.group(1), m.group(2), m.group(3));
            if (!v.isEmpty()) return v;
        }

        // fallback: 본문 첫 ISO 날짜
        Matcher m2 = RE_DATE_ISO.matcher(text);
        if (m2.find()) {
            return yyyymmddFromParts(m2.group(1), m2.group(2), m2.group(3));
        }
        return "";
    }
}
