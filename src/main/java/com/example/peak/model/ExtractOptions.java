package com.example.peak.model;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

import lombok.Getter;

/**
 * 요청 단위 옵션 (cfg). 느슨한 Map 을 한 번만 해석해서 타입 있는 값으로 보관한다.
 */
@Getter
public class ExtractOptions {

    public static final double DEFAULT_WHT_RATE = 0.03;
    public static final String DEFAULT_PND = "53";

    private static final Gson GSON = new Gson();
    private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

    private boolean calculateWht;
    private boolean autoDetectWht = true;
    private double whtRate = DEFAULT_WHT_RATE;
    private String pndWhenWht = DEFAULT_PND;
    private String pndWhenNoWht = DEFAULT_PND;
    private boolean whtOverrideExisting;

    private String clientTaxId = "";
    private List<String> clientTaxIds = Collections.emptyList();
    private List<String> clientTags = Collections.emptyList();

    /** 회사 taxId -> "520317" 또는 {"MARKETPLACE":"520317","ADS":"520201","DEFAULT":"520203"} */
    private Map<String, Object> glCodeMap = Collections.emptyMap();
    private Map<String, Object> companyNameByTaxId = Collections.emptyMap();

    public static ExtractOptions defaults() {
        return new ExtractOptions();
    }

    public static ExtractOptions from(Map<String, ?> cfg) {
        ExtractOptions o = new ExtractOptions();
        if (cfg == null || cfg.isEmpty()) return o;


        Object calc = cfg.containsKey("calculate_wht") ? cfg.get("calculate_wht") : cfg.get("wht_enabled");
        o.calculateWht = truthy(calc);
        o.autoDetectWht = cfg.containsKey("auto_detect_wht") ? truthy(cfg.get("auto_detect_wht")) : true;
        o.whtRate = toRate(cfg.get("wht_rate"));
        o.pndWhenWht = textOr(cfg.get("pnd_when_wht"), DEFAULT_PND);
        o.pndWhenNoWht = textOr(cfg.get("pnd_when_no_wht"), DEFAULT_PND);
        o.whtOverrideExisting = truthy(cfg.get("wht_override_existing"));

        o.clientTaxId = textOr(cfg.get("client_tax_id"), "");
        o.clientTaxIds = asList(cfg.get("client_tax_ids"));
        o.clientTags = asList(cfg.get("client_tags"));

        o.glCodeMap = asMap(cfg.get("gl_code_map"));
        o.companyNameByTaxId = asMap(cfg.get("company_name_by_tax_id"));
        return o;
    }

    // -------------------- 해석 헬퍼 --------------------

    public static boolean truthy(Object v) {
        if (v == null) return false;
        if (v instanceof Boolean) return (Boolean) v;
        if (v instanceof Number) return ((Number) v).doubleValue() != 0;
        String s = String.valueOf(v).trim().toLowerCase();
        return switch (s) {
            case "1", "true", "yes", "y", "on", "enable", "enabled" -> true;
            default -> false;
        };
    }

    private static double toRate(Object v) {
        if (v == null) return DEFAULT_WHT_RATE;
        double x;
        if (v instanceof Number) {
            x = ((Number) v).doubleValue();
        } else {
            try {
                x = Double.parseDouble(String.valueOf(v).trim());
            } catch (NumberFormatException e) {
                return DEFAULT_WHT_RATE;
            }
        }
        return Double.isFinite(x) ? x : DEFAULT_WHT_RATE;
    }

    private static String textOr(Object v, String fallback) {
        if (v == null) return fallback;
        String s = String.valueOf(v).trim();
        return s.isEmpty() ? fallback : s;
    }

    /**
     * 단일값 / List / JSON 배열 문자열 / 콤마 구분 문자열 -> List
     */
    public static List<String> asList(Object v) {
        List<String> out = new ArrayList<>();
        if (v == null) return out;

        if (v instanceof Iterable) {
            for (Object x : (Iterable<?>) v) {
                if (x == null) continue;
                String s = String.valueOf(x).trim();
                if (!s.isEmpty()) out.add(s);
            }
            return out;
        }

        String s = String.valueOf(v).trim();
        if (s.isEmpty()) return out;

        if ((s.startsWith("[") && s.endsWith("]")) || (s.startsWith("\"") && s.endsWith("\""))) {
            Object parsed = parseJson(s);
            if (parsed instanceof List) return asList(parsed);
            if (parsed instanceof String && !((String) parsed).isBlank()) {
                out.add(((String) parsed).trim());
                return out;
            }
        }

        if (s.contains(",")) {
            for (String part : s.split(",")) {
                String p = part.trim();
                if (!p.isEmpty()) out.add(p);
            }
            return out;
        }

        out.add(s);
        return out;
    }

    /** JSON 이 아니면 null (콤마 분리로 넘어감) */
    private static Object parseJson(String s) {
        try {
            return GSON.fromJson(s, Object.class);
        } catch (JsonParseException e) {
            return null;
        }
    }

    private static Map<String, Object> asMap(Object v) {
        if (v instanceof Map) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : ((Map<?, ?>) v).entrySet()) {
                if (e.getKey() != null) out.put(String.valueOf(e.getKey()), e.getValue());
            }
            return out;
        }
        if (v instanceof String && ((String) v).trim().startsWith("{")) {
            try {
                Map<String, Object> parsed = GSON.fromJson((String) v, MAP_TYPE);
                return parsed == null ? Collections.emptyMap() : parsed;
            } catch (JsonParseException e) {
                return Collections.emptyMap();
            }
        }
        return Collections.emptyMap();
    }
}
