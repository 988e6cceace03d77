package com.example.peak.service;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Service;

import com.example.peak.model.ClientCompany;
import com.example.peak.utils.TaxIdUtils;

/**
 * 우리 회사 + 판매자(상점) 식별자 -> 결제수단 지갑 코드(EWLxxx).
 * 찾지 못하면 "" (검토 필요). 플랫폼 이름은 절대 반환하지 않는다.
 */
@Service
public class WalletResolver {

    private static final Pattern RE_WALLET = Pattern.compile("^EWL\\d{3}$", Pattern.CASE_INSENSITIVE);

    // "Seller ID: 253227155" (Shopee 숫자 id)
    private static final Pattern RE_SID_DIGITS = Pattern.compile(
            "\\b(?:seller|shop|merchant|store)\\s*(?:id)?\\s*[:#=\\-]?\\s*([0-9][0-9\\s,\\-]{4,30})\\b",
            Pattern.CASE_INSENSITIVE);
    // Lazada/TikTok "TH1K0CDIML", "THLC6LWARA" (숫자 하나 이상 포함)
    private static final Pattern RE_ID_TH = Pattern.compile(
            "\\b(TH(?=[0-9A-Z]*[0-9])[0-9A-Z]{6,})\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern RE_NON_ALNUM = Pattern.compile("[^\\p{L}\\p{N}_]+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern RE_NAME_PUNCT = Pattern.compile("[\"'`“”‘’()\\[\\]{}<>]+");
    private static final Pattern RE_WS = Pattern.compile("\\s+");

    private final WalletMappingTables tables;

    public WalletResolver(WalletMappingTables tables) {
        this.tables = tables;
    }

    public String resolve(String clientTaxId, String sellerId, String shopName, String text) {
        ClientCompany company = ClientCompany.fromTaxId(clientTaxId);
        // 모르는 회사는 대체 테이블 없음
        if (company == null) return "";

        Map<String, String> byId = tables.idTable(company);

        // 1) id 직접
        String sid = normalizeId(sellerId);
        if (!sid.isEmpty()) {
            String code = byId.get(sid);
            if (isValidWallet(code)) return code.toUpperCase();
        }

        // 2) id 가 없을 때만 본문에서 추출
        if (sid.isEmpty() && text != null && !text.isEmpty()) {
            String fromText = extractSellerId(text);
            if (!fromText.isEmpty()) {
                String code = byId.get(fromText);
                if (isValidWallet(code)) return code.toUpperCase();
            }
        }

        // 3) 상점명 키워드
        String code = matchKeyword(company, normalizeName(shopName));
        if (!code.isEmpty()) return code;

        // 4) 본문 키워드 (신뢰도 낮음)
        if (text != null && !text.isEmpty()) {
            return matchKeyword(company, normalizeName(text));
        }
        return "";
    }

    /**
     * 본문에서 판매자 id 추출 (best-effort)
     */
    public String extractSellerId(String text) {
        String t = normalizeText(text);
        if (t.isEmpty()) return "";

        Matcher m = RE_SID_DIGITS.matcher(t);
        if (m.find()) {
            String sid = normalizeId(m.group(1));
            if (sid.length() >= 5 && sid.chars().allMatch(Character::isDigit)) return sid;
        }

        Matcher m2 = RE_ID_TH.matcher(t);
        if (m2.find()) {
            return normalizeId(m2.group(1));
        }
        return "";
    }

    private String matchKeyword(ClientCompany company, String normalized) {
        if (normalized.isEmpty()) return "";
        for (Map.Entry<String, String> e : tables.keywordTable(company)) {
            // 빈 코드는 매칭 금지 키워드
            if (!isValidWallet(e.getValue())) continue;
            if (normalized.contains(e.getKey())) return e.getValue().toUpperCase();
        }
        return "";
    }

    public static boolean isValidWallet(String code) {
        return code != null && RE_WALLET.matcher(code.trim()).matches();
    }

    // -------------------- 정규화 --------------------

    static String normalizeText(String s) {
        if (s == null) return "";
        String t = TaxIdUtils.thaiDigitsToArabic(s.trim());
        return RE_WS.matcher(t).replaceAll(" ").trim();
    }

    /**
     * 숫자 id 는 숫자만, 영숫자 id 는 대문자 + 구분자 제거
     */
    static String normalizeId(String s) {
        String t = normalizeText(s);
        if (t.isEmpty()) return "";
        String stripped = RE_NON_ALNUM.matcher(t).replaceAll("");
        if (stripped.isEmpty()) return "";
        if (stripped.chars().allMatch(Character::isDigit)) return TaxIdUtils.digitsOnly(stripped);
        return stripped.toUpperCase();
    }

    static String normalizeName(String s) {
        String t = normalizeText(s).toLowerCase();
        if (t.isEmpty()) return "";
        t = RE_NAME_PUNCT.matcher(t).replaceAll(" ");
        return RE_WS.matcher(t).replaceAll(" ").trim();
    }
}
