package com.example.peak.service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Service;

import com.example.peak.model.PeakColumn;
import com.example.peak.model.PeakRow;
import com.example.peak.model.Platform;

/**
 * 참조번호/인보이스번호 후보 중 가장 믿을 만한 하나를 고른다.
 * 우선순위: extractor 필드 > 본문 매칭 > 파일명. 파일 해시(32 hex)는 대안이 있으면 절대 선택하지 않는다.
 */
@Service
public class ReferenceResolver {

    // 플랫폼 문서번호 코어
    static final Pattern RE_TRS_CORE = Pattern.compile("(TRS[A-Z0-9\\-_/.]{10,})", Pattern.CASE_INSENSITIVE);
    static final Pattern RE_RCS_CORE = Pattern.compile("(RCS[A-Z0-9\\-_/.]{10,})", Pattern.CASE_INSENSITIVE);
    static final Pattern RE_TTSTH_CORE = Pattern.compile("(TTSTH\\d{8,})", Pattern.CASE_INSENSITIVE);
    static final Pattern RE_LAZ_INVOICE = Pattern.compile("\\b(THMPTI\\d{10,})\\b", Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> CORE_PATTERNS = List.of(RE_TRS_CORE, RE_RCS_CORE, RE_TTSTH_CORE, RE_LAZ_INVOICE);

    private static final Pattern RE_INVNO_BLOCK = Pattern.compile(
            "(?:Invoice\\s*No\\.?|Tax\\s*Invoice\\s*/\\s*Receipt|Receipt\\s*No\\.?)\\s*[:：]?\\s*([A-Z0-9\\-_/.]{8,})",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern RE_HASH32 = Pattern.compile("^[a-f0-9]{32}$", Pattern.CASE_INSENSITIVE);
    private static final Pattern RE_GENERIC_TOKEN = Pattern.compile("[A-Z0-9\\-_/.]+", Pattern.CASE_INSENSITIVE);

    private static final Pattern RE_LEADING_NOISE = Pattern.compile(
            "^(?:Shopee-)?TI[VR]-|^Shopee-|^TIV-|^TIR-|^SPX-|^LAZ-|^LZD-|^TikTok-",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern RE_EXT = Pattern.compile("\\.(pdf|png|jpg|jpeg|xlsx|xls)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern RE_WS = Pattern.compile("\\s+");

    /**
     * 행 + 본문 + 파일명에서 후보를 모아 최적 참조번호 선택
     */
    public String resolve(Platform platform, String sourceFilename, PeakRow row, String text) {
        List<String> cands = new ArrayList<>();

        // 1) extractor 필드
        cands.add(normalize(row.get(PeakColumn.G_INVOICE_NO)));
        cands.add(normalize(row.get(PeakColumn.C_REFERENCE)));

        // 2) 본문
        cands.addAll(candidatesFromText(text));

        // 3) 파일명 (마지막)
        if (sourceFilename != null && !sourceFilename.isBlank()) {
            cands.add(normalize(sourceFilename));
        }

        return pickBest(platform, cands);
    }

    /**
     * 후보 목록에서 선택. 동점이면 앞쪽 후보 유지.
     */
    public String pickBest(Platform platform, List<String> candidates) {
        Set<String> uniq = new LinkedHashSet<>();
        for (String c : candidates) {
            String n = normalize(c);
            if (!n.isEmpty()) uniq.add(n);
        }
        if (uniq.isEmpty()) return "";

        String best = null;
        int bestScore = Integer.MIN_VALUE;
        for (String ref : uniq) {
            int sc = score(platform, ref);
            if (sc > bestScore) {
                best = ref;
                bestScore = sc;
            }
        }

        // 해시가 뽑혔는데 해시 아닌 후보가 있으면 그쪽으로 교체
        if (isProbablyHash(best)) {
            for (String ref : uniq) {
                if (!isProbablyHash(ref)) {
                    best = ref;
                    break;
                }
            }
        }
        return best;
    }

    /**
     * 점수가 높을수록 믿을 만함
     */
    int score(Platform platform, String ref) {
        if (ref == null || ref.isBlank()) return 0;
        String r = ref.trim();

        if (isProbablyHash(r)) return 5;

        if (RE_TRS_CORE.matcher(r).lookingAt()) return 100;
        if (RE_RCS_CORE.matcher(r).lookingAt()) return 95;
        if (RE_LAZ_INVOICE.matcher(r).lookingAt()) return 90;
        if (RE_TTSTH_CORE.matcher(r).lookingAt()) return 85;

        // Lazada 인보이스는 보통 TH... 로 길게 시작
        if (platform == Platform.LAZADA && r.toUpperCase().startsWith("TH") && r.length() >= 12) {
            return 80;
        }

        if (r.length() >= 10 && RE_GENERIC_TOKEN.matcher(r).matches()) return 60;

        return 30;
    }

    /**
     * 공백 제거 -> 확장자 제거 -> 코어 추출, 코어가 없으면 잡음 prefix 제거.
     * 같은 값을 다시 넣어도 결과가 같아야 한다.
     */
    public String normalize(String value) {
        String s = compact(value);
        if (s.isEmpty()) return "";
        s = stripExt(s);

        for (Pattern p : CORE_PATTERNS) {
            Matcher m = p.matcher(s);
            if (m.find()) return compact(m.group(1));
        }

        String stripped = s;
        String prev;
        do {
            prev = stripped;
            stripped = stripExt(RE_LEADING_NOISE.matcher(prev).replaceFirst("").trim());
        } while (!stripped.isEmpty() && !stripped.equals(prev));

        return stripped.isEmpty() ? s : stripped;
    }

    List<String> candidatesFromText(String text) {
        List<String> out = new ArrayList<>();
        if (text == null || text.isEmpty()) return out;

        // Lazada 인보이스 명시
        Matcher laz = RE_LAZ_INVOICE.matcher(text);
        while (laz.find()) out.add(normalize(laz.group(1)));

        // "Invoice No." 블록
        Matcher inv = RE_INVNO_BLOCK.matcher(text);
        while (inv.find()) out.add(normalize(inv.group(1)));

        for (Pattern p : List.of(RE_TRS_CORE, RE_RCS_CORE, RE_TTSTH_CORE)) {
            Matcher m = p.matcher(text);
            while (m.find()) out.add(normalize(m.group(1)));
        }
        return new ArrayList<>(new LinkedHashSet<>(out));
    }

    public static boolean isProbablyHash(String s) {
        return s != null && !s.isBlank() && RE_HASH32.matcher(s.trim()).matches();
    }

    static String compact(String v) {
        if (v == null) return "";
        return RE_WS.matcher(v.trim()).replaceAll("");
    }

    private static String stripExt(String s) {
        String prev;
        String cur = s;
        do {
            prev = cur;
            cur = RE_EXT.matcher(prev).replaceFirst("").trim();
        } while (!cur.equals(prev));
        return cur;
    }
}
