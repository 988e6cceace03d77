package com.example.peak.classify;

import org.springframework.stereotype.Component;

/**
 * 키워드 점수 기반 플랫폼 분류 (본문 + 파일명)
 */
@Component
public class KeywordPlatformClassifier implements PlatformClassifier {

    @Override
    public Classified classify(String text, String filename) {
        String body = text == null ? "" : text.toLowerCase();
        String file = filename == null ? "" : filename.toLowerCase();
        String upper = text == null ? "" : text.toUpperCase();

        int meta = 0;
        int google = 0;
        int shopee = 0;
        int spx = 0;
        int lazada = 0;
        int tiktok = 0;
        int thaiTax = 0;

        // 1) 광고 (Meta / Google)
        if (body.contains("meta platforms")) meta += 6;
        if (body.contains("facebook")) meta += 4;
        if (body.contains("meta ads") || body.contains("ads manager")) meta += 3;
        if (file.contains("facebook") || file.contains("meta")) meta += 2;

        if (body.contains("google asia pacific")) google += 6;
        if (body.contains("google ads") || body.contains("adwords")) google += 4;
        if (file.contains("google")) google += 2;

        // 2) 마켓플레이스
        if (body.contains("shopee")) shopee += 4;
        if (body.contains("shopee (thailand)") || body.contains("ช้อปปี้")) shopee += 3;
        if (file.startsWith("shopee") || file.contains("shopee-ti")) shopee += 2;

        // SPX 는 shopee 문구와 같이 나오므로 가중치를 더 준다
        if (body.contains("shopee express") || body.contains("spx express")) spx += 9;
        if (upper.contains("SPX")) spx += 3;
        if (file.contains("spx")) spx += 2;

        if (body.contains("lazada")) lazada += 4;
        if (upper.contains("THMPTI")) lazada += 4;
        if (body.contains("ลาซาด้า")) lazada += 3;
        if (file.contains("lazada") || file.startsWith("laz")) lazada += 2;

        if (body.contains("tiktok")) tiktok += 4;
        if (upper.contains("TTSTH")) tiktok += 5;
        if (file.contains("tiktok")) tiktok += 2;

        // 3) 일반 세금계산서
        if (body.contains("ใบกำกับภาษี")) thaiTax += 3;
        if (body.contains("tax invoice")) thaiTax += 2;
        if (body.contains("เลขประจำตัวผู้เสียภาษี")) thaiTax += 1;

        // 최종 선택. 동점이면 위쪽 우선
        // 우선순위: SPX > TikTok > Lazada > Shopee > Meta > Google > Thai tax
        int best = max(spx, tiktok, lazada, shopee, meta, google, thaiTax);
        if (best <= 0) return new Classified("UNKNOWN", 0.10);

        if (best == spx) return new Classified("SPX", conf(best));
        if (best == tiktok) return new Classified("TIKTOK", conf(best));
        if (best == lazada) return new Classified("LAZADA", conf(best));
        if (best == shopee) return new Classified("SHOPEE", conf(best));
        if (best == meta) return new Classified("META", conf(best));
        if (best == google) return new Classified("GOOGLE", conf(best));
        return new Classified("THAI_TAX", conf(best));
    }

    private int max(int... arr) {
        int m = Integer.MIN_VALUE;
        for (int v : arr) m = Math.max(m, v);
        return m;
    }

    private double conf(int score) {
        // 대충 0.45~0.95
        if (score >= 10) return 0.95;
        if (score >= 8) return 0.85;
        if (score >= 6) return 0.75;
        if (score >= 4) return 0.60;
        return 0.45;
    }
}
