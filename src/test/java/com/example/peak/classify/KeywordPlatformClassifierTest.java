package com.example.peak.classify;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class KeywordPlatformClassifierTest {

    private final KeywordPlatformClassifier classifier = new KeywordPlatformClassifier();

    @Test
    void tiktokInvoice() {
        PlatformClassifier.Classified c = classifier.classify(
                "TikTok Shop (Thailand) Ltd.\nTax Invoice\nInvoice No: TTSTH20250008665805", "a.pdf");

        assertThat(c.label).isEqualTo("TIKTOK");
        assertThat(c.confidence).isGreaterThan(0.5);
    }

    @Test
    void shopeeExpressBeatsShopee() {
        assertThat(classifier.classify("Shopee Express (Thailand) shipping fee", "").label).isEqualTo("SPX");
        assertThat(classifier.classify("Shopee (Thailand) Co., Ltd. commission", "").label).isEqualTo("SHOPEE");
    }

    @Test
    void lazadaByInvoicePrefix() {
        assertThat(classifier.classify("Invoice THMPTI2025000012345", "").label).isEqualTo("LAZADA");
    }

    @Test
    void adsPlatforms() {
        assertThat(classifier.classify("Meta Platforms Ireland Limited receipt", "").label).isEqualTo("META");
        assertThat(classifier.classify("Google Asia Pacific Pte. Ltd. Google Ads", "").label).isEqualTo("GOOGLE");
    }

    @Test
    void filenameAloneCanDecide() {
        assertThat(classifier.classify("", "Shopee-TIV-TRSPEMKP00.pdf").label).isEqualTo("SHOPEE");
    }

    @Test
    void thaiTaxInvoiceAndUnknown() {
        assertThat(classifier.classify("ใบกำกับภาษี บริษัท ตัวอย่าง จำกัด", "").label).isEqualTo("THAI_TAX");

        PlatformClassifier.Classified unknown = classifier.classify("hello", null);
        assertThat(unknown.label).isEqualTo("UNKNOWN");
        assertThat(unknown.confidence).isEqualTo(0.10);
    }
}
