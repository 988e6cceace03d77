package com.example.peak.service;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import com.example.peak.model.ClientCompany;

class WalletResolverTest {

    private static final String RABBIT = ClientCompany.RABBIT.taxId();
    private static final String TOPONE = ClientCompany.TOPONE.taxId();

    private static WalletResolver resolver;

    @BeforeAll
    static void loadTables() {
        resolver = new WalletResolver(new WalletMappingTables());
    }

    @Test
    void knownSellerIdMapsToWallet() {
        assertThat(resolver.resolve(RABBIT, "253227155", "", "")).isEqualTo("EWL001");
    }

    @Test
    void unknownSellerIdGivesEmpty() {
        assertThat(resolver.resolve(RABBIT, "999999999", "", "")).isEmpty();
    }

    @Test
    void sellerIdWithSeparatorsAndThaiDigitsIsNormalized() {
        assertThat(resolver.resolve(RABBIT, " 253-227-155 ", "", "")).isEqualTo("EWL001");
        assertThat(resolver.resolve(RABBIT, "๒๕๓๒๒๗๑๕๕", "", "")).isEqualTo("EWL001");
    }

    @Test
    void alphanumericIdIsCaseInsensitive() {
        assertThat(resolver.resolve(TOPONE, "th1k0cdiml", "", "")).isEqualTo("EWL003");
    }

    @Test
    void longerKeywordWinsOverEarlierShorterOne() {
        // "mova" 가 파일에서 먼저 나오지만 "rabbit" 이 더 길다
        assertThat(resolver.resolve(RABBIT, "", "Rabbit Mova Shop", "")).isEqualTo("EWL010");
    }

    @Test
    void platformNameGuardNeverMatches() {
        assertThat(resolver.resolve(TOPONE, "", "Lazada Official", "")).isEmpty();
        assertThat(resolver.resolve(TOPONE, "", "tiktok", "")).isEmpty();
    }

    @Test
    void sellerIdFromTextOnlyWhenNoIdGiven() {
        String text = "Shopee Tax Invoice\nSeller ID: 538498056";

        assertThat(resolver.resolve(TOPONE, "", "", text)).isEqualTo("EWL001");
        assertThat(resolver.resolve(TOPONE, "123456789", "", text)).isEmpty();
    }

    @Test
    void unknownCompanyHasNoTable() {
        assertThat(resolver.resolve("0000000000000", "253227155", "70mai", "")).isEmpty();
        assertThat(resolver.resolve("", "253227155", "70mai", "")).isEmpty();
    }

    @Test
    void resultIsAlwaysWalletCodeOrEmpty() {
        String[] shops = {"Shopee", "Lazada", "TikTok", "SPX Express", "shopee-70mai", "unknown"};
        for (String shop : shops) {
            String code = resolver.resolve(TOPONE, "", shop, shop);
            assertThat(code.isEmpty() || WalletResolver.isValidWallet(code)).as(shop).isTrue();
        }
    }

    @Test
    void extractSellerIdFromText() {
        assertThat(resolver.extractSellerId("Seller ID: 253227155")).isEqualTo("253227155");
        assertThat(resolver.extractSellerId("Shop: THLC6LWARA")).isEqualTo("THLC6LWARA");
        assertThat(resolver.extractSellerId("Bangkok THAILAND")).isEmpty();
    }
}
