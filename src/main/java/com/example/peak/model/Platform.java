package com.example.peak.model;

/**
 * 문서 플랫폼 구분 + 플랫폼별 기본값 (그룹/설명/VAT/가격유형/GL 버킷)
 */
public enum Platform {

    META("Advertising Expense", "Meta Ads", GlBucket.ADS),
    GOOGLE("Advertising Expense", "Google Ads", GlBucket.ADS),
    SHOPEE("Marketplace Expense", "Shopee Marketplace Fee", GlBucket.MARKETPLACE),
    LAZADA("Marketplace Expense", "Lazada Marketplace Fee", GlBucket.MARKETPLACE),
    TIKTOK("Marketplace Expense", "TikTok Shop Fee", GlBucket.MARKETPLACE),
    SPX("Marketplace Expense", "Shopee Express", GlBucket.MARKETPLACE),
    THAI_TAX("General Expense", "Tax Invoice", GlBucket.DEFAULT),
    UNKNOWN("Other Expense", "", GlBucket.DEFAULT);

    public enum GlBucket { ADS, MARKETPLACE, DEFAULT }

    public static final String MARKETPLACE_GROUP = "Marketplace Expense";

    private final String group;
    private final String description;
    private final GlBucket glBucket;

    Platform(String group, String description, GlBucket glBucket) {
        this.group = group;
        this.description = description;
        this.glBucket = glBucket;
    }

    public String group() {
        return group;
    }

    public String description() {
        return description;
    }

    public GlBucket glBucket() {
        return glBucket;
    }

    public boolean isAds() {
        return glBucket == GlBucket.ADS;
    }

    public boolean isMarketplace() {
        return glBucket == GlBucket.MARKETPLACE;
    }

    /** 광고 영수증은 VAT 없음, 마켓플레이스는 7% */
    public String defaultVatRate() {
        return isAds() ? "NO" : "7%";
    }

    public String defaultPriceType() {
        return isAds() ? "3" : "1";
    }

    /**
     * 분류기 라벨 -> Platform. 모르는 값은 UNKNOWN (generic 라우트)
     */
    public static Platform fromLabel(String label) {
        if (label == null || label.isBlank()) return UNKNOWN;
        String t = label.trim().toUpperCase().replace('-', '_').replace(' ', '_');

        return switch (t) {
            case "META", "FACEBOOK", "META_ADS", "FB" -> META;
            case "GOOGLE", "GOOGLE_ADS", "ADWORDS" -> GOOGLE;
            case "SHOPEE" -> SHOPEE;
            case "LAZADA", "LZD" -> LAZADA;
            case "TIKTOK", "TIKTOK_SHOP" -> TIKTOK;
            case "SPX", "SHOPEE_EXPRESS", "SPX_EXPRESS" -> SPX;
            case "THAI_TAX", "TAX_INVOICE" -> THAI_TAX;
            default -> UNKNOWN;
        };
    }
}
