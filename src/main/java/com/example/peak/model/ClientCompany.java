package com.example.peak.model;

import com.example.peak.utils.TaxIdUtils;

/**
 * 운영 회사(우리 회사) 목록. 지갑/GL 테이블 선택 기준.
 */
public enum ClientCompany {

    RABBIT("0105561071873", "RABBIT"),
    SHD("0105563022918", "SHD"),
    TOPONE("0105565027615", "TOPONE");

    private final String taxId;
    private final String defaultName;

    ClientCompany(String taxId, String defaultName) {
        this.taxId = taxId;
        this.defaultName = defaultName;
    }

    public String taxId() {
        return taxId;
    }

    public String defaultName() {
        return defaultName;
    }

    /** 숫자만 비교 (하이픈/공백/태국 숫자 섞여 있어도 처리) */
    public static ClientCompany fromTaxId(String raw) {
        String digits = TaxIdUtils.digitsOnly(raw);
        if (digits.isEmpty()) return null;
        for (ClientCompany c : values()) {
            if (c.taxId.equals(digits)) return c;
        }
        return null;
    }

    public static ClientCompany fromTag(String tag) {
        if (tag == null || tag.isBlank()) return null;
        String t = tag.trim().toUpperCase();
        for (ClientCompany c : values()) {
            if (c.name().equals(t)) return c;
        }
        return null;
    }
}
