package com.example.peak.service;

import com.example.peak.model.CollaboratorResult;

/**
 * 우리 회사 + 판매자(taxId / 이름) -> PEAK 거래처 코드 (Cxxxxx)
 */
public interface VendorCodeLookup {

    CollaboratorResult<String> lookup(String clientTaxId, String vendorTaxId, String vendorName);

    /** 조회 테이블 없음 */
    VendorCodeLookup NONE = (clientTaxId, vendorTaxId, vendorName) -> CollaboratorResult.unavailable();
}
