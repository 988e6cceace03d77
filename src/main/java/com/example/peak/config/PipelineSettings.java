package com.example.peak.config;

import java.util.EnumMap;
import java.util.Map;

import com.example.peak.model.ClientCompany;

import lombok.Data;

/**
 * 프로세스 단위 설정 (application.properties / 환경변수). 요청 단위 옵션은 ExtractOptions.
 */
@Data
public class PipelineSettings {

    // 외부 보강(AI) 단계
    private boolean enableAiExtract = false;
    private boolean aiFillMissing = true;
    private boolean aiRepairPass = false;

    // 진단 메타 저장 여부
    private boolean storeClassifierMeta = true;
    private boolean storeWhtMeta = true;
    private boolean storeWalletMeta = true;
    private boolean storeVendorMeta = true;
    private boolean storeAiErrorMeta = true;

    // 회사별 오버라이드 (COMPANY_NAME_RABBIT, GL_CODE_RABBIT ...)
    private Map<ClientCompany, String> companyNames = new EnumMap<>(ClientCompany.class);
    private Map<ClientCompany, String> glCodes = new EnumMap<>(ClientCompany.class);

    public static PipelineSettings defaults() {
        return new PipelineSettings();
    }

    public String companyNameOverride(ClientCompany company) {
        if (company == null) return "";
        String v = companyNames.get(company);
        return v == null ? "" : v.trim();
    }

    public String glCodeOverride(ClientCompany company) {
        if (company == null) return "";
        String v = glCodes.get(company);
        return v == null ? "" : v.trim();
    }
}
