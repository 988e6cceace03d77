package com.example.peak.service;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Service;

import com.example.peak.config.PipelineSettings;
import com.example.peak.model.ClientCompany;
import com.example.peak.model.ExtractOptions;
import com.example.peak.model.PeakColumn;
import com.example.peak.model.PeakRow;
import com.example.peak.model.Platform;
import com.example.peak.utils.TaxIdUtils;

/**
 * 우리 회사 식별 (taxId), 회사 표시명, GL 계정코드
 */
@Service
public class ClientIdentityResolver {

    private static final Pattern RE_TAX13 = Pattern.compile("(?<!\\d)(\\d(?:[\\s-]?\\d){12})(?!\\d)");

    private final PipelineSettings settings;

    public ClientIdentityResolver(PipelineSettings settings) {
        this.settings = settings;
    }

    /**
     * 인자 > cfg.client_tax_id > cfg.client_tax_ids(1개) > client_tags > 첫 번째 id > 본문에 나온 우리 회사 taxId
     */
    public String resolveClientTaxId(String clientTaxId, ExtractOptions opts, String text) {
        if (clientTaxId != null && !clientTaxId.isBlank()) return clientTaxId.trim();

        ExtractOptions o = opts == null ? ExtractOptions.defaults() : opts;
        if (!o.getClientTaxId().isBlank()) return o.getClientTaxId().trim();

        List<String> ids = o.getClientTaxIds();
        if (ids.size() == 1) return ids.get(0).trim();

        for (String tag : o.getClientTags()) {
            ClientCompany c = ClientCompany.fromTag(tag);
            if (c == null) continue;
            if (ids.isEmpty() || ids.stream().anyMatch(id -> c.taxId().equals(TaxIdUtils.digitsOnly(id)))) {
                return c.taxId();
            }
        }

        if (!ids.isEmpty()) return ids.get(0).trim();

        ClientCompany fromText = detectFromText(text);
        return fromText == null ? "" : fromText.taxId();
    }

    /** 본문에 우리 회사 taxId 가 찍혀 있으면 그 회사 */
    public ClientCompany detectFromText(String text) {
        if (text == null || text.isEmpty()) return null;
        Matcher m = RE_TAX13.matcher(TaxIdUtils.thaiDigitsToArabic(text));
        while (m.find()) {
            ClientCompany c = ClientCompany.fromTaxId(m.group(1));
            if (c != null) return c;
        }
        return null;
    }

    /**
     * cfg.company_name_by_tax_id > 설정 오버라이드 > 기본 이름
     */
    public String companyName(String clientTaxId, ExtractOptions opts) {
        if (clientTaxId == null || clientTaxId.isBlank()) return "";
        ExtractOptions o = opts == null ? ExtractOptions.defaults() : opts;

        Object v = o.getCompanyNameByTaxId().get(clientTaxId.trim());
        if (v instanceof String && !((String) v).isBlank()) return ((String) v).trim();

        ClientCompany company = ClientCompany.fromTaxId(clientTaxId);
        if (company == null) return "";
        String override = settings.companyNameOverride(company);
        return override.isEmpty() ? company.defaultName() : override;
    }

    /**
     * GL 계정코드 우선순위:
     * cfg.gl_code_map(회사 단일값 또는 회사별 버킷) > 설정 오버라이드 > extractor 값 > 비용 그룹명
     */
    public String glCode(String clientTaxId, Platform platform, PeakRow row, ExtractOptions opts) {
        ExtractOptions o = opts == null ? ExtractOptions.defaults() : opts;
        String ctax = clientTaxId == null ? "" : clientTaxId.trim();

        if (!ctax.isEmpty()) {
            Object v = o.getGlCodeMap().get(ctax);
            if (v instanceof String && !((String) v).isBlank()) return ((String) v).trim();
            if (v instanceof Map) {
                Map<?, ?> byBucket = (Map<?, ?>) v;
                Platform p = platform == null ? Platform.UNKNOWN : platform;
                Object vv = byBucket.get(p.glBucket().name());
                if (!(vv instanceof String) || ((String) vv).isBlank()) {
                    vv = byBucket.get(Platform.GlBucket.DEFAULT.name());
                }
                if (vv instanceof String && !((String) vv).isBlank()) return ((String) vv).trim();
            }

            String override = settings.glCodeOverride(ClientCompany.fromTaxId(ctax));
            if (!override.isEmpty()) return override;
        }

        String cur = row.get(PeakColumn.K_ACCOUNT).trim();
        if (!cur.isEmpty()) return cur;

        return row.get(PeakColumn.U_GROUP).trim();
    }
}
