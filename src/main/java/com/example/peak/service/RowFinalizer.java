package com.example.peak.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.example.peak.config.PipelineSettings;
import com.example.peak.model.ExtractOptions;
import com.example.peak.model.PeakColumn;
import com.example.peak.model.PeakRow;
import com.example.peak.model.Platform;
import com.example.peak.utils.DateUtils;

/**
 * 최종 정리 + 스키마 잠금.
 * 날짜 -> 회사 -> 플랫폼 기본값 -> 참조번호 -> 설명 -> 지갑 -> GL -> WHT -> 잠금 순서는 바꾸지 않는다.
 */
@Service
public class RowFinalizer {

    private static final Logger log = LoggerFactory.getLogger(RowFinalizer.class);

    static final String DESC_SEPARATOR = " \u2014 ";
    static final String TAG_SEPARATOR = " | ";

    private static final Pattern RE_SELLER_ID = Pattern.compile(
            "(?:seller\\s*id|shop\\s*id)\\s*[:#]?\\s*([0-9]{4,})", Pattern.CASE_INSENSITIVE);
    private static final Pattern RE_USERNAME = Pattern.compile(
            "(?:username|user\\s*name|shop\\s*name)\\s*[:#]?\\s*([A-Za-z0-9_.\\-]{3,})", Pattern.CASE_INSENSITIVE);
    private static final Pattern RE_TAGS_ONLY = Pattern.compile("^(?:SellerID|Username|File)=.*");

    private final ReferenceResolver referenceResolver;
    private final WalletResolver walletResolver;
    private final WhtPolicyEngine whtPolicyEngine;
    private final ClientIdentityResolver identityResolver;
    private final PipelineSettings settings;

    public RowFinalizer(ReferenceResolver referenceResolver,
                        WalletResolver walletResolver,
                        WhtPolicyEngine whtPolicyEngine,
                        ClientIdentityResolver identityResolver,
                        PipelineSettings settings) {
        this.referenceResolver = referenceResolver;
        this.walletResolver = walletResolver;
        this.whtPolicyEngine = whtPolicyEngine;
        this.identityResolver = identityResolver;
        this.settings = settings;
    }

    public Map<String, Object> finalizeRow(PeakRow row, Platform platform, String text, String filename,
                                           String clientTaxId, ExtractOptions opts) {
        Platform p = platform == null ? Platform.UNKNOWN : platform;
        ExtractOptions o = opts == null ? ExtractOptions.defaults() : opts;
        String t = text == null ? "" : text;

        // 비고는 항상 비움
        row.set(PeakColumn.T_NOTE, "");

        // 문서일자: 본문에서만 (파일명 금지)
        if (row.isBlank(PeakColumn.B_DOC_DATE)) {
            row.setIfBlank(PeakColumn.B_DOC_DATE, DateUtils.docDateFromText(t));
        }

        String ctax = identityResolver.resolveClientTaxId(clientTaxId, o, t);
        if (!ctax.isEmpty()) {
            row.setIfBlank(PeakColumn.A_COMPANY_NAME, identityResolver.companyName(ctax, o));
        }

        applyPlatformDefaults(row, p);

        String srcFile = sourceFilename(filename, row);
        String ref = referenceResolver.resolve(p, srcFile, row, t);
        row.set(PeakColumn.C_REFERENCE, ref);
        row.set(PeakColumn.G_INVOICE_NO, ref);

        String sellerId = guessSellerId(row, t);
        String username = guessUsername(row, t);
        row.set(PeakColumn.L_DESCRIPTION, buildDescription(row.get(PeakColumn.L_DESCRIPTION), p, sellerId, username, srcFile));

        if (row.isBlank(PeakColumn.Q_PAYMENT_METHOD)) {
            String shopName = firstNonBlank(row.hint("shop_name", "seller_name", "username"), username, srcFile);
            String wallet = walletResolver.resolve(ctax, sellerId, shopName, t);
            // 못 찾으면 비워 둔다 (검토 필요)
            row.set(PeakColumn.Q_PAYMENT_METHOD, wallet);
            if (!wallet.isEmpty() && settings.isStoreWalletMeta()) {
                row.putDiagnostic("_wallet_code_resolved", wallet);
            }
        }

        row.set(PeakColumn.K_ACCOUNT, identityResolver.glCode(ctax, p, row, o));

        // PEAK import 최소 기본값
        if (!row.isSet(PeakColumn.A_SEQ)) row.set(PeakColumn.A_SEQ, "");
        row.setIfBlank(PeakColumn.J_PRICE_TYPE, p.defaultPriceType());
        row.setIfBlank(PeakColumn.M_QTY, "1");
        row.setIfBlank(PeakColumn.O_VAT_RATE, p.defaultVatRate());

        whtPolicyEngine.apply(row, o, t);

        log.debug("row finalized: platform={} ref={} wallet={} account={}",
                p, ref, row.get(PeakColumn.Q_PAYMENT_METHOD), row.get(PeakColumn.K_ACCOUNT));
        return row.toLockedMap();
    }

    /**
     * extractor 가 비워 둔 그룹/설명/VAT/가격유형만 채운다
     */
    void applyPlatformDefaults(PeakRow row, Platform p) {
        row.setIfBlank(PeakColumn.U_GROUP, p.group());
        row.setIfBlank(PeakColumn.L_DESCRIPTION, p.description());

        if (p.isAds() || p.isMarketplace()) {
            row.setIfBlank(PeakColumn.O_VAT_RATE, p.defaultVatRate());
            row.setIfBlank(PeakColumn.J_PRICE_TYPE, p.defaultPriceType());
        }

        // 그룹명이 계정코드 자리에 들어온 경우
        if (p.isMarketplace() && Platform.MARKETPLACE_GROUP.equals(row.get(PeakColumn.K_ACCOUNT).trim())) {
            row.set(PeakColumn.K_ACCOUNT, "");
        }
    }

    /**
     * "기본설명 - SellerID=.. | Username=.. | File=.." (빈 태그 제외)
     */
    String buildDescription(String baseDesc, Platform p, String sellerId, String username, String srcFile) {
        String base = stripTags(baseDesc == null ? "" : baseDesc.trim());
        if (base.isEmpty()) base = p.description();

        List<String> tags = new ArrayList<>();
        if (!sellerId.isEmpty()) tags.add("SellerID=" + sellerId);
        if (!username.isEmpty()) tags.add("Username=" + username);
        if (!srcFile.isEmpty()) tags.add("File=" + srcFile);

        List<String> parts = new ArrayList<>();
        if (!base.isEmpty()) parts.add(base);
        if (!tags.isEmpty()) parts.add(String.join(TAG_SEPARATOR, tags));
        return String.join(DESC_SEPARATOR, parts).trim();
    }

    // 이미 정리된 설명을 다시 넣어도 태그가 중복되지 않게
    private String stripTags(String desc) {
        if (RE_TAGS_ONLY.matcher(desc).matches()) return "";
        int i = desc.indexOf(DESC_SEPARATOR);
        while (i >= 0) {
            if (RE_TAGS_ONLY.matcher(desc.substring(i + DESC_SEPARATOR.length())).matches()) {
                return desc.substring(0, i).trim();
            }
            i = desc.indexOf(DESC_SEPARATOR, i + 1);
        }
        return desc;
    }

    String guessSellerId(PeakRow row, String text) {
        String v = row.hint("seller_id", "sellerId", "shop_id", "shopid", "shopId", "merchant_id", "merchantId");
        if (!v.isEmpty()) return v;
        Matcher m = RE_SELLER_ID.matcher(text);
        return m.find() ? m.group(1).trim() : "";
    }

    String guessUsername(PeakRow row, String text) {
        String v = row.hint("username", "user_name", "seller_username", "shop_name", "shopName", "sellerName");
        if (!v.isEmpty()) return v;
        Matcher m = RE_USERNAME.matcher(text);
        return m.find() ? m.group(1).trim() : "";
    }

    /**
     * 넘겨받은 파일명 우선, 없으면 행에 남아 있는 파일명 메타
     */
    static String sourceFilename(String filename, PeakRow row) {
        if (filename != null && !filename.isBlank()) return basename(filename.trim());

        String v = row.hint("filename", "source_file", "file");
        if (v.isEmpty()) {
            for (String k : List.of("_filename", "_source_file", "_file")) {
                String d = row.diagnosticText(k).trim();
                if (!d.isEmpty()) {
                    v = d;
                    break;
                }
            }
        }
        return v.isEmpty() ? "" : basename(v);
    }

    private static String basename(String path) {
        int i = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return i >= 0 ? path.substring(i + 1) : path;
    }

    private static String firstNonBlank(String... arr) {
        for (String s : arr) if (s != null && !s.isBlank()) return s.trim();
        return "";
    }
}
