package com.example.peak.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import com.example.peak.model.ClientCompany;
import com.example.peak.service.RowEnhancer;
import com.example.peak.service.VendorCodeLookup;

@Configuration
public class PeakPipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PeakPipelineConfig.class);

    // application.properties (환경변수로 덮어쓰기 가능)
    @Value("${peak.ai.extract-enabled:false}")
    private boolean enableAiExtract;

    @Value("${peak.ai.fill-missing:true}")
    private boolean aiFillMissing;

    @Value("${peak.ai.repair-pass:false}")
    private boolean aiRepairPass;

    @Value("${peak.meta.classifier:true}")
    private boolean storeClassifierMeta;

    @Value("${peak.meta.wht:true}")
    private boolean storeWhtMeta;

    @Value("${peak.meta.wallet-mapping:true}")
    private boolean storeWalletMeta;

    @Value("${peak.meta.vendor-mapping:true}")
    private boolean storeVendorMeta;

    @Value("${peak.meta.ai-error:true}")
    private boolean storeAiErrorMeta;

    /**
     * 프로세스 단위 설정. 회사별 이름/GL 오버라이드는 peak.company-name.{tag} / peak.gl-code.{tag}
     */
    @Bean
    public PipelineSettings pipelineSettings(Environment env) {
        PipelineSettings s = new PipelineSettings();
        s.setEnableAiExtract(enableAiExtract);
        s.setAiFillMissing(aiFillMissing);
        s.setAiRepairPass(aiRepairPass);
        s.setStoreClassifierMeta(storeClassifierMeta);
        s.setStoreWhtMeta(storeWhtMeta);
        s.setStoreWalletMeta(storeWalletMeta);
        s.setStoreVendorMeta(storeVendorMeta);
        s.setStoreAiErrorMeta(storeAiErrorMeta);

        for (ClientCompany c : ClientCompany.values()) {
            String tag = c.name().toLowerCase();
            String name = env.getProperty("peak.company-name." + tag, "");
            String gl = env.getProperty("peak.gl-code." + tag, "");
            if (!name.isBlank()) s.getCompanyNames().put(c, name.trim());
            if (!gl.isBlank()) s.getGlCodes().put(c, gl.trim());
        }

        log.info("pipeline settings: aiExtract={} aiFillMissing={} aiRepair={} glOverrides={}",
                enableAiExtract, aiFillMissing, aiRepairPass, s.getGlCodes().keySet());
        return s;
    }

    /** 보강 구현이 등록되지 않으면 비활성 */
    @Bean
    @ConditionalOnMissingBean(RowEnhancer.class)
    public RowEnhancer rowEnhancer() {
        return RowEnhancer.DISABLED;
    }

    @Bean
    @ConditionalOnMissingBean(VendorCodeLookup.class)
    public VendorCodeLookup vendorCodeLookup() {
        return VendorCodeLookup.NONE;
    }
}
