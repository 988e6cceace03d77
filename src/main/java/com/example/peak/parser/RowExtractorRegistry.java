package com.example.peak.parser;

import java.util.EnumMap;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.example.peak.model.Platform;

/**
 * 플랫폼 -> extractor. 전용 extractor 가 없는 플랫폼은 generic.
 */
@Component
public class RowExtractorRegistry {

    private final Map<Platform, RowExtractor> map = new EnumMap<>(Platform.class);
    private final RowExtractor generic;

    public RowExtractorRegistry(TikTokRowExtractor tiktok, GenericRowExtractor generic) {
        this.generic = generic;

        map.put(Platform.TIKTOK, tiktok);
        // META / GOOGLE / SHOPEE / LAZADA / SPX / THAI_TAX 전용 extractor 는 아직 없음 -> generic
        map.put(Platform.UNKNOWN, generic);
    }

    public RowExtractor get(Platform platform) {
        if (platform == null) return generic;
        return map.getOrDefault(platform, generic);
    }

    public RowExtractor generic() {
        return generic;
    }

    /**
     * 진단용 추출 방식 이름: rule_based_tiktok / generic / generic_spx_fallback ...
     */
    public String methodFor(Platform platform) {
        RowExtractor e = get(platform);
        if (e != generic || platform == null || platform == Platform.UNKNOWN) return e.method();
        return "generic_" + platform.name().toLowerCase() + "_fallback";
    }
}
