package com.example.peak.service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import com.example.peak.model.ClientCompany;

/**
 * 회사별 지갑 매핑 테이블 (seller id -> EWLxxx, 상점명 키워드 -> EWLxxx).
 * 기동 시 classpath 에서 한 번만 읽고 이후에는 읽기 전용.
 */
@Component
public class WalletMappingTables {

    private static final Logger log = LoggerFactory.getLogger(WalletMappingTables.class);

    private final Map<ClientCompany, Map<String, String>> byId;
    private final Map<ClientCompany, List<Map.Entry<String, String>>> byKeyword;

    public WalletMappingTables() {
        this("wallet");
    }

    public WalletMappingTables(String basePath) {
        Map<ClientCompany, Map<String, String>> ids = new EnumMap<>(ClientCompany.class);
        Map<ClientCompany, List<Map.Entry<String, String>>> keywords = new EnumMap<>(ClientCompany.class);

        for (ClientCompany c : ClientCompany.values()) {
            String prefix = basePath + "/" + c.name().toLowerCase();

            Map<String, String> idTable = new LinkedHashMap<>();
            for (Map.Entry<String, String> e : loadFile(prefix + "_seller_ids.txt").entrySet()) {
                String key = WalletResolver.normalizeId(e.getKey());
                if (!key.isEmpty()) idTable.put(key, e.getValue());
            }
            ids.put(c, Collections.unmodifiableMap(idTable));

            // 긴 키워드 우선 (동일 길이는 파일 순서 유지)
            List<Map.Entry<String, String>> kw = new ArrayList<>();
            for (Map.Entry<String, String> e : loadFile(prefix + "_shop_keywords.txt").entrySet()) {
                String key = WalletResolver.normalizeName(e.getKey());
                if (!key.isEmpty()) kw.add(Map.entry(key, e.getValue()));
            }
            kw.sort(Comparator.comparingInt((Map.Entry<String, String> e) -> e.getKey().length()).reversed());
            keywords.put(c, Collections.unmodifiableList(kw));

            log.info("wallet table loaded: company={} ids={} keywords={}", c, idTable.size(), kw.size());
        }

        this.byId = Collections.unmodifiableMap(ids);
        this.byKeyword = Collections.unmodifiableMap(keywords);
    }

    public Map<String, String> idTable(ClientCompany company) {
        if (company == null) return Collections.emptyMap();
        return byId.getOrDefault(company, Collections.emptyMap());
    }

    /** 긴 키워드부터 정렬된 목록 */
    public List<Map.Entry<String, String>> keywordTable(ClientCompany company) {
        if (company == null) return Collections.emptyList();
        return byKeyword.getOrDefault(company, Collections.emptyList());
    }

    /**
     * "key=code" 형식 파일 로드. '#' 주석/빈 줄 무시. code 가 비어 있으면 매칭 금지 키워드
     */
    private Map<String, String> loadFile(String path) {
        Map<String, String> out = new LinkedHashMap<>();
        ClassPathResource resource = new ClassPathResource(path);
        if (!resource.exists()) {
            log.warn("wallet table not found: {}", path);
            return out;
        }

        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String l = line.trim();
                if (l.isEmpty() || l.startsWith("#")) continue;
                int eq = l.indexOf('=');
                if (eq <= 0) continue;
                out.put(l.substring(0, eq).trim(), l.substring(eq + 1).trim());
            }
        } catch (IOException e) {
            throw new IllegalStateException("failed to load wallet table: " + path, e);
        }
        return out;
    }
}
