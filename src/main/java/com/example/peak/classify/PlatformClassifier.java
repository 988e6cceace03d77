package com.example.peak.classify;

public interface PlatformClassifier {

    class Classified {
        public final String label;       // 분류기 원본 라벨 (_platform_raw)
        public final double confidence;

        public Classified(String label, double confidence) {
            this.label = label;
            this.confidence = confidence;
        }
    }

    Classified classify(String text, String filename);
}
