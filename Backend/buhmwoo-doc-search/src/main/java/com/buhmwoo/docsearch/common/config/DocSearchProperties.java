package com.buhmwoo.docsearch.common.config;

import jakarta.annotation.PostConstruct;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 검색 서비스 전역 설정입니다. // ✅ ranking 하위 값은 요청마다 RankingSettings 로 복사되어 엔진에 전달됩니다.
 */
@Component
@ConfigurationProperties(prefix = "docsearch")
@Validated
public class DocSearchProperties {

    private static final Logger log = LoggerFactory.getLogger(DocSearchProperties.class);

    @Validated
    public static class Rag {
        @NotBlank
        private String backendUrl;

        @NotNull
        private Duration timeout = Duration.ofSeconds(15); // ✅ 청크/메타데이터 조회 대기 상한

        @NotNull
        private Duration vectorTimeout = Duration.ofSeconds(10); // ✅ 벡터 검색은 초과 시 키워드 단독으로 진행합니다.

        public String getBackendUrl() { return backendUrl; }
        public void setBackendUrl(String backendUrl) { this.backendUrl = backendUrl; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }

        public Duration getVectorTimeout() { return vectorTimeout; }
        public void setVectorTimeout(Duration vectorTimeout) { this.vectorTimeout = vectorTimeout; }
    }

    @Validated
    public static class Expansion {
        private boolean enabled;
        private Duration timeout = Duration.ofSeconds(5);

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double minConfidence = 0.3; // ✅ 이보다 낮은 신뢰도의 확장 결과는 버리고 원래 검색어만 씁니다.

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }

        public double getMinConfidence() { return minConfidence; }
        public void setMinConfidence(double minConfidence) { this.minConfidence = minConfidence; }
    }

    /**
     * 퍼지 매칭 임계값. 경험적으로 정한 값이라 운영 데이터로 재보정이 필요합니다.
     */
    @Validated
    public static class Fuzzy {
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double shortTermThreshold = 0.8;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double threshold = 0.75;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double thaiThreshold = 0.75;
        @Min(1)
        private int shortTermMaxLength = 3;
        @Min(0)
        private int maxLengthDifference = 2;
        @Min(1)
        private int minTermLength = 4;

        public double getShortTermThreshold() { return shortTermThreshold; }
        public void setShortTermThreshold(double shortTermThreshold) { this.shortTermThreshold = shortTermThreshold; }

        public double getThreshold() { return threshold; }
        public void setThreshold(double threshold) { this.threshold = threshold; }

        public double getThaiThreshold() { return thaiThreshold; }
        public void setThaiThreshold(double thaiThreshold) { this.thaiThreshold = thaiThreshold; }

        public int getShortTermMaxLength() { return shortTermMaxLength; }
        public void setShortTermMaxLength(int shortTermMaxLength) { this.shortTermMaxLength = shortTermMaxLength; }

        public int getMaxLengthDifference() { return maxLengthDifference; }
        public void setMaxLengthDifference(int maxLengthDifference) { this.maxLengthDifference = maxLengthDifference; }

        public int getMinTermLength() { return minTermLength; }
        public void setMinTermLength(int minTermLength) { this.minTermLength = minTermLength; }
    }

    @Validated
    public static class Ranking {
        @DecimalMin("0.0")
        private double keywordWeight = 0.5;
        @DecimalMin("0.0")
        private double vectorWeight = 0.5;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double threshold = 0.3;
        @Min(1)
        private int vectorLimit = 100;
        @Min(1)
        private int minResults = 5;
        @Min(1)
        private int maxResults = 8;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double massFraction = 0.9;
        @DecimalMin("0.0")
        private double qualityFloor = 0.05;
        @DecimalMin("0.000001")
        private double lexicalCeiling = 2.0;
        private double exactMatchBoost = 1.2;
        private double fuzzyTfWeight = 0.7;
        private double phraseWeight = 2.0;
        private double shortTermWeight = 0.7;
        private double termWeight = 1.0;
        private double expandedTermWeight = 0.8;
        @Min(1)
        private int parallelThreshold = 200;
        private List<String> extraStopWords = new ArrayList<>();

        @Valid
        private Fuzzy fuzzy = new Fuzzy();

        public double getKeywordWeight() { return keywordWeight; }
        public void setKeywordWeight(double keywordWeight) { this.keywordWeight = keywordWeight; }

        public double getVectorWeight() { return vectorWeight; }
        public void setVectorWeight(double vectorWeight) { this.vectorWeight = vectorWeight; }

        public double getThreshold() { return threshold; }
        public void setThreshold(double threshold) { this.threshold = threshold; }

        public int getVectorLimit() { return vectorLimit; }
        public void setVectorLimit(int vectorLimit) { this.vectorLimit = vectorLimit; }

        public int getMinResults() { return minResults; }
        public void setMinResults(int minResults) { this.minResults = minResults; }

        public int getMaxResults() { return maxResults; }
        public void setMaxResults(int maxResults) { this.maxResults = maxResults; }

        public double getMassFraction() { return massFraction; }
        public void setMassFraction(double massFraction) { this.massFraction = massFraction; }

        public double getQualityFloor() { return qualityFloor; }
        public void setQualityFloor(double qualityFloor) { this.qualityFloor = qualityFloor; }

        public double getLexicalCeiling() { return lexicalCeiling; }
        public void setLexicalCeiling(double lexicalCeiling) { this.lexicalCeiling = lexicalCeiling; }

        public double getExactMatchBoost() { return exactMatchBoost; }
        public void setExactMatchBoost(double exactMatchBoost) { this.exactMatchBoost = exactMatchBoost; }

        public double getFuzzyTfWeight() { return fuzzyTfWeight; }
        public void setFuzzyTfWeight(double fuzzyTfWeight) { this.fuzzyTfWeight = fuzzyTfWeight; }

        public double getPhraseWeight() { return phraseWeight; }
        public void setPhraseWeight(double phraseWeight) { this.phraseWeight = phraseWeight; }

        public double getShortTermWeight() { return shortTermWeight; }
        public void setShortTermWeight(double shortTermWeight) { this.shortTermWeight = shortTermWeight; }

        public double getTermWeight() { return termWeight; }
        public void setTermWeight(double termWeight) { this.termWeight = termWeight; }

        public double getExpandedTermWeight() { return expandedTermWeight; }
        public void setExpandedTermWeight(double expandedTermWeight) { this.expandedTermWeight = expandedTermWeight; }

        public int getParallelThreshold() { return parallelThreshold; }
        public void setParallelThreshold(int parallelThreshold) { this.parallelThreshold = parallelThreshold; }

        public List<String> getExtraStopWords() { return extraStopWords; }
        public void setExtraStopWords(List<String> extraStopWords) { this.extraStopWords = extraStopWords; }

        public Fuzzy getFuzzy() { return fuzzy; }
        public void setFuzzy(Fuzzy fuzzy) { this.fuzzy = fuzzy; }
    }

    @Valid
    private Rag rag = new Rag();
    @Valid
    private Expansion expansion = new Expansion();
    @Valid
    private Ranking ranking = new Ranking();

    public Rag getRag() { return rag; }
    public void setRag(Rag rag) { this.rag = rag; }

    public Expansion getExpansion() { return expansion; }
    public void setExpansion(Expansion expansion) { this.expansion = expansion; }

    public Ranking getRanking() { return ranking; }
    public void setRanking(Ranking ranking) { this.ranking = ranking; }

    @PostConstruct
    void logProps() {
        log.info("[BOOT] docsearch.rag.backendUrl={}", rag != null ? rag.getBackendUrl() : null);
        log.info("[BOOT] docsearch.expansion.enabled={}", expansion != null && expansion.isEnabled());
        if (ranking != null) {
            log.info("[BOOT] docsearch.ranking weights={}/{} threshold={} bounds=[{},{}] mass={}",
                    ranking.getKeywordWeight(), ranking.getVectorWeight(), ranking.getThreshold(),
                    ranking.getMinResults(), ranking.getMaxResults(), ranking.getMassFraction());
        }
    }
}
