package com.buhmwoo.docsearch.modules.search.application.ranking;

import lombok.Builder;

import java.util.Set;

/**
 * 한 번의 검색 요청에 적용되는 랭킹 설정입니다. // ✅ 전역 설정과 호출 옵션을 합친 결과이며 엔진 컴포넌트는 이 값만 참조합니다.
 */
@Builder(toBuilder = true)
public record RankingSettings(
        double keywordWeight,
        double vectorWeight,
        double threshold,
        int vectorLimit,
        int minResults,
        int maxResults,
        double massFraction,
        double qualityFloor,
        double lexicalCeiling,
        double exactMatchBoost,
        double fuzzyTfWeight,
        double phraseWeight,
        double shortTermWeight,
        double termWeight,
        double expandedTermWeight,
        int parallelThreshold,
        FuzzySettings fuzzy,
        Set<String> stopWords
) {

    public RankingSettings {
        fuzzy = fuzzy == null ? FuzzySettings.defaults() : fuzzy;
        stopWords = stopWords == null ? StopWords.defaults() : Set.copyOf(stopWords);
    }

    public static RankingSettings defaults() {
        return RankingSettings.builder()
                .keywordWeight(0.5)
                .vectorWeight(0.5)
                .threshold(0.3)
                .vectorLimit(100)
                .minResults(5)
                .maxResults(8)
                .massFraction(0.9)
                .qualityFloor(0.05)
                .lexicalCeiling(2.0)
                .exactMatchBoost(1.2)
                .fuzzyTfWeight(0.7)
                .phraseWeight(2.0)
                .shortTermWeight(0.7)
                .termWeight(1.0)
                .expandedTermWeight(0.8)
                .parallelThreshold(200)
                .fuzzy(FuzzySettings.defaults())
                .stopWords(StopWords.defaults())
                .build();
    }
}
