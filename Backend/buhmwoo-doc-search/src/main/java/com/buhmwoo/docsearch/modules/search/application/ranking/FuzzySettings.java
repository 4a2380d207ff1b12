package com.buhmwoo.docsearch.modules.search.application.ranking;

import lombok.Builder;

/**
 * 퍼지 매칭 임계값 묶음입니다.
 *
 * @param shortTermThreshold  shortTermMaxLength 이하 검색어에 적용하는 유사도 하한
 * @param threshold           일반 검색어 유사도 하한
 * @param thaiThreshold       태국어 정규화 비교 시 유사도 하한
 * @param shortTermMaxLength  "짧은 검색어"로 보는 최대 길이
 * @param maxLengthDifference 거리 계산 전에 걸러낼 길이 차 상한
 * @param minTermLength       퍼지 매칭 대상이 되는 최소 검색어 길이
 */
@Builder(toBuilder = true)
public record FuzzySettings(
        double shortTermThreshold,
        double threshold,
        double thaiThreshold,
        int shortTermMaxLength,
        int maxLengthDifference,
        int minTermLength
) {

    public static FuzzySettings defaults() {
        return new FuzzySettings(0.8, 0.75, 0.75, 3, 2, 4);
    }
}
