package com.buhmwoo.docsearch.modules.search.application.ranking;

import org.springframework.stereotype.Component;

/**
 * 편집 거리 기반 근사 문자열 비교기입니다.
 * <p>
 * 검색어 × 토큰 조합마다 호출되므로, 길이 차이만으로 판정 가능한 경우는 거리 계산 없이 바로 탈락시킵니다.
 * 태국어가 섞인 경우 {@link ThaiText#fold(String)} 결과끼리 비교합니다.
 */
@Component
public class FuzzyMatcher {

    /**
     * Levenshtein 거리. 두 행만 유지해 메모리를 O(min) 으로 씁니다.
     */
    public int distance(String a, String b) {
        if (a.equals(b)) {
            return 0;
        }
        if (a.isEmpty()) {
            return b.length();
        }
        if (b.isEmpty()) {
            return a.length();
        }
        // 짧은 쪽을 열로 둡니다
        String rows = a.length() >= b.length() ? a : b;
        String cols = rows == a ? b : a;

        int[] prev = new int[cols.length() + 1];
        int[] curr = new int[cols.length() + 1];
        for (int j = 0; j <= cols.length(); j++) {
            prev[j] = j;
        }
        for (int i = 1; i <= rows.length(); i++) {
            curr[0] = i;
            char rc = rows.charAt(i - 1);
            for (int j = 1; j <= cols.length(); j++) {
                int cost = rc == cols.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[cols.length()];
    }

    /**
     * (최대 길이 - 거리) / 최대 길이. 동일 문자열은 1.0 입니다.
     */
    public double similarity(String a, String b) {
        if (a.equals(b)) {
            return 1.0;
        }
        int maxLength = Math.max(a.length(), b.length());
        if (maxLength == 0) {
            return 1.0;
        }
        return (double) (maxLength - distance(a, b)) / maxLength;
    }

    /**
     * 검색어와 후보 토큰이 퍼지 일치하면 유사도를, 아니면 0 을 돌려줍니다.
     */
    public double match(String term, String candidate, FuzzySettings settings) {
        if (term == null || candidate == null || term.isEmpty() || candidate.isEmpty()) {
            return 0.0;
        }

        boolean thai = ThaiText.containsThai(term) || ThaiText.containsThai(candidate);
        String left = thai ? ThaiText.fold(term) : term;
        String right = thai ? ThaiText.fold(candidate) : candidate;
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }

        int lengthGap = Math.abs(left.length() - right.length());
        if (lengthGap > settings.maxLengthDifference()) {
            return 0.0;
        }

        double threshold = thresholdFor(term, thai, settings);
        int maxLength = Math.max(left.length(), right.length());
        // 거리는 길이 차보다 작을 수 없으므로 상한만으로 탈락 여부를 먼저 봅니다
        if ((double) (maxLength - lengthGap) / maxLength < threshold) {
            return 0.0;
        }

        double similarity = similarity(left, right);
        return similarity >= threshold ? similarity : 0.0;
    }

    double thresholdFor(String term, boolean thai, FuzzySettings settings) {
        if (thai) {
            return settings.thaiThreshold();
        }
        return term.length() <= settings.shortTermMaxLength()
                ? settings.shortTermThreshold()
                : settings.threshold();
    }
}
