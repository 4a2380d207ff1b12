package com.buhmwoo.docsearch.modules.search.application.ranking;

import java.util.List;

/**
 * 검색어가 청크에 어떻게 매칭되었는지 남기는 진단용 레코드입니다.
 *
 * @param term      매칭된 검색어
 * @param score     해당 검색어가 청크 점수에 기여한 값
 * @param positions 원문 기준 문자 오프셋(하이라이트용)
 * @param wasFuzzy  정확 일치 없이 퍼지 매칭으로만 잡혔는지 여부
 */
public record MatchDetail(
        String term,
        double score,
        List<Integer> positions,
        boolean wasFuzzy
) {

    public MatchDetail {
        positions = positions == null ? List.of() : List.copyOf(positions);
    }

    /**
     * 키워드 매칭 없이 벡터 유사도로만 선택된 청크의 매칭 기록입니다.
     */
    public static MatchDetail vector(String query, double vectorScore) {
        return new MatchDetail(query, vectorScore, List.of(), false);
    }
}
