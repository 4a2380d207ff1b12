package com.buhmwoo.docsearch.modules.search.application.source;

import java.util.List;

/**
 * 키워드 확장 결과입니다.
 *
 * @param expandedTerms 확장된 검색어
 * @param contextual    대화 이력과 연관된 확장인지 여부
 * @param confidence    확장 결과 신뢰도 [0, 1]
 */
public record QueryExpansion(
        List<String> expandedTerms,
        boolean contextual,
        double confidence
) {

    public QueryExpansion {
        expandedTerms = expandedTerms == null ? List.of() : List.copyOf(expandedTerms);
    }

    public static QueryExpansion none() {
        return new QueryExpansion(List.of(), false, 0.0);
    }
}
