package com.buhmwoo.docsearch.modules.search.application.query;

/**
 * 검색 방식.
 */
public enum SearchMode {
    HYBRID,   // 키워드 + 벡터
    KEYWORD,  // 벡터 협력자를 호출하지 않음
    SEMANTIC  // 키워드 점수 계산을 건너뜀
}
