package com.buhmwoo.docsearch.modules.search.application.ranking;

/**
 * 검색어가 어디서 왔는지 표시합니다.
 */
public enum TermSource {
    ORIGINAL,   // 사용자 질의에서 직접 파싱
    EXPANDED,   // 키워드 확장 서비스가 추가
    CONTEXTUAL  // 대화 이력 기반으로 확장
}
