package com.buhmwoo.docsearch.modules.search.application.query;

/**
 * 결과 단위. DOCUMENT 이면 문서마다 최고 점수 청크 하나만 남깁니다.
 */
public enum ResultGranularity {
    CHUNK,
    DOCUMENT
}
