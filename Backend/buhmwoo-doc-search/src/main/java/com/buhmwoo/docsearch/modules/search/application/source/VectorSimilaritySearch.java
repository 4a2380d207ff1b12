package com.buhmwoo.docsearch.modules.search.application.source;

import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.List;

/**
 * 임베딩 기반 유사도 검색 계약입니다. // ✅ 키워드 점수 계산과 동시에 실행되도록 Mono 로 노출합니다.
 */
public interface VectorSimilaritySearch {

    /**
     * @param query       사용자 질의 원문
     * @param ownerId     청크 소유자
     * @param limit       요청할 최대 후보 수
     * @param documentIds 문서 범위 제한(비어 있거나 null 이면 전체)
     * @return 유사도 [0, 1] 이 채워진 매칭 목록
     */
    Mono<List<VectorMatch>> similaritySearch(String query, String ownerId, int limit, Collection<String> documentIds);
}
