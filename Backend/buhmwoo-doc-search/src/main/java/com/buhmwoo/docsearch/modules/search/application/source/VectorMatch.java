package com.buhmwoo.docsearch.modules.search.application.source;

/**
 * 벡터 유사도 검색 결과 한 건입니다.
 *
 * @param score   [0, 1] 범위 유사도
 * @param content 벡터 저장소가 함께 내려준 청크 본문(없을 수 있음)
 */
public record VectorMatch(
        String documentId,
        int chunkIndex,
        double score,
        String content
) {

    public String reference() {
        return documentId + "-" + chunkIndex;
    }
}
