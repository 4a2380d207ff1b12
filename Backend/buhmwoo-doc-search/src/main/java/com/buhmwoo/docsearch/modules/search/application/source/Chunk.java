package com.buhmwoo.docsearch.modules.search.application.source;

/**
 * 외부 저장소가 소유한 문서 청크입니다. 검색 엔진은 읽기만 합니다.
 */
public record Chunk(
        String documentId,
        int chunkIndex,
        String content,
        String ownerId
) {

    /** "문서ID-청크번호" 형태의 참조 키 */
    public String reference() {
        return documentId + "-" + chunkIndex;
    }
}
