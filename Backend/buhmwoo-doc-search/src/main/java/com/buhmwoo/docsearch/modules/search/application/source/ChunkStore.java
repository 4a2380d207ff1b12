package com.buhmwoo.docsearch.modules.search.application.source;

import java.util.Collection;
import java.util.List;

/**
 * 검색 대상 청크를 제공하는 저장소 계약입니다.
 */
public interface ChunkStore {

    /**
     * 사용자 소유 청크를 모두 조회합니다.
     *
     * @param ownerId     청크 소유자
     * @param documentIds 문서 범위 제한(비어 있거나 null 이면 전체)
     */
    List<Chunk> getChunks(String ownerId, Collection<String> documentIds);
}
