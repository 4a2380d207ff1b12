package com.buhmwoo.docsearch.modules.search.application.source;

import java.util.List;

/**
 * 결과 조립 단계에서 문서 이름/요약을 조회하는 읽기 전용 계약입니다.
 */
public interface DocumentMetadataStore {

    List<DocumentMetadata> getDocuments(String ownerId);
}
