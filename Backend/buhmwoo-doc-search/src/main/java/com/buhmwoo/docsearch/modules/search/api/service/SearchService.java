package com.buhmwoo.docsearch.modules.search.api.service;

import com.buhmwoo.docsearch.modules.search.application.query.SearchOptions;
import com.buhmwoo.docsearch.modules.search.application.ranking.SearchResult;

import java.util.List;

/**
 * 사용자 문서 청크를 대상으로 하이브리드 검색을 수행하는 서비스 계약입니다. // ✅ 채팅 도구와 UI 검색 엔드포인트가 함께 사용합니다.
 */
public interface SearchService {

    /**
     * 질의와 옵션으로 청크를 순위화해 반환합니다.
     * 빈 질의나 빈 코퍼스는 빈 목록이며, 잘못된 옵션은 VALIDATION_ERROR 로 거절합니다.
     */
    List<SearchResult> search(String query, String ownerId, SearchOptions options);
}
