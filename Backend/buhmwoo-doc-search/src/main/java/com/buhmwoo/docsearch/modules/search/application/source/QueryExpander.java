package com.buhmwoo.docsearch.modules.search.application.source;

import java.util.List;

/**
 * 질의를 동의어/관련어로 확장하는 선택적 협력자입니다. 실패해도 검색은 원래 검색어로 계속됩니다.
 */
public interface QueryExpander {

    QueryExpansion expand(String query, List<String> recentHistory);
}
