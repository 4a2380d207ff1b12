package com.buhmwoo.docsearch.modules.search.application.query;

import lombok.Builder;

import java.util.List;

/**
 * 검색 호출 옵션입니다. null 필드는 docsearch.ranking 기본값을 따릅니다.
 *
 * @param weightKeyword 키워드 점수 가중치
 * @param weightVector  벡터 점수 가중치
 * @param threshold     벡터 유사도 하한 [0, 1]
 * @param limit         벡터 검색에 요청할 후보 수
 * @param documentIds   문서 범위 제한
 * @param granularity   청크 단위/문서 단위 결과
 * @param mode          검색 방식
 * @param minResults    적응형 선택 최소 개수
 * @param maxResults    적응형 선택 최대 개수
 * @param history       키워드 확장에 넘길 최근 대화
 */
@Builder(toBuilder = true)
public record SearchOptions(
        Double weightKeyword,
        Double weightVector,
        Double threshold,
        Integer limit,
        List<String> documentIds,
        ResultGranularity granularity,
        SearchMode mode,
        Integer minResults,
        Integer maxResults,
        List<String> history
) {

    public SearchOptions {
        documentIds = documentIds == null ? List.of() : List.copyOf(documentIds);
        history = history == null ? List.of() : List.copyOf(history);
        granularity = granularity == null ? ResultGranularity.CHUNK : granularity;
        mode = mode == null ? SearchMode.HYBRID : mode;
    }

    public static SearchOptions defaults() {
        return SearchOptions.builder().build();
    }
}
