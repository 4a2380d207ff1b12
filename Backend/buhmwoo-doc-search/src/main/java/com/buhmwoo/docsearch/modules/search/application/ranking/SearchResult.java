package com.buhmwoo.docsearch.modules.search.application.ranking;

import lombok.Builder;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 호출자에게 노출되는 최종 검색 결과입니다.
 *
 * @param id           "문서ID-청크번호"
 * @param displayName  문서명 + "(Chunk N)" 라벨(문서 단위 결과에서는 라벨 없음)
 * @param similarity   결합 점수 [0, 1]
 * @param lexicalScore 정규화 전 키워드 점수
 * @param vectorScore  임계값 적용 후 벡터 점수
 */
@Builder
public record SearchResult(
        String id,
        String displayName,
        String content,
        double similarity,
        List<MatchDetail> matchedTerms,
        String documentId,
        int chunkIndex,
        String summary,
        String category,
        List<String> tags,
        LocalDateTime createdAt,
        double lexicalScore,
        double vectorScore,
        List<String> highlights
) {

    public SearchResult {
        matchedTerms = matchedTerms == null ? List.of() : List.copyOf(matchedTerms);
        tags = tags == null ? List.of() : List.copyOf(tags);
        highlights = highlights == null ? List.of() : List.copyOf(highlights);
    }
}
