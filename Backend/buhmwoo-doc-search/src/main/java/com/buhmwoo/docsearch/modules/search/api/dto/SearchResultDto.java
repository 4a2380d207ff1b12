package com.buhmwoo.docsearch.modules.search.api.dto;

import com.buhmwoo.docsearch.modules.search.application.ranking.SearchResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 검색 결과 한 건을 클라이언트에 전달하기 위한 DTO 입니다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResultDto {

    private String id; // ✅ "문서ID-청크번호"
    private String name; // ✅ 문서명 + (Chunk N)
    private String content;
    private String summary;
    private double similarity;
    private String documentId;
    private int chunkIndex;
    private String category;
    private List<String> tags;
    private LocalDateTime createdAt;
    private double keywordScore;
    private double vectorScore;
    private List<MatchDetailDto> matchedTerms;
    private List<String> highlights;

    public static SearchResultDto from(SearchResult result) {
        return SearchResultDto.builder()
                .id(result.id())
                .name(result.displayName())
                .content(result.content())
                .summary(result.summary())
                .similarity(result.similarity())
                .documentId(result.documentId())
                .chunkIndex(result.chunkIndex())
                .category(result.category())
                .tags(result.tags())
                .createdAt(result.createdAt())
                .keywordScore(result.lexicalScore())
                .vectorScore(result.vectorScore())
                .matchedTerms(result.matchedTerms().stream().map(MatchDetailDto::from).toList())
                .highlights(result.highlights())
                .build();
    }
}
