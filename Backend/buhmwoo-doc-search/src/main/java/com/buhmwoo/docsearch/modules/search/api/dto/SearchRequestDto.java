package com.buhmwoo.docsearch.modules.search.api.dto;

import com.buhmwoo.docsearch.modules.search.application.query.ResultGranularity;
import com.buhmwoo.docsearch.modules.search.application.query.SearchMode;
import com.buhmwoo.docsearch.modules.search.application.query.SearchOptions;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 검색 요청 본문입니다. // ✅ 생략한 옵션은 서버 기본 설정을 따릅니다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchRequestDto {

    @Schema(description = "검색 질의. 큰따옴표로 감싼 구문은 하나의 검색어로 취급합니다.", example = "\"the mall\" opening hours")
    private String query;

    @NotBlank
    @Schema(description = "문서 소유자 ID", example = "user-1")
    private String ownerId;

    @DecimalMin("0.0")
    private Double weightKeyword;

    @DecimalMin("0.0")
    private Double weightVector;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double threshold;

    @Min(1)
    private Integer limit;

    private List<String> documentIds;

    private ResultGranularity granularity;

    private SearchMode mode;

    @Min(1)
    private Integer minResults;

    @Min(1)
    private Integer maxResults;

    @Size(max = 20)
    private List<String> history;

    public SearchOptions toOptions() {
        return SearchOptions.builder()
                .weightKeyword(weightKeyword)
                .weightVector(weightVector)
                .threshold(threshold)
                .limit(limit)
                .documentIds(documentIds)
                .granularity(granularity)
                .mode(mode)
                .minResults(minResults)
                .maxResults(maxResults)
                .history(history)
                .build();
    }
}
