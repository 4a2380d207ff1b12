package com.buhmwoo.docsearch.modules.search.api.controller;

import com.buhmwoo.docsearch.common.dto.ApiResponseDto;
import com.buhmwoo.docsearch.modules.search.api.dto.SearchRequestDto;
import com.buhmwoo.docsearch.modules.search.api.dto.SearchResultDto;
import com.buhmwoo.docsearch.modules.search.api.service.SearchService;
import com.buhmwoo.docsearch.modules.search.application.query.ResultGranularity;
import com.buhmwoo.docsearch.modules.search.application.query.SearchMode;
import com.buhmwoo.docsearch.modules.search.application.query.SearchOptions;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Tag(name = "Search", description = "문서 청크 하이브리드 검색 API")
@RestController
@RequestMapping("/api/search")
public class SearchController {

    private final SearchService searchService; // ✅ 구현체 대신 인터페이스에 의존합니다.

    public SearchController(SearchService searchService) {
        this.searchService = searchService;
    }

    @Operation(summary = "하이브리드 검색", description = "키워드(TF-IDF + 퍼지)와 벡터 유사도를 결합해 청크를 순위화합니다.")
    @PostMapping
    public ApiResponseDto<List<SearchResultDto>> search(@Valid @RequestBody SearchRequestDto request) {
        List<SearchResultDto> results = searchService.search(request.getQuery(), request.getOwnerId(), request.toOptions())
                .stream()
                .map(SearchResultDto::from)
                .toList();
        return ApiResponseDto.ok(results, "검색 성공");
    }

    @Operation(summary = "간단 검색", description = "기본 설정으로 검색합니다.")
    @GetMapping
    public ApiResponseDto<List<SearchResultDto>> searchByQuery(
            @RequestParam("q") String query,
            @RequestParam("ownerId") String ownerId,
            @RequestParam(value = "documentId", required = false) List<String> documentIds,   // ✅ 반복 파라미터로 문서 범위 제한
            @RequestParam(value = "granularity", defaultValue = "CHUNK") ResultGranularity granularity,
            @RequestParam(value = "mode", defaultValue = "HYBRID") SearchMode mode
    ) {
        SearchOptions options = SearchOptions.builder()
                .documentIds(documentIds)
                .granularity(granularity)
                .mode(mode)
                .build();
        List<SearchResultDto> results = searchService.search(query, ownerId, options)
                .stream()
                .map(SearchResultDto::from)
                .toList();
        return ApiResponseDto.ok(results, "검색 성공");
    }
}
