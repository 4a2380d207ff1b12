package com.buhmwoo.docsearch.modules.search.api.controller;

import com.buhmwoo.docsearch.common.exception.BusinessException;
import com.buhmwoo.docsearch.modules.search.api.service.SearchService;
import com.buhmwoo.docsearch.modules.search.application.query.ResultGranularity;
import com.buhmwoo.docsearch.modules.search.application.query.SearchMode;
import com.buhmwoo.docsearch.modules.search.application.query.SearchOptions;
import com.buhmwoo.docsearch.modules.search.application.ranking.MatchDetail;
import com.buhmwoo.docsearch.modules.search.application.ranking.SearchResult;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SearchController.class)
class SearchControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SearchService searchService;

    private static SearchResult result() {
        return SearchResult.builder()
                .id("a-0")
                .displayName("Mall Guide.pdf (Chunk 1)")
                .content("shopping mall opens downtown")
                .similarity(0.65)
                .matchedTerms(List.of(new MatchDetail("mall", 0.33, List.of(9), false)))
                .documentId("a")
                .chunkIndex(0)
                .summary("shopping mall opens downtown")
                .tags(List.of())
                .lexicalScore(0.33)
                .vectorScore(0.8)
                .highlights(List.of("shopping mall opens downtown"))
                .build();
    }

    @Test
    void postSearchReturnsWrappedResults() throws Exception {
        when(searchService.search(eq("mall"), eq("owner-1"), any(SearchOptions.class))).thenReturn(List.of(result()));

        mockMvc.perform(post("/api/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"mall\",\"ownerId\":\"owner-1\",\"weightKeyword\":0.7,\"mode\":\"KEYWORD\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data[0].id").value("a-0"))
                .andExpect(jsonPath("$.data[0].name").value("Mall Guide.pdf (Chunk 1)"))
                .andExpect(jsonPath("$.data[0].matchedTerms[0].term").value("mall"))
                .andExpect(jsonPath("$.data[0].keywordScore").value(0.33));

        ArgumentCaptor<SearchOptions> options = ArgumentCaptor.forClass(SearchOptions.class);
        verify(searchService).search(eq("mall"), eq("owner-1"), options.capture());
        assertEquals(0.7, options.getValue().weightKeyword());
        assertEquals(SearchMode.KEYWORD, options.getValue().mode());
        assertNull(options.getValue().weightVector());
    }

    @Test
    void blankOwnerIsRejectedByValidation() throws Exception {
        mockMvc.perform(post("/api/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"mall\",\"ownerId\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.data.code").value("E400"))
                .andExpect(jsonPath("$.data.details.fieldErrors[0].field").value("ownerId"));

        verifyNoInteractions(searchService);
    }

    @Test
    void invalidOptionFromServiceMapsToBadRequest() throws Exception {
        when(searchService.search(anyString(), anyString(), any(SearchOptions.class)))
                .thenThrow(BusinessException.invalidOption("threshold", 1.5, "threshold 는 [0, 1] 범위여야 합니다."));

        mockMvc.perform(post("/api/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"mall\",\"ownerId\":\"owner-1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.data.code").value("E400"))
                .andExpect(jsonPath("$.data.details.field").value("threshold"));
    }

    @Test
    void storeFailureMapsToInternalError() throws Exception {
        when(searchService.search(anyString(), anyString(), any(SearchOptions.class)))
                .thenThrow(new IllegalStateException("청크 조회 실패"));

        mockMvc.perform(get("/api/search").param("q", "mall").param("ownerId", "owner-1"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.data.code").value("E500"));
    }

    @Test
    void getSearchBindsScopeAndGranularity() throws Exception {
        when(searchService.search(anyString(), anyString(), any(SearchOptions.class))).thenReturn(List.of());

        mockMvc.perform(get("/api/search")
                        .param("q", "mall")
                        .param("ownerId", "owner-1")
                        .param("documentId", "a", "b")
                        .param("granularity", "DOCUMENT"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").isEmpty());

        ArgumentCaptor<SearchOptions> options = ArgumentCaptor.forClass(SearchOptions.class);
        verify(searchService).search(eq("mall"), eq("owner-1"), options.capture());
        assertEquals(List.of("a", "b"), options.getValue().documentIds());
        assertEquals(ResultGranularity.DOCUMENT, options.getValue().granularity());
        assertEquals(SearchMode.HYBRID, options.getValue().mode());
    }

    @Test
    void missingOwnerParameterIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/search").param("q", "mall"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }
}
