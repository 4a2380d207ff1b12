package com.buhmwoo.docsearch.modules.search.infrastructure.client;

import com.buhmwoo.docsearch.common.config.DocSearchProperties;
import com.buhmwoo.docsearch.modules.search.application.source.VectorMatch;
import com.buhmwoo.docsearch.modules.search.application.source.VectorSimilaritySearch;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * RAG 백엔드의 임베딩 유사도 검색 엔드포인트를 호출합니다. // ✅ block 하지 않고 Mono 를 그대로 돌려 키워드 점수 계산과 겹치게 합니다.
 */
@Component
public class RagVectorSearchClient implements VectorSimilaritySearch {

    private final DocSearchProperties props;
    private final WebClient ragWebClient;

    public RagVectorSearchClient(DocSearchProperties props, @Qualifier("ragWebClient") WebClient ragWebClient) {
        this.props = props;
        this.ragWebClient = ragWebClient;
    }

    @Override
    public Mono<List<VectorMatch>> similaritySearch(String query, String ownerId, int limit,
                                                    Collection<String> documentIds) {
        String baseUrl = props.getRag().getBackendUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            return Mono.error(new IllegalStateException("RAG 백엔드 URL이 설정되어 있지 않습니다."));
        }

        Map<String, Object> body = new HashMap<>();
        body.put("query", query);
        body.put("ownerId", ownerId);
        body.put("limit", limit);
        body.put("documentIds", documentIds == null || documentIds.isEmpty() ? null : List.copyOf(documentIds));

        return ragWebClient.post()
                .uri(baseUrl + "/query/similarity")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(SimilarityResponsePayload.class)
                .map(this::toMatches);
    }

    private List<VectorMatch> toMatches(SimilarityResponsePayload payload) {
        if (payload.matches() == null) {
            return List.of();
        }
        return payload.matches().stream()
                .filter(Objects::nonNull)
                .filter(m -> m.documentId() != null && m.score() != null)
                .map(m -> new VectorMatch(
                        m.documentId(),
                        m.chunkIndex() == null ? 0 : m.chunkIndex(),
                        m.score(),
                        m.content()
                ))
                .toList();
    }

    private record SimilarityResponsePayload(List<MatchPayload> matches) {
    }

    private record MatchPayload(String documentId, Integer chunkIndex, Double score, String content) {
    }
}
