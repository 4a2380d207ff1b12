package com.buhmwoo.docsearch.modules.search.infrastructure.client;

import com.buhmwoo.docsearch.common.config.DocSearchProperties;
import com.buhmwoo.docsearch.modules.search.application.source.QueryExpander;
import com.buhmwoo.docsearch.modules.search.application.source.QueryExpansion;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 언어 모델 기반 키워드 확장 엔드포인트를 호출합니다. docsearch.expansion.enabled=true 일 때만 등록됩니다.
 */
@Component
@ConditionalOnProperty(prefix = "docsearch.expansion", name = "enabled", havingValue = "true")
public class RagQueryExpansionClient implements QueryExpander {

    private static final int MAX_EXPANDED_TERMS = 8;
    private static final int MAX_HISTORY_ITEMS = 5;

    private final DocSearchProperties props;
    private final WebClient ragWebClient;

    public RagQueryExpansionClient(DocSearchProperties props, @Qualifier("ragWebClient") WebClient ragWebClient) {
        this.props = props;
        this.ragWebClient = ragWebClient;
    }

    @Override
    public QueryExpansion expand(String query, List<String> recentHistory) {
        String baseUrl = props.getRag().getBackendUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalStateException("RAG 백엔드 URL이 설정되어 있지 않습니다.");
        }

        List<String> history = recentHistory == null ? List.of() : recentHistory;
        Map<String, Object> body = new HashMap<>();
        body.put("query", query);
        body.put("history", history.subList(Math.max(0, history.size() - MAX_HISTORY_ITEMS), history.size())); // ✅ 최근 대화만 보냅니다.

        ExpandResponsePayload payload = ragWebClient.post()
                .uri(baseUrl + "/query/expand")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(ExpandResponsePayload.class)
                .block(props.getExpansion().getTimeout());

        if (payload == null) {
            return QueryExpansion.none();
        }

        List<String> terms = payload.expandedTerms() == null ? List.of() : payload.expandedTerms().stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(term -> !term.isEmpty())
                .distinct()
                .limit(MAX_EXPANDED_TERMS)
                .toList();
        double confidence = payload.confidence() == null ? 0.5 : Math.max(0.0, Math.min(1.0, payload.confidence()));
        return new QueryExpansion(terms, Boolean.TRUE.equals(payload.isContextual()), confidence);
    }

    private record ExpandResponsePayload(List<String> expandedTerms, Boolean isContextual, Double confidence) {
    }
}
