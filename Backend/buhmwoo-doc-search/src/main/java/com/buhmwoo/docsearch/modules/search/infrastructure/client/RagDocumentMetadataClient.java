package com.buhmwoo.docsearch.modules.search.infrastructure.client;

import com.buhmwoo.docsearch.common.config.DocSearchProperties;
import com.buhmwoo.docsearch.modules.search.application.source.DocumentMetadata;
import com.buhmwoo.docsearch.modules.search.application.source.DocumentMetadataStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * 결과 표시용 문서 메타데이터를 조회합니다. 실패 시 예외를 던지고, 호출 측이 임시 이름으로 강등합니다.
 */
@Component
public class RagDocumentMetadataClient implements DocumentMetadataStore {

    private final DocSearchProperties props;
    private final WebClient ragWebClient;

    public RagDocumentMetadataClient(DocSearchProperties props, @Qualifier("ragWebClient") WebClient ragWebClient) {
        this.props = props;
        this.ragWebClient = ragWebClient;
    }

    @Override
    public List<DocumentMetadata> getDocuments(String ownerId) {
        String baseUrl = props.getRag().getBackendUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalStateException("RAG 백엔드 URL이 설정되어 있지 않습니다.");
        }

        DocumentListPayload payload = ragWebClient.get()
                .uri(baseUrl + "/documents?ownerId={ownerId}", ownerId)
                .retrieve()
                .bodyToMono(DocumentListPayload.class)
                .block(props.getRag().getTimeout());

        if (payload == null || payload.documents() == null) {
            return List.of();
        }
        return payload.documents().stream()
                .filter(Objects::nonNull)
                .filter(d -> d.id() != null)
                .map(d -> new DocumentMetadata(d.id(), d.name(), d.summary(), d.category(), d.tags(), d.createdAt()))
                .toList();
    }

    private record DocumentListPayload(List<DocumentPayload> documents) {
    }

    private record DocumentPayload(String id, String name, String summary, String category,
                                   List<String> tags, LocalDateTime createdAt) {
    }
}
