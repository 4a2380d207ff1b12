package com.buhmwoo.docsearch.modules.search.infrastructure.client;

import com.buhmwoo.docsearch.common.config.DocSearchProperties; // ✅ RAG 백엔드 URL과 타임아웃을 읽기 위해 임포트합니다.
import com.buhmwoo.docsearch.modules.search.application.source.Chunk;
import com.buhmwoo.docsearch.modules.search.application.source.ChunkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier; // ✅ 특정 이름의 WebClient 빈을 주입하기 위해 Qualifier를 사용합니다.
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
 * RAG 백엔드에서 사용자 청크 스냅샷을 한 번에 가져오는 구현체입니다. // ✅ 질의 시작 시 한 번만 호출되고 이후에는 읽기만 합니다.
 */
@Component
public class RagChunkStoreClient implements ChunkStore {

    private static final Logger log = LoggerFactory.getLogger(RagChunkStoreClient.class);

    private final DocSearchProperties props;
    private final WebClient ragWebClient;

    public RagChunkStoreClient(DocSearchProperties props, @Qualifier("ragWebClient") WebClient ragWebClient) {
        this.props = props;
        this.ragWebClient = ragWebClient;
    }

    @Override
    public List<Chunk> getChunks(String ownerId, Collection<String> documentIds) {
        String baseUrl = props.getRag().getBackendUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalStateException("RAG 백엔드 URL이 설정되어 있지 않습니다.");
        }

        Map<String, Object> body = new HashMap<>(); // ✅ null 값을 허용하기 위해 가변 맵으로 요청 본문을 구성합니다.
        body.put("ownerId", ownerId);
        body.put("documentIds", documentIds == null || documentIds.isEmpty() ? null : List.copyOf(documentIds));

        Mono<ChunkListPayload> call = ragWebClient.post()
                .uri(baseUrl + "/chunks/list")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(ChunkListPayload.class);

        ChunkListPayload payload;
        try {
            payload = call.block(props.getRag().getTimeout());
        } catch (Exception e) {
            log.warn("[CHUNKS][CALL_FAIL] url={}/chunks/list owner={} err={}", baseUrl, ownerId, e.toString(), e);
            throw new IllegalStateException("청크 조회 실패: " + (e.getMessage() != null ? e.getMessage() : e.toString()), e);
        }

        if (payload == null || payload.chunks() == null) {
            return List.of(); // ✅ 빈 응답은 빈 코퍼스로 취급합니다.
        }

        List<Chunk> chunks = payload.chunks().stream()
                .filter(Objects::nonNull)
                .filter(c -> c.documentId() != null)
                .map(c -> new Chunk(
                        c.documentId(),
                        c.chunkIndex() == null ? 0 : c.chunkIndex(),
                        c.content() == null ? "" : c.content(),
                        c.ownerId() == null ? ownerId : c.ownerId()
                ))
                .toList();
        log.debug("[CHUNKS] owner={} documents={} chunks={}", ownerId, documentIds, chunks.size());
        return chunks;
    }

    private record ChunkListPayload(List<ChunkPayload> chunks) {
    }

    private record ChunkPayload(String documentId, Integer chunkIndex, String content, String ownerId) {
    }
}
