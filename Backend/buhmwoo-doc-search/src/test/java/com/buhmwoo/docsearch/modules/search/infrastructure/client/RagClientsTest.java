package com.buhmwoo.docsearch.modules.search.infrastructure.client;

import com.buhmwoo.docsearch.common.config.DocSearchProperties;
import com.buhmwoo.docsearch.modules.search.application.source.Chunk;
import com.buhmwoo.docsearch.modules.search.application.source.DocumentMetadata;
import com.buhmwoo.docsearch.modules.search.application.source.QueryExpansion;
import com.buhmwoo.docsearch.modules.search.application.source.VectorMatch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 네트워크 없이 ExchangeFunction 을 바꿔 끼워 각 클라이언트의 요청 경로와 응답 매핑을 확인합니다.
 */
class RagClientsTest {

    private static final String BASE_URL = "http://rag.local";

    private DocSearchProperties props;
    private final List<ClientRequest> requests = new ArrayList<>();

    @BeforeEach
    void setUp() {
        props = new DocSearchProperties();
        props.getRag().setBackendUrl(BASE_URL);
        requests.clear();
    }

    private WebClient respondingWith(HttpStatus status, String json) {
        return WebClient.builder()
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(json)
                            .build());
                })
                .build();
    }

    @Test
    void chunkStoreMapsPayloadAndSkipsIncompleteEntries() {
        RagChunkStoreClient client = new RagChunkStoreClient(props, respondingWith(HttpStatus.OK, """
                {"chunks":[
                  {"documentId":"a","chunkIndex":0,"content":"shopping mall","ownerId":"owner-1"},
                  {"documentId":"a","chunkIndex":1,"content":null},
                  {"chunkIndex":2,"content":"no document"}
                ]}
                """));

        List<Chunk> chunks = client.getChunks("owner-1", List.of("a"));

        assertEquals(List.of(
                new Chunk("a", 0, "shopping mall", "owner-1"),
                new Chunk("a", 1, "", "owner-1")), chunks);
        assertEquals(HttpMethod.POST, requests.get(0).method());
        assertEquals(BASE_URL + "/chunks/list", requests.get(0).url().toString());
    }

    @Test
    void chunkStoreFailureIsRaisedAsIllegalState() {
        RagChunkStoreClient client = new RagChunkStoreClient(props,
                respondingWith(HttpStatus.SERVICE_UNAVAILABLE, "{\"error\":\"down\"}"));

        assertThrows(IllegalStateException.class, () -> client.getChunks("owner-1", List.of()));
    }

    @Test
    void missingBackendUrlIsReported() {
        props.getRag().setBackendUrl(" ");
        RagChunkStoreClient client = new RagChunkStoreClient(props, respondingWith(HttpStatus.OK, "{}"));

        assertThrows(IllegalStateException.class, () -> client.getChunks("owner-1", List.of()));
        assertTrue(requests.isEmpty());
    }

    @Test
    void metadataClientPassesOwnerAsQueryParameter() {
        RagDocumentMetadataClient client = new RagDocumentMetadataClient(props, respondingWith(HttpStatus.OK, """
                {"documents":[{"id":"a","name":"Mall Guide.pdf","category":"guide","tags":["mall"],
                               "createdAt":"2024-09-30T12:00:00"}]}
                """));

        List<DocumentMetadata> documents = client.getDocuments("owner 1");

        assertEquals(1, documents.size());
        assertEquals("Mall Guide.pdf", documents.get(0).name());
        assertEquals(2024, documents.get(0).createdAt().getYear());
        assertEquals(HttpMethod.GET, requests.get(0).method());
        assertEquals("ownerId=owner%201", requests.get(0).url().getRawQuery());
    }

    @Test
    void vectorSearchEmitsMatchesWithoutBlocking() {
        RagVectorSearchClient client = new RagVectorSearchClient(props, respondingWith(HttpStatus.OK, """
                {"matches":[{"documentId":"a","chunkIndex":3,"score":0.82,"content":"mall hours"},
                            {"documentId":"b","chunkIndex":0}]}
                """));

        StepVerifier.create(client.similaritySearch("mall", "owner-1", 50, List.of()))
                .expectNext(List.of(new VectorMatch("a", 3, 0.82, "mall hours")))
                .verifyComplete();
        assertEquals(BASE_URL + "/query/similarity", requests.get(0).url().toString());
    }

    @Test
    void vectorSearchErrorsSurfaceThroughMono() {
        RagVectorSearchClient client = new RagVectorSearchClient(props,
                respondingWith(HttpStatus.INTERNAL_SERVER_ERROR, "{}"));

        StepVerifier.create(client.similaritySearch("mall", "owner-1", 50, List.of()))
                .expectError()
                .verify();
    }

    @Test
    void expansionClientTrimsDeduplicatesAndClampsConfidence() {
        RagQueryExpansionClient client = new RagQueryExpansionClient(props, respondingWith(HttpStatus.OK, """
                {"expandedTerms":[" shopping center ","mall","mall",""],"isContextual":true,"confidence":1.7}
                """));

        QueryExpansion expansion = client.expand("mall", List.of("where is parking?"));

        assertEquals(List.of("shopping center", "mall"), expansion.expandedTerms());
        assertTrue(expansion.contextual());
        assertEquals(1.0, expansion.confidence());
        assertEquals(BASE_URL + "/query/expand", requests.get(0).url().toString());
    }
}
