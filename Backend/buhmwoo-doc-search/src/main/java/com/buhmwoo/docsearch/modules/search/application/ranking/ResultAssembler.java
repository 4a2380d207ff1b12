package com.buhmwoo.docsearch.modules.search.application.ranking;

import com.buhmwoo.docsearch.modules.search.application.query.ResultGranularity;
import com.buhmwoo.docsearch.modules.search.application.source.DocumentMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * 선택된 청크를 소속 문서 정보와 묶어 {@link SearchResult} 로 만듭니다.
 * 메타데이터에 없는 문서는 "Document {id}" 이름으로 대신하고 계속 진행합니다.
 */
@Component
public class ResultAssembler {

    private static final Logger log = LoggerFactory.getLogger(ResultAssembler.class);

    private static final int SUMMARY_LENGTH = 200;
    private static final int HIGHLIGHT_RADIUS = 100;
    private static final int MAX_HIGHLIGHTS = 5;

    /**
     * @param selected    점수 내림차순으로 정렬된 선택 결과
     * @param documents   문서 ID → 메타데이터
     * @param granularity CHUNK 이면 그대로, DOCUMENT 이면 문서당 최고 점수 청크 하나
     */
    public List<SearchResult> assemble(List<ChunkScore> selected, Map<String, DocumentMetadata> documents,
                                       ResultGranularity granularity) {
        List<ChunkScore> chunks = granularity == ResultGranularity.DOCUMENT ? bestPerDocument(selected) : selected;

        List<SearchResult> results = new ArrayList<>(chunks.size());
        for (ChunkScore chunk : chunks) {
            DocumentMetadata document = documents.get(chunk.documentId());
            if (document == null) {
                log.warn("[ASSEMBLE] 문서 메타데이터 없음: documentId={}, chunk={} → 임시 이름 사용",
                        chunk.documentId(), chunk.reference());
            }
            String documentName = document != null && document.name() != null && !document.name().isBlank()
                    ? document.name()
                    : "Document " + chunk.documentId();
            String displayName = granularity == ResultGranularity.DOCUMENT
                    ? documentName
                    : documentName + " " + chunkLabel(chunk.chunkIndex());

            results.add(SearchResult.builder()
                    .id(chunk.reference())
                    .displayName(displayName)
                    .content(chunk.content())
                    .similarity(chunk.fusedScore())
                    .matchedTerms(chunk.matchedTerms())
                    .documentId(chunk.documentId())
                    .chunkIndex(chunk.chunkIndex())
                    .summary(summaryOf(document, chunk.content()))
                    .category(document != null ? document.category() : null)
                    .tags(document != null ? document.tags() : List.of())
                    .createdAt(document != null ? document.createdAt() : null)
                    .lexicalScore(chunk.lexicalScore())
                    .vectorScore(chunk.vectorScore())
                    .highlights(highlights(chunk.content(), chunk.matchedTerms()))
                    .build());
        }
        return results;
    }

    /** 사람이 읽는 청크 번호는 1부터 셉니다. */
    public static String chunkLabel(int chunkIndex) {
        return "(Chunk " + (chunkIndex + 1) + ")";
    }

    /**
     * 매칭 위치 주변 ±100자를 잘라 최대 5개까지 돌려줍니다.
     */
    public List<String> highlights(String content, List<MatchDetail> details) {
        if (content == null || content.isEmpty()) {
            return List.of();
        }
        TreeSet<Integer> positions = new TreeSet<>();
        details.forEach(detail -> positions.addAll(detail.positions()));

        List<String> snippets = new ArrayList<>();
        int coveredUntil = -1;
        for (int position : positions) {
            if (snippets.size() >= MAX_HIGHLIGHTS) {
                break;
            }
            if (position < 0 || position >= content.length() || position < coveredUntil) {
                continue;
            }
            int start = Math.max(0, position - HIGHLIGHT_RADIUS);
            int end = Math.min(content.length(), position + HIGHLIGHT_RADIUS);
            snippets.add((start > 0 ? "..." : "") + content.substring(start, end) + (end < content.length() ? "..." : ""));
            coveredUntil = end;
        }
        return snippets;
    }

    private List<ChunkScore> bestPerDocument(List<ChunkScore> selected) {
        Map<String, ChunkScore> best = new LinkedHashMap<>();
        for (ChunkScore chunk : selected) {
            best.merge(chunk.documentId(), chunk, (current, candidate) ->
                    AdaptiveSelector.RANKING.compare(candidate, current) < 0 ? candidate : current);
        }
        List<ChunkScore> deduplicated = new ArrayList<>(best.values());
        deduplicated.sort(AdaptiveSelector.RANKING);
        return deduplicated;
    }

    private String summaryOf(DocumentMetadata document, String content) {
        if (document != null && document.summary() != null && !document.summary().isBlank()) {
            return document.summary();
        }
        if (content == null) {
            return null;
        }
        return content.length() > SUMMARY_LENGTH ? content.substring(0, SUMMARY_LENGTH) + "..." : content;
    }
}
