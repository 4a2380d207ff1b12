package com.buhmwoo.docsearch.modules.search.application.impl;

import com.buhmwoo.docsearch.common.config.DocSearchProperties;
import com.buhmwoo.docsearch.common.exception.BusinessException;
import com.buhmwoo.docsearch.modules.search.api.service.SearchService;
import com.buhmwoo.docsearch.modules.search.application.query.SearchMode;
import com.buhmwoo.docsearch.modules.search.application.query.SearchOptions;
import com.buhmwoo.docsearch.modules.search.application.ranking.AdaptiveSelector;
import com.buhmwoo.docsearch.modules.search.application.ranking.ChunkScore;
import com.buhmwoo.docsearch.modules.search.application.ranking.FuzzySettings;
import com.buhmwoo.docsearch.modules.search.application.ranking.LexicalScorer;
import com.buhmwoo.docsearch.modules.search.application.ranking.QueryNormalizer;
import com.buhmwoo.docsearch.modules.search.application.ranking.RankingSettings;
import com.buhmwoo.docsearch.modules.search.application.ranking.ResultAssembler;
import com.buhmwoo.docsearch.modules.search.application.ranking.ScoreFusion;
import com.buhmwoo.docsearch.modules.search.application.ranking.SearchResult;
import com.buhmwoo.docsearch.modules.search.application.ranking.SearchTerm;
import com.buhmwoo.docsearch.modules.search.application.ranking.StopWords;
import com.buhmwoo.docsearch.modules.search.application.source.Chunk;
import com.buhmwoo.docsearch.modules.search.application.source.ChunkStore;
import com.buhmwoo.docsearch.modules.search.application.source.DocumentMetadata;
import com.buhmwoo.docsearch.modules.search.application.source.DocumentMetadataStore;
import com.buhmwoo.docsearch.modules.search.application.source.QueryExpander;
import com.buhmwoo.docsearch.modules.search.application.source.QueryExpansion;
import com.buhmwoo.docsearch.modules.search.application.source.VectorMatch;
import com.buhmwoo.docsearch.modules.search.application.source.VectorSimilaritySearch;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.function.Tuple2;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 질의 파싱 → (키워드 점수 ∥ 벡터 검색) → 결합 → 적응형 선택 → 결과 조립 순서로 검색을 수행합니다.
 * <p>
 * 모든 중간 구조는 한 번의 호출 안에서만 쓰이고 버려집니다. 설정도 호출마다 {@link RankingSettings} 로 새로 만듭니다.
 */
@Service
@RequiredArgsConstructor
public class HybridSearchServiceImpl implements SearchService {

    private static final Logger log = LoggerFactory.getLogger(HybridSearchServiceImpl.class);

    private final DocSearchProperties props;
    private final QueryNormalizer normalizer;
    private final LexicalScorer lexicalScorer;
    private final ScoreFusion scoreFusion;
    private final AdaptiveSelector selector;
    private final ResultAssembler assembler;
    private final ChunkStore chunkStore;
    private final DocumentMetadataStore documentMetadataStore;
    private final VectorSimilaritySearch vectorSearch;
    private final ObjectProvider<QueryExpander> queryExpander;

    @Override
    public List<SearchResult> search(String query, String ownerId, SearchOptions options) {
        SearchOptions opts = options == null ? SearchOptions.defaults() : options;
        if (ownerId == null || ownerId.isBlank()) {
            throw BusinessException.invalidOption("ownerId", ownerId, "ownerId 는 비어 있을 수 없습니다.");
        }
        RankingSettings settings = resolveSettings(opts); // ✅ 잘못된 옵션은 질의 처리 전에 거절합니다.

        if (query == null || query.isBlank()) {
            log.debug("[SEARCH] 빈 질의 → 빈 결과 owner={}", ownerId);
            return List.of();
        }

        List<SearchTerm> terms = buildTerms(query, opts, settings);
        log.info("[SEARCH] owner={} mode={} terms={} weights={}/{}", ownerId, opts.mode(),
                terms.stream().map(SearchTerm::text).toList(), settings.keywordWeight(), settings.vectorWeight());

        List<Chunk> chunks = chunkStore.getChunks(ownerId, opts.documentIds());
        if (chunks == null || chunks.isEmpty()) {
            log.info("[SEARCH] owner={} 검색 대상 청크 없음", ownerId);
            return List.of();
        }

        // 키워드 점수와 벡터 검색은 서로 독립이므로 동시에 실행하고 결합 단계에서 합류합니다
        Mono<List<ChunkScore>> lexicalCall = opts.mode() == SearchMode.SEMANTIC
                ? Mono.just(List.of())
                : Mono.fromCallable(() -> lexicalScorer.score(chunks, terms, settings))
                        .subscribeOn(Schedulers.boundedElastic());
        Mono<List<VectorMatch>> vectorCall = opts.mode() == SearchMode.KEYWORD
                ? Mono.just(List.of())
                : vectorMatches(query, ownerId, opts, settings);

        Tuple2<List<ChunkScore>, List<VectorMatch>> scored = Mono.zip(lexicalCall, vectorCall).block();
        if (scored == null) {
            return List.of();
        }

        Map<String, Chunk> corpus = new LinkedHashMap<>();
        chunks.forEach(chunk -> corpus.put(chunk.reference(), chunk));

        List<ChunkScore> fused = scoreFusion.fuse(scored.getT1(), inScope(scored.getT2(), opts), corpus, query.trim(), settings);
        List<ChunkScore> selected = selector.select(fused, settings);
        List<SearchResult> results = assembler.assemble(selected, documentsOf(ownerId), opts.granularity());

        log.info("[SEARCH] owner={} chunks={} keyword={} vector={} fused={} selected={} results={}",
                ownerId, chunks.size(), scored.getT1().size(), scored.getT2().size(),
                fused.size(), selected.size(), results.size());
        return results;
    }

    /**
     * 전역 기본값 위에 호출 옵션을 덮어쓰고 검증합니다.
     */
    RankingSettings resolveSettings(SearchOptions options) {
        DocSearchProperties.Ranking ranking = props.getRanking();
        DocSearchProperties.Fuzzy fuzzy = ranking.getFuzzy();

        double keywordWeight = options.weightKeyword() != null ? options.weightKeyword() : ranking.getKeywordWeight();
        double vectorWeight = options.weightVector() != null ? options.weightVector() : ranking.getVectorWeight();
        double threshold = options.threshold() != null ? options.threshold() : ranking.getThreshold();
        int limit = options.limit() != null ? options.limit() : ranking.getVectorLimit();
        int minResults = options.minResults() != null ? options.minResults() : ranking.getMinResults();
        int maxResults = options.maxResults() != null ? options.maxResults() : ranking.getMaxResults();

        if (keywordWeight < 0 || Double.isNaN(keywordWeight)) {
            throw BusinessException.invalidOption("weightKeyword", keywordWeight, "weightKeyword 는 0 이상이어야 합니다.");
        }
        if (vectorWeight < 0 || Double.isNaN(vectorWeight)) {
            throw BusinessException.invalidOption("weightVector", vectorWeight, "weightVector 는 0 이상이어야 합니다.");
        }
        if (keywordWeight + vectorWeight <= 0) {
            throw BusinessException.invalidOption("weightKeyword+weightVector", keywordWeight + vectorWeight,
                    "키워드/벡터 가중치 합이 0 입니다.");
        }
        if (Double.isNaN(threshold) || threshold < 0 || threshold > 1) {
            throw BusinessException.invalidOption("threshold", threshold, "threshold 는 [0, 1] 범위여야 합니다.");
        }
        if (limit <= 0) {
            throw BusinessException.invalidOption("limit", limit, "limit 는 1 이상이어야 합니다.");
        }
        if (minResults <= 0 || maxResults <= 0) {
            throw BusinessException.invalidOption("minResults/maxResults", minResults + "/" + maxResults,
                    "결과 개수 범위는 1 이상이어야 합니다.");
        }
        if (minResults > maxResults) {
            throw BusinessException.invalidOption("minResults/maxResults", minResults + "/" + maxResults,
                    "minResults 가 maxResults 보다 클 수 없습니다.");
        }

        return RankingSettings.builder()
                .keywordWeight(keywordWeight)
                .vectorWeight(vectorWeight)
                .threshold(threshold)
                .vectorLimit(limit)
                .minResults(minResults)
                .maxResults(maxResults)
                .massFraction(ranking.getMassFraction())
                .qualityFloor(ranking.getQualityFloor())
                .lexicalCeiling(ranking.getLexicalCeiling())
                .exactMatchBoost(ranking.getExactMatchBoost())
                .fuzzyTfWeight(ranking.getFuzzyTfWeight())
                .phraseWeight(ranking.getPhraseWeight())
                .shortTermWeight(ranking.getShortTermWeight())
                .termWeight(ranking.getTermWeight())
                .expandedTermWeight(ranking.getExpandedTermWeight())
                .parallelThreshold(ranking.getParallelThreshold())
                .fuzzy(FuzzySettings.builder()
                        .shortTermThreshold(fuzzy.getShortTermThreshold())
                        .threshold(fuzzy.getThreshold())
                        .thaiThreshold(fuzzy.getThaiThreshold())
                        .shortTermMaxLength(fuzzy.getShortTermMaxLength())
                        .maxLengthDifference(fuzzy.getMaxLengthDifference())
                        .minTermLength(fuzzy.getMinTermLength())
                        .build())
                .stopWords(StopWords.with(ranking.getExtraStopWords()))
                .build();
    }

    private List<SearchTerm> buildTerms(String query, SearchOptions options, RankingSettings settings) {
        List<SearchTerm> terms = normalizer.parse(query, settings);
        QueryExpander expander = queryExpander.getIfAvailable();
        if (expander == null || options.mode() == SearchMode.SEMANTIC) {
            return terms;
        }
        try {
            QueryExpansion expansion = expander.expand(query, options.history());
            double minConfidence = props.getExpansion().getMinConfidence();
            if (expansion == null || expansion.confidence() < minConfidence) {
                log.info("[EXPAND][SKIP] 신뢰도 미달 확장 결과 무시: confidence={} < {}",
                        expansion == null ? null : expansion.confidence(), minConfidence);
                return terms;
            }
            return normalizer.mergeExpansion(terms, expansion, settings);
        } catch (RuntimeException e) {
            log.warn("[EXPAND][FALLBACK] 키워드 확장 실패, 원래 검색어로 진행: {}", e.getMessage());
            return terms;
        }
    }

    /**
     * 벡터 검색 실패/지연은 질의 실패가 아니라 키워드 단독 검색으로의 강등입니다.
     */
    private Mono<List<VectorMatch>> vectorMatches(String query, String ownerId, SearchOptions options,
                                                  RankingSettings settings) {
        return Mono.defer(() -> vectorSearch.similaritySearch(query, ownerId, settings.vectorLimit(), options.documentIds()))
                .timeout(props.getRag().getVectorTimeout())
                .defaultIfEmpty(List.of())
                .onErrorResume(e -> {
                    log.warn("[VECTOR][DEGRADED] owner={} 벡터 검색 실패, 키워드 점수만 사용합니다: {}", ownerId, e.toString());
                    return Mono.just(List.<VectorMatch>of());
                });
    }

    private List<VectorMatch> inScope(List<VectorMatch> matches, SearchOptions options) {
        if (options.documentIds().isEmpty()) {
            return matches;
        }
        Set<String> allowed = new HashSet<>(options.documentIds());
        return matches.stream().filter(match -> allowed.contains(match.documentId())).toList();
    }

    private Map<String, DocumentMetadata> documentsOf(String ownerId) {
        Map<String, DocumentMetadata> documents = new LinkedHashMap<>();
        try {
            List<DocumentMetadata> found = documentMetadataStore.getDocuments(ownerId);
            if (found != null) {
                found.forEach(document -> documents.putIfAbsent(document.id(), document));
            }
        } catch (RuntimeException e) {
            log.warn("[DOCS] owner={} 문서 메타데이터 조회 실패, 임시 이름으로 조립합니다: {}", ownerId, e.getMessage());
        }
        return documents;
    }
}
