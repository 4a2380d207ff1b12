package com.buhmwoo.docsearch.modules.search.application.ranking;

import com.buhmwoo.docsearch.modules.search.application.ranking.QueryNormalizer.Token;
import com.buhmwoo.docsearch.modules.search.application.source.Chunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * 청크별 TF-IDF 점수를 계산합니다.
 * <ul>
 *     <li>df: 검색어가 정확히(또는 퍼지 대상이면 근사로) 등장한 청크 수</li>
 *     <li>idf = ln(전체 청크 수 / max(df, 1))</li>
 *     <li>tf = (정확 일치 수, 없으면 퍼지 일치 수 × fuzzyTfWeight) / max(토큰 수, 1)</li>
 *     <li>기여도 = tf × idf × 검색어 가중치, 정확 일치면 exactMatchBoost 를 곱함</li>
 * </ul>
 * 청크끼리 서로 영향을 주지 않으므로 코퍼스 크기가 parallelThreshold 이상이면 병렬 스트림으로 매칭합니다.
 */
@Component
public class LexicalScorer {

    private static final Logger log = LoggerFactory.getLogger(LexicalScorer.class);

    private final QueryNormalizer normalizer;
    private final FuzzyMatcher fuzzyMatcher;

    public LexicalScorer(QueryNormalizer normalizer, FuzzyMatcher fuzzyMatcher) {
        this.normalizer = normalizer;
        this.fuzzyMatcher = fuzzyMatcher;
    }

    /**
     * 매칭된 검색어가 하나라도 있는 청크만, 입력 순서대로 돌려줍니다.
     */
    public List<ChunkScore> score(List<Chunk> chunks, List<SearchTerm> terms, RankingSettings settings) {
        if (chunks == null || chunks.isEmpty() || terms == null || terms.isEmpty()) {
            return List.of();
        }

        List<PreparedTerm> prepared = terms.stream()
                .map(term -> new PreparedTerm(term, normalizer.tokenize(term.text())))
                .filter(p -> !p.tokens().isEmpty())
                .toList();
        if (prepared.isEmpty()) {
            return List.of();
        }

        boolean parallel = chunks.size() >= settings.parallelThreshold();
        Stream<Chunk> stream = parallel ? chunks.parallelStream() : chunks.stream();

        // 1) 토큰화 + 검색어별 매칭 위치 수집 (청크 단위로 독립)
        List<ChunkHits> hits = stream
                .map(chunk -> collectHits(chunk, prepared, settings.fuzzy()))
                .toList();

        // 2) 문서 빈도
        int totalChunks = chunks.size();
        double[] idf = new double[prepared.size()];
        for (int t = 0; t < prepared.size(); t++) {
            int df = 0;
            for (ChunkHits chunkHits : hits) {
                if (chunkHits.termHits()[t].matched()) {
                    df++;
                }
            }
            idf[t] = Math.log((double) totalChunks / Math.max(df, 1));
            log.debug("[LEXICAL] term=\"{}\" df={} idf={}", prepared.get(t).term().text(), df, idf[t]);
        }

        // 3) 청크 점수
        List<ChunkScore> scores = new ArrayList<>();
        for (ChunkHits chunkHits : hits) {
            ChunkScore score = scoreChunk(chunkHits, prepared, idf, settings);
            if (score != null) {
                scores.add(score);
            }
        }

        log.debug("[LEXICAL] chunks={} matched={} terms={} parallel={}",
                totalChunks, scores.size(), prepared.size(), parallel);
        return scores;
    }

    private ChunkHits collectHits(Chunk chunk, List<PreparedTerm> prepared, FuzzySettings fuzzy) {
        List<Token> tokens = normalizer.tokenizeWithOffsets(chunk.content());
        TermHits[] termHits = new TermHits[prepared.size()];
        for (int t = 0; t < prepared.size(); t++) {
            termHits[t] = findHits(tokens, prepared.get(t), fuzzy);
        }
        return new ChunkHits(chunk, tokens.size(), termHits);
    }

    /**
     * 검색어 토큰 수만큼의 창을 밀면서 정확 일치를 찾고, 하나도 없을 때만 퍼지 일치를 찾습니다.
     */
    TermHits findHits(List<Token> tokens, PreparedTerm prepared, FuzzySettings fuzzy) {
        List<String> termTokens = prepared.tokens();
        int width = termTokens.size();
        if (tokens.size() < width) {
            return TermHits.NONE;
        }

        List<Integer> exact = new ArrayList<>();
        for (int i = 0; i + width <= tokens.size(); i++) {
            if (windowEquals(tokens, i, termTokens)) {
                exact.add(tokens.get(i).offset());
            }
        }
        if (!exact.isEmpty() || !prepared.term().fuzzyEligible()) {
            return new TermHits(exact, List.of());
        }

        String termText = prepared.joined();
        List<Integer> fuzzyPositions = new ArrayList<>();
        for (int i = 0; i + width <= tokens.size(); i++) {
            String candidate = width == 1 ? tokens.get(i).text() : joinWindow(tokens, i, width);
            if (fuzzyMatcher.match(termText, candidate, fuzzy) > 0.0) {
                fuzzyPositions.add(tokens.get(i).offset());
            }
        }
        return new TermHits(List.of(), fuzzyPositions);
    }

    private ChunkScore scoreChunk(ChunkHits chunkHits, List<PreparedTerm> prepared, double[] idf,
                                  RankingSettings settings) {
        double total = 0.0;
        List<MatchDetail> details = new ArrayList<>();
        int tokenCount = Math.max(chunkHits.tokenCount(), 1);

        for (int t = 0; t < prepared.size(); t++) {
            TermHits termHits = chunkHits.termHits()[t];
            if (!termHits.matched()) {
                continue;
            }
            SearchTerm term = prepared.get(t).term();
            boolean exact = !termHits.exact().isEmpty();
            double matches = exact
                    ? termHits.exact().size()
                    : termHits.fuzzy().size() * settings.fuzzyTfWeight();
            double tf = matches / tokenCount;
            double contribution = tf * idf[t] * term.weight();
            if (exact) {
                contribution *= settings.exactMatchBoost();
            }
            total += contribution;
            details.add(new MatchDetail(term.text(), contribution,
                    exact ? termHits.exact() : termHits.fuzzy(), !exact));
        }

        if (details.isEmpty()) {
            return null;
        }
        Chunk chunk = chunkHits.chunk();
        return ChunkScore.lexical(chunk.documentId(), chunk.chunkIndex(), chunk.content(), total, details);
    }

    private static boolean windowEquals(List<Token> tokens, int start, List<String> termTokens) {
        for (int k = 0; k < termTokens.size(); k++) {
            if (!tokens.get(start + k).text().equals(termTokens.get(k))) {
                return false;
            }
        }
        return true;
    }

    private static String joinWindow(List<Token> tokens, int start, int width) {
        StringBuilder sb = new StringBuilder();
        for (int k = 0; k < width; k++) {
            if (k > 0) {
                sb.append(' ');
            }
            sb.append(tokens.get(start + k).text());
        }
        return sb.toString();
    }

    record PreparedTerm(SearchTerm term, List<String> tokens) {
        String joined() {
            return String.join(" ", tokens);
        }
    }

    record TermHits(List<Integer> exact, List<Integer> fuzzy) {
        static final TermHits NONE = new TermHits(List.of(), List.of());

        boolean matched() {
            return !exact.isEmpty() || !fuzzy.isEmpty();
        }
    }

    private record ChunkHits(Chunk chunk, int tokenCount, TermHits[] termHits) {
    }
}
