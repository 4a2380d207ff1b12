package com.buhmwoo.docsearch.modules.search.application.ranking;

import com.buhmwoo.docsearch.modules.search.application.source.Chunk;
import com.buhmwoo.docsearch.modules.search.application.source.VectorMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 키워드 점수와 벡터 유사도를 하나의 점수로 합칩니다.
 * <pre>
 * fused = clamp(lexical / lexicalCeiling) × keywordWeight + vector' × vectorWeight
 * vector' = vector &lt; threshold ? 0 : vector
 * </pre>
 * 한쪽에서만 잡힌 청크도 다른 쪽을 0 으로 두고 점수를 받습니다. 결과는 항상 [0, 1] 로 잘립니다.
 */
@Component
public class ScoreFusion {

    private static final Logger log = LoggerFactory.getLogger(ScoreFusion.class);

    /**
     * @param lexical 키워드 점수(청크당 최대 1건)
     * @param vector  벡터 매칭 결과
     * @param corpus  청크 참조 → 청크, 벡터 전용 매칭의 본문 보완용
     * @param query   벡터 전용 매칭 기록에 남길 질의 원문
     * @return 최종 점수가 0 보다 큰 청크만
     */
    public List<ChunkScore> fuse(List<ChunkScore> lexical, List<VectorMatch> vector, Map<String, Chunk> corpus,
                                 String query, RankingSettings settings) {
        Map<String, ChunkScore> lexicalByRef = new LinkedHashMap<>();
        for (ChunkScore score : lexical) {
            lexicalByRef.put(score.reference(), score);
        }
        Map<String, VectorMatch> vectorByRef = new LinkedHashMap<>();
        for (VectorMatch match : vector) {
            vectorByRef.merge(match.reference(), match, (a, b) -> a.score() >= b.score() ? a : b);
        }

        Set<String> references = new LinkedHashSet<>(lexicalByRef.keySet());
        references.addAll(vectorByRef.keySet());

        List<ChunkScore> fused = new ArrayList<>();
        for (String reference : references) {
            ChunkScore lex = lexicalByRef.get(reference);
            VectorMatch vm = vectorByRef.get(reference);

            String content = resolveContent(lex, vm, corpus.get(reference));
            if (content == null || content.isBlank()) {
                log.warn("[FUSION] chunk={} 본문을 찾을 수 없어 결과에서 제외합니다 (keyword={}, vector={})",
                        reference, lex != null, vm != null);
                continue;
            }

            double normalizedLexical = lex == null ? 0.0 : normalizeLexical(lex.lexicalScore(), settings);
            double vectorScore = vm == null ? 0.0 : vectorContribution(vm.score(), settings);
            double score = clamp(normalizedLexical * settings.keywordWeight() + vectorScore * settings.vectorWeight());

            log.debug("[FUSION] chunk={} keyword={}→{} vector={} fused={}", reference,
                    lex == null ? 0.0 : lex.lexicalScore(), normalizedLexical, vectorScore, score);
            if (score <= 0.0) {
                continue;
            }

            List<MatchDetail> details = new ArrayList<>();
            if (lex != null) {
                details.addAll(lex.matchedTerms());
            }
            if (details.isEmpty()) {
                details.add(MatchDetail.vector(query, vectorScore));
            }

            String documentId = lex != null ? lex.documentId() : vm.documentId();
            int chunkIndex = lex != null ? lex.chunkIndex() : vm.chunkIndex();
            fused.add(new ChunkScore(documentId, chunkIndex, content,
                    lex == null ? 0.0 : lex.lexicalScore(), vectorScore, score, details));
        }
        return fused;
    }

    public double normalizeLexical(double raw, RankingSettings settings) {
        return clamp(raw / settings.lexicalCeiling());
    }

    /**
     * 임계값 미만의 벡터 점수는 가중치를 낮추는 대신 아예 0 으로 둡니다.
     */
    public double vectorContribution(double raw, RankingSettings settings) {
        if (Double.isNaN(raw) || raw < settings.threshold()) {
            return 0.0;
        }
        return clamp(raw);
    }

    private String resolveContent(ChunkScore lex, VectorMatch vm, Chunk chunk) {
        if (lex != null) {
            return lex.content();
        }
        if (chunk != null && chunk.content() != null && !chunk.content().isBlank()) {
            return chunk.content();
        }
        return vm != null ? vm.content() : null;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value) || value <= 0.0) {
            return 0.0;
        }
        return Math.min(value, 1.0);
    }
}
