package com.buhmwoo.docsearch.modules.search.application.ranking;

import java.util.List;

/**
 * 질의 한 번 동안만 존재하는 청크별 점수입니다.
 *
 * @param lexicalScore 정규화 전 TF-IDF 점수
 * @param vectorScore  임계값 적용 후 벡터 유사도(미달이면 0)
 * @param fusedScore   [0, 1] 범위로 결합된 최종 점수
 */
public record ChunkScore(
        String documentId,
        int chunkIndex,
        String content,
        double lexicalScore,
        double vectorScore,
        double fusedScore,
        List<MatchDetail> matchedTerms
) {

    public ChunkScore {
        matchedTerms = matchedTerms == null ? List.of() : List.copyOf(matchedTerms);
    }

    public static ChunkScore lexical(String documentId, int chunkIndex, String content,
                                     double lexicalScore, List<MatchDetail> matchedTerms) {
        return new ChunkScore(documentId, chunkIndex, content, lexicalScore, 0.0, 0.0, matchedTerms);
    }

    public String reference() {
        return documentId + "-" + chunkIndex;
    }
}
