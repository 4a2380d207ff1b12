package com.buhmwoo.docsearch.modules.search.application.ranking;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 고정 top-k 대신 점수 분포에 따라 결과 개수를 정합니다.
 * <p>
 * 평균 점수가 qualityFloor 를 넘으면 누적 점수가 전체의 massFraction 에 닿고 최소 개수를 채울 때까지(최대 maxResults) 담고,
 * 그렇지 않으면 상위 minResults 개만 담습니다.
 */
@Component
public class AdaptiveSelector {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveSelector.class);

    // ✅ 동점일 때도 항상 같은 순서가 나오도록 문서 ID, 청크 번호로 한 번 더 정렬합니다. 문서 ID 가 없는 청크는 뒤로 보냅니다.
    static final Comparator<ChunkScore> RANKING = Comparator
            .comparingDouble(ChunkScore::fusedScore).reversed()
            .thenComparing(ChunkScore::documentId, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparingInt(ChunkScore::chunkIndex);

    public List<ChunkScore> select(List<ChunkScore> scored, RankingSettings settings) {
        if (scored == null || scored.isEmpty()) {
            return List.of();
        }

        List<ChunkScore> ranked = new ArrayList<>(scored);
        ranked.sort(RANKING);

        int available = ranked.size();
        int minResults = Math.min(settings.minResults(), available);
        int maxResults = Math.min(settings.maxResults(), available);

        double total = ranked.stream().mapToDouble(ChunkScore::fusedScore).sum();
        double mean = total / available;

        if (mean <= settings.qualityFloor()) {
            log.debug("[SELECT] mean={} <= floor={}, 상위 {}개 사용", mean, settings.qualityFloor(), minResults);
            return List.copyOf(ranked.subList(0, minResults));
        }

        double target = total * settings.massFraction();
        double accumulated = 0.0;
        List<ChunkScore> selected = new ArrayList<>();
        for (ChunkScore score : ranked) {
            selected.add(score);
            accumulated += score.fusedScore();
            if (accumulated >= target && selected.size() >= minResults) {
                break;
            }
            if (selected.size() >= maxResults) {
                break;
            }
        }

        log.debug("[SELECT] mass selection: {}/{} chunks, {} of {} (target {})",
                selected.size(), available, accumulated, total, target);
        return List.copyOf(selected);
    }
}
