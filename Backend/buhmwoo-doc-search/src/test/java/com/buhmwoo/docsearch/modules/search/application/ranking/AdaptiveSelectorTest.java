package com.buhmwoo.docsearch.modules.search.application.ranking;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class AdaptiveSelectorTest {

    private final AdaptiveSelector selector = new AdaptiveSelector();
    private final RankingSettings settings = RankingSettings.defaults();

    private static ChunkScore scored(String documentId, int chunkIndex, double fused) {
        return new ChunkScore(documentId, chunkIndex, "content", 0.0, 0.0, fused, List.of());
    }

    private static List<ChunkScore> uniform(int count, double fused) {
        List<ChunkScore> scores = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            scores.add(scored("doc-" + (char) ('a' + i), 0, fused));
        }
        return scores;
    }

    @Test
    void evenDistributionIsCappedAtMaxResults() {
        assertEquals(8, selector.select(uniform(20, 0.5), settings).size());
    }

    @Test
    void dominantChunkStillFillsMinResults() {
        List<ChunkScore> scores = new ArrayList<>(uniform(10, 0.01));
        scores.add(scored("top", 0, 0.9));

        List<ChunkScore> selected = selector.select(scores, settings);

        assertEquals(5, selected.size());
        assertEquals("top", selected.get(0).documentId());
    }

    @Test
    void stopsOnceScoreMassIsCovered() {
        List<ChunkScore> scores = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            scores.add(scored("high-" + i, 0, 0.5));
        }
        for (int i = 0; i < 4; i++) {
            scores.add(scored("low-" + i, 0, 0.05));
        }

        // 합 3.2, 목표 2.88 → 0.5 × 6 = 3.0 에서 멈춤
        assertEquals(6, selector.select(scores, settings).size());
    }

    @Test
    void lowQualityResultsFallBackToMinResults() {
        List<ChunkScore> selected = selector.select(uniform(20, 0.04), settings);

        assertEquals(5, selected.size());
    }

    @Test
    void fewerCandidatesThanMinimumReturnsAll() {
        assertEquals(3, selector.select(uniform(3, 0.6), settings).size());
        assertTrue(selector.select(List.of(), settings).isEmpty());
    }

    @Test
    void customBoundsAreRespected() {
        RankingSettings narrow = settings.toBuilder().minResults(2).maxResults(3).build();

        assertEquals(3, selector.select(uniform(20, 0.5), narrow).size());
    }

    @Test
    void chunkWithoutDocumentIdSortsLastAmongTies() {
        List<ChunkScore> scores = List.of(scored(null, 0, 0.7), scored("b", 0, 0.7), scored("a", 0, 0.9));

        List<ChunkScore> selected = selector.select(scores, settings);

        assertEquals(3, selected.size());
        assertEquals("a", selected.get(0).documentId());
        assertEquals("b", selected.get(1).documentId());
        assertNull(selected.get(2).documentId());
    }

    @Test
    void tiesAreBrokenByDocumentAndChunkSoOrderIsStable() {
        List<ChunkScore> scores = new ArrayList<>(List.of(
                scored("b", 1, 0.7), scored("a", 2, 0.7), scored("a", 0, 0.7), scored("c", 0, 0.9)));
        List<ChunkScore> shuffled = new ArrayList<>(scores);
        Collections.reverse(shuffled);

        List<ChunkScore> first = selector.select(scores, settings);
        List<ChunkScore> second = selector.select(shuffled, settings);

        assertEquals(first, second);
        assertThat(first).extracting(ChunkScore::reference).containsExactly("c-0", "a-0", "a-2", "b-1");
    }
}
