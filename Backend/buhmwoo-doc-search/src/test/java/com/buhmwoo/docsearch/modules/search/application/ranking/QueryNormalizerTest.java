package com.buhmwoo.docsearch.modules.search.application.ranking;

import com.buhmwoo.docsearch.modules.search.application.source.QueryExpansion;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class QueryNormalizerTest {

    private final QueryNormalizer normalizer = new QueryNormalizer();
    private final RankingSettings settings = RankingSettings.defaults();

    @Test
    void quotedPhraseBecomesSingleHighWeightTerm() {
        List<SearchTerm> terms = normalizer.parse("\"Shopping  Mall\" near me", settings);

        assertEquals(3, terms.size());
        assertEquals(new SearchTerm("shopping mall", 2.0, true, TermSource.ORIGINAL), terms.get(0));
        assertEquals(new SearchTerm("near", 1.0, true, TermSource.ORIGINAL), terms.get(1));
        assertEquals(new SearchTerm("me", 0.7, false, TermSource.ORIGINAL), terms.get(2));
    }

    @Test
    void stopWordsSingleCharsAndDuplicatesAreDropped() {
        List<SearchTerm> terms = normalizer.parse("The best mall in town, b MALL mall!", settings);

        assertThat(terms).extracting(SearchTerm::text).containsExactly("best", "mall", "town");
    }

    @Test
    void fuzzyEligibilityFollowsMinimumLength() {
        List<SearchTerm> terms = normalizer.parse("gym pool", settings);

        assertFalse(terms.get(0).fuzzyEligible());
        assertTrue(terms.get(1).fuzzyEligible());
    }

    @Test
    void blankQueryYieldsNoTerms() {
        assertTrue(normalizer.parse("", settings).isEmpty());
        assertTrue(normalizer.parse("   ", settings).isEmpty());
        assertTrue(normalizer.parse(null, settings).isEmpty());
        assertTrue(normalizer.parse("the and of", settings).isEmpty());
    }

    @Test
    void thaiRepetitionMarkSplitsTokens() {
        assertEquals(List.of("ร้านอาหาร", "ดี"), normalizer.tokenize("ร้านอาหารๆ ดี"));
    }

    @Test
    void tokenOffsetsPointIntoOriginalText() {
        List<QueryNormalizer.Token> tokens = normalizer.tokenizeWithOffsets("Hello, World");

        assertEquals(new QueryNormalizer.Token("hello", 0), tokens.get(0));
        assertEquals(new QueryNormalizer.Token("world", 7), tokens.get(1));
    }

    @Test
    void extraStopWordsFromConfigurationAreApplied() {
        RankingSettings custom = settings.toBuilder().stopWords(StopWords.with(List.of("Please"))).build();

        assertThat(normalizer.parse("please find mall", custom)).extracting(SearchTerm::text)
                .containsExactly("find", "mall");
    }

    @Test
    void expansionAppendsNewTermsWithReducedWeight() {
        List<SearchTerm> original = normalizer.parse("mall", settings);
        QueryExpansion expansion = new QueryExpansion(List.of("Shopping Center", "mall", "the"), false, 0.8);

        List<SearchTerm> merged = normalizer.mergeExpansion(original, expansion, settings);

        assertEquals(2, merged.size());
        assertEquals(new SearchTerm("shopping center", 0.8, true, TermSource.EXPANDED), merged.get(1));
    }

    @Test
    void contextualExpansionIsTaggedAsSuch() {
        List<SearchTerm> merged = normalizer.mergeExpansion(normalizer.parse("mall", settings),
                new QueryExpansion(List.of("parking"), true, 0.6), settings);

        assertEquals(TermSource.CONTEXTUAL, merged.get(1).source());
        assertTrue(normalizer.mergeExpansion(List.of(), QueryExpansion.none(), settings).isEmpty());
    }
}
