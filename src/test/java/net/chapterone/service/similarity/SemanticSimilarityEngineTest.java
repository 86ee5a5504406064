package net.chapterone.service.similarity;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SemanticSimilarityEngineTest {

    private static final Instant BUILT_AT = Instant.parse("2026-03-01T12:00:00Z");

    private static final Map<String, String> CORPUS = Map.of(
        "dune", "Desert planet epic: spice, empire, prophecy and sandworms on Arrakis",
        "foundation", "Galactic empire collapse, psychohistory and a plan spanning centuries",
        "walden", "Quiet reflection on simple living in nature beside a pond",
        "silent-spring", "Pesticides, nature and the fragile web of life in the countryside",
        "empty", "a an of"
    );

    private SemanticSimilarityEngine engine;

    @BeforeEach
    void setUp() {
        engine = new SemanticSimilarityEngine(Clock.fixed(BUILT_AT, ZoneOffset.UTC));
        engine.buildIndex(CORPUS);
    }

    @Test
    void should_ReturnBookFirstWithUnitSimilarity_When_QueryingWithItsOwnVector() {
        SparseVector duneVector = engine.currentIndex().vectorOf("dune").orElseThrow();

        List<SimilarityMatch> matches = engine.query(duneVector, 3, 0.0);

        assertThat(matches).isNotEmpty();
        assertThat(matches.get(0).bookId()).isEqualTo("dune");
        assertThat(matches.get(0).similarity()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void should_ExcludeZeroNormBooks_When_TextHasNoUsableTokens() {
        SimilarityIndex index = engine.currentIndex();

        assertThat(index.documentCount()).isEqualTo(5);
        assertThat(index.indexedBookCount()).isEqualTo(4);
        assertThat(index.vectorOf("empty")).isEmpty();
        assertThat(index.builtAt()).isEqualTo(BUILT_AT);
    }

    @Test
    void should_RankSharedTermsAboveUnrelated_When_FindingSimilarBooks() {
        List<SimilarityMatch> similar = engine.similarTo("walden", 3, 0.0);

        assertThat(similar).extracting(SimilarityMatch::bookId).doesNotContain("walden");
        assertThat(similar.get(0).bookId()).isEqualTo("silent-spring");
    }

    @Test
    void should_ReturnEmpty_When_BookIsNotIndexed() {
        assertThat(engine.similarTo("unknown-book", 5, 0.0)).isEmpty();
        assertThat(engine.similarity("unknown-book", "dune")).isZero();
    }

    @Test
    void should_DropMatchesBelowThreshold_When_ThresholdGiven() {
        List<SimilarityMatch> matches = engine.queryText("empire", 10, 0.01);

        assertThat(matches).extracting(SimilarityMatch::bookId).containsExactlyInAnyOrder("dune", "foundation");
        assertThat(matches).allSatisfy(match -> assertThat(match.similarity()).isGreaterThanOrEqualTo(0.01));
    }

    @Test
    void should_BreakTiesByBookId_When_SimilaritiesAreEqual() {
        engine.buildIndex(Map.of("b-book", "lighthouse keeper", "a-book", "lighthouse keeper"));

        List<SimilarityMatch> matches = engine.queryText("lighthouse keeper", 2, 0.0);

        assertThat(matches).extracting(SimilarityMatch::bookId).containsExactly("a-book", "b-book");
    }

    @Test
    void should_ReturnEmpty_When_QueryHasNoKnownTerms() {
        assertThat(engine.queryText("zeppelin", 5, 0.0)).isEmpty();
        assertThat(engine.query(SparseVector.empty(), 5, 0.0)).isEmpty();
    }

    @Test
    void should_ServeNewIndex_When_Rebuilt() {
        engine.buildIndex(Map.of("only", "lighthouse keeper stories"));

        assertThat(engine.currentIndex().indexedBookCount()).isEqualTo(1);
        assertThat(engine.similarTo("dune", 5, 0.0)).isEmpty();
    }

    @Test
    void should_ScoreUnindexedCandidatesZero_When_ScoringBooks() {
        Map<String, Double> scores = engine.scoreBooks("nature pond", List.of("walden", "dune", "missing"));

        assertThat(scores.get("walden")).isPositive();
        assertThat(scores.get("dune")).isZero();
        assertThat(scores.get("missing")).isZero();
    }
}
