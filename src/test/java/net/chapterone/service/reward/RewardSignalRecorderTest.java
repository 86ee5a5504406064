package net.chapterone.service.reward;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.UUID;
import net.chapterone.adapters.memory.InMemoryRewardStore;
import net.chapterone.domain.context.ContextVector;
import net.chapterone.domain.context.ReadingContext;
import net.chapterone.domain.reward.ActionType;
import net.chapterone.domain.reward.Identity;
import net.chapterone.domain.reward.Impression;
import net.chapterone.domain.reward.UserAction;
import net.chapterone.exception.RecommendationValidationException;
import net.chapterone.service.BanditMetrics;
import net.chapterone.service.context.ContextEncoder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RewardSignalRecorderTest {

    private static final Instant NOW = Instant.parse("2026-04-10T12:00:00Z");

    private InMemoryRewardStore store;
    private RewardSignalRecorder recorder;
    private ContextVector context;

    @BeforeEach
    void setUp() {
        store = new InMemoryRewardStore();
        recorder = new RewardSignalRecorder(store, store, new BanditMetrics(), Clock.fixed(NOW, ZoneOffset.UTC));
        context = new ContextEncoder().encode(new ReadingContext("curious", "commuting", "learn", "morning"));
    }

    @Test
    void should_PersistUnattributedImpression_When_Recorded() {
        UUID impressionId = recorder.recordImpression(Identity.session("s-1"), " dune ", context,
            "semantic_similarity", 1, 0.82, Map.of("scope", "global"));

        Impression stored = store.findImpressionById(impressionId).orElseThrow();
        assertThat(stored.bookId()).isEqualTo("dune");
        assertThat(stored.armId()).isEqualTo("semantic_similarity");
        assertThat(stored.createdAt()).isEqualTo(NOW);
        assertThat(stored.reward()).isNull();
        assertThat(stored.metadata()).containsEntry("scope", "global");
    }

    @Test
    void should_RejectImpression_When_ContextHasWrongDimension() {
        ContextVector shortVector = ContextVector.of(new double[] {1.0, 0.0});

        assertThatThrownBy(() -> recorder.recordImpression(Identity.session("s-1"), "dune", shortVector,
            "semantic_similarity", 1, 0.5, null))
            .isInstanceOf(RecommendationValidationException.class)
            .hasMessageContaining("dimensions");
    }

    @Test
    void should_RejectImpression_When_RankBelowOne() {
        assertThatThrownBy(() -> recorder.recordImpression(Identity.session("s-1"), "dune", context,
            "semantic_similarity", 0, 0.5, null))
            .isInstanceOf(RecommendationValidationException.class);
    }

    @Test
    void should_KeepEveryAction_When_SameActionRepeats() {
        RewardSignalRecorder.ActionAck first = recorder.recordAction(Identity.user("reader-1"), "dune",
            ActionType.CLICK, null, null);
        RewardSignalRecorder.ActionAck second = recorder.recordAction(Identity.user("reader-1"), "dune",
            ActionType.CLICK, null, null);

        assertThat(first.actionId()).isNotEqualTo(second.actionId());
        assertThat(first.recordedAt()).isEqualTo(NOW);
        assertThat(store.findSince(NOW.minusSeconds(1), 10)).hasSize(2);
    }

    @Test
    void should_UseClientTimestamp_When_Provided() {
        Instant happenedAt = NOW.minusSeconds(90);

        RewardSignalRecorder.ActionAck ack = recorder.recordAction(Identity.session("s-1"), "dune",
            ActionType.SAVE, null, happenedAt);

        UserAction stored = store.findActionById(ack.actionId()).orElseThrow();
        assertThat(stored.createdAt()).isEqualTo(happenedAt);
        assertThat(stored.isAttributed()).isFalse();
    }

    @Test
    void should_RejectRating_When_OutsideOneToFive() {
        assertThatThrownBy(() -> recorder.recordAction(Identity.user("reader-1"), "dune", ActionType.RATE, 6.0, null))
            .isInstanceOf(RecommendationValidationException.class)
            .hasMessageContaining("between 1 and 5");
        assertThatThrownBy(() -> recorder.recordAction(Identity.user("reader-1"), "dune", ActionType.RATE, null, null))
            .isInstanceOf(RecommendationValidationException.class);
        assertThat(store.findSince(NOW.minusSeconds(1), 10)).isEmpty();
    }

    @Test
    void should_RejectAction_When_ViewDurationNegativeOrBookMissing() {
        assertThatThrownBy(() -> recorder.recordAction(Identity.user("reader-1"), "dune", ActionType.VIEW, -1.0, null))
            .isInstanceOf(RecommendationValidationException.class);
        assertThatThrownBy(() -> recorder.recordAction(Identity.user("reader-1"), " ", ActionType.CLICK, null, null))
            .isInstanceOf(RecommendationValidationException.class)
            .satisfies(ex -> assertThat(((RecommendationValidationException) ex).getField()).isEqualTo("bookId"));
    }
}
