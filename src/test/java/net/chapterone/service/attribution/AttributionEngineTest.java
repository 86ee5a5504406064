package net.chapterone.service.attribution;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import net.chapterone.adapters.memory.InMemoryArmParameterRepository;
import net.chapterone.adapters.memory.InMemoryRewardStore;
import net.chapterone.config.AttributionProperties;
import net.chapterone.config.BanditProperties;
import net.chapterone.config.CacheFactory;
import net.chapterone.config.RewardPointProperties;
import net.chapterone.domain.bandit.ArmKey;
import net.chapterone.domain.bandit.ArmParameters;
import net.chapterone.domain.context.ContextVector;
import net.chapterone.domain.context.ReadingContext;
import net.chapterone.domain.reward.ActionType;
import net.chapterone.domain.reward.AttributionResult;
import net.chapterone.domain.reward.Identity;
import net.chapterone.domain.reward.Impression;
import net.chapterone.domain.reward.UserAction;
import net.chapterone.exception.RecommendationValidationException;
import net.chapterone.repository.AttributionLedger;
import net.chapterone.service.BanditMetrics;
import net.chapterone.service.bandit.ArmRegistry;
import net.chapterone.service.bandit.ModelUpdater;
import net.chapterone.service.context.ContextEncoder;
import net.chapterone.service.reward.RewardPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AttributionEngineTest {

    private static final Instant SHOWN_AT = Instant.parse("2026-05-01T08:00:00Z");
    private static final Instant NOW = SHOWN_AT.plus(Duration.ofDays(10));
    private static final int SCAN_HOURS = 24 * 30;
    private static final double LAMBDA = 1.0 / 48.0;

    private InMemoryRewardStore store;
    private InMemoryArmParameterRepository parameterRepository;
    private AtomicInteger failingArmSaves;
    private ArmRegistry armRegistry;
    private ModelUpdater modelUpdater;
    private AttributionProperties properties;
    private RewardPolicy rewardPolicy;
    private AttributionEngine engine;
    private ContextVector context;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        store = new InMemoryRewardStore();
        failingArmSaves = new AtomicInteger();
        parameterRepository = new InMemoryArmParameterRepository() {
            @Override
            public void save(ArmParameters armParameters) {
                if (failingArmSaves.getAndUpdate(remaining -> Math.max(0, remaining - 1)) > 0) {
                    throw new IllegalStateException("arm parameter store unavailable");
                }
                super.save(armParameters);
            }
        };
        armRegistry = new ArmRegistry(parameterRepository, new BanditProperties(), new CacheFactory());
        modelUpdater = new ModelUpdater(armRegistry, parameterRepository, new BanditMetrics(), clock);
        properties = new AttributionProperties();
        rewardPolicy = new RewardPolicy(new RewardPointProperties());
        engine = engineWith(store, clock);
        context = new ContextEncoder().encode(new ReadingContext("adventurous", "vacation", "escape", "evening"));
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void should_CreditImpression_When_ActionExactlyAtWindowEdge() {
        Impression impression = impression(Identity.session("s-1"), "dune", "trending_popular", SHOWN_AT);
        action(Identity.session("s-1"), "dune", ActionType.CLICK, null, SHOWN_AT.plus(Duration.ofDays(7)));

        AttributionResult result = engine.attributeRewards(SCAN_HOURS);

        assertThat(result.updated()).isEqualTo(1);
        assertThat(store.findImpressionById(impression.impressionId()).orElseThrow().reward())
            .isCloseTo(Math.exp(-LAMBDA * 168.0), within(1e-12));
    }

    @Test
    void should_LeaveActionUnattributed_When_OneMillisecondPastWindow() {
        impression(Identity.session("s-1"), "dune", "trending_popular", SHOWN_AT);
        UserAction late = action(Identity.session("s-1"), "dune", ActionType.CLICK, null,
            SHOWN_AT.plus(Duration.ofDays(7)).plusMillis(1));

        AttributionResult result = engine.attributeRewards(SCAN_HOURS);

        assertThat(result.processed()).isEqualTo(1);
        assertThat(result.unmatched()).isEqualTo(1);
        assertThat(result.updated()).isZero();
        assertThat(store.findActionById(late.actionId()).orElseThrow().isAttributed()).isFalse();
    }

    @Test
    void should_CreditMostRecentImpression_When_BookShownTwice() {
        Impression earlier = impression(Identity.user("reader-1"), "dune", "trending_popular", SHOWN_AT);
        Impression later = impression(Identity.user("reader-1"), "dune", "semantic_similarity",
            SHOWN_AT.plus(Duration.ofHours(5)));
        UserAction save = action(Identity.user("reader-1"), "dune", ActionType.SAVE, null,
            SHOWN_AT.plus(Duration.ofHours(6)));

        engine.attributeRewards(SCAN_HOURS);

        assertThat(store.findActionById(save.actionId()).orElseThrow().attributedImpressionId())
            .isEqualTo(later.impressionId());
        assertThat(store.findImpressionById(earlier.impressionId()).orElseThrow().reward()).isNull();
        assertThat(armRegistry.snapshot(new ArmKey("reader-1", "semantic_similarity")).interactionCount()).isEqualTo(1);
        assertThat(armRegistry.snapshot(new ArmKey("reader-1", "trending_popular")).interactionCount()).isZero();
    }

    @Test
    void should_MatchAcrossSessionAndUser_When_IdentitiesShareSession() {
        impression(new Identity("reader-2", "s-9"), "walden", "contextual_mood", SHOWN_AT);
        action(Identity.session("s-9"), "walden", ActionType.CLICK, null, SHOWN_AT.plus(Duration.ofMinutes(3)));

        AttributionResult result = engine.attributeRewards(SCAN_HOURS);

        assertThat(result.updated()).isEqualTo(1);
    }

    @Test
    void should_NotCountTwice_When_BatchRunsAgain() {
        impression(Identity.session("s-1"), "dune", "trending_popular", SHOWN_AT);
        action(Identity.session("s-1"), "dune", ActionType.CLICK, null, SHOWN_AT.plus(Duration.ofHours(1)));

        AttributionResult first = engine.attributeRewards(SCAN_HOURS);
        AttributionResult second = engine.attributeRewards(SCAN_HOURS);

        assertThat(first.updated()).isEqualTo(1);
        assertThat(second.processed()).isZero();
        assertThat(armRegistry.snapshot(ArmKey.global("trending_popular")).interactionCount()).isEqualTo(1);
    }

    @Test
    void should_SumDecayedRewards_When_SeveralActionsHitOneImpression() {
        Impression impression = impression(Identity.session("s-1"), "dune", "trending_popular", SHOWN_AT);
        action(Identity.session("s-1"), "dune", ActionType.CLICK, null, SHOWN_AT.plus(Duration.ofHours(1)));
        action(Identity.session("s-1"), "dune", ActionType.SAVE, null, SHOWN_AT.plus(Duration.ofHours(2)));
        action(Identity.session("s-1"), "dune", ActionType.UNSAVE, null, SHOWN_AT.plus(Duration.ofHours(24)));

        AttributionResult result = engine.attributeRewards(SCAN_HOURS);

        double expected = Math.exp(-LAMBDA) + 3.0 * Math.exp(-2 * LAMBDA) - 3.0 * Math.exp(-24 * LAMBDA);
        assertThat(result.updated()).isEqualTo(3);
        assertThat(store.findImpressionById(impression.impressionId()).orElseThrow().reward())
            .isCloseTo(expected, within(1e-9));
        assertThat(armRegistry.snapshot(ArmKey.global("trending_popular")).cumulativeReward())
            .isCloseTo(expected, within(1e-9));
    }

    @Test
    void should_SkipMalformedRecords_When_BatchContinues() {
        impression(Identity.session("s-1"), "dune", "trending_popular", SHOWN_AT);
        action(Identity.session("s-1"), "dune", ActionType.RATE, 9.0, SHOWN_AT.plus(Duration.ofHours(1)));
        action(Identity.session("s-1"), "dune", ActionType.CLICK, null, SHOWN_AT.plus(Duration.ofHours(2)));

        AttributionResult result = engine.attributeRewards(SCAN_HOURS);

        assertThat(result.processed()).isEqualTo(2);
        assertThat(result.errors()).isEqualTo(1);
        assertThat(result.updated()).isEqualTo(1);
    }

    @Test
    void should_CountConflict_When_LedgerReportsPriorAttribution() {
        AttributionLedger alreadyAttributed = (actionId, impressionId, delta, at, update) -> false;
        AttributionEngine conflicted = new AttributionEngine(store, store, alreadyAttributed, modelUpdater,
            armRegistry, rewardPolicy, properties, new BanditMetrics(), Clock.fixed(NOW, ZoneOffset.UTC));
        impression(Identity.session("s-1"), "dune", "trending_popular", SHOWN_AT);
        action(Identity.session("s-1"), "dune", ActionType.CLICK, null, SHOWN_AT.plus(Duration.ofHours(1)));

        AttributionResult result = conflicted.attributeRewards(SCAN_HOURS);

        assertThat(result.conflicts()).isEqualTo(1);
        assertThat(result.updated()).isZero();
        assertThat(armRegistry.snapshot(ArmKey.global("trending_popular")).interactionCount()).isZero();
    }

    @Test
    void should_ReachMatchableAction_When_OlderUnmatchedActionsFillRunCap() {
        properties.setMaxActionsPerRun(3);
        impression(Identity.session("s-1"), "dune", "trending_popular", SHOWN_AT);
        for (int i = 1; i <= 3; i++) {
            action(Identity.session("s-1"), "never-shown-" + i, ActionType.CLICK, null, SHOWN_AT.plus(Duration.ofMinutes(i)));
        }
        UserAction click = action(Identity.session("s-1"), "dune", ActionType.CLICK, null,
            SHOWN_AT.plus(Duration.ofHours(1)));

        AttributionResult first = engine.attributeRewards(SCAN_HOURS);
        AttributionResult second = engine.attributeRewards(SCAN_HOURS);

        assertThat(first.processed()).isEqualTo(3);
        assertThat(first.unmatched()).isEqualTo(3);
        assertThat(second.processed()).isEqualTo(1);
        assertThat(second.updated()).isEqualTo(1);
        assertThat(store.findActionById(click.actionId()).orElseThrow().isAttributed()).isTrue();
    }

    @Test
    void should_NotRescanMalformedAction_When_BatchRunsAgain() {
        impression(Identity.session("s-1"), "dune", "trending_popular", SHOWN_AT);
        action(Identity.session("s-1"), "dune", ActionType.RATE, 9.0, SHOWN_AT.plus(Duration.ofHours(1)));

        AttributionResult first = engine.attributeRewards(SCAN_HOURS);
        AttributionResult second = engine.attributeRewards(SCAN_HOURS);

        assertThat(first.errors()).isEqualTo(1);
        assertThat(second.processed()).isZero();
    }

    @Test
    void should_RetryAction_When_ArmUpdateFailed() {
        Impression impression = impression(Identity.session("s-1"), "dune", "trending_popular", SHOWN_AT);
        UserAction click = action(Identity.session("s-1"), "dune", ActionType.CLICK, null,
            SHOWN_AT.plus(Duration.ofHours(1)));
        failingArmSaves.set(1);

        AttributionResult failed = engine.attributeRewards(SCAN_HOURS);

        assertThat(failed.errors()).isEqualTo(1);
        assertThat(failed.updated()).isZero();
        assertThat(store.findActionById(click.actionId()).orElseThrow().isAttributed()).isFalse();
        assertThat(store.findImpressionById(impression.impressionId()).orElseThrow().reward()).isNull();
        assertThat(armRegistry.snapshot(ArmKey.global("trending_popular")).interactionCount()).isZero();

        AttributionResult retried = engine.attributeRewards(SCAN_HOURS);

        assertThat(retried.updated()).isEqualTo(1);
        assertThat(store.findActionById(click.actionId()).orElseThrow().isAttributed()).isTrue();
        assertThat(armRegistry.snapshot(ArmKey.global("trending_popular")).interactionCount()).isEqualTo(1);
    }

    @Test
    void should_NotCreditOtherUser_When_SignedInReadersShareSession() {
        impression(new Identity("alice", "kiosk"), "dune", "trending_popular", SHOWN_AT);
        UserAction save = action(new Identity("bob", "kiosk"), "dune", ActionType.SAVE, null,
            SHOWN_AT.plus(Duration.ofMinutes(10)));

        AttributionResult result = engine.attributeRewards(SCAN_HOURS);

        assertThat(result.unmatched()).isEqualTo(1);
        assertThat(result.updated()).isZero();
        assertThat(store.findActionById(save.actionId()).orElseThrow().isAttributed()).isFalse();
        assertThat(armRegistry.snapshot(new ArmKey("alice", "trending_popular")).interactionCount()).isZero();
    }

    @Test
    void should_IgnoreActionsOlderThanScanWindow_When_Scanning() {
        impression(Identity.session("s-1"), "dune", "trending_popular", SHOWN_AT);
        action(Identity.session("s-1"), "dune", ActionType.CLICK, null, SHOWN_AT.plus(Duration.ofHours(1)));

        AttributionResult result = engine.attributeRewards(24);

        assertThat(result.processed()).isZero();
    }

    @Test
    void should_PageThroughActions_When_MoreThanOnePage() {
        properties.setPageSize(2);
        impression(Identity.session("s-1"), "dune", "trending_popular", SHOWN_AT);
        for (int i = 1; i <= 5; i++) {
            action(Identity.session("s-1"), "dune", ActionType.CLICK, null, SHOWN_AT.plus(Duration.ofMinutes(i)));
        }

        AttributionResult result = engine.attributeRewards(SCAN_HOURS);

        assertThat(result.processed()).isEqualTo(5);
        assertThat(result.updated()).isEqualTo(5);
    }

    @Test
    void should_RejectWindow_When_NotPositive() {
        assertThatThrownBy(() -> engine.attributeRewards(0))
            .isInstanceOf(RecommendationValidationException.class);
    }

    @Test
    void should_StopEarly_When_ThreadInterrupted() {
        impression(Identity.session("s-1"), "dune", "trending_popular", SHOWN_AT);
        UserAction click = action(Identity.session("s-1"), "dune", ActionType.CLICK, null,
            SHOWN_AT.plus(Duration.ofHours(1)));

        Thread.currentThread().interrupt();
        AttributionResult result = engine.attributeRewards(SCAN_HOURS);

        assertThat(result.interrupted()).isTrue();
        assertThat(result.processed()).isZero();
        assertThat(store.findActionById(click.actionId()).orElseThrow().isAttributed()).isFalse();
    }

    private AttributionEngine engineWith(InMemoryRewardStore rewardStore, Clock clock) {
        return new AttributionEngine(rewardStore, rewardStore, rewardStore, modelUpdater, armRegistry,
            rewardPolicy, properties, new BanditMetrics(), clock);
    }

    private Impression impression(Identity identity, String bookId, String armId, Instant createdAt) {
        String scope = armRegistry.scopeFor(identity.userId());
        Impression impression = new Impression(UUID.randomUUID(), identity, bookId, context, armId, 1, 0.5,
            Map.of(AttributionEngine.SCOPE_METADATA_KEY, scope), createdAt, null, null);
        store.save(impression);
        return impression;
    }

    private UserAction action(Identity identity, String bookId, ActionType type, Double value, Instant createdAt) {
        UserAction action = UserAction.unattributed(UUID.randomUUID(), identity, bookId, type, value, createdAt);
        store.save(action);
        return action;
    }
}
