package net.chapterone.adapters.memory;

import jakarta.annotation.Nullable;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import net.chapterone.domain.reward.AttributionCursor;
import net.chapterone.domain.reward.Identity;
import net.chapterone.domain.reward.Impression;
import net.chapterone.domain.reward.UserAction;
import net.chapterone.repository.ActionRepository;
import net.chapterone.repository.AttributionLedger;
import net.chapterone.repository.ImpressionRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Process-local impression and action store for the {@code nodb} profile and tests.
 *
 * <p>All access goes through one monitor, which makes {@link #commitAttribution} atomic in the same
 * way the JDBC ledger's transaction is.</p>
 */
@Component
@ConditionalOnProperty(name = "app.persistence.mode", havingValue = "memory", matchIfMissing = true)
public class InMemoryRewardStore implements ImpressionRepository, ActionRepository, AttributionLedger {

    private static final Comparator<Impression> NEWEST_IMPRESSION_FIRST = Comparator
        .comparing(Impression::createdAt)
        .thenComparing(Impression::impressionId)
        .reversed();

    private static final Comparator<UserAction> SCAN_ORDER = Comparator
        .comparing(UserAction::createdAt)
        .thenComparing(UserAction::actionId);

    private final Object monitor = new Object();
    private final Map<UUID, Impression> impressions = new LinkedHashMap<>();
    private final Map<UUID, UserAction> actions = new LinkedHashMap<>();
    private final Set<UUID> examined = new HashSet<>();

    @Override
    public void save(Impression impression) {
        synchronized (monitor) {
            impressions.put(impression.impressionId(), impression);
        }
    }

    @Override
    public void save(UserAction action) {
        synchronized (monitor) {
            actions.put(action.actionId(), action);
        }
    }

    @Override
    public Optional<Impression> findImpressionById(UUID impressionId) {
        synchronized (monitor) {
            return Optional.ofNullable(impressions.get(impressionId));
        }
    }

    @Override
    public Optional<UserAction> findActionById(UUID actionId) {
        synchronized (monitor) {
            return Optional.ofNullable(actions.get(actionId));
        }
    }

    @Override
    public Optional<Impression> findLatestAttributable(Identity identity, String bookId, Instant earliest,
                                                       Instant latest) {
        synchronized (monitor) {
            return impressions.values().stream()
                .filter(impression -> impression.bookId().equals(bookId))
                .filter(impression -> impression.identity().matches(identity))
                .filter(impression -> !impression.createdAt().isBefore(earliest)
                    && !impression.createdAt().isAfter(latest))
                .min(NEWEST_IMPRESSION_FIRST);
        }
    }

    @Override
    public List<Impression> findRecentForIdentity(Identity identity, Instant since, int limit) {
        synchronized (monitor) {
            return impressions.values().stream()
                .filter(impression -> impression.identity().matches(identity))
                .filter(impression -> !impression.createdAt().isBefore(since))
                .sorted(NEWEST_IMPRESSION_FIRST)
                .limit(limit)
                .toList();
        }
    }

    @Override
    public List<UserAction> findUnattributed(Instant since, @Nullable AttributionCursor cursor, int limit) {
        synchronized (monitor) {
            return actions.values().stream()
                .filter(action -> !action.isAttributed())
                .filter(action -> !examined.contains(action.actionId()))
                .filter(action -> !action.createdAt().isBefore(since))
                .filter(action -> cursor == null || cursor.precedes(action))
                .sorted(SCAN_ORDER)
                .limit(limit)
                .toList();
        }
    }

    @Override
    public void markExamined(UUID actionId, Instant examinedAt) {
        synchronized (monitor) {
            UserAction action = actions.get(actionId);
            if (action != null && !action.isAttributed()) {
                examined.add(actionId);
            }
        }
    }

    @Override
    public List<UserAction> findSince(Instant since, int limit) {
        synchronized (monitor) {
            return actions.values().stream()
                .filter(action -> !action.createdAt().isBefore(since))
                .sorted(SCAN_ORDER)
                .limit(limit)
                .toList();
        }
    }

    @Override
    public List<UserAction> findForIdentity(Identity identity, Instant since, int limit) {
        synchronized (monitor) {
            return actions.values().stream()
                .filter(action -> action.identity().matches(identity))
                .filter(action -> !action.createdAt().isBefore(since))
                .sorted(SCAN_ORDER.reversed())
                .limit(limit)
                .toList();
        }
    }

    /**
     * Runs the model update first, so a failing update leaves both records untouched.
     */
    @Override
    public boolean commitAttribution(UUID actionId, UUID impressionId, double rewardDelta, Instant attributedAt,
                                     Runnable modelUpdate) {
        synchronized (monitor) {
            UserAction action = actions.get(actionId);
            Impression impression = impressions.get(impressionId);
            if (action == null || impression == null) {
                throw new IllegalStateException("Cannot attribute action " + actionId + " to impression " + impressionId
                    + ": record missing");
            }
            if (action.isAttributed()) {
                return false;
            }
            modelUpdate.run();
            actions.put(actionId, action.markedAttributed(impressionId, attributedAt));
            impressions.put(impressionId, impression.withAddedReward(rewardDelta, attributedAt));
            return true;
        }
    }

    @Override
    public int reassignImpressions(String sessionId, String userId) {
        synchronized (monitor) {
            int count = 0;
            for (Map.Entry<UUID, Impression> entry : impressions.entrySet()) {
                Identity identity = entry.getValue().identity();
                if (identity.userId() == null && sessionId.equals(identity.sessionId())) {
                    entry.setValue(entry.getValue().withIdentity(new Identity(userId, sessionId)));
                    count++;
                }
            }
            return count;
        }
    }

    @Override
    public int reassignActions(String sessionId, String userId) {
        synchronized (monitor) {
            int count = 0;
            for (Map.Entry<UUID, UserAction> entry : actions.entrySet()) {
                Identity identity = entry.getValue().identity();
                if (identity.userId() == null && sessionId.equals(identity.sessionId())) {
                    entry.setValue(entry.getValue().withIdentity(new Identity(userId, sessionId)));
                    examined.remove(entry.getKey());
                    count++;
                }
            }
            return count;
        }
    }
}
