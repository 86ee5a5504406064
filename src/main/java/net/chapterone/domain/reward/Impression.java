package net.chapterone.domain.reward;

import jakarta.annotation.Nullable;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import net.chapterone.domain.context.ContextVector;

/**
 * A recorded instance of a book being shown to a reader by one arm.
 *
 * <p>{@code reward} is null until the first attribution lands and then accumulates
 * decayed action rewards.</p>
 */
public record Impression(
    UUID impressionId,
    Identity identity,
    String bookId,
    ContextVector context,
    String armId,
    int rank,
    double score,
    Map<String, String> metadata,
    Instant createdAt,
    @Nullable Double reward,
    @Nullable Instant attributedAt
) {

    public Impression {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public Impression withIdentity(Identity newIdentity) {
        return new Impression(impressionId, newIdentity, bookId, context, armId, rank, score, metadata,
            createdAt, reward, attributedAt);
    }

    public Impression withAddedReward(double delta, Instant at) {
        double current = reward == null ? 0.0 : reward;
        return new Impression(impressionId, identity, bookId, context, armId, rank, score, metadata,
            createdAt, current + delta, at);
    }
}
