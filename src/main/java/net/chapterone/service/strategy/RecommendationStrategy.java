package net.chapterone.service.strategy;

import java.util.List;
import net.chapterone.domain.bandit.BanditArm;
import net.chapterone.domain.catalog.RankedBook;

/**
 * One bandit arm: a way of ranking the caller's candidate books for a context.
 *
 * <p>Implementations must be thread-safe and must return at most {@code request.limit()} books,
 * each drawn from {@code request.candidates()}.</p>
 */
public interface RecommendationStrategy {

    BanditArm arm();

    default String armId() {
        return arm().armId();
    }

    List<RankedBook> rank(StrategyRequest request);
}
