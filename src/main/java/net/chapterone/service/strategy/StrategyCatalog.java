package net.chapterone.service.strategy;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Registered strategies keyed by arm id, in lexical arm id order.
 */
@Slf4j
@Component
public class StrategyCatalog {

    private final Map<String, RecommendationStrategy> strategies = new TreeMap<>();

    public StrategyCatalog(List<RecommendationStrategy> strategies) {
        for (RecommendationStrategy strategy : strategies) {
            RecommendationStrategy previous = this.strategies.put(strategy.armId(), strategy);
            if (previous != null) {
                throw new IllegalStateException("Duplicate strategy for arm " + strategy.armId());
            }
        }
        log.info("Registered {} recommendation strategies: {}", this.strategies.size(), this.strategies.keySet());
    }

    public List<String> armIds() {
        return List.copyOf(strategies.keySet());
    }

    public Optional<RecommendationStrategy> find(String armId) {
        return Optional.ofNullable(strategies.get(armId));
    }

    public String displayName(String armId) {
        RecommendationStrategy strategy = strategies.get(armId);
        return strategy == null ? armId : strategy.arm().displayName();
    }
}
