package net.chapterone.adapters.memory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import net.chapterone.domain.bandit.ArmKey;
import net.chapterone.domain.bandit.ArmParameters;
import net.chapterone.repository.ArmParameterRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Process-local arm parameter store. Arrays are copied on the way in and out.
 */
@Component
@ConditionalOnProperty(name = "app.persistence.mode", havingValue = "memory", matchIfMissing = true)
public class InMemoryArmParameterRepository implements ArmParameterRepository {

    private final Map<ArmKey, ArmParameters> parameters = new ConcurrentHashMap<>();

    @Override
    public Optional<ArmParameters> find(ArmKey key) {
        return Optional.ofNullable(parameters.get(key)).map(InMemoryArmParameterRepository::copy);
    }

    @Override
    public List<ArmParameters> findByScope(String scope) {
        return parameters.values().stream()
            .filter(stored -> stored.key().scope().equals(scope))
            .sorted(Comparator.comparing(stored -> stored.key().armId()))
            .map(InMemoryArmParameterRepository::copy)
            .toList();
    }

    @Override
    public void save(ArmParameters armParameters) {
        parameters.put(armParameters.key(), copy(armParameters));
    }

    @Override
    public int deleteScope(String scope) {
        int before = parameters.size();
        parameters.keySet().removeIf(key -> key.scope().equals(scope));
        return before - parameters.size();
    }

    @Override
    public int deleteAll() {
        int removed = parameters.size();
        parameters.clear();
        return removed;
    }

    private static ArmParameters copy(ArmParameters source) {
        double[][] matrix = new double[source.designMatrix().length][];
        for (int i = 0; i < matrix.length; i++) {
            matrix[i] = source.designMatrix()[i].clone();
        }
        return new ArmParameters(source.key(), matrix, source.rewardVector().clone(), source.contextSum().clone(),
            source.interactionCount(), source.cumulativeReward(), source.sumSquaredReward(), source.updatedAt());
    }
}
