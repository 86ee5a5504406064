package net.chapterone.repository;

import java.util.List;
import java.util.Optional;
import net.chapterone.domain.bandit.ArmKey;
import net.chapterone.domain.bandit.ArmParameters;

/**
 * Persistence of arm model parameters keyed by scope and arm id.
 */
public interface ArmParameterRepository {

    Optional<ArmParameters> find(ArmKey key);

    List<ArmParameters> findByScope(String scope);

    /** Inserts or replaces the parameters of one arm. */
    void save(ArmParameters parameters);

    /** @return arms removed */
    int deleteScope(String scope);

    int deleteAll();
}
