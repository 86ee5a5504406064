package net.chapterone.service.bandit;

import com.github.benmanes.caffeine.cache.Cache;
import jakarta.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.IntSupplier;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;
import net.chapterone.config.BanditProperties;
import net.chapterone.config.CacheFactory;
import net.chapterone.domain.bandit.ArmKey;
import net.chapterone.domain.bandit.ArmParameters;
import net.chapterone.domain.bandit.ArmSnapshot;
import net.chapterone.repository.ArmParameterRepository;
import net.chapterone.service.context.ContextEncoder;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Owns the in-memory arm models of the process.
 *
 * <p>Models are created lazily on first reference, from persisted parameters when the store has them
 * and from the cold-start prior (A = I, b = 0) otherwise. They live in a size-bounded Caffeine cache; a
 * model dropped from it is reloaded from the store on its next reference, so the store stays the source
 * of truth.</p>
 *
 * <p>Updates to one arm are serialized on a per-key lock that outlives any single model instance.
 * Updates and loads hold the shared side of a registry-wide lock and resets hold the exclusive side, so a
 * reset never interleaves with an in-flight update.</p>
 */
@Slf4j
@Component
public class ArmRegistry {

    private final ArmParameterRepository parameterRepository;
    private final BanditProperties properties;
    private final int dimension;

    private final Cache<ArmKey, ArmModel> models;
    private final Cache<ArmKey, ReentrantLock> updateLocks;
    private final Cache<ArmKey, AtomicLong> timesSelected;
    private final Cache<ArmKey, AtomicLong> exploratorySelections;
    private final ReadWriteLock stateLock = new ReentrantReadWriteLock();

    @Autowired
    public ArmRegistry(ArmParameterRepository parameterRepository, BanditProperties properties,
                       CacheFactory cacheFactory) {
        this(parameterRepository, properties, cacheFactory, ContextEncoder.DIMENSION);
    }

    ArmRegistry(ArmParameterRepository parameterRepository, BanditProperties properties, int dimension) {
        this(parameterRepository, properties, new CacheFactory(), dimension);
    }

    ArmRegistry(ArmParameterRepository parameterRepository, BanditProperties properties,
                CacheFactory cacheFactory, int dimension) {
        this.parameterRepository = parameterRepository;
        this.properties = properties;
        this.dimension = dimension;
        int maxSize = properties.getModelCacheSize();
        this.models = cacheFactory.createCacheWithSize("armModels", maxSize);
        this.updateLocks = cacheFactory.createWeakValueCache("armUpdateLocks");
        this.timesSelected = cacheFactory.createCacheWithSize("armTimesSelected", maxSize);
        this.exploratorySelections = cacheFactory.createCacheWithSize("armExploratorySelections", maxSize);
    }

    /**
     * Scope owning the arm models for a request: the user id when per-user models are on and a user is
     * known, otherwise the global scope.
     */
    public String scopeFor(@Nullable String userId) {
        if (properties.isPerUserModels() && userId != null && !userId.isBlank()) {
            return userId.trim();
        }
        return ArmKey.GLOBAL_SCOPE;
    }

    public int dimension() {
        return dimension;
    }

    ArmModel model(ArmKey key) {
        ArmModel cached = models.getIfPresent(key);
        if (cached != null) {
            return cached;
        }
        stateLock.readLock().lock();
        try {
            return models.get(key, this::load);
        } finally {
            stateLock.readLock().unlock();
        }
    }

    /**
     * Runs {@code update} against the current model of {@code key} while holding the arm's update lock.
     *
     * <p>When the model was dropped from the cache during the update, any copy loaded in the meantime may
     * predate the write and is discarded.</p>
     */
    <T> T withUpdateLock(ArmKey key, Function<ArmModel, T> update) {
        stateLock.readLock().lock();
        try {
            ReentrantLock keyLock = updateLocks.get(key, ignored -> new ReentrantLock());
            keyLock.lock();
            try {
                ArmModel model = model(key);
                T result = update.apply(model);
                if (models.getIfPresent(key) != model) {
                    models.invalidate(key);
                }
                return result;
            } finally {
                keyLock.unlock();
            }
        } finally {
            stateLock.readLock().unlock();
        }
    }

    /**
     * Drops the in-memory model of {@code key} after waiting for any update in flight. The next reference
     * reloads it from the store.
     */
    public void evict(ArmKey key) {
        stateLock.readLock().lock();
        try {
            ReentrantLock keyLock = updateLocks.get(key, ignored -> new ReentrantLock());
            keyLock.lock();
            try {
                models.invalidate(key);
            } finally {
                keyLock.unlock();
            }
        } finally {
            stateLock.readLock().unlock();
        }
        log.debug("Evicted arm {} in scope {}", key.armId(), key.scope());
    }

    long cachedModelCount() {
        models.cleanUp();
        return models.estimatedSize();
    }

    public ArmSnapshot snapshot(ArmKey key) {
        return model(key).snapshot();
    }

    public List<ArmSnapshot> snapshots(String scope, Collection<String> armIds) {
        List<ArmSnapshot> snapshots = new ArrayList<>(armIds.size());
        for (String armId : armIds) {
            snapshots.add(snapshot(new ArmKey(scope, armId)));
        }
        return snapshots;
    }

    public void recordSelection(ArmKey key, boolean exploratory) {
        timesSelected.get(key, ignored -> new AtomicLong()).incrementAndGet();
        if (exploratory) {
            exploratorySelections.get(key, ignored -> new AtomicLong()).incrementAndGet();
        }
    }

    public long timesSelected(ArmKey key) {
        AtomicLong count = timesSelected.getIfPresent(key);
        return count == null ? 0L : count.get();
    }

    public long exploratorySelections(ArmKey key) {
        AtomicLong count = exploratorySelections.getIfPresent(key);
        return count == null ? 0L : count.get();
    }

    /**
     * Drops every model of the scope, in memory and in the store. The next reference starts from the prior.
     *
     * @return persisted arms removed
     */
    public int resetScope(String scope) {
        int removed = reset(key -> key.scope().equals(scope), () -> parameterRepository.deleteScope(scope));
        log.info("Reset bandit scope {} ({} persisted arms removed)", scope, removed);
        return removed;
    }

    public int resetAll() {
        int removed = reset(key -> true, parameterRepository::deleteAll);
        log.info("Reset all bandit scopes ({} persisted arms removed)", removed);
        return removed;
    }

    private int reset(Predicate<ArmKey> affected, IntSupplier deletion) {
        stateLock.writeLock().lock();
        try {
            int removed = deletion.getAsInt();
            models.asMap().keySet().removeIf(affected);
            timesSelected.asMap().keySet().removeIf(affected);
            exploratorySelections.asMap().keySet().removeIf(affected);
            return removed;
        } finally {
            stateLock.writeLock().unlock();
        }
    }

    private ArmModel load(ArmKey key) {
        ArmParameters parameters = parameterRepository.find(key)
            .filter(stored -> {
                if (stored.dimension() != dimension) {
                    log.warn("Ignoring stored parameters for {}: dimension {} does not match {}",
                        key, stored.dimension(), dimension);
                    return false;
                }
                return true;
            })
            .orElseGet(() -> ArmParameters.initial(key, dimension));
        log.debug("Loaded arm {} in scope {} with {} interactions", key.armId(), key.scope(),
            parameters.interactionCount());
        return ArmModel.fromParameters(parameters);
    }
}
