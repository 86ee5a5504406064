package net.chapterone.service.context;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.Map;
import java.util.Set;
import net.chapterone.domain.context.ContextVector;
import net.chapterone.domain.context.ReadingContext;
import net.chapterone.util.ValidationUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Encodes a {@link ReadingContext} into the 44-dimensional feature vector used by every arm model.
 *
 * <p>Layout: mood (8) · situation (8) · goal (8) · temporal (12) · meta (8). The meta block carries
 * one indicator per categorical input that was missing or outside the vocabulary, three neutral
 * preference priors and a constant bias term. The result is L2-normalised.</p>
 *
 * <p>Encoding is pure: identical input always yields a bit-identical vector. All arithmetic goes
 * through {@link StrictMath} and no clock is consulted.</p>
 */
@Component
public class ContextEncoder {

    public static final int MOOD_DIMENSIONS = 8;
    public static final int SITUATION_DIMENSIONS = 8;
    public static final int GOAL_DIMENSIONS = 8;
    public static final int TEMPORAL_DIMENSIONS = 12;
    public static final int META_DIMENSIONS = 8;
    public static final int DIMENSION =
        MOOD_DIMENSIONS + SITUATION_DIMENSIONS + GOAL_DIMENSIONS + TEMPORAL_DIMENSIONS + META_DIMENSIONS;

    static final int MOOD_OFFSET = 0;
    static final int SITUATION_OFFSET = MOOD_OFFSET + MOOD_DIMENSIONS;
    static final int GOAL_OFFSET = SITUATION_OFFSET + SITUATION_DIMENSIONS;
    static final int TEMPORAL_OFFSET = GOAL_OFFSET + GOAL_DIMENSIONS;
    static final int META_OFFSET = TEMPORAL_OFFSET + TEMPORAL_DIMENSIONS;

    public static final int UNKNOWN_MOOD_INDEX = META_OFFSET;
    static final int UNKNOWN_SITUATION_INDEX = META_OFFSET + 1;
    static final int UNKNOWN_GOAL_INDEX = META_OFFSET + 2;
    static final int UNKNOWN_TIME_INDEX = META_OFFSET + 3;
    static final int BIAS_INDEX = META_OFFSET + 7;

    private static final double NEUTRAL_PRIOR = 0.5;

    // energy, curiosity, drive, openness, calm, warmth, reflection, depth
    private static final Map<String, double[]> MOODS = Map.ofEntries(
        Map.entry("motivated", new double[] {1.0, 0.8, 0.6, 0.2, 0.0, 0.0, 0.0, 0.0}),
        Map.entry("curious", new double[] {0.6, 1.0, 0.4, 0.8, 0.2, 0.0, 0.0, 0.0}),
        Map.entry("relaxed", new double[] {0.0, 0.2, 0.0, 0.0, 1.0, 0.8, 0.6, 0.2}),
        Map.entry("adventurous", new double[] {0.8, 0.6, 1.0, 0.4, 0.0, 0.0, 0.0, 0.0}),
        Map.entry("nostalgic", new double[] {0.2, 0.4, 0.0, 0.6, 0.8, 0.6, 1.0, 0.4}),
        Map.entry("focused", new double[] {0.8, 0.9, 0.4, 0.6, 0.0, 0.0, 0.0, 0.0}),
        Map.entry("excited", new double[] {0.9, 0.7, 0.8, 0.3, 0.0, 0.0, 0.0, 0.0}),
        Map.entry("contemplative", new double[] {0.2, 0.8, 0.0, 0.4, 0.6, 0.4, 0.8, 0.6}),
        Map.entry("energetic", new double[] {0.9, 0.6, 0.7, 0.4, 0.0, 0.0, 0.0, 0.0}),
        Map.entry("peaceful", new double[] {0.0, 0.1, 0.0, 0.0, 0.9, 0.8, 0.7, 0.3}),
        Map.entry("inspired", new double[] {0.7, 0.9, 0.5, 0.8, 0.2, 0.0, 0.0, 0.0}),
        Map.entry("thoughtful", new double[] {0.3, 0.7, 0.2, 0.5, 0.4, 0.3, 0.6, 0.4})
    );

    // mobile, leisure, short-form, interruptible, wind-down, sleepy, unhurried, study
    private static final Map<String, double[]> SITUATIONS = Map.ofEntries(
        Map.entry("commuting", new double[] {1.0, 0.0, 0.6, 0.4, 0.0, 0.0, 0.0, 0.0}),
        Map.entry("before_bed", new double[] {0.0, 0.0, 0.0, 0.0, 1.0, 0.8, 0.0, 0.0}),
        Map.entry("weekend", new double[] {0.0, 1.0, 0.0, 0.0, 0.6, 0.4, 0.8, 0.0}),
        Map.entry("lunch_break", new double[] {0.6, 0.0, 0.8, 0.6, 0.2, 0.0, 0.0, 0.0}),
        Map.entry("traveling", new double[] {0.8, 0.2, 0.4, 0.6, 0.0, 0.0, 0.0, 0.0}),
        Map.entry("studying", new double[] {0.2, 0.0, 0.2, 0.0, 0.0, 0.0, 0.0, 1.0}),
        Map.entry("break_time", new double[] {0.4, 0.6, 0.6, 0.4, 0.4, 0.2, 0.6, 0.0}),
        Map.entry("waiting", new double[] {0.6, 0.2, 0.4, 0.8, 0.2, 0.0, 0.0, 0.0}),
        Map.entry("vacation", new double[] {0.2, 0.8, 0.2, 0.2, 0.8, 0.6, 0.9, 0.0}),
        Map.entry("work_day", new double[] {0.4, 0.0, 0.6, 0.2, 0.0, 0.0, 0.0, 0.6}),
        Map.entry("evening", new double[] {0.0, 0.4, 0.0, 0.0, 0.6, 1.0, 0.4, 0.0}),
        Map.entry("morning", new double[] {0.6, 0.2, 0.4, 0.8, 0.0, 0.0, 0.0, 0.4})
    );

    // fun, knowledge, career, inspiration, relief, perspective, spare, spare
    private static final Map<String, double[]> GOALS = Map.ofEntries(
        Map.entry("entertainment", new double[] {1.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0}),
        Map.entry("learning", new double[] {0.0, 1.0, 0.8, 0.6, 0.0, 0.0, 0.0, 0.0}),
        Map.entry("professional", new double[] {0.0, 0.8, 1.0, 0.4, 0.0, 0.0, 0.0, 0.0}),
        Map.entry("inspiration", new double[] {0.4, 0.6, 0.2, 1.0, 0.0, 0.0, 0.0, 0.0}),
        Map.entry("relaxation", new double[] {0.0, 0.0, 0.0, 0.0, 1.0, 0.0, 0.0, 0.0}),
        Map.entry("perspective", new double[] {0.2, 0.8, 0.4, 0.8, 0.0, 1.0, 0.0, 0.0}),
        Map.entry("skill_building", new double[] {0.0, 0.9, 0.8, 0.4, 0.0, 0.0, 0.0, 0.0}),
        Map.entry("escape", new double[] {0.8, 0.0, 0.0, 0.2, 0.8, 0.0, 0.0, 0.0}),
        Map.entry("self_improvement", new double[] {0.2, 0.7, 0.6, 0.8, 0.0, 0.4, 0.0, 0.0}),
        Map.entry("creativity", new double[] {0.4, 0.5, 0.0, 0.9, 0.0, 0.6, 0.0, 0.0}),
        Map.entry("productivity", new double[] {0.0, 0.6, 0.9, 0.6, 0.0, 0.0, 0.0, 0.0}),
        Map.entry("mindfulness", new double[] {0.0, 0.2, 0.0, 0.4, 0.9, 0.8, 0.0, 0.0})
    );

    // time of day -> representative hour
    private static final Map<String, Integer> TIMES_OF_DAY = Map.of(
        "morning", 9,
        "afternoon", 14,
        "evening", 19,
        "night", 23
    );

    private static final String[] TIME_SLOTS = {"morning", "afternoon", "evening", "night"};

    private final Cache<ReadingContext, ContextVector> cache;

    @Autowired
    public ContextEncoder(Cache<ReadingContext, ContextVector> contextVectorCache) {
        this.cache = contextVectorCache;
    }

    public ContextEncoder() {
        this(Caffeine.newBuilder().maximumSize(256).build());
    }

    /**
     * Encodes the reading context.
     *
     * @param context caller-supplied context, null is treated as all-unknown
     * @return unit-length vector of {@link #DIMENSION} entries
     */
    public ContextVector encode(ReadingContext context) {
        ReadingContext canonical = canonicalize(context);
        return cache.get(canonical, ContextEncoder::encodeCanonical);
    }

    /**
     * Cosine similarity of two encoded contexts.
     */
    public double similarity(ContextVector a, ContextVector b) {
        double normA = a.norm();
        double normB = b.norm();
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return a.dot(b) / (normA * normB);
    }

    public static Set<String> supportedMoods() {
        return MOODS.keySet();
    }

    public static Set<String> supportedSituations() {
        return SITUATIONS.keySet();
    }

    public static Set<String> supportedGoals() {
        return GOALS.keySet();
    }

    public static Set<String> supportedTimesOfDay() {
        return TIMES_OF_DAY.keySet();
    }

    private static ReadingContext canonicalize(ReadingContext context) {
        if (context == null) {
            return ReadingContext.empty();
        }
        Integer day = context.dayOfWeek();
        if (day != null && (day < 1 || day > 7)) {
            day = null;
        }
        return new ReadingContext(
            ValidationUtils.normalizeKey(context.mood()),
            ValidationUtils.normalizeKey(context.situation()),
            ValidationUtils.normalizeKey(context.goal()),
            ValidationUtils.normalizeKey(context.timeOfDay()),
            day);
    }

    private static ContextVector encodeCanonical(ReadingContext context) {
        double[] features = new double[DIMENSION];

        features[UNKNOWN_MOOD_INDEX] = copyBlock(lookup(MOODS, context.mood()), features, MOOD_OFFSET);
        features[UNKNOWN_SITUATION_INDEX] =
            copyBlock(lookup(SITUATIONS, context.situation()), features, SITUATION_OFFSET);
        features[UNKNOWN_GOAL_INDEX] = copyBlock(lookup(GOALS, context.goal()), features, GOAL_OFFSET);
        features[UNKNOWN_TIME_INDEX] = encodeTemporal(context, features);

        features[META_OFFSET + 4] = NEUTRAL_PRIOR;
        features[META_OFFSET + 5] = NEUTRAL_PRIOR;
        features[META_OFFSET + 6] = NEUTRAL_PRIOR;
        features[BIAS_INDEX] = 1.0;

        return ContextVector.of(normalize(features));
    }

    // Map.of tables reject null keys
    private static <V> V lookup(Map<String, V> table, String key) {
        return key == null ? null : table.get(key);
    }

    /** Returns 1.0 (the unknown indicator) when the value had no vocabulary entry. */
    private static double copyBlock(double[] block, double[] target, int offset) {
        if (block == null) {
            return 1.0;
        }
        System.arraycopy(block, 0, target, offset, block.length);
        return 0.0;
    }

    private static double encodeTemporal(ReadingContext context, double[] features) {
        int base = TEMPORAL_OFFSET;
        double unknownTime = 1.0;
        Integer hour = lookup(TIMES_OF_DAY, context.timeOfDay());
        if (hour != null) {
            double angle = 2.0 * StrictMath.PI * hour / 24.0;
            features[base] = StrictMath.sin(angle);
            features[base + 1] = StrictMath.cos(angle);
            for (int slot = 0; slot < TIME_SLOTS.length; slot++) {
                features[base + 2 + slot] = TIME_SLOTS[slot].equals(context.timeOfDay()) ? 1.0 : 0.0;
            }
            features[base + 10] = hour / 23.0;
            unknownTime = 0.0;
        }
        Integer day = context.dayOfWeek();
        if (day != null) {
            double angle = 2.0 * StrictMath.PI * (day - 1) / 7.0;
            features[base + 6] = StrictMath.sin(angle);
            features[base + 7] = StrictMath.cos(angle);
            boolean weekend = day >= 6;
            features[base + 8] = weekend ? 1.0 : 0.0;
            features[base + 9] = weekend ? 0.0 : 1.0;
            features[base + 11] = (day - 1) / 6.0;
        }
        return unknownTime;
    }

    private static double[] normalize(double[] features) {
        double sum = 0.0;
        for (double value : features) {
            sum += value * value;
        }
        double norm = StrictMath.sqrt(sum);
        if (norm == 0.0) {
            return features;
        }
        for (int i = 0; i < features.length; i++) {
            features[i] = features[i] / norm;
        }
        return features;
    }
}
