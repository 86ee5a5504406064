package net.chapterone.domain.bandit;

import java.util.Optional;

/**
 * The recommendation strategies the selector chooses between.
 */
public enum BanditArm {
    SEMANTIC_SIMILARITY("semantic_similarity", "Content-Based"),
    CONTEXTUAL_MOOD("contextual_mood", "Mood-Based"),
    TRENDING_POPULAR("trending_popular", "Trending"),
    COLLABORATIVE_FILTERING("collaborative_filtering", "Collaborative"),
    PERSONALIZED_MIX("personalized_mix", "Personalized Mix");

    private final String armId;
    private final String displayName;

    BanditArm(String armId, String displayName) {
        this.armId = armId;
        this.displayName = displayName;
    }

    public String armId() {
        return armId;
    }

    public String displayName() {
        return displayName;
    }

    public static Optional<BanditArm> fromArmId(String armId) {
        for (BanditArm arm : values()) {
            if (arm.armId.equals(armId)) {
                return Optional.of(arm);
            }
        }
        return Optional.empty();
    }
}
