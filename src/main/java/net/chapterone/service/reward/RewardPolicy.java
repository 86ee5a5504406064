package net.chapterone.service.reward;

import jakarta.annotation.Nullable;
import net.chapterone.config.RewardPointProperties;
import net.chapterone.domain.reward.ActionType;
import org.springframework.stereotype.Component;

/**
 * Reward points of an action before time decay.
 */
@Component
public class RewardPolicy {

    public static final double MIN_RATING = 1.0;
    public static final double MAX_RATING = 5.0;

    private final RewardPointProperties points;

    public RewardPolicy(RewardPointProperties points) {
        this.points = points;
    }

    /**
     * @param actionType what the reader did; null for stored rows whose type no longer parses, worth 0
     * @param actionValue rating for {@code rate}, dwell milliseconds for {@code view}, ignored otherwise
     */
    public double points(@Nullable ActionType actionType, @Nullable Double actionValue) {
        if (actionType == null) {
            return 0.0;
        }
        return switch (actionType) {
            case CLICK -> points.getClick();
            case SAVE -> points.getSave();
            case UNSAVE -> points.getUnsave();
            case RATE -> actionValue == null ? 0.0 : actionValue;
            case VIEW -> actionValue != null && actionValue >= points.getEngagedViewMillis()
                ? points.getEngagedView() : 0.0;
            case DISMISS -> points.getDismiss();
            case SHARE -> points.getShare();
        };
    }

    /**
     * Reward after exponential decay: {@code points × exp(-λ·Δt)} with Δt in hours.
     */
    public static double decay(double points, double lambdaPerHour, double elapsedHours) {
        return points * Math.exp(-lambdaPerHour * Math.max(0.0, elapsedHours));
    }
}
