package net.chapterone.domain.reward;

/**
 * Engagement one arm earned from a reader's impressions over a time range.
 *
 * <p>Rates are actions per impression and are 0 when the arm showed nothing.</p>
 */
public record ArmEngagement(
    String armId,
    int impressions,
    int attributedActions,
    int clicks,
    int saves,
    int ratings,
    double clickThroughRate,
    double saveRate,
    double conversionRate,
    double totalReward
) {
}
