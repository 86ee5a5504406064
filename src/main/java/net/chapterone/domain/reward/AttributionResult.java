package net.chapterone.domain.reward;

/**
 * Summary of one attribution batch.
 *
 * @param processed actions examined
 * @param updated actions attributed to an impression and applied to an arm
 * @param errors malformed or failing records, skipped
 * @param unmatched actions with no qualifying impression, left unattributed and marked examined
 * @param conflicts actions another run attributed first
 * @param interrupted whether the batch stopped early on interruption
 */
public record AttributionResult(int processed, int updated, int errors, int unmatched, int conflicts,
                                boolean interrupted) {

    public static AttributionResult empty() {
        return new AttributionResult(0, 0, 0, 0, 0, false);
    }
}
