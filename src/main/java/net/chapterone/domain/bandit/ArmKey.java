package net.chapterone.domain.bandit;

/**
 * Identifies one arm model: the arm within the scope that owns it (a user id or {@link #GLOBAL_SCOPE}).
 */
public record ArmKey(String scope, String armId) {

    public static final String GLOBAL_SCOPE = "global";

    public ArmKey {
        if (scope == null || scope.isBlank()) {
            throw new IllegalArgumentException("scope must not be blank");
        }
        if (armId == null || armId.isBlank()) {
            throw new IllegalArgumentException("armId must not be blank");
        }
    }

    public static ArmKey global(String armId) {
        return new ArmKey(GLOBAL_SCOPE, armId);
    }
}
