package net.chapterone.adapters.persistence;

import java.util.List;
import net.chapterone.domain.reward.Identity;

/**
 * SQL form of {@link Identity#matches(Identity)}: the same user, or the same session on a row without a user.
 */
final class IdentitySql {

    private IdentitySql() {
    }

    /**
     * Appends the predicate to {@code args} order and returns its SQL.
     */
    static String matchClause(Identity identity, List<Object> args) {
        if (identity.userId() != null && identity.sessionId() != null) {
            args.add(identity.userId());
            args.add(identity.sessionId());
            return "(user_id = ? OR (user_id IS NULL AND session_id = ?))";
        }
        if (identity.userId() != null) {
            args.add(identity.userId());
            return "user_id = ?";
        }
        args.add(identity.sessionId());
        return "session_id = ?";
    }
}
