package net.chapterone.adapters.persistence;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import net.chapterone.domain.reward.Identity;
import org.junit.jupiter.api.Test;

class IdentitySqlTest {

    @Test
    void should_OnlyFallBackToSessionOnAnonymousRows_When_UserAndSessionKnown() {
        List<Object> args = new ArrayList<>();

        String clause = IdentitySql.matchClause(new Identity("bob", "kiosk"), args);

        assertThat(clause).isEqualTo("(user_id = ? OR (user_id IS NULL AND session_id = ?))");
        assertThat(args).containsExactly("bob", "kiosk");
    }

    @Test
    void should_MatchUserColumn_When_OnlyUserKnown() {
        List<Object> args = new ArrayList<>();

        assertThat(IdentitySql.matchClause(Identity.user("bob"), args)).isEqualTo("user_id = ?");
        assertThat(args).containsExactly("bob");
    }

    @Test
    void should_MatchSessionColumn_When_Anonymous() {
        List<Object> args = new ArrayList<>();

        assertThat(IdentitySql.matchClause(Identity.session("kiosk"), args)).isEqualTo("session_id = ?");
        assertThat(args).containsExactly("kiosk");
    }
}
