package me.golemcore.teams.domain.runtime;

import me.golemcore.teams.domain.model.ConversationRecord;
import me.golemcore.teams.domain.model.Message;
import me.golemcore.teams.domain.model.MessageRole;
import me.golemcore.teams.domain.model.RoutingPolicyType;
import me.golemcore.teams.domain.model.TaskEvent;
import me.golemcore.teams.domain.model.TaskStatus;
import me.golemcore.teams.domain.model.Team;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class CriteriaHandoffSelectorTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private final Team team = new Team("dev", List.of("Developer", "Architect", "Tester"),
            RoutingPolicyType.CRITERIA_HANDOFF, null, 10);
    private final CriteriaHandoffSelector selector = new CriteriaHandoffSelector(team);

    @Test
    void shouldUseLastHandoffLine() {
        assertEquals(Optional.of("Tester"),
                selector.handoffTarget("HANDOFF: Architect\nchanged my mind\nHANDOFF: tester"));
    }

    @Test
    void shouldIgnoreUnknownTarget() {
        assertEquals(Optional.empty(), selector.handoffTarget("HANDOFF: Manager"));
    }

    @Test
    void shouldIgnoreInlineMention() {
        assertEquals(Optional.empty(), selector.handoffTarget("I would say HANDOFF: Tester is premature"));
    }

    @Test
    void shouldFallBackToRoundRobin() {
        ConversationRecord record = recordWithReply("Developer", "Code is written.");

        assertEquals("Architect", selector.select(record, "Developer").speaker());
    }

    @Test
    void shouldRouteToNamedMember() {
        ConversationRecord record = recordWithReply("Developer", "Please test.\nHANDOFF: Tester");

        SpeakerSelector.SpeakerChoice choice = selector.select(record, "Developer");

        assertEquals("Tester", choice.speaker());
        assertFalse(choice.mustPersist());
    }

    private static ConversationRecord recordWithReply(String sender, String content) {
        ConversationRecord record = new ConversationRecord("t-1");
        record.append(TaskEvent.builder().taskId("t-1").seq(1).timestamp(NOW).status(TaskStatus.PENDING)
                .description("d").teamName("dev").build());
        record.append(Message.builder().taskId("t-1").seq(2).timestamp(NOW).sender(sender)
                .role(MessageRole.AGENT).content(content).turn(1).build());
        return record;
    }
}
