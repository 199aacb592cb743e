package me.golemcore.teams.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.teams.domain.model.ConversationEntry;

import java.util.List;

/**
 * Full view of a task: its projection, its outcome once finished, and the
 * complete conversation log in sequence order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskDetailDto {
    private TaskSummaryDto task;
    private TaskOutcomeDto outcome;
    private List<ConversationEntry> entries;
}
