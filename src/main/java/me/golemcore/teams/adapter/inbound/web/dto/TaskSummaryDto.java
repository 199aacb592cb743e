package me.golemcore.teams.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskSummaryDto {
    private String id;
    private String description;
    private String team;
    private String status;
    private String failureReason;
    private String summary;
    private String createdAt;
    private boolean running;
}
