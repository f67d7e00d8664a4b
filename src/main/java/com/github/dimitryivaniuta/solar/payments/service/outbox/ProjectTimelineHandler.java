package com.github.dimitryivaniuta.solar.payments.service.outbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.solar.payments.client.ProjectGatewayClient;
import com.github.dimitryivaniuta.solar.payments.domain.OutboxCommandType;
import com.github.dimitryivaniuta.solar.payments.domain.OutboxEvent;
import org.springframework.stereotype.Component;

@Component
public class ProjectTimelineHandler implements OutboxHandler {

    private final ProjectGatewayClient projectGatewayClient;
    private final ObjectMapper objectMapper;

    public ProjectTimelineHandler(ProjectGatewayClient projectGatewayClient, ObjectMapper objectMapper) {
        this.projectGatewayClient = projectGatewayClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public OutboxCommandType type() {
        return OutboxCommandType.PROJECT_TIMELINE;
    }

    @Override
    public void handle(OutboxEvent command) throws Exception {
        OutboxCommands.ProjectTimeline cmd = objectMapper.readValue(command.getPayload(), OutboxCommands.ProjectTimeline.class);
        projectGatewayClient.appendTimeline(cmd.projectId(), cmd.event());
    }
}
