package com.github.dimitryivaniuta.solar.payments.service.outbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.solar.payments.client.ProjectGatewayClient;
import com.github.dimitryivaniuta.solar.payments.domain.OutboxCommandType;
import com.github.dimitryivaniuta.solar.payments.domain.OutboxEvent;
import org.springframework.stereotype.Component;

@Component
public class ProjectStatusHandler implements OutboxHandler {

    private final ProjectGatewayClient projectGatewayClient;
    private final ObjectMapper objectMapper;

    public ProjectStatusHandler(ProjectGatewayClient projectGatewayClient, ObjectMapper objectMapper) {
        this.projectGatewayClient = projectGatewayClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public OutboxCommandType type() {
        return OutboxCommandType.PROJECT_STATUS;
    }

    @Override
    public void handle(OutboxEvent command) throws Exception {
        OutboxCommands.ProjectStatus cmd = objectMapper.readValue(command.getPayload(), OutboxCommands.ProjectStatus.class);
        projectGatewayClient.updateStatus(cmd.projectId(), cmd.status());
    }
}
