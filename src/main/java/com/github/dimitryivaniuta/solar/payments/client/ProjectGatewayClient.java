package com.github.dimitryivaniuta.solar.payments.client;

import com.github.dimitryivaniuta.solar.payments.client.dto.ApiEnvelope;
import com.github.dimitryivaniuta.solar.payments.client.dto.ProjectInfo;
import com.github.dimitryivaniuta.solar.payments.client.dto.ProjectStatusUpdate;
import com.github.dimitryivaniuta.solar.payments.client.dto.TimelineEvent;
import com.github.dimitryivaniuta.solar.payments.domain.Money;
import com.github.dimitryivaniuta.solar.payments.exception.RemoteServiceException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/**
 * Client of the project service internal API.
 *
 * <p>Status and timeline writes are normally issued by the outbox dispatcher, not by request threads.</p>
 */
@Component
public class ProjectGatewayClient {

    private static final Logger log = LoggerFactory.getLogger(ProjectGatewayClient.class);

    static final String SERVICE = "project-service";

    private static final ParameterizedTypeReference<ApiEnvelope<ProjectInfo>> PROJECT_RESPONSE =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<ApiEnvelope<Object>> ANY_RESPONSE =
            new ParameterizedTypeReference<>() {};

    private final RestTemplate restTemplate;

    public ProjectGatewayClient(@Qualifier("projectServiceRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    /**
     * Reads the project facts.
     *
     * @param projectId project id
     * @return project, or empty when the project service answers 404
     * @throws RemoteServiceException on any other failure
     */
    public Optional<ProjectInfo> fetchProjectInfo(String projectId) {
        ProjectInfo info;
        try {
            info = RemoteCalls.call(SERVICE, "fetchProjectInfo", () -> RemoteCalls.unwrap(SERVICE, "fetchProjectInfo",
                    restTemplate.exchange("/api/internal/projects/{id}/info", HttpMethod.GET, HttpEntity.EMPTY, PROJECT_RESPONSE, projectId),
                    true));
        } catch (RemoteServiceException e) {
            if (e.getStatus() == HttpStatus.NOT_FOUND.value()) {
                log.info("Project not found in project service. projectId={}", projectId);
                return Optional.empty();
            }
            throw e;
        }
        requireMonetaryCost(info);
        return Optional.of(info);
    }

    // Cost must fit whole cents.
    private static void requireMonetaryCost(ProjectInfo info) {
        if (info.cost() == null) {
            return;
        }
        try {
            Money.of(info.cost());
        } catch (IllegalArgumentException | ArithmeticException e) {
            throw new RemoteServiceException(SERVICE,
                    "fetchProjectInfo returned an invalid cost: " + info.cost().toPlainString(), e);
        }
    }

    /**
     * Sets the project status.
     *
     * @param projectId project id
     * @param status    new status, e.g. {@code payment_completed}
     */
    public void updateStatus(String projectId, String status) {
        RemoteCalls.call(SERVICE, "updateStatus", () -> RemoteCalls.unwrap(SERVICE, "updateStatus",
                restTemplate.exchange("/api/internal/projects/{id}/status", HttpMethod.PATCH,
                        new HttpEntity<>(new ProjectStatusUpdate(status)), ANY_RESPONSE, projectId),
                false));
        log.info("Project status updated. projectId={} status={}", projectId, status);
    }

    /**
     * Appends a timeline entry.
     *
     * @param projectId project id
     * @param event     entry
     */
    public void appendTimeline(String projectId, TimelineEvent event) {
        RemoteCalls.call(SERVICE, "appendTimeline", () -> RemoteCalls.unwrap(SERVICE, "appendTimeline",
                restTemplate.exchange("/api/internal/projects/{id}/timeline", HttpMethod.POST,
                        new HttpEntity<>(event), ANY_RESPONSE, projectId),
                false));
        log.debug("Timeline event appended. projectId={} eventType={}", projectId, event.eventType());
    }
}
