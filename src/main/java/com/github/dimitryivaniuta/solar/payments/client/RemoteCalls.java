package com.github.dimitryivaniuta.solar.payments.client;

import com.github.dimitryivaniuta.solar.payments.client.dto.ApiEnvelope;
import com.github.dimitryivaniuta.solar.payments.exception.RemoteServiceException;
import java.util.function.Supplier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Translates {@link RestClientException}s and envelope failures into {@link RemoteServiceException}.
 */
final class RemoteCalls {

    private RemoteCalls() {
    }

    static <T> T call(String service, String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (RestClientResponseException e) {
            throw new RemoteServiceException(service, e.getStatusCode().value(),
                    operation + " failed with HTTP " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            throw new RemoteServiceException(service, operation + " failed: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new RemoteServiceException(service, operation + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Unwraps a 2xx envelope, failing when {@code success=false} or {@code data} is required but missing.
     */
    static <T> T unwrap(String service, String operation, ResponseEntity<ApiEnvelope<T>> response, boolean dataRequired) {
        ApiEnvelope<T> body = response.getBody();
        if (body == null || !body.success()) {
            String message = body == null ? "empty response" : String.valueOf(body.message());
            throw new RemoteServiceException(service, response.getStatusCode().value(), operation + " rejected: " + message, null);
        }
        if (dataRequired && body.data() == null) {
            throw new RemoteServiceException(service, response.getStatusCode().value(), operation + " returned no data", null);
        }
        return body.data();
    }
}
