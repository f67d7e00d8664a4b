package com.github.dimitryivaniuta.solar.payments.exception;

/**
 * A call to another service failed: transport error, timeout, non-2xx status or {@code success=false}.
 *
 * <p>Callers decide whether it becomes an API error or a retry. One that escapes a request becomes a 503.</p>
 */
public class RemoteServiceException extends RuntimeException {

    private final String service;
    private final int status;

    public RemoteServiceException(String service, int status, String message, Throwable cause) {
        super(service + ": " + message, cause);
        this.service = service;
        this.status = status;
    }

    public RemoteServiceException(String service, String message, Throwable cause) {
        this(service, -1, message, cause);
    }

    public String getService() {
        return service;
    }

    /**
     * HTTP status returned by the remote, or -1 when no response was received.
     *
     * @return status
     */
    public int getStatus() {
        return status;
    }
}
