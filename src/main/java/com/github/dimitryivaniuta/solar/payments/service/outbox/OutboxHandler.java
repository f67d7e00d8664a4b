package com.github.dimitryivaniuta.solar.payments.service.outbox;

import com.github.dimitryivaniuta.solar.payments.domain.OutboxCommandType;
import com.github.dimitryivaniuta.solar.payments.domain.OutboxEvent;

/**
 * Delivers one kind of outbox command. Any exception means "not delivered, retry later".
 */
public interface OutboxHandler {

    OutboxCommandType type();

    /**
     * Delivers the command. Must be safe to repeat with the same {@link OutboxEvent#getEventKey()}.
     *
     * @param command command to deliver
     * @throws Exception on any delivery failure
     */
    void handle(OutboxEvent command) throws Exception;
}
