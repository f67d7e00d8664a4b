package com.github.dimitryivaniuta.solar.payments.service.dto;

import java.util.List;

/**
 * Result of a committed local transaction: the view to return and the outbox commands to dispatch now.
 *
 * @param view       response view
 * @param commandIds outbox command ids written in the transaction
 * @param <T>        view type
 */
public record TxOutcome<T>(T view, List<String> commandIds) {

    public TxOutcome {
        commandIds = List.copyOf(commandIds);
    }
}
