package com.github.dimitryivaniuta.solar.payments.service;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Postgres advisory lock service.
 *
 * <p>Row locks only work once a row exists. Method selection creates the payment row, so concurrent
 * selections for one project are serialized with {@code pg_advisory_xact_lock} on (scope, project id)
 * instead. The unique {@code project_id} constraint stays as the backstop.</p>
 *
 * <p>Locks are released when the transaction ends.</p>
 */
@Component
public class PostgresAdvisoryLockService {

    private final JdbcTemplate jdbcTemplate;

    public PostgresAdvisoryLockService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Acquires a transaction-scoped advisory lock. Must run inside a transaction.
     *
     * @param scope operation scope
     * @param key   key within the scope (project id)
     */
    public void lock(String scope, String key) {
        long lockId = toLongHash(scope + "|" + key);
        jdbcTemplate.queryForObject("select pg_advisory_xact_lock(?)", Long.class, lockId);
    }

    static long toLongHash(String s) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(s.getBytes(StandardCharsets.UTF_8));
            return ByteBuffer.wrap(hash, 0, 8).getLong();
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
