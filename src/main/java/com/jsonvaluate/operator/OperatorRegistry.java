package com.jsonvaluate.operator;

import com.jsonvaluate.condition.Operator;
import com.jsonvaluate.exception.InvalidOperatorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Runtime-extensible table of custom operators.
 *
 * <p>Thread safety: a {@link ReadWriteLock} guards the table.
 * <ul>
 *   <li>Lookups and listings share the read lock and never block each other.</li>
 *   <li>Registration and removal take the write lock for the duration of the map update only.</li>
 *   <li>Validators are returned to the caller and invoked after the lock is released,
 *       so a validator may itself register or unregister operators.</li>
 * </ul>
 *
 * <p>Built-in operator identifiers (see {@link Operator}) are reserved and never stored here.
 */
public class OperatorRegistry {

    private static final Logger log = LoggerFactory.getLogger(OperatorRegistry.class);

    private final Map<String, OperatorValidator> validators = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Register or replace a custom operator.
     *
     * @param id        operator identifier
     * @param validator validation function
     * @throws InvalidOperatorException if the identifier or validator is missing,
     *                                  or the identifier belongs to a built-in operator
     */
    public void register(String id, OperatorValidator validator) {
        if (id == null || id.isEmpty()) {
            throw new InvalidOperatorException("Custom operator identifier cannot be empty");
        }
        if (validator == null) {
            throw new InvalidOperatorException("Custom operator validator cannot be null: " + id);
        }
        if (Operator.isBuiltin(id)) {
            throw new InvalidOperatorException("Cannot register built-in operator: " + id);
        }

        OperatorValidator previous;
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            previous = validators.put(id, validator);
        } finally {
            writeLock.unlock();
        }

        if (previous != null) {
            log.debug("Replaced custom operator: {}", id);
        } else {
            log.debug("Registered custom operator: {}", id);
        }
    }

    /**
     * Register a custom operator definition.
     *
     * @see #register(String, OperatorValidator)
     */
    public void register(CustomOperator operator) {
        if (operator == null) {
            throw new InvalidOperatorException("Custom operator cannot be null");
        }
        register(operator.id(), operator.validator());
    }

    /**
     * Remove a custom operator. No-op if it is not registered.
     * Built-in operators are unaffected since they never live in the registry.
     *
     * @param id operator identifier
     */
    public void unregister(String id) {
        if (id == null) {
            return;
        }

        OperatorValidator removed;
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            removed = validators.remove(id);
        } finally {
            writeLock.unlock();
        }

        if (removed != null) {
            log.debug("Unregistered custom operator: {}", id);
        }
    }

    /**
     * Look up a custom operator.
     *
     * @param id operator identifier
     * @return the validator, or empty if none is registered under this identifier
     */
    public Optional<OperatorValidator> lookup(String id) {
        if (id == null) {
            return Optional.empty();
        }

        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return Optional.ofNullable(validators.get(id));
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Snapshot of the registered identifiers. Order is unspecified.
     *
     * @return immutable copy of the identifiers
     */
    public Set<String> list() {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return Set.copyOf(validators.keySet());
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Check whether a custom operator is registered.
     */
    public boolean isRegistered(String id) {
        return lookup(id).isPresent();
    }
}
