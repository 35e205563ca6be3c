package com.ryuqq.provisioner.testkit.remote;

import com.ryuqq.provisioner.core.model.Address;
import com.ryuqq.provisioner.core.model.Attributes;
import com.ryuqq.provisioner.core.normalize.PlaceholderResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Fake remote system for engine tests.
 *
 * <p>Stores objects by address and records every call in order. Tests can inject
 * failures, block a call until released, and modify objects out of band to simulate drift.</p>
 *
 * <p><strong>Behavior:</strong></p>
 * <ul>
 *   <li>create fails if the object exists; update fails if it does not</li>
 *   <li>delete of a missing object is a no-op</li>
 *   <li>when placeholder variables are set, stored strings have {@code ${name}} resolved,
 *       like a remote that expands project variables on write</li>
 *   <li>when server fields are enabled, every stored object gets an {@code id} field</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class InMemoryRemote {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRemote.class);

    private final Map<Address, Map<String, Object>> objects = new ConcurrentHashMap<>();
    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());
    private final Map<String, RuntimeException> failures = new ConcurrentHashMap<>();
    private final Map<String, Blocker> blockers = new ConcurrentHashMap<>();
    private volatile PlaceholderResolver resolver = PlaceholderResolver.none();
    private volatile boolean serverFields;

    /**
     * Creates the remote object.
     *
     * @param address address
     * @param attributes attributes
     * @return stored attributes
     * @throws IllegalStateException if the object already exists
     */
    public Map<String, Object> create(Address address, Map<String, Object> attributes) {
        enter("create", address);
        Map<String, Object> stored = store(address, attributes);
        if (objects.putIfAbsent(address, stored) != null) {
            throw new IllegalStateException("Object already exists: " + address);
        }
        return stored;
    }

    /**
     * Reads the remote object.
     *
     * @param address address
     * @return stored attributes, or empty if absent
     */
    public Optional<Map<String, Object>> read(Address address) {
        enter("read", address);
        return Optional.ofNullable(objects.get(address));
    }

    /**
     * Replaces the remote object.
     *
     * @param address address
     * @param attributes attributes
     * @return stored attributes
     * @throws IllegalStateException if the object does not exist
     */
    public Map<String, Object> update(Address address, Map<String, Object> attributes) {
        enter("update", address);
        if (!objects.containsKey(address)) {
            throw new IllegalStateException("Object does not exist: " + address);
        }
        Map<String, Object> stored = store(address, attributes);
        objects.put(address, stored);
        return stored;
    }

    /**
     * Deletes the remote object (no-op if absent).
     *
     * @param address address
     */
    public void delete(Address address) {
        enter("delete", address);
        objects.remove(address);
    }

    // ============================================================
    // Test controls
    // ============================================================

    /**
     * Makes the next matching call throw.
     *
     * @param operation create, read, update or delete
     * @param address address
     * @param failure the exception to throw
     * @return this remote
     */
    public InMemoryRemote failOn(String operation, Address address, RuntimeException failure) {
        failures.put(key(operation, address), failure);
        return this;
    }

    /**
     * Blocks the next matching call until {@link Blocker#release()}.
     *
     * @param operation create, read, update or delete
     * @param address address
     * @return the blocker
     */
    public Blocker blockOn(String operation, Address address) {
        Blocker blocker = new Blocker();
        blockers.put(key(operation, address), blocker);
        return blocker;
    }

    /**
     * Resolves {@code ${name}} placeholders in stored strings.
     *
     * @param variables variables
     * @return this remote
     */
    public InMemoryRemote resolvingPlaceholders(Map<String, String> variables) {
        this.resolver = new PlaceholderResolver(variables);
        return this;
    }

    /**
     * Adds a server-computed {@code id} field to every stored object.
     *
     * @return this remote
     */
    public InMemoryRemote withServerFields() {
        this.serverFields = true;
        return this;
    }

    /**
     * Writes an object out of band (no call recorded).
     *
     * @param address address
     * @param attributes attributes
     */
    public void put(Address address, Map<String, ?> attributes) {
        objects.put(address, Attributes.copyOf(attributes));
    }

    /**
     * Removes an object out of band (no call recorded).
     *
     * @param address address
     */
    public void remove(Address address) {
        objects.remove(address);
    }

    public Optional<Map<String, Object>> get(Address address) {
        return Optional.ofNullable(objects.get(address));
    }

    public boolean contains(Address address) {
        return objects.containsKey(address);
    }

    public int size() {
        return objects.size();
    }

    /**
     * Recorded calls in order, e.g. {@code "create dss_dataset.a"}.
     *
     * @return call log snapshot
     */
    public List<String> calls() {
        synchronized (calls) {
            return List.copyOf(calls);
        }
    }

    /**
     * Recorded calls excluding reads.
     *
     * @return mutating call log snapshot
     */
    public List<String> mutatingCalls() {
        return calls().stream().filter(call -> !call.startsWith("read ")).toList();
    }

    public void clearCalls() {
        calls.clear();
    }

    private void enter(String operation, Address address) {
        String key = key(operation, address);
        calls.add(key);
        Blocker blocker = blockers.remove(key);
        if (blocker != null) {
            log.debug("Holding remote call {} until released", key);
            blocker.block();
        }
        RuntimeException failure = failures.remove(key);
        if (failure != null) {
            log.debug("Injected failure for remote call {}: {}", key, failure.getMessage());
            throw failure;
        }
    }

    private Map<String, Object> store(Address address, Map<String, Object> attributes) {
        Map<String, Object> stored = new TreeMap<>(resolver.resolveAll(Attributes.copyOf(attributes)));
        if (serverFields) {
            stored.put("id", address.getValue());
        }
        return Attributes.copyOf(stored);
    }

    private static String key(String operation, Address address) {
        return operation + " " + address.getValue();
    }

    /**
     * Holds a remote call until released.
     */
    public static final class Blocker {

        private final CountDownLatch entered = new CountDownLatch(1);
        private final CountDownLatch released = new CountDownLatch(1);

        /**
         * Waits until the blocked call has started.
         *
         * @param timeout timeout
         * @param unit unit
         * @return true if the call started in time
         * @throws InterruptedException if interrupted
         */
        public boolean awaitEntered(long timeout, TimeUnit unit) throws InterruptedException {
            return entered.await(timeout, unit);
        }

        /**
         * Lets the blocked call continue.
         */
        public void release() {
            released.countDown();
        }

        private void block() {
            entered.countDown();
            try {
                if (!released.await(30, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("Blocked remote call was never released");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while blocked", e);
            }
        }
    }
}
