package com.ryuqq.provisioner.adapter.inmemory.store;

import com.ryuqq.provisioner.core.error.StateLockException;
import com.ryuqq.provisioner.core.spi.StateStore;
import com.ryuqq.provisioner.core.state.State;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * In-memory implementation of {@link StateStore} SPI for testing and embedding.
 *
 * <p>The current state is held in an {@link AtomicReference}; every save replaces it
 * with a copy whose serial is incremented. The previous version is kept as the backup,
 * and the full save history is retained for assertions in tests.</p>
 *
 * <p><strong>Locking:</strong> the lock is non-reentrant and non-blocking. A second
 * {@link #withLock(Supplier)} call, from another thread or nested in the same thread,
 * fails immediately with {@link StateLockException}, matching the file-based store.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>No cross-process exclusion</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryStateStore store = new InMemoryStateStore();
 * Provisioner provisioner = new ProvisioningEngine(store, registry, new EngineConfig("PRJ"));
 * </pre>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class InMemoryStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStateStore.class);

    private final AtomicReference<State> current = new AtomicReference<>();
    private final AtomicReference<State> backup = new AtomicReference<>();
    private final AtomicReference<Thread> lockHolder = new AtomicReference<>();
    private final List<State> history = Collections.synchronizedList(new ArrayList<>());

    /**
     * Creates an empty store.
     */
    public InMemoryStateStore() {
    }

    /**
     * Creates a store pre-populated with a persisted state (no serial increment).
     *
     * @param initial the state to start from
     */
    public InMemoryStateStore(State initial) {
        if (initial == null) {
            throw new IllegalArgumentException("initial cannot be null");
        }
        current.set(initial);
    }

    @Override
    public Optional<State> load() {
        return Optional.ofNullable(current.get());
    }

    @Override
    public State save(State state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        State persisted = state.nextSerial();
        State previous = current.getAndSet(persisted);
        backup.set(previous);
        history.add(persisted);
        log.debug("Saved in-memory state {} serial {}", persisted.lineage(), persisted.serial());
        return persisted;
    }

    @Override
    public <T> T withLock(Supplier<T> action) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        Thread self = Thread.currentThread();
        if (!lockHolder.compareAndSet(null, self)) {
            Thread holder = lockHolder.get();
            throw new StateLockException("State is locked by thread "
                + (holder == null ? "<released>" : holder.getName()));
        }
        try {
            return action.get();
        } finally {
            lockHolder.compareAndSet(self, null);
        }
    }

    @Override
    public boolean exists() {
        return current.get() != null;
    }

    /**
     * The state that was current before the last save.
     *
     * @return the previous state, or empty if fewer than two saves happened
     */
    public Optional<State> backup() {
        return Optional.ofNullable(backup.get());
    }

    /**
     * Every state persisted through {@link #save(State)}, in order.
     *
     * @return an immutable snapshot of the history
     */
    public List<State> history() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    /**
     * Checks whether the lock is currently held.
     *
     * @return true if a {@link #withLock(Supplier)} call is in progress
     */
    public boolean isLocked() {
        return lockHolder.get() != null;
    }

    /**
     * Replaces the persisted state without going through {@link #save(State)}.
     *
     * <p>Simulates another process writing the state between plan and apply.</p>
     *
     * @param state the new persisted state
     */
    public void overwrite(State state) {
        current.set(state);
    }

    /**
     * Clears all stored data.
     */
    public void clear() {
        current.set(null);
        backup.set(null);
        history.clear();
    }
}
