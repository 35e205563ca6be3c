package com.ryuqq.provisioner.core.spi;

import com.ryuqq.provisioner.core.error.StateLockException;
import com.ryuqq.provisioner.core.error.StateStoreException;
import com.ryuqq.provisioner.core.state.State;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Persistent storage SPI for the engine's {@link State} record.
 *
 * <p>The state record is the only shared mutable resource of the engine. Every
 * mutating workflow (apply, destroy, refresh, plan with refresh) runs inside
 * {@link #withLock(Supplier)} and persists through {@link #save(State)}.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Atomicity: a save either fully replaces the previous record or leaves it untouched</li>
 *   <li>Integrity: the digest is recomputed on save and verified on load</li>
 *   <li>Exclusion: the lock is non-blocking; a second holder fails fast with {@link StateLockException}</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * State saved = store.withLock(() -&gt; {
 *     State current = store.load().orElseGet(() -&gt; State.empty("PRJ"));
 *     return store.save(current.withEntry(address, entry));
 * });
 * </pre>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public interface StateStore {

    /**
     * Loads the persisted state.
     *
     * @return the persisted state, or empty if nothing has been saved yet
     * @throws StateStoreException if the record cannot be read, is corrupt, or fails digest verification
     */
    Optional<State> load();

    /**
     * Persists the given state with its serial incremented by one.
     *
     * <p>The previous record (if any) is retained as a backup where the
     * implementation supports it.</p>
     *
     * @param state the state to persist
     * @return the state as persisted (serial = {@code state.serial() + 1})
     * @throws IllegalArgumentException if state is null
     * @throws StateStoreException if the record cannot be written
     */
    State save(State state);

    /**
     * Runs the action while holding the exclusive state lock.
     *
     * <p>The lock is released when the action returns or throws.</p>
     *
     * @param action the action to run
     * @param <T> the result type
     * @return the action's result
     * @throws StateLockException if the lock is already held
     */
    <T> T withLock(Supplier<T> action);

    /**
     * Checks whether a state record has been persisted.
     *
     * @return true if {@link #load()} would return a state
     */
    boolean exists();
}
