package com.codeops.workbench.storage;

import java.time.Duration;
import java.util.Optional;

/**
 * A component whose in-memory state is persisted opportunistically by the {@link StorageManager}.
 *
 * @param <T> an observable token of the provider's state; two equal tokens mean nothing changed
 */
public interface StorageProvider<T> {

    /** Stable name of this provider, used in logs. */
    String key();

    /**
     * Loads persisted state into the provider.
     *
     * @return the state token after loading, or empty when nothing was persisted yet
     */
    Optional<T> load();

    /**
     * Persists pending changes.
     *
     * @param force write everything resident, not only what changed
     */
    void save(boolean force);

    /**
     * Decides whether a state transition warrants a save.
     *
     * @param previous the token seen at the last save
     * @param next     the current token
     * @return true if {@link #save(boolean)} should run
     */
    boolean shouldSave(T previous, T next);

    /** Minimum interval between two opportunistic saves. */
    Duration throttleWait();

    /** Current state token. */
    T state();
}
