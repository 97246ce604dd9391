package com.eainde.ace.precedent;

import java.util.Optional;

/**
 * Durable home of the precedent document. Implementations throw
 * {@link com.eainde.ace.store.AceStorageException} when storage is unavailable.
 */
public interface PrecedentStore {

    /**
     * @return the stored document, or empty when nothing has been written yet
     */
    Optional<PrecedentSnapshot> load();

    void save(PrecedentSnapshot snapshot);

    /** Human-readable location, e.g. a file path. */
    String location();
}
