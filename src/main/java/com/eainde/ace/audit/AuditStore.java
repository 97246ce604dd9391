package com.eainde.ace.audit;

import java.util.Optional;

/**
 * Durable audit state plus the append-only audit log. Implementations throw
 * {@link com.eainde.ace.store.AceStorageException} when storage is unavailable.
 */
public interface AuditStore {

    Optional<AuditState> loadState();

    void saveState(AuditState state);

    void append(AuditLogEntry entry);

    /** Where the audit log lives. */
    String logLocation();
}
