package com.eainde.ace.audit;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryAuditStore implements AuditStore {

    private volatile AuditState state;
    private final List<AuditLogEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public Optional<AuditState> loadState() {
        return Optional.ofNullable(state).map(AuditState::copy);
    }

    @Override
    public void saveState(AuditState state) {
        this.state = state.copy();
    }

    @Override
    public void append(AuditLogEntry entry) {
        entries.add(entry);
    }

    @Override
    public String logLocation() {
        return "memory";
    }

    public List<AuditLogEntry> getEntries() {
        return List.copyOf(entries);
    }
}
