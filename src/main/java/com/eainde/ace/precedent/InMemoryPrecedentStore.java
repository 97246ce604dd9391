package com.eainde.ace.precedent;

import java.util.Optional;

public class InMemoryPrecedentStore implements PrecedentStore {

    private volatile PrecedentSnapshot snapshot;

    @Override
    public Optional<PrecedentSnapshot> load() {
        return Optional.ofNullable(snapshot);
    }

    @Override
    public void save(PrecedentSnapshot snapshot) {
        this.snapshot = snapshot;
    }

    @Override
    public String location() {
        return "memory";
    }
}
