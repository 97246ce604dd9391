package com.eainde.ace.precedent;

import com.eainde.ace.store.JsonFiles;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Keeps the precedent document in a single pretty-printed JSON file, replaced atomically
 * on every save.
 */
public class JsonFilePrecedentStore implements PrecedentStore {

    public static final String FILE_NAME = "ace_precedent.json";

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonFilePrecedentStore(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<PrecedentSnapshot> load() {
        return JsonFiles.read(file, objectMapper, PrecedentSnapshot.class);
    }

    @Override
    public void save(PrecedentSnapshot snapshot) {
        JsonFiles.writeAtomically(file, objectMapper, snapshot);
    }

    @Override
    public String location() {
        return file.toString();
    }
}
