package com.eainde.ace.audit;

import com.eainde.ace.store.JsonFiles;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Audit state as a JSON document and the audit log as JSON lines, side by side.
 */
public class JsonFileAuditStore implements AuditStore {

    public static final String STATE_FILE_NAME = "ace_audit_state.json";
    public static final String LOG_FILE_NAME = "ace_audit_log.jsonl";

    private final Path stateFile;
    private final Path logFile;
    private final ObjectMapper objectMapper;

    public JsonFileAuditStore(Path stateFile, Path logFile, ObjectMapper objectMapper) {
        this.stateFile = stateFile;
        this.logFile = logFile;
        this.objectMapper = objectMapper;
    }

    public static JsonFileAuditStore in(Path directory, ObjectMapper objectMapper) {
        return new JsonFileAuditStore(directory.resolve(STATE_FILE_NAME), directory.resolve(LOG_FILE_NAME), objectMapper);
    }

    @Override
    public Optional<AuditState> loadState() {
        return JsonFiles.read(stateFile, objectMapper, AuditState.class);
    }

    @Override
    public void saveState(AuditState state) {
        JsonFiles.writeAtomically(stateFile, objectMapper, state);
    }

    @Override
    public void append(AuditLogEntry entry) {
        JsonFiles.appendLine(logFile, objectMapper, entry);
    }

    @Override
    public String logLocation() {
        return logFile.toString();
    }
}
