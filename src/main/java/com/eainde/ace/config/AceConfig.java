package com.eainde.ace.config;

import com.eainde.ace.audit.AuditStore;
import com.eainde.ace.audit.InMemoryAuditStore;
import com.eainde.ace.audit.JsonFileAuditStore;
import com.eainde.ace.precedent.InMemoryPrecedentStore;
import com.eainde.ace.precedent.JsonFilePrecedentStore;
import com.eainde.ace.precedent.PrecedentStore;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Locale;

@Slf4j
@Configuration
@EnableConfigurationProperties(AceProperties.class)
public class AceConfig {

    static final String STORAGE_FILE = "file";
    static final String STORAGE_MEMORY = "memory";

    @Bean
    public Clock aceClock() {
        return Clock.systemUTC();
    }

    /** Mapper for the ACE state files. Kept separate from any web-layer mapper. */
    @Bean
    public ObjectMapper aceObjectMapper() {
        return aceMapper();
    }

    public static ObjectMapper aceMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    public PrecedentStore precedentStore(AceProperties properties, ObjectMapper aceObjectMapper) {
        if (isMemory(properties)) {
            log.info("Precedent memory is in-memory only");
            return new InMemoryPrecedentStore();
        }
        Path file = basePath(properties).resolve(JsonFilePrecedentStore.FILE_NAME);
        log.info("Precedent memory at {}", file);
        return new JsonFilePrecedentStore(file, aceObjectMapper);
    }

    @Bean
    public AuditStore auditStore(AceProperties properties, ObjectMapper aceObjectMapper) {
        if (isMemory(properties)) {
            return new InMemoryAuditStore();
        }
        return JsonFileAuditStore.in(basePath(properties), aceObjectMapper);
    }

    private static boolean isMemory(AceProperties properties) {
        String type = properties.getStorage().getType() == null
                ? STORAGE_FILE
                : properties.getStorage().getType().trim().toLowerCase(Locale.ROOT);
        switch (type) {
            case STORAGE_FILE:
                return false;
            case STORAGE_MEMORY:
                return true;
            default:
                throw new IllegalArgumentException("Unknown ace.storage.type \"" + type + "\". Use: file or memory");
        }
    }

    private static Path basePath(AceProperties properties) {
        return Path.of(properties.getStorage().getBasePath());
    }
}
