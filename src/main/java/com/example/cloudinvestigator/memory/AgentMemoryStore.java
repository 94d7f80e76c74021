package com.example.cloudinvestigator.memory;

import com.example.cloudinvestigator.config.InvestigatorProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Optional JSON file backing for {@link AgentMemory}.
 * <p>
 * When {@code cloud-investigator.memory.path} is set, the snapshot is loaded
 * on startup and written back after each investigation. A blank path keeps
 * memory in-process only.
 */
@Slf4j
@Component
public class AgentMemoryStore {

    private final AgentMemory memory;
    private final ObjectMapper objectMapper;
    private final String path;

    public AgentMemoryStore(AgentMemory memory, ObjectMapper objectMapper, InvestigatorProperties properties) {
        this.memory = memory;
        this.objectMapper = objectMapper;
        this.path = properties.getMemory().getPath();
    }

    public boolean isEnabled() {
        return path != null && !path.isBlank();
    }

    @PostConstruct
    public void load() {
        if (!isEnabled()) {
            log.info("Memory file not configured - agent memory is in-process only");
            return;
        }
        Path file = Path.of(path);
        if (!Files.exists(file)) {
            log.info("No memory file at {} yet, starting empty", file);
            return;
        }
        try {
            MemorySnapshot snapshot = objectMapper.readValue(file.toFile(), MemorySnapshot.class);
            memory.restore(snapshot);
        } catch (IOException e) {
            log.warn("Could not read memory file {}: {} - starting empty", file, e.getMessage());
        }
    }

    /**
     * Write the current memory to disk. Failures are logged and do not
     * affect the investigation that triggered the save.
     */
    public synchronized void save() {
        if (!isEnabled()) return;
        Path file = Path.of(path).toAbsolutePath();
        Path tmp = null;
        try {
            Files.createDirectories(file.getParent());
            tmp = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), memory.snapshot());
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Saved agent memory to {}", file);
        } catch (IOException e) {
            log.warn("Failed to save agent memory to {}: {}", file, e.getMessage());
            deleteQuietly(tmp);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.debug("Could not remove temporary memory file {}: {}", tmp, e.getMessage());
        }
    }
}
