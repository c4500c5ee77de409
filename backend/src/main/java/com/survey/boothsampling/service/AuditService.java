package com.survey.boothsampling.service;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.survey.boothsampling.dto.AuditLogEntry;
import com.survey.boothsampling.exception.BusinessException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Append-only trail of sampling runs, kept as a JSON array on disk.
 * Audit failures are logged and never fail the run being audited.
 */
@Service
@Slf4j
public class AuditService {

    public static final String RUN_REQUEST = "SAMPLING_RUN_REQUEST";
    public static final String RUN_SUCCESS = "SAMPLING_RUN_SUCCESS";
    public static final String RUN_FAILURE = "SAMPLING_RUN_FAILURE";

    @Value("${audit.log.file:logs/audit-logs.json}")
    private String auditLogFilePath;

    @Value("${audit.log.max-entries:1000}")
    private int maxLogEntries;

    @Value("${audit.log.retention-days:30}")
    private int retentionDays;

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

    private final ReadWriteLock rwLock = new ReentrantReadWriteLock();

    @PostConstruct
    public void init() {
        Path path = Paths.get(auditLogFilePath);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!Files.exists(path)) {
                objectMapper.writeValue(path.toFile(), new ArrayList<>());
                log.info("Created new audit log file at {}", path.toAbsolutePath());
                return;
            }
            objectMapper.readValue(path.toFile(), entryListType());
            log.info("Validated existing audit log file at {}", path.toAbsolutePath());
        } catch (IOException e) {
            log.error("Audit log file {} is unreadable, starting a new one", path.toAbsolutePath(), e);
            backupAndReset(path);
        }
    }

    public void record(String action, String username, String runId, String details) {
        if (action == null || action.isBlank()) {
            log.warn("Attempted to record audit event with empty action");
            return;
        }

        AuditLogEntry entry = new AuditLogEntry(
                LocalDateTime.now(),
                action,
                username != null && !username.isBlank() ? username : "anonymous",
                runId,
                details != null ? details : "No details provided");

        rwLock.writeLock().lock();
        try {
            List<AuditLogEntry> entries = readEntries();
            entries.add(entry);
            if (entries.size() > maxLogEntries) {
                entries = new ArrayList<>(entries.subList(entries.size() - maxLogEntries, entries.size()));
            }
            objectMapper.writeValue(new File(auditLogFilePath), entries);
            log.info("Audit log entry created: {}", entry);
        } catch (IOException e) {
            log.error("Failed to write audit log entry {}", entry, e);
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    public List<AuditLogEntry> getAllAuditLogs() {
        return query(entry -> true, "all");
    }

    public List<AuditLogEntry> getAuditLogsByUser(String username) {
        if (username == null || username.isBlank()) {
            throw new BusinessException("Username cannot be empty");
        }
        return query(entry -> username.equals(entry.getUsername()), "user " + username);
    }

    public List<AuditLogEntry> getAuditLogsByAction(String action) {
        if (action == null || action.isBlank()) {
            throw new BusinessException("Action cannot be empty");
        }
        return query(entry -> action.equals(entry.getAction()), "action " + action);
    }

    private List<AuditLogEntry> query(Predicate<AuditLogEntry> filter, String description) {
        rwLock.readLock().lock();
        try {
            List<AuditLogEntry> matching = readEntries().stream()
                    .filter(filter)
                    .collect(Collectors.toList());
            log.info("Retrieved {} audit logs for {}", matching.size(), description);
            return matching;
        } catch (IOException e) {
            log.error("Error retrieving audit logs for {}", description, e);
            throw new BusinessException("Unable to retrieve audit logs", e);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    // Callers hold a lock
    private List<AuditLogEntry> readEntries() throws IOException {
        File file = new File(auditLogFilePath);
        if (!file.exists() || file.length() == 0) {
            return new ArrayList<>();
        }
        List<AuditLogEntry> entries = objectMapper.readValue(file, entryListType());
        LocalDateTime cutoff = LocalDateTime.now().minusDays(retentionDays);
        int before = entries.size();
        entries.removeIf(entry -> entry.getTimestamp() == null || entry.getTimestamp().isBefore(cutoff));
        if (entries.size() < before) {
            log.info("Pruned {} audit logs older than {} days", before - entries.size(), retentionDays);
        }
        return entries;
    }

    private void backupAndReset(Path path) {
        Path backup = Paths.get(auditLogFilePath + ".backup." + System.currentTimeMillis());
        try {
            if (Files.exists(path)) {
                Files.copy(path, backup);
                log.info("Created backup of unreadable audit log at {}", backup);
            }
            objectMapper.writeValue(path.toFile(), new ArrayList<>());
        } catch (IOException e) {
            log.error("Failed to reset audit log file {}", path.toAbsolutePath(), e);
        }
    }

    private JavaType entryListType() {
        return objectMapper.getTypeFactory().constructCollectionType(List.class, AuditLogEntry.class);
    }
}
