package com.survey.boothsampling.controller;

import com.survey.boothsampling.dto.AuditLogEntry;
import com.survey.boothsampling.service.AuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/audit")
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
@Slf4j
public class AuditController {

    private final AuditService auditService;

    /**
     * Full trail of sampling runs within the retention window
     */
    @GetMapping("/logs")
    public ResponseEntity<List<AuditLogEntry>> getAllAuditLogs() {
        log.info("Fetching all audit logs");
        return ResponseEntity.ok(auditService.getAllAuditLogs());
    }

    @GetMapping("/logs/user")
    public ResponseEntity<List<AuditLogEntry>> getAuditLogsByUser(@RequestParam String username) {
        log.info("Fetching audit logs for user: {}", username);
        return ResponseEntity.ok(auditService.getAuditLogsByUser(username));
    }

    /**
     * @param action one of SAMPLING_RUN_REQUEST, SAMPLING_RUN_SUCCESS, SAMPLING_RUN_FAILURE
     */
    @GetMapping("/logs/action")
    public ResponseEntity<List<AuditLogEntry>> getAuditLogsByAction(@RequestParam String action) {
        log.info("Fetching audit logs for action: {}", action);
        return ResponseEntity.ok(auditService.getAuditLogsByAction(action));
    }
}
