package com.survey.boothsampling.controller;

import com.survey.boothsampling.dto.AuditLogEntry;
import com.survey.boothsampling.exception.BusinessException;
import com.survey.boothsampling.exception.GlobalExceptionHandler;
import com.survey.boothsampling.service.AuditService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDateTime;
import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class AuditControllerTest {

    @Mock
    private AuditService auditService;

    @InjectMocks
    private AuditController auditController;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(auditController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void testGetAllAuditLogs() throws Exception {
        when(auditService.getAllAuditLogs()).thenReturn(List.of(entry(AuditService.RUN_SUCCESS, "run-1")));

        mockMvc.perform(get("/api/audit/logs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].action").value("SAMPLING_RUN_SUCCESS"))
                .andExpect(jsonPath("$[0].runId").value("run-1"));
    }

    @Test
    void testGetAuditLogsByAction() throws Exception {
        when(auditService.getAuditLogsByAction(AuditService.RUN_REQUEST))
                .thenReturn(List.of(entry(AuditService.RUN_REQUEST, null)));

        mockMvc.perform(get("/api/audit/logs/action").param("action", AuditService.RUN_REQUEST))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].username").value("surveyor"))
                .andExpect(jsonPath("$[0].runId").doesNotExist());
    }

    @Test
    void testBlankUserIsRejected() throws Exception {
        when(auditService.getAuditLogsByUser(" ")).thenThrow(new BusinessException("Username cannot be empty"));

        mockMvc.perform(get("/api/audit/logs/user").param("username", " "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Username cannot be empty"));
    }

    private static AuditLogEntry entry(String action, String runId) {
        return new AuditLogEntry(LocalDateTime.now(), action, "surveyor", runId, "details");
    }
}
