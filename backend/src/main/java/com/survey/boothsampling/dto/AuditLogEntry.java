package com.survey.boothsampling.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * One entry of the sampling audit trail
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuditLogEntry {

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime timestamp;

    private String action;
    private String username;

    // Present once the run has an id, i.e. on success
    private String runId;

    private String details;

    @Override
    public String toString() {
        return String.format(
                "[%s] %s - User: %s, Run: %s, Details: %s",
                timestamp != null
                        ? timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
                        : "Unknown Time",
                action,
                username,
                runId != null ? runId : "-",
                details
        );
    }
}
