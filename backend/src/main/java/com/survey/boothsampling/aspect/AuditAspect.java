package com.survey.boothsampling.aspect;

import com.survey.boothsampling.dto.SamplingRequest;
import com.survey.boothsampling.model.SamplingRun;
import com.survey.boothsampling.service.AuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.JoinPoint;
import org.aspectj.lang.annotation.AfterReturning;
import org.aspectj.lang.annotation.AfterThrowing;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Before;
import org.springframework.stereotype.Component;

/**
 * Writes an audit entry before every sampling run and once it succeeds or fails
 */
@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class AuditAspect {

    private final AuditService auditService;

    @Before("execution(* com.survey.boothsampling.service.SamplingService.runBatch(..)) && args(request)")
    public void beforeRun(SamplingRequest request) {
        String details = String.format("Requested sampling of %s (%s) with %s samples per region",
                request.getState(), request.getSelectionType(), request.getSamplesPerRegion());
        auditService.record(AuditService.RUN_REQUEST, request.getRequestedBy(), null, details);
    }

    @AfterReturning(
            pointcut = "execution(* com.survey.boothsampling.service.SamplingService.runBatch(..)) && args(request)",
            returning = "run")
    public void afterRunSuccess(SamplingRequest request, SamplingRun run) {
        String details = String.format(
                "Sampled %d regions of %s (%s): %d complete, %d booths selected of %d valid, %d clusters per region",
                run.getOutcomes().size(),
                run.getState(),
                run.getSelectionType(),
                run.getCompletedCount(),
                run.getTotalSelected(),
                run.getTotalBooths(),
                run.getClustersPerRegion());
        auditService.record(AuditService.RUN_SUCCESS, request.getRequestedBy(), run.getRunId(), details);
    }

    @AfterThrowing(
            pointcut = "execution(* com.survey.boothsampling.service.SamplingService.runBatch(..)) && args(request)",
            throwing = "exception")
    public void afterRunFailure(JoinPoint joinPoint, SamplingRequest request, Exception exception) {
        log.debug("Auditing failed {}", joinPoint.getSignature().toShortString());
        String details = String.format("Sampling of %s (%s) failed: %s",
                request.getState(),
                request.getSelectionType(),
                exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        auditService.record(AuditService.RUN_FAILURE, request.getRequestedBy(), null, details);
    }
}
