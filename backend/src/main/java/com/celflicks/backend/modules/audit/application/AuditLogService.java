package com.celflicks.backend.modules.audit.application;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.celflicks.backend.global.web.RequestIdFilter;
import com.celflicks.backend.modules.audit.domain.AuditLog;
import com.celflicks.backend.modules.audit.infrastructure.AuditLogRepository;

import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AuditLogService {

    private final AuditLogRepository auditLogRepository;

    public AuditLogService(AuditLogRepository auditLogRepository) {
        this.auditLogRepository = auditLogRepository;
    }

    /**
     * Joins the caller's transaction, so the record commits or rolls back with the audited change.
     * The correlation id defaults to the current request id.
     */
    @Transactional
    public void record(AuditLogCommand command) {
        Objects.requireNonNull(command.actionType(), "actionType is required");
        Objects.requireNonNull(command.resourceType(), "resourceType is required");
        Objects.requireNonNull(command.resourceKey(), "resourceKey is required");

        AuditLog auditLog = new AuditLog();
        auditLog.setActionType(command.actionType());
        auditLog.setResourceType(command.resourceType());
        auditLog.setResourceKey(command.resourceKey());
        auditLog.setActorUserId(command.actorUserId());
        auditLog.setCorrelationId(command.correlationId() != null
                ? command.correlationId()
                : MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY));

        if (command.detail() != null && !command.detail().isEmpty()) {
            auditLog.setDetail(new HashMap<>(command.detail()));
        }

        auditLogRepository.save(auditLog);
    }

    public record AuditLogCommand(
            String actionType,
            String resourceType,
            String resourceKey,
            UUID actorUserId,
            String correlationId,
            Map<String, Object> detail
    ) {
    }
}
