package com.coopvault.audit;

import com.coopvault.common.Money;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Append-only audit trail.
 *
 * {@link #record} joins the caller's transaction and refuses to run without one, so
 * an event is committed if and only if the mutation it describes is committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditService {

    public static final String SUBJECT_REDEMPTION = "REDEMPTION";
    public static final String SUBJECT_VAULT = "VAULT";
    public static final String SUBJECT_TREASURY = "TREASURY";
    public static final String SUBJECT_PRINCIPAL = "PRINCIPAL";
    public static final String SUBJECT_PROPOSAL = "PROPOSAL";

    private final AuditRepository auditRepository;

    @Transactional(propagation = Propagation.MANDATORY)
    public AuditEvent record(AuditEventType eventType, String actor, String subjectType,
                             String subjectId, Money amount, String detail) {
        AuditEvent event = auditRepository.save(
            new AuditEvent(eventType, actor, subjectType, subjectId, amount, detail));

        log.debug("Audit {}: actor={}, subject={}:{}, amount={}",
            eventType, actor, subjectType, subjectId, amount);

        return event;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public AuditEvent record(AuditEventType eventType, String actor, String subjectType,
                             String subjectId, String detail) {
        return record(eventType, actor, subjectType, subjectId, null, detail);
    }

    @Transactional(readOnly = true)
    public List<AuditEvent> getTrail(String subjectType, String subjectId) {
        if (subjectId == null) {
            return auditRepository.findBySubjectTypeOrderByCreatedAtDesc(subjectType);
        }
        return auditRepository.findBySubjectTypeAndSubjectIdOrderByCreatedAtAsc(subjectType, subjectId);
    }

    @Transactional(readOnly = true)
    public List<AuditEvent> getByType(AuditEventType eventType) {
        return auditRepository.findByEventTypeOrderByCreatedAtAsc(eventType);
    }
}
