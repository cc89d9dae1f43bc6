package com.coopvault.audit;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for audit events.
 */
@Repository
public interface AuditRepository extends JpaRepository<AuditEvent, String> {

    List<AuditEvent> findBySubjectTypeAndSubjectIdOrderByCreatedAtAsc(String subjectType, String subjectId);

    List<AuditEvent> findBySubjectTypeOrderByCreatedAtDesc(String subjectType);

    List<AuditEvent> findByEventTypeOrderByCreatedAtAsc(AuditEventType eventType);
}
