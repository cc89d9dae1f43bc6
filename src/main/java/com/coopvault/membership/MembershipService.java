package com.coopvault.membership;

import com.coopvault.access.AccessControlService;
import com.coopvault.access.Role;
import com.coopvault.audit.AuditEventType;
import com.coopvault.audit.AuditService;
import com.coopvault.common.exception.InvalidDestinationException;
import com.coopvault.common.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Database-backed membership registry with admin maintenance operations.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MembershipService implements MembershipRegistry {

    private final CoopMemberRepository memberRepository;
    private final AccessControlService accessControl;
    private final AuditService auditService;

    @Override
    @Transactional(readOnly = true)
    public boolean isActiveMember(String principal) {
        return memberRepository.findById(principal)
            .map(CoopMember::isActive)
            .orElse(false);
    }

    /**
     * Add members in one batch. Principals already registered keep their current status.
     *
     * @return the members that were newly added
     */
    @Transactional
    public List<CoopMember> addMembers(String caller, List<String> principals) {
        accessControl.requireRole(caller, Role.DEFAULT_ADMIN, "add members");

        List<CoopMember> added = new ArrayList<>();
        for (String principal : principals) {
            if (principal == null || principal.isBlank()) {
                throw new InvalidDestinationException("add members");
            }
            if (memberRepository.existsById(principal)) {
                log.debug("Member {} already registered", principal);
                continue;
            }
            added.add(memberRepository.save(new CoopMember(principal)));
            auditService.record(AuditEventType.MEMBER_ADDED, caller,
                AuditService.SUBJECT_PRINCIPAL, principal, null);
        }

        log.info("Added {} of {} members by {}", added.size(), principals.size(), caller);
        return added;
    }

    @Transactional
    public CoopMember suspend(String caller, String principal) {
        accessControl.requireRole(caller, Role.DEFAULT_ADMIN, "suspend members");

        CoopMember member = getMember(principal);
        member.suspend();
        memberRepository.save(member);
        auditService.record(AuditEventType.MEMBER_SUSPENDED, caller,
            AuditService.SUBJECT_PRINCIPAL, principal, null);

        log.info("Suspended member {} by {}", principal, caller);
        return member;
    }

    @Transactional
    public CoopMember reactivate(String caller, String principal) {
        accessControl.requireRole(caller, Role.DEFAULT_ADMIN, "reactivate members");

        CoopMember member = getMember(principal);
        member.reactivate();
        memberRepository.save(member);
        auditService.record(AuditEventType.MEMBER_REACTIVATED, caller,
            AuditService.SUBJECT_PRINCIPAL, principal, null);

        log.info("Reactivated member {} by {}", principal, caller);
        return member;
    }

    @Transactional(readOnly = true)
    public CoopMember getMember(String principal) {
        return memberRepository.findById(principal)
            .orElseThrow(() -> new NotFoundException("Member", principal));
    }
}
