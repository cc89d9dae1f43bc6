package com.coopvault.access;

import com.coopvault.audit.AuditEventType;
import com.coopvault.audit.AuditService;
import com.coopvault.common.exception.AdminLockoutException;
import com.coopvault.common.exception.ForbiddenException;
import com.coopvault.common.exception.InvalidDestinationException;
import com.coopvault.common.exception.RoleAlreadyGrantedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Role-gated capability checks and role management.
 *
 * Every guarded operation calls {@link #requireRole} or {@link #requireAnyRole} as its
 * first statement, so a {@link ForbiddenException} is raised before any state is read
 * for update or written.
 *
 * Admin hand-over is two-phase: {@link #initiateAdminTransfer} adds the new admin,
 * {@link #completeAdminTransfer} removes the caller. The last admin grant can never be
 * deleted; the repository delete itself carries that condition.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccessControlService {

    private final RoleGrantRepository roleGrantRepository;
    private final AuditService auditService;

    @Transactional(readOnly = true)
    public boolean hasRole(String principal, Role role) {
        if (principal == null || principal.isBlank()) {
            return false;
        }
        return roleGrantRepository.existsByPrincipalAndRole(principal, role);
    }

    @Transactional(readOnly = true)
    public void requireRole(String caller, Role role, String operation) {
        if (!hasRole(caller, role)) {
            log.info("Denied {} to {}: missing role {}", operation, caller, role);
            throw new ForbiddenException(caller, operation);
        }
    }

    @Transactional(readOnly = true)
    public void requireAnyRole(String caller, String operation, Role... roles) {
        for (Role role : roles) {
            if (hasRole(caller, role)) {
                return;
            }
        }
        log.info("Denied {} to {}: none of roles {}", operation, caller, Arrays.toString(roles));
        throw new ForbiddenException(caller, operation);
    }

    @Transactional(readOnly = true)
    public Set<Role> rolesOf(String principal) {
        List<RoleGrant> grants = roleGrantRepository.findByPrincipal(principal);
        if (grants.isEmpty()) {
            return EnumSet.noneOf(Role.class);
        }
        return grants.stream()
            .map(RoleGrant::getRole)
            .collect(Collectors.toCollection(() -> EnumSet.noneOf(Role.class)));
    }

    @Transactional
    public RoleGrant grantRole(String caller, String principal, Role role) {
        requireRole(caller, Role.DEFAULT_ADMIN, "grant roles");
        requirePrincipal(principal, "grant role");

        RoleGrant grant = addGrant(principal, role, caller);
        auditService.record(AuditEventType.ROLE_GRANTED, caller,
            AuditService.SUBJECT_PRINCIPAL, principal, "role=" + role);
        return grant;
    }

    /**
     * Revoke a role. Revoking a role the principal does not hold is a no-op.
     */
    @Transactional
    public void revokeRole(String caller, String principal, Role role) {
        requireRole(caller, Role.DEFAULT_ADMIN, "revoke roles");
        requirePrincipal(principal, "revoke role");

        if (!roleGrantRepository.existsByPrincipalAndRole(principal, role)) {
            log.info("Role {} not held by {}, nothing to revoke", role, principal);
            return;
        }

        removeGrant(principal, role);
        auditService.record(AuditEventType.ROLE_REVOKED, caller,
            AuditService.SUBJECT_PRINCIPAL, principal, "role=" + role);

        log.info("Revoked role {} from {} by {}", role, principal, caller);
    }

    /**
     * Phase one of an admin hand-over: grant admin to the new principal while the
     * caller keeps it.
     */
    @Transactional
    public RoleGrant initiateAdminTransfer(String caller, String newAdmin) {
        requireRole(caller, Role.DEFAULT_ADMIN, "initiate admin transfer");
        requirePrincipal(newAdmin, "initiate admin transfer");

        RoleGrant grant = addGrant(newAdmin, Role.DEFAULT_ADMIN, caller);
        auditService.record(AuditEventType.ADMIN_TRANSFER_INITIATED, caller,
            AuditService.SUBJECT_PRINCIPAL, newAdmin, "from=" + caller);

        log.info("Admin transfer initiated: from={}, to={}", caller, newAdmin);
        return grant;
    }

    /**
     * Phase two of an admin hand-over: the caller gives up its own admin role.
     */
    @Transactional
    public void completeAdminTransfer(String caller) {
        requireRole(caller, Role.DEFAULT_ADMIN, "complete admin transfer");

        removeGrant(caller, Role.DEFAULT_ADMIN);
        auditService.record(AuditEventType.ADMIN_TRANSFER_COMPLETED, caller,
            AuditService.SUBJECT_PRINCIPAL, caller, "admin role renounced");

        log.info("Admin transfer completed: {} renounced admin", caller);
    }

    /**
     * Grant every role to the given principal when no admin exists yet.
     *
     * @return true if the principal was bootstrapped
     */
    @Transactional
    public boolean bootstrapAdmin(String principal) {
        if (principal == null || principal.isBlank()) {
            return false;
        }
        if (roleGrantRepository.countByRole(Role.DEFAULT_ADMIN) > 0) {
            log.debug("Admin already present, skipping bootstrap of {}", principal);
            return false;
        }

        for (Role role : Role.values()) {
            if (!roleGrantRepository.existsByPrincipalAndRole(principal, role)) {
                roleGrantRepository.save(new RoleGrant(principal, role, "bootstrap"));
                auditService.record(AuditEventType.ROLE_GRANTED, "bootstrap",
                    AuditService.SUBJECT_PRINCIPAL, principal, "role=" + role);
            }
        }

        log.info("Bootstrapped {} with roles {}", principal, Arrays.toString(Role.values()));
        return true;
    }

    private RoleGrant addGrant(String principal, Role role, String grantedBy) {
        if (roleGrantRepository.existsByPrincipalAndRole(principal, role)) {
            throw new RoleAlreadyGrantedException(principal, role.name());
        }
        RoleGrant grant = roleGrantRepository.save(new RoleGrant(principal, role, grantedBy));
        log.info("Granted role {} to {} by {}", role, principal, grantedBy);
        return grant;
    }

    private void removeGrant(String principal, Role role) {
        if (role != Role.DEFAULT_ADMIN) {
            roleGrantRepository.deleteGrant(principal, role);
            return;
        }

        roleGrantRepository.lockByRole(Role.DEFAULT_ADMIN);
        int removed = roleGrantRepository.deleteGrantIfNotLast(principal, Role.DEFAULT_ADMIN);
        if (removed == 0) {
            throw new AdminLockoutException(principal);
        }
    }

    private void requirePrincipal(String principal, String operation) {
        if (principal == null || principal.isBlank()) {
            throw new InvalidDestinationException(operation);
        }
    }
}
