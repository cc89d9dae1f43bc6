package com.coopvault.access;

import com.coopvault.audit.AuditEventType;
import com.coopvault.audit.AuditService;
import com.coopvault.common.exception.AdminLockoutException;
import com.coopvault.common.exception.ErrorKind;
import com.coopvault.common.exception.ForbiddenException;
import com.coopvault.common.exception.InvalidDestinationException;
import com.coopvault.common.exception.RoleAlreadyGrantedException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for role management and the admin hand-over.
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
class AccessControlServiceTest {

    private static final String ADMIN = "admin";

    @Autowired
    private AccessControlService accessControl;

    @Autowired
    private RoleGrantRepository roleGrantRepository;

    @Autowired
    private AuditService auditService;

    @Test
    void testBootstrapAdminHoldsEveryRole() {
        assertEquals(EnumSet.allOf(Role.class), accessControl.rolesOf(ADMIN));
        assertFalse(accessControl.bootstrapAdmin("someone-else"));
    }

    @Test
    void testGrantAndRevoke() {
        accessControl.grantRole(ADMIN, "ops", Role.BACKEND);
        assertTrue(accessControl.hasRole("ops", Role.BACKEND));

        accessControl.revokeRole(ADMIN, "ops", Role.BACKEND);
        assertFalse(accessControl.hasRole("ops", Role.BACKEND));

        // Revoking again is a no-op
        accessControl.revokeRole(ADMIN, "ops", Role.BACKEND);
        assertTrue(accessControl.rolesOf("ops").isEmpty());
    }

    @Test
    void testGrantTwiceFails() {
        accessControl.grantRole(ADMIN, "ops", Role.BACKEND);

        RoleAlreadyGrantedException ex = assertThrows(RoleAlreadyGrantedException.class,
            () -> accessControl.grantRole(ADMIN, "ops", Role.BACKEND));

        assertEquals(ErrorKind.ROLE_ALREADY_GRANTED, ex.getKind());
    }

    @Test
    void testOnlyAdminManagesRoles() {
        accessControl.grantRole(ADMIN, "treasurer", Role.TREASURER);

        assertThrows(ForbiddenException.class,
            () -> accessControl.grantRole("treasurer", "ops", Role.BACKEND));
        assertThrows(ForbiddenException.class,
            () -> accessControl.revokeRole("treasurer", ADMIN, Role.BACKEND));
    }

    @Test
    void testBlankPrincipalRejected() {
        InvalidDestinationException ex = assertThrows(InvalidDestinationException.class,
            () -> accessControl.initiateAdminTransfer(ADMIN, ""));

        assertEquals(ErrorKind.ZERO_ADDRESS, ex.getKind());
    }

    @Test
    void testSoleAdminCannotRenounce() {
        AdminLockoutException ex = assertThrows(AdminLockoutException.class,
            () -> accessControl.completeAdminTransfer(ADMIN));

        assertEquals(ErrorKind.WOULD_LEAVE_WITHOUT_ADMIN, ex.getKind());
        assertTrue(accessControl.hasRole(ADMIN, Role.DEFAULT_ADMIN));
    }

    @Test
    void testSoleAdminCannotBeRevoked() {
        assertThrows(AdminLockoutException.class,
            () -> accessControl.revokeRole(ADMIN, ADMIN, Role.DEFAULT_ADMIN));

        assertEquals(1, roleGrantRepository.countByRole(Role.DEFAULT_ADMIN));
    }

    @Test
    void testTwoPhaseAdminTransfer() {
        accessControl.initiateAdminTransfer(ADMIN, "new-admin");

        // Both hold admin until the old admin completes
        assertTrue(accessControl.hasRole(ADMIN, Role.DEFAULT_ADMIN));
        assertTrue(accessControl.hasRole("new-admin", Role.DEFAULT_ADMIN));

        accessControl.completeAdminTransfer(ADMIN);

        assertFalse(accessControl.hasRole(ADMIN, Role.DEFAULT_ADMIN));
        assertTrue(accessControl.hasRole("new-admin", Role.DEFAULT_ADMIN));
        // Other roles are kept
        assertTrue(accessControl.hasRole(ADMIN, Role.TREASURER));

        // The new admin is now the last one
        assertThrows(AdminLockoutException.class, () -> accessControl.completeAdminTransfer("new-admin"));

        assertEquals(1, auditService.getByType(AuditEventType.ADMIN_TRANSFER_COMPLETED).size());
    }

    @Test
    void testInitiateTransferToExistingAdminFails() {
        accessControl.initiateAdminTransfer(ADMIN, "new-admin");

        assertThrows(RoleAlreadyGrantedException.class,
            () -> accessControl.initiateAdminTransfer(ADMIN, "new-admin"));
    }

    @Test
    void testFormerAdminLosesCapabilities() {
        accessControl.initiateAdminTransfer(ADMIN, "new-admin");
        accessControl.completeAdminTransfer(ADMIN);

        assertThrows(ForbiddenException.class,
            () -> accessControl.grantRole(ADMIN, "ops", Role.BACKEND));
    }
}
