package com.coopvault.membership;

import com.coopvault.common.exception.ForbiddenException;
import com.coopvault.common.exception.InvalidDestinationException;
import com.coopvault.common.exception.NotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class MembershipServiceTest {

    private static final String ADMIN = "admin";

    @Autowired
    private MembershipService membershipService;

    @Test
    void testAddMembersSkipsExisting() {
        membershipService.addMembers(ADMIN, List.of("m1"));

        List<CoopMember> added = membershipService.addMembers(ADMIN, List.of("m1", "m2"));

        assertEquals(1, added.size());
        assertEquals("m2", added.get(0).getPrincipal());
        assertTrue(membershipService.isActiveMember("m1"));
        assertTrue(membershipService.isActiveMember("m2"));
    }

    @Test
    void testSuspendAndReactivate() {
        membershipService.addMembers(ADMIN, List.of("m1"));

        membershipService.suspend(ADMIN, "m1");
        assertFalse(membershipService.isActiveMember("m1"));
        assertEquals(MemberStatus.SUSPENDED, membershipService.getMember("m1").getStatus());

        membershipService.reactivate(ADMIN, "m1");
        assertTrue(membershipService.isActiveMember("m1"));
    }

    @Test
    void testUnknownPrincipalIsNotActive() {
        assertFalse(membershipService.isActiveMember("stranger"));
        assertThrows(NotFoundException.class, () -> membershipService.suspend(ADMIN, "stranger"));
    }

    @Test
    void testAdminOnly() {
        assertThrows(ForbiddenException.class, () -> membershipService.addMembers("m1", List.of("m3")));
    }

    @Test
    void testBlankPrincipalRejected() {
        assertThrows(InvalidDestinationException.class,
            () -> membershipService.addMembers(ADMIN, Arrays.asList("m1", " ")));
    }
}
