package com.coopvault.api.controller;

import com.coopvault.common.Currency;
import com.coopvault.common.Money;
import com.coopvault.membership.MembershipService;
import com.coopvault.settlement.mock.MockSettlementRail;
import com.coopvault.vault.VaultService;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Tests the redemption API through MockMvc, including the error mapping.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Transactional
class RedemptionControllerTest {

    private static final String MEMBER = "member-api";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private MembershipService membershipService;

    @Autowired
    private VaultService vaultService;

    @Autowired
    private MockSettlementRail settlementRail;

    @BeforeEach
    void setUp() {
        settlementRail.reset();
        membershipService.addMembers("admin", List.of(MEMBER));
        settlementRail.fundWallet(MEMBER, new BigDecimal("100"));
        vaultService.processOnboarding(MEMBER, Money.of("100", Currency.USDC));
    }

    @Test
    void testRedeemReturnsCreated() throws Exception {
        mockMvc.perform(post("/api/v1/redemptions")
                .header("X-Caller", MEMBER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\": 25}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("PENDING"))
            .andExpect(jsonPath("$.requester").value(MEMBER));
    }

    @Test
    void testValidationErrorReturnsFieldMessage() throws Exception {
        mockMvc.perform(post("/api/v1/redemptions")
                .header("X-Caller", MEMBER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\": -5}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.amount").value("Amount must be positive"));
    }

    @Test
    void testMissingCallerHeaderIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/redemptions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\": 5}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void testForbiddenCarriesKind() throws Exception {
        mockMvc.perform(post("/api/v1/redemptions/any-id/fulfill")
                .header("X-Caller", MEMBER))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.kind").value("FORBIDDEN"))
            .andExpect(jsonPath("$.status").value("403"));
    }

    @Test
    void testUnknownRedemptionIsNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/redemptions/does-not-exist"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.kind").value("NOT_FOUND"));
    }

    @Test
    void testOverdraftIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/redemptions")
                .header("X-Caller", MEMBER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\": 500}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.kind").value("INSUFFICIENT_FUNDS"));
    }

    @Test
    void testDoubleFulfillIsConflict() throws Exception {
        String body = mockMvc.perform(post("/api/v1/redemptions")
                .header("X-Caller", MEMBER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\": 10}"))
            .andReturn().getResponse().getContentAsString();
        String requestId = JsonPath.read(body, "$.requestId");

        mockMvc.perform(post("/api/v1/redemptions/" + requestId + "/fulfill").header("X-Caller", "admin"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("FULFILLED"));

        mockMvc.perform(post("/api/v1/redemptions/" + requestId + "/fulfill").header("X-Caller", "admin"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.kind").value("NOT_PENDING"));
    }
}
