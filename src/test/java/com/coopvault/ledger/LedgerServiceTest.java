package com.coopvault.ledger;

import com.coopvault.common.Currency;
import com.coopvault.common.Money;
import com.coopvault.common.exception.ErrorKind;
import com.coopvault.common.exception.InsufficientFundsException;
import com.coopvault.common.exception.InvalidAmountException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the reserve unit ledger.
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
class LedgerServiceTest {

    @Autowired
    private LedgerService ledgerService;

    @Test
    void testMintTransferBurnKeepSupplyConsistent() {
        Money supplyBefore = ledgerService.totalSupply();

        ledgerService.mint("alice", uc("100"), "test", "ref-1");
        ledgerService.transfer("alice", "bob", uc("40"), "alice", "ref-2");
        ledgerService.burn("bob", uc("15"), "test", "ref-3");

        assertTrue(ledgerService.balanceOf("alice").isSameAmount(uc("60")));
        assertTrue(ledgerService.balanceOf("bob").isSameAmount(uc("25")));
        assertTrue(ledgerService.totalSupply().isSameAmount(supplyBefore.add(uc("85"))));
    }

    @Test
    void testEntriesRecordEveryMovement() {
        ledgerService.mint("alice", uc("10"), "minter", "ref-a");
        ledgerService.transfer("alice", "bob", uc("4"), "alice", "ref-b");

        List<LedgerEntry> entries = ledgerService.getAccountLedger("alice");

        assertEquals(2, entries.size());
        LedgerEntry transfer = ledgerService.getReferenceLedger("ref-b").get(0);
        assertEquals(TransactionType.TRANSFER, transfer.getTransactionType());
        assertEquals("alice", transfer.getFromAccount());
        assertEquals("bob", transfer.getToAccount());
        assertEquals("alice", transfer.getActor());
    }

    @Test
    void testOverdraftRejected() {
        ledgerService.mint("alice", uc("1"), "test", "ref-1");

        InsufficientFundsException ex = assertThrows(InsufficientFundsException.class,
            () -> ledgerService.burn("alice", uc("1.5"), "test", "ref-2"));

        assertEquals(ErrorKind.INSUFFICIENT_FUNDS, ex.getKind());
        assertTrue(ledgerService.balanceOf("alice").isSameAmount(uc("1")));
    }

    @Test
    void testOnlyPositiveUnitsMove() {
        assertThrows(InvalidAmountException.class,
            () -> ledgerService.mint("alice", uc("0"), "test", "ref"));
        assertThrows(InvalidAmountException.class,
            () -> ledgerService.mint("alice", Money.of("5", Currency.USDC), "test", "ref"));
    }

    @Test
    void testSelfTransferRejected() {
        ledgerService.mint("alice", uc("5"), "test", "ref");

        assertThrows(IllegalArgumentException.class,
            () -> ledgerService.transfer("alice", "alice", uc("1"), "alice", "ref"));
    }

    @Test
    void testUnknownAccountHasZeroBalance() {
        assertTrue(ledgerService.balanceOf("nobody").isZero());
    }

    private static Money uc(String amount) {
        return Money.of(amount, Currency.UC);
    }
}
