package com.flagship.custody_ledger.access;

import com.flagship.custody_ledger.error.CustodyError;
import com.flagship.custody_ledger.error.CustodyRejectedException;
import com.flagship.custody_ledger.event.EventKind;
import com.flagship.custody_ledger.store.HistoryEntry;
import com.flagship.custody_ledger.support.CustodyFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.List;
import java.util.UUID;

import static com.flagship.custody_ledger.support.CustodyFixture.caller;
import static org.junit.jupiter.api.Assertions.*;

class AccessControlServiceTest {

    private CustodyFixture fixture;
    private AccessControlService accessControl;
    private UUID ledger;

    @BeforeEach
    void setUp() {
        fixture = new CustodyFixture();
        accessControl = fixture.accessControl;
        ledger = fixture.openLedger("O", LedgerKind.SHARED_TREASURY);
    }

    private static CustodyError rejection(Executable action) {
        return assertThrows(CustodyRejectedException.class, action).getError();
    }

    @Test
    @DisplayName("Owner manages members and each change lands in history")
    void membership() {
        accessControl.addMember(ledger, caller("O"), "M1");
        accessControl.addMember(ledger, caller("O"), "M2");
        accessControl.removeMember(ledger, caller("O"), "M1");

        assertEquals(List.of("M2"), accessControl.members(ledger));
        assertTrue(accessControl.isMember(ledger, "M2"));
        assertFalse(accessControl.isMember(ledger, "M1"));

        List<HistoryEntry> history = fixture.engine.recentHistory(ledger, 10);
        assertEquals(3, history.size());
        assertTrue(history.stream().allMatch(entry -> entry.getAction() == EventKind.MEMBERSHIP_CHANGED));
        assertEquals("member removed", history.get(0).getReason());
        assertEquals("M1", history.get(0).getCounterparty());
    }

    @Test
    @DisplayName("Membership changes are refused for non-owners and no-ops")
    void membershipGuards() {
        accessControl.addMember(ledger, caller("O"), "M");

        assertEquals(CustodyError.UNAUTHORIZED, rejection(() -> accessControl.addMember(ledger, caller("M"), "X")));
        assertEquals(CustodyError.INVALID_STATE, rejection(() -> accessControl.addMember(ledger, caller("O"), "M")));
        assertEquals(CustodyError.INVALID_STATE, rejection(() -> accessControl.addMember(ledger, caller("O"), "O")));
        assertEquals(CustodyError.INVALID_STATE, rejection(() -> accessControl.removeMember(ledger, caller("O"), "X")));
        assertEquals(CustodyError.INVALID_INPUT, rejection(() -> accessControl.addMember(ledger, caller("O"), " ")));
        assertEquals(1, fixture.history.size(ledger));
    }

    @Test
    @DisplayName("Ownership moves to the successor and the old owner loses owner rights")
    void transferOwnership() {
        LedgerInstance moved = accessControl.transferOwnership(ledger, caller("O"), "N");

        assertEquals("N", moved.getOwner());
        assertEquals("N", accessControl.getLedger(ledger).getOwner());
        assertEquals(CustodyError.UNAUTHORIZED, rejection(() -> accessControl.addMember(ledger, caller("O"), "X")));
        accessControl.addMember(ledger, caller("N"), "X");

        HistoryEntry transfer = fixture.engine.recentHistory(ledger, 2).get(1);
        assertEquals(EventKind.OWNERSHIP_TRANSFERRED, transfer.getAction());
        assertEquals("O", transfer.getActor());
        assertEquals("N", transfer.getCounterparty());
    }

    @Test
    @DisplayName("Handing ownership to the current owner is invalid input")
    void transferToSelf() {
        assertEquals(CustodyError.INVALID_INPUT, rejection(() -> accessControl.transferOwnership(ledger, caller("O"), "O")));
        assertEquals(CustodyError.UNAUTHORIZED, rejection(() -> accessControl.transferOwnership(ledger, caller("M"), "M")));
    }

    @Test
    @DisplayName("Privileges resolve against owner and member set")
    void privileges() {
        accessControl.addMember(ledger, caller("O"), "M");

        assertNotNull(accessControl.require(ledger, caller("O"), Privilege.OWNER));
        assertNotNull(accessControl.require(ledger, caller("M"), Privilege.OWNER_OR_MEMBER));
        assertNotNull(accessControl.require(ledger, caller("anyone"), Privilege.OPEN));
        assertEquals(CustodyError.UNAUTHORIZED, rejection(() -> accessControl.require(ledger, caller("M"), Privilege.OWNER)));
        assertEquals(CustodyError.NOT_FOUND, rejection(() -> accessControl.getLedger(UUID.randomUUID())));
    }
}
