package com.flagship.property_settlement.transition;

import com.flagship.property_settlement.history.AuditTrailRecorder;
import com.flagship.property_settlement.history.InvoiceOutcome;
import com.flagship.property_settlement.history.ProcessingStatus;
import com.flagship.property_settlement.history.StatusHistoryEntry;
import com.flagship.property_settlement.invoice.CounterpartyRole;
import com.flagship.property_settlement.invoice.Invoice;
import com.flagship.property_settlement.invoice.InvoiceCategory;
import com.flagship.property_settlement.invoice.InvoiceLedgerService;
import com.flagship.property_settlement.invoice.InvoiceResult;
import com.flagship.property_settlement.invoice.InvoiceStatus;
import com.flagship.property_settlement.observability.SettlementMetrics;
import com.flagship.property_settlement.property.ListingStatus;
import com.flagship.property_settlement.property.PropertySnapshot;
import com.flagship.property_settlement.property.SalesStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SettlementInvoiceCoordinatorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final LocalDate SETTLEMENT_DATE = LocalDate.of(2026, 3, 20);

    @Mock
    private InvoiceLedgerService ledger;
    @Mock
    private AuditTrailRecorder recorder;

    private SettlementInvoiceCoordinator coordinator;

    private UUID agentId;
    private UUID ownerId;
    private PropertySnapshot property;

    @BeforeEach
    void setUp() {
        coordinator = new SettlementInvoiceCoordinator(ledger, recorder,
                new SettlementMetrics(new SimpleMeterRegistry()), Clock.fixed(NOW, ZoneOffset.UTC));
        agentId = UUID.randomUUID();
        ownerId = UUID.randomUUID();
        property = new PropertySnapshot(UUID.randomUUID(), "harbour-view", "Harbour View", new BigDecimal("500000"),
                SalesStatus.SETTLED, ListingStatus.SOLD, ownerId, null, agentId, null, false, NOW);
    }

    private StatusHistoryEntry entry(InvoiceOutcome sellerOutcome) {
        return new StatusHistoryEntry(UUID.randomUUID(), property.getId(), SalesStatus.UNCONDITIONAL,
                SalesStatus.SETTLED, agentId, "", null, null, null, null, sellerOutcome, null, List.of(),
                ProcessingStatus.PROCESSING, List.of(), NOW, NOW);
    }

    private Invoice invoice(String number) {
        Invoice invoice = mock(Invoice.class);
        when(invoice.getId()).thenReturn(UUID.randomUUID());
        when(invoice.getInvoiceNumber()).thenReturn(number);
        return invoice;
    }

    @Test
    @DisplayName("New seller invoice is attached and announced")
    void testSettle_NewSellerInvoice() {
        Invoice invoice = invoice("INV-2026-000001");
        when(invoice.getTotalAmount()).thenReturn(new BigDecimal("6050.00"));
        when(invoice.getStatus()).thenReturn(InvoiceStatus.PENDING);
        when(ledger.getOrCreate(InvoiceCategory.SETTLEMENT_COMMISSION, property, CounterpartyRole.SELLER,
                ownerId, agentId, SETTLEMENT_DATE)).thenReturn(InvoiceResult.created(invoice));
        StatusHistoryEntry entry = entry(null);

        SettlementInvoices result = coordinator.settle(entry, property, ownerId, null, false, agentId, SETTLEMENT_DATE);

        assertFalse(result.sellerFailed());
        assertEquals(List.of(invoice), result.getToAnnounce());
        verify(recorder).attachInvoice(eq(entry.getId()), any(InvoiceOutcome.class));
    }

    @Test
    @DisplayName("Reused seller invoice is attached but never announced")
    void testSettle_ExistingSellerInvoice() {
        Invoice invoice = invoice("INV-2026-000001");
        when(ledger.getOrCreate(eq(InvoiceCategory.SETTLEMENT_COMMISSION), any(), any(), any(), any(), any()))
                .thenReturn(InvoiceResult.existing(invoice));

        SettlementInvoices result = coordinator.settle(entry(null), property, ownerId, null, false, agentId, null);

        assertTrue(result.getSeller().isAlreadyExisted());
        assertTrue(result.getToAnnounce().isEmpty());
    }

    @Test
    @DisplayName("Resumed entry announces an invoice its first run created but never announced")
    void testSettle_ResumeAnnouncesUnannouncedInvoice() {
        Invoice invoice = invoice("INV-2026-000007");
        InvoiceOutcome firstRun = new InvoiceOutcome(true, invoice.getId(), "INV-2026-000007", NOW,
                new BigDecimal("6050.00"), InvoiceStatus.PENDING, false);
        when(ledger.getOrCreate(eq(InvoiceCategory.SETTLEMENT_COMMISSION), any(), any(), any(), any(), any()))
                .thenReturn(InvoiceResult.existing(invoice));
        StatusHistoryEntry entry = entry(firstRun);

        SettlementInvoices result = coordinator.settle(entry, property, ownerId, null, false, agentId, null);

        assertEquals(List.of(invoice), result.getToAnnounce());
        verify(recorder, never()).attachInvoice(any(), any());
    }

    @Test
    @DisplayName("Seller invoice failure is reported, buyer and platform failures only logged on the entry")
    void testSettle_Failures() {
        UUID buyerId = UUID.randomUUID();
        when(ledger.getOrCreate(eq(InvoiceCategory.SETTLEMENT_COMMISSION), any(), any(), any(), any(), any()))
                .thenThrow(new IllegalArgumentException("Seller not found: " + ownerId));
        when(ledger.getOrCreate(eq(InvoiceCategory.BUYER_PAYMENT), any(), eq(CounterpartyRole.BUYER), eq(buyerId),
                any(), any())).thenThrow(new IllegalArgumentException("Buyer not found: " + buyerId));
        when(ledger.getOrCreate(eq(InvoiceCategory.PLATFORM_COMMISSION), any(), any(), any(), any(), any()))
                .thenThrow(new IllegalStateException("db down"));
        StatusHistoryEntry entry = entry(null);

        SettlementInvoices result = coordinator.settle(entry, property, ownerId, buyerId, true, agentId, null);

        assertTrue(result.sellerFailed());
        assertEquals("Invoice generation failed: Seller not found: " + ownerId, result.getSellerFailure());
        assertNull(result.getBuyer());
        assertNull(result.getPlatform());
        verify(recorder).appendError(eq(entry.getId()), startsWith("Buyer invoice generation failed"));
        verify(recorder).appendError(eq(entry.getId()), startsWith("Platform invoice generation failed"));
    }

    @Test
    @DisplayName("Buyer and platform invoices are created when requested")
    void testSettle_BuyerAndPlatform() {
        UUID buyerId = UUID.randomUUID();
        Invoice seller = invoice("INV-2026-000010");
        Invoice buyer = invoice("INV-2026-000011");
        Invoice platform = mock(Invoice.class);
        when(ledger.getOrCreate(eq(InvoiceCategory.SETTLEMENT_COMMISSION), any(), any(), any(), any(), any()))
                .thenReturn(InvoiceResult.created(seller));
        when(ledger.getOrCreate(eq(InvoiceCategory.BUYER_PAYMENT), any(), eq(CounterpartyRole.BUYER), eq(buyerId),
                eq(agentId), any())).thenReturn(InvoiceResult.created(buyer));
        when(ledger.getOrCreate(eq(InvoiceCategory.PLATFORM_COMMISSION), any(), eq(CounterpartyRole.SELLER),
                eq(ownerId), eq(agentId), any())).thenReturn(InvoiceResult.created(platform));

        SettlementInvoices result = coordinator.settle(entry(null), property, ownerId, buyerId, true, agentId, null);

        assertEquals(List.of(seller, buyer), result.getToAnnounce());
        assertSame(platform, result.getPlatform().getInvoice());
        verify(recorder).attachBuyerInvoice(any(), any());
    }

    @Test
    @DisplayName("Without an active agent the acting user is recorded as agent")
    void testSettle_FallsBackToActor() {
        PropertySnapshot unassigned = new PropertySnapshot(property.getId(), property.getSlug(), property.getTitle(),
                property.getPrice(), SalesStatus.SETTLED, ListingStatus.SOLD, ownerId, null, null, null, false, NOW);
        UUID adminId = UUID.randomUUID();
        Invoice invoice = invoice("INV-2026-000020");
        when(ledger.getOrCreate(InvoiceCategory.SETTLEMENT_COMMISSION, unassigned, CounterpartyRole.SELLER,
                ownerId, adminId, null)).thenReturn(InvoiceResult.created(invoice));

        SettlementInvoices result = coordinator.settle(entry(null), unassigned, ownerId, null, false, adminId, null);

        assertSame(invoice, result.getSeller().getInvoice());
    }
}
