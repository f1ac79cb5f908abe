package com.flagship.property_settlement.invoice;

import com.flagship.property_settlement.api.ApiResponse;
import com.flagship.property_settlement.directory.CallerResolver;
import com.flagship.property_settlement.directory.DirectoryUser;
import com.flagship.property_settlement.exception.ForbiddenOperationException;
import com.flagship.property_settlement.invoice.dto.CancelInvoiceRequest;
import com.flagship.property_settlement.invoice.dto.InvoiceResponse;
import com.flagship.property_settlement.invoice.dto.RecordPaymentRequest;
import com.flagship.property_settlement.property.PropertyEntity;
import com.flagship.property_settlement.property.PropertyNotFoundException;
import com.flagship.property_settlement.property.PropertyPersistenceService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Invoice read and lifecycle endpoints.
 *
 * Access: admins see everything; the agent on an invoice may send, cancel and
 * record payments; the counterparty may read it and mark it viewed.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class InvoiceController {

    private final InvoiceLedgerService ledgerService;
    private final PropertyPersistenceService propertyService;
    private final CallerResolver callerResolver;
    private final Clock clock;

    @GetMapping("/api/invoices/{id}")
    public ResponseEntity<ApiResponse<InvoiceResponse>> getInvoice(
            @PathVariable("id") UUID id,
            @RequestHeader(CallerResolver.USER_ID_HEADER) String userId) {
        DirectoryUser caller = callerResolver.resolve(userId);
        Invoice invoice = ledgerService.findById(id);
        requireParty(caller, invoice);
        return ResponseEntity.ok(ApiResponse.ok(toResponse(invoice)));
    }

    @GetMapping("/api/invoices/number/{invoiceNumber}")
    public ResponseEntity<ApiResponse<InvoiceResponse>> getInvoiceByNumber(
            @PathVariable("invoiceNumber") String invoiceNumber,
            @RequestHeader(CallerResolver.USER_ID_HEADER) String userId) {
        DirectoryUser caller = callerResolver.resolve(userId);
        Invoice invoice = ledgerService.findByNumber(invoiceNumber);
        requireParty(caller, invoice);
        return ResponseEntity.ok(ApiResponse.ok(toResponse(invoice)));
    }

    @GetMapping("/api/properties/{idOrSlug}/invoices")
    public ResponseEntity<ApiResponse<List<InvoiceResponse>>> listForProperty(
            @PathVariable("idOrSlug") String idOrSlug,
            @RequestHeader(CallerResolver.USER_ID_HEADER) String userId) {
        DirectoryUser caller = callerResolver.resolve(userId);
        PropertyEntity property = propertyService.findByIdOrSlug(idOrSlug)
                .orElseThrow(() -> new PropertyNotFoundException(idOrSlug));
        if (!caller.isAdmin()
                && !caller.getId().equals(property.getOwnerId())
                && !property.isActiveAgent(caller.getId())) {
            throw new ForbiddenOperationException("Not authorized to view invoices for this property");
        }
        List<InvoiceResponse> invoices = ledgerService.listForProperty(property.getId()).stream()
                .map(this::toResponse)
                .toList();
        return ResponseEntity.ok(ApiResponse.ok(invoices));
    }

    @PostMapping("/api/invoices/{id}/payments")
    public ResponseEntity<ApiResponse<InvoiceResponse>> recordPayment(
            @PathVariable("id") UUID id,
            @Valid @RequestBody RecordPaymentRequest request,
            @RequestHeader(CallerResolver.USER_ID_HEADER) String userId) {
        DirectoryUser caller = callerResolver.resolve(userId);
        requireAgentOrAdmin(caller, ledgerService.findById(id));
        Invoice updated = ledgerService.recordPayment(id, request.getAmount(), request.getMethod(),
                request.getReference(), caller.getId());
        return ResponseEntity.ok(ApiResponse.ok("Payment recorded", toResponse(updated)));
    }

    @PostMapping("/api/invoices/{id}/send")
    public ResponseEntity<ApiResponse<InvoiceResponse>> send(
            @PathVariable("id") UUID id,
            @RequestHeader(CallerResolver.USER_ID_HEADER) String userId) {
        DirectoryUser caller = callerResolver.resolve(userId);
        requireAgentOrAdmin(caller, ledgerService.findById(id));
        Invoice updated = ledgerService.markSent(id, caller.getId());
        return ResponseEntity.ok(ApiResponse.ok("Invoice sent", toResponse(updated)));
    }

    @PostMapping("/api/invoices/{id}/view")
    public ResponseEntity<ApiResponse<InvoiceResponse>> view(
            @PathVariable("id") UUID id,
            @RequestHeader(CallerResolver.USER_ID_HEADER) String userId) {
        DirectoryUser caller = callerResolver.resolve(userId);
        Invoice invoice = ledgerService.findById(id);
        if (!caller.getId().equals(invoice.getCounterpartyId())) {
            throw new ForbiddenOperationException("Only the invoice recipient can mark it as viewed");
        }
        return ResponseEntity.ok(ApiResponse.ok(toResponse(ledgerService.markViewed(id))));
    }

    @PostMapping("/api/invoices/{id}/cancel")
    public ResponseEntity<ApiResponse<InvoiceResponse>> cancel(
            @PathVariable("id") UUID id,
            @Valid @RequestBody CancelInvoiceRequest request,
            @RequestHeader(CallerResolver.USER_ID_HEADER) String userId) {
        DirectoryUser caller = callerResolver.resolve(userId);
        requireAgentOrAdmin(caller, ledgerService.findById(id));
        Invoice updated = ledgerService.cancel(id, request.getReason().trim(), caller.getId());
        return ResponseEntity.ok(ApiResponse.ok("Invoice cancelled", toResponse(updated)));
    }

    private void requireParty(DirectoryUser caller, Invoice invoice) {
        UUID callerId = caller.getId();
        boolean party = callerId.equals(invoice.getAgentId())
                || callerId.equals(invoice.getSellerId())
                || callerId.equals(invoice.getBuyerId());
        if (!caller.isAdmin() && !party) {
            throw new ForbiddenOperationException("Not authorized to access this invoice");
        }
    }

    private void requireAgentOrAdmin(DirectoryUser caller, Invoice invoice) {
        if (!caller.isAdmin() && !caller.getId().equals(invoice.getAgentId())) {
            throw new ForbiddenOperationException("Only the invoicing agent or an admin can modify this invoice");
        }
    }

    private InvoiceResponse toResponse(Invoice invoice) {
        return InvoiceResponse.from(invoice, LocalDate.now(clock));
    }
}
