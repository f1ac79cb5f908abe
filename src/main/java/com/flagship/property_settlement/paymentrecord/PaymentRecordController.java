package com.flagship.property_settlement.paymentrecord;

import com.flagship.property_settlement.api.ApiResponse;
import com.flagship.property_settlement.directory.CallerResolver;
import com.flagship.property_settlement.paymentrecord.dto.UpdatePaymentRecordStatusRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/admin/payment-records")
@RequiredArgsConstructor
public class PaymentRecordController {

    private final PaymentRecordService paymentRecordService;
    private final CallerResolver callerResolver;

    @GetMapping
    public ResponseEntity<ApiResponse<List<PaymentRecord>>> list(
            @RequestParam(value = "status", required = false) PaymentRecordStatus status,
            @RequestHeader(CallerResolver.USER_ID_HEADER) String userId) {
        callerResolver.requireAdmin(userId);
        return ResponseEntity.ok(ApiResponse.ok(paymentRecordService.list(status)));
    }

    @GetMapping("/overdue")
    public ResponseEntity<ApiResponse<List<PaymentRecord>>> overdue(
            @RequestHeader(CallerResolver.USER_ID_HEADER) String userId) {
        callerResolver.requireAdmin(userId);
        return ResponseEntity.ok(ApiResponse.ok(paymentRecordService.overdue()));
    }

    @PutMapping("/{id}/status")
    public ResponseEntity<ApiResponse<PaymentRecord>> updateStatus(
            @PathVariable("id") UUID id,
            @Valid @RequestBody UpdatePaymentRecordStatusRequest request,
            @RequestHeader(CallerResolver.USER_ID_HEADER) String userId) {
        callerResolver.requireAdmin(userId);
        PaymentRecord updated = paymentRecordService.updateStatus(id, request.getStatus(), request.getReason());
        return ResponseEntity.ok(ApiResponse.ok("Payment record updated successfully", updated));
    }
}
