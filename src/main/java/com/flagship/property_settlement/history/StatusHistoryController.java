package com.flagship.property_settlement.history;

import com.flagship.property_settlement.api.ApiResponse;
import com.flagship.property_settlement.directory.CallerResolver;
import com.flagship.property_settlement.directory.DirectoryUser;
import com.flagship.property_settlement.exception.ForbiddenOperationException;
import com.flagship.property_settlement.property.PropertyEntity;
import com.flagship.property_settlement.property.PropertyNotFoundException;
import com.flagship.property_settlement.property.PropertyPersistenceService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Read access to the status audit trail.
 */
@RestController
@RequiredArgsConstructor
public class StatusHistoryController {

    static final int MAX_ADMIN_PAGE = 200;

    private final AuditTrailRecorder recorder;
    private final PropertyPersistenceService propertyService;
    private final CallerResolver callerResolver;

    @GetMapping("/api/properties/{idOrSlug}/status-history")
    public ResponseEntity<ApiResponse<List<StatusHistoryEntry>>> propertyHistory(
            @PathVariable("idOrSlug") String idOrSlug,
            @RequestHeader(CallerResolver.USER_ID_HEADER) String userId) {
        DirectoryUser caller = callerResolver.resolve(userId);
        PropertyEntity property = propertyService.findByIdOrSlug(idOrSlug)
                .orElseThrow(() -> new PropertyNotFoundException(idOrSlug));
        if (!caller.isAdmin()
                && !caller.getId().equals(property.getOwnerId())
                && !property.isActiveAgent(caller.getId())) {
            throw new ForbiddenOperationException("Not authorized to view status history for this property");
        }
        return ResponseEntity.ok(ApiResponse.ok(recorder.historyForProperty(property.getId())));
    }

    @GetMapping("/api/agents/{agentId}/status-history")
    public ResponseEntity<ApiResponse<List<StatusHistoryEntry>>> agentHistory(
            @PathVariable("agentId") UUID agentId,
            @RequestHeader(CallerResolver.USER_ID_HEADER) String userId) {
        DirectoryUser caller = callerResolver.resolve(userId);
        if (!caller.isAdmin() && !caller.getId().equals(agentId)) {
            throw new ForbiddenOperationException("Not authorized to view another agent's status history");
        }
        return ResponseEntity.ok(ApiResponse.ok(recorder.historyForAgent(agentId)));
    }

    @GetMapping("/api/admin/status-history")
    public ResponseEntity<ApiResponse<List<StatusHistoryEntry>>> byProcessingStatus(
            @RequestParam(value = "processingStatus", defaultValue = "FAILED") ProcessingStatus processingStatus,
            @RequestParam(value = "limit", defaultValue = "50") int limit,
            @RequestHeader(CallerResolver.USER_ID_HEADER) String userId) {
        callerResolver.requireAdmin(userId);
        int pageSize = Math.max(1, Math.min(limit, MAX_ADMIN_PAGE));
        return ResponseEntity.ok(ApiResponse.ok(recorder.findByProcessingStatus(processingStatus, pageSize)));
    }
}
