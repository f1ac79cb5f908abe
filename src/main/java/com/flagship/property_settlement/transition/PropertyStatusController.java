package com.flagship.property_settlement.transition;

import com.flagship.property_settlement.api.ApiResponse;
import com.flagship.property_settlement.directory.CallerResolver;
import com.flagship.property_settlement.directory.DirectoryUser;
import com.flagship.property_settlement.history.ChangeSource;
import com.flagship.property_settlement.observability.CorrelationContext;
import com.flagship.property_settlement.ratelimit.StatusUpdateRateLimiter;
import com.flagship.property_settlement.transition.dto.UpdateSalesStatusRequest;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;

/**
 * Sales status updates for agents and admins.
 *
 * The caller comes from {@code X-User-Id}; a missing or unknown caller is rejected
 * with 403 before the rate limiter is consulted.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class PropertyStatusController {

    static final String CLIENT_SOURCE_HEADER = "X-Client-Source";

    private final StatusTransitionEngine engine;
    private final CallerResolver callerResolver;
    private final StatusUpdateRateLimiter rateLimiter;

    @PatchMapping("/api/properties/{idOrSlug}/status")
    public ResponseEntity<ApiResponse<TransitionResult>> updateSalesStatus(
            @PathVariable("idOrSlug") String idOrSlug,
            @RequestBody UpdateSalesStatusRequest request,
            @RequestHeader(value = CallerResolver.USER_ID_HEADER, required = false) String userId,
            @RequestHeader(value = CLIENT_SOURCE_HEADER, required = false) String clientSource,
            HttpServletRequest httpRequest) {

        DirectoryUser caller = callerResolver.resolve(userId);
        String clientIp = clientIp(httpRequest);
        rateLimiter.check(clientIp, caller);

        log.info("Sales status update requested: property={}, status={}, caller={}",
                idOrSlug, request.getStatus(), caller.getId());

        TransitionCommand command = TransitionCommand.builder()
                .propertyIdOrSlug(idOrSlug)
                .status(request.getStatus())
                .changeReason(request.getChangeReason())
                .settlementDetails(request.getSettlementDetails())
                .sellerId(request.getSellerId())
                .buyerId(request.getBuyerId())
                .requestContext(new RequestContext(
                        httpRequest.getHeader(HttpHeaders.USER_AGENT),
                        clientIp,
                        source(clientSource),
                        CorrelationContext.getCorrelationId()))
                .build();

        TransitionResult result = engine.transition(command, caller);
        return ResponseEntity.ok(ApiResponse.ok(result.getMessage(), result));
    }

    /**
     * Socket address of the caller. Forwarded headers are honoured only when
     * {@code server.forward-headers-strategy} is enabled behind a trusted proxy.
     */
    static String clientIp(HttpServletRequest request) {
        return request.getRemoteAddr();
    }

    static ChangeSource source(String header) {
        if (header == null || header.isBlank()) {
            return ChangeSource.WEB;
        }
        try {
            return ChangeSource.valueOf(header.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.debug("Unknown client source '{}', defaulting to WEB", header);
            return ChangeSource.WEB;
        }
    }
}
