package com.flagship.property_settlement.notification;

import com.flagship.property_settlement.api.ApiResponse;
import com.flagship.property_settlement.directory.CallerResolver;
import com.flagship.property_settlement.directory.DirectoryUser;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private final NotificationService notificationService;
    private final CallerResolver callerResolver;

    @GetMapping
    public ResponseEntity<ApiResponse<List<Notification>>> list(
            @RequestHeader(CallerResolver.USER_ID_HEADER) String userId) {
        DirectoryUser caller = callerResolver.resolve(userId);
        return ResponseEntity.ok(ApiResponse.ok(notificationService.listFor(caller)));
    }

    @PostMapping("/{id}/read")
    public ResponseEntity<ApiResponse<Notification>> markRead(
            @PathVariable("id") UUID id,
            @RequestHeader(CallerResolver.USER_ID_HEADER) String userId) {
        DirectoryUser caller = callerResolver.resolve(userId);
        return ResponseEntity.ok(ApiResponse.ok(notificationService.markRead(id, caller)));
    }
}
