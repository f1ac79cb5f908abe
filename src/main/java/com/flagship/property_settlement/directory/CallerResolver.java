package com.flagship.property_settlement.directory;

import com.flagship.property_settlement.exception.ForbiddenOperationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Resolves the authenticated caller forwarded by the gateway in the
 * {@value #USER_ID_HEADER} header.
 */
@Component
@RequiredArgsConstructor
public class CallerResolver {

    public static final String USER_ID_HEADER = "X-User-Id";

    private final UserDirectory userDirectory;

    public DirectoryUser resolve(String userIdHeader) {
        if (userIdHeader == null || userIdHeader.isBlank()) {
            throw new ForbiddenOperationException("Authenticated user is required");
        }
        UUID userId;
        try {
            userId = UUID.fromString(userIdHeader.trim());
        } catch (IllegalArgumentException e) {
            throw new ForbiddenOperationException("Authenticated user is required");
        }
        return userDirectory.findById(userId)
                .orElseThrow(() -> new ForbiddenOperationException("Unknown user: " + userId));
    }

    public DirectoryUser requireAdmin(String userIdHeader) {
        DirectoryUser caller = resolve(userIdHeader);
        if (!caller.isAdmin()) {
            throw new ForbiddenOperationException("Access denied. Admin role required");
        }
        return caller;
    }
}
