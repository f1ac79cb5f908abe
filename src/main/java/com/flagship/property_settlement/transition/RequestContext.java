package com.flagship.property_settlement.transition;

import com.flagship.property_settlement.history.ChangeSource;
import com.flagship.property_settlement.history.RequestMetadata;
import lombok.Value;

import java.time.Instant;

/**
 * Where a transition request came from.
 */
@Value
public class RequestContext {
    String userAgent;
    String ipAddress;
    ChangeSource source;
    String correlationId;

    public static RequestContext system(String correlationId) {
        return new RequestContext(null, null, ChangeSource.SYSTEM, correlationId);
    }

    public RequestMetadata toMetadata(Instant at) {
        return new RequestMetadata(userAgent, ipAddress, at, source == null ? ChangeSource.WEB : source, correlationId);
    }
}
