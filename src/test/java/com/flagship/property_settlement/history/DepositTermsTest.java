package com.flagship.property_settlement.history;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.property_settlement.config.JacksonConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class DepositTermsTest {

    private final ObjectMapper objectMapper = new JacksonConfig().objectMapper();

    @Test
    @DisplayName("Off-platform terms are 10% of the price, released, in AUD")
    void testOffPlatform() {
        Instant releasedAt = Instant.parse("2026-03-01T10:00:00Z");

        DepositTerms terms = DepositTerms.offPlatform(new BigDecimal("750000"), releasedAt);

        assertEquals(new BigDecimal("75000.00"), terms.getExpectedAmount());
        assertEquals(DepositTerms.Handler.AGENT_TRUST_ACCOUNT, terms.getHandler());
        assertEquals(DepositTerms.ReleaseStatus.RELEASED, terms.getReleaseStatus());
        assertEquals(releasedAt, terms.getReleasedAt());
        assertEquals("AUD", terms.getCurrency());
    }

    @Test
    @DisplayName("Wire values do not depend on the default locale")
    void testWireValues_LocaleIndependent() throws Exception {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertEquals("agent_trust_account", DepositTerms.Handler.AGENT_TRUST_ACCOUNT.wireValue());
            assertEquals("eligible", DepositTerms.ReleaseStatus.ELIGIBLE.wireValue());

            JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(
                    DepositTerms.offPlatform(new BigDecimal("500000"), Instant.parse("2026-03-01T10:00:00Z"))));
            assertEquals("agent_trust_account", json.get("handler").asText());
            assertEquals("released", json.get("releaseStatus").asText());
        } finally {
            Locale.setDefault(previous);
        }
    }
}
