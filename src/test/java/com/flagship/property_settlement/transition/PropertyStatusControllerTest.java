package com.flagship.property_settlement.transition;

import com.flagship.property_settlement.directory.DirectoryUserEntity;
import com.flagship.property_settlement.directory.DirectoryUserRepository;
import com.flagship.property_settlement.directory.UserRole;
import com.flagship.property_settlement.property.AgentRole;
import com.flagship.property_settlement.property.ListingStatus;
import com.flagship.property_settlement.property.PropertyEntity;
import com.flagship.property_settlement.property.PropertyPersistenceService;
import com.flagship.property_settlement.property.SalesStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.UUID;

import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP contract of {@code PATCH /api/properties/{idOrSlug}/status}.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class PropertyStatusControllerTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("property_settlement_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("sales.recovery.enabled", () -> "false");
        registry.add("sales.rate-limit.enabled", () -> "false");
        registry.add("invoice.overdue-sweep.enabled", () -> "false");
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private DirectoryUserRepository userRepository;

    @Autowired
    private PropertyPersistenceService propertyService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private UUID agentId;
    private UUID otherAgentId;
    private UUID sellerId;
    private UUID propertyId;
    private String slug;

    @BeforeEach
    void setUp() {
        jdbcTemplate.execute("TRUNCATE TABLE outbox_events, notifications, status_history_notifications,"
                + " status_history_errors, property_status_history, invoice_payments, invoice_line_items,"
                + " invoices, invoice_counters, property_agents, properties, directory_users CASCADE");

        agentId = UUID.randomUUID();
        otherAgentId = UUID.randomUUID();
        sellerId = UUID.randomUUID();
        userRepository.save(new DirectoryUserEntity(agentId, "Alex Agent", "alex@agency.test", UserRole.AGENT, null));
        userRepository.save(new DirectoryUserEntity(otherAgentId, "Olly Other", "olly@agency.test", UserRole.AGENT, null));
        userRepository.save(new DirectoryUserEntity(sellerId, "Sam Seller", "sam@example.test", UserRole.SELLER, null));

        propertyId = UUID.randomUUID();
        slug = "harbour-street-" + propertyId.toString().substring(0, 8);
        PropertyEntity entity = PropertyEntity.list(propertyId, slug, "12 Harbour Street", "12 Harbour Street, Sydney",
                new BigDecimal("500000"), sellerId, "sam@example.test", ListingStatus.ACTIVE);
        entity.assignAgent(agentId, AgentRole.LISTING, new BigDecimal("2.0"));
        propertyService.save(entity);
    }

    @Test
    @DisplayName("Assigned agent settles the property and gets the invoice back")
    void settle_returnsEnvelope() throws Exception {
        mockMvc.perform(patch("/api/properties/{id}/status", propertyId)
                        .header("X-User-Id", agentId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"settled\",\"changeReason\":\"Keys handed over\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message", startsWith("Property sales status successfully updated to Settled and invoice INV-")))
                .andExpect(jsonPath("$.data.property.salesStatus").value("settled"))
                .andExpect(jsonPath("$.data.property.status").value("SOLD"))
                .andExpect(jsonPath("$.data.statusHistory.newStatus").value("settled"))
                .andExpect(jsonPath("$.data.invoice.amount").value(6050.00))
                .andExpect(jsonPath("$.data.invoice.alreadyExisted").value(false))
                .andExpect(jsonPath("$.data.buyerInvoice").doesNotExist())
                .andExpect(jsonPath("$.data.message").doesNotExist());
    }

    @Test
    @DisplayName("Slug resolves the property and non-settled statuses carry no invoice")
    void slugLookup_contractExchanged() throws Exception {
        mockMvc.perform(patch("/api/properties/{slug}/status", slug)
                        .header("X-User-Id", agentId.toString())
                        .header("X-Client-Source", "mobile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"contract-exchanged\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Property sales status successfully updated to Contract Exchanged"))
                .andExpect(jsonPath("$.data.property.salesStatus").value("contract-exchanged"))
                .andExpect(jsonPath("$.data.invoice").doesNotExist());

        assertEquals(SalesStatus.CONTRACT_EXCHANGED, propertyService.requireSnapshot(propertyId).getSalesStatus());
    }

    @Test
    @DisplayName("Invalid status is a 400 with field details")
    void invalidStatus_badRequest() throws Exception {
        mockMvc.perform(patch("/api/properties/{id}/status", propertyId)
                        .header("X-User-Id", agentId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"sold\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.statusCode").value(400))
                .andExpect(jsonPath("$.details.status")
                        .value("Invalid status. Must be one of: contract-exchanged, unconditional, settled"));

        assertNull(propertyService.requireSnapshot(propertyId).getSalesStatus());
    }

    @Test
    @DisplayName("Missing caller is forbidden")
    void missingCaller_forbidden() throws Exception {
        mockMvc.perform(patch("/api/properties/{id}/status", propertyId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"settled\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.message").value("Authenticated user is required"));
    }

    @Test
    @DisplayName("Agent not assigned to the property is forbidden")
    void unassignedAgent_forbidden() throws Exception {
        mockMvc.perform(patch("/api/properties/{id}/status", propertyId)
                        .header("X-User-Id", otherAgentId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"unconditional\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.message").value("Access denied. You are not assigned to this property"));
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"contract-exchanged", "unconditional", "settled"})
    @DisplayName("Replaced agent is forbidden and nothing is written")
    void deactivatedAgent_forbiddenWithoutSideEffects(String requested) throws Exception {
        PropertyEntity reassigned = propertyService.findByIdOrSlug(propertyId.toString()).orElseThrow();
        reassigned.assignAgent(otherAgentId, AgentRole.SELLING, new BigDecimal("2.0"));
        propertyService.save(reassigned);

        mockMvc.perform(patch("/api/properties/{id}/status", propertyId)
                        .header("X-User-Id", agentId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"" + requested + "\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.message").value("Access denied. You are not assigned to this property"));

        assertNull(propertyService.requireSnapshot(propertyId).getSalesStatus());
        assertEquals(ListingStatus.ACTIVE, propertyService.requireSnapshot(propertyId).getStatus());
        assertEquals(0, count("property_status_history"));
        assertEquals(0, count("invoices"));
        assertEquals(0, count("outbox_events"));
    }

    private int count(String table) {
        return jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
    }

    @Test
    @DisplayName("Sellers cannot change the sales status")
    void seller_forbidden() throws Exception {
        mockMvc.perform(patch("/api/properties/{id}/status", propertyId)
                        .header("X-User-Id", sellerId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"unconditional\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.details.role").value("SELLER"));
    }

    @Test
    @DisplayName("Unknown property is a 404")
    void unknownProperty_notFound() throws Exception {
        mockMvc.perform(patch("/api/properties/{slug}/status", "no-such-listing")
                        .header("X-User-Id", agentId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"settled\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Property not found: no-such-listing"));
    }

    @Test
    @DisplayName("Legacy sellerID field is checked against the owner")
    void legacySellerIdAlias_mismatch() throws Exception {
        mockMvc.perform(patch("/api/properties/{id}/status", propertyId)
                        .header("X-User-Id", agentId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"settled\",\"sellerID\":\"" + UUID.randomUUID() + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.sellerId").value("Seller ID does not match the property owner"));
    }

    @Test
    @DisplayName("Malformed body is a 400")
    void malformedBody_badRequest() throws Exception {
        mockMvc.perform(patch("/api/properties/{id}/status", propertyId)
                        .header("X-User-Id", agentId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed request body"));
    }
}
