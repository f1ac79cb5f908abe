package com.flagship.property_settlement.transition;

import com.flagship.property_settlement.config.JacksonConfig;
import com.flagship.property_settlement.directory.CallerResolver;
import com.flagship.property_settlement.directory.DirectoryUser;
import com.flagship.property_settlement.directory.UserRole;
import com.flagship.property_settlement.ratelimit.StatusUpdateRateLimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * The rate-limit key and the recorded IP come from the connection, not from
 * headers the client controls.
 */
@ExtendWith(MockitoExtension.class)
class PropertyStatusControllerClientAddressTest {

    @Mock
    private StatusTransitionEngine engine;
    @Mock
    private CallerResolver callerResolver;
    @Mock
    private StatusUpdateRateLimiter rateLimiter;

    private MockMvc mockMvc;
    private DirectoryUser agent;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new PropertyStatusController(engine, callerResolver, rateLimiter))
                .setMessageConverters(new MappingJackson2HttpMessageConverter(new JacksonConfig().objectMapper()))
                .build();
        agent = new DirectoryUser(UUID.randomUUID(), "Alex Agent", "alex@agency.test", UserRole.AGENT, null);
        when(callerResolver.resolve(agent.getId().toString())).thenReturn(agent);
        when(engine.transition(any(TransitionCommand.class), eq(agent)))
                .thenReturn(new TransitionResult(null, null, null, null, null, "Property status updated"));
    }

    @Test
    @DisplayName("Rotating X-Forwarded-For does not change the rate-limit key")
    void testForwardedHeaderIgnored() throws Exception {
        for (int i = 0; i < 3; i++) {
            String spoofed = "10.9.9." + i;
            mockMvc.perform(patch("/api/properties/harbour-view/status")
                            .with(request -> {
                                request.setRemoteAddr("203.0.113.7");
                                return request;
                            })
                            .header(CallerResolver.USER_ID_HEADER, agent.getId().toString())
                            .header("X-Forwarded-For", spoofed)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"status\":\"contract-exchanged\"}"))
                    .andExpect(status().isOk());
        }

        verify(rateLimiter, times(3)).check("203.0.113.7", agent);

        ArgumentCaptor<TransitionCommand> commands = ArgumentCaptor.forClass(TransitionCommand.class);
        verify(engine, times(3)).transition(commands.capture(), eq(agent));
        List<TransitionCommand> captured = commands.getAllValues();
        captured.forEach(command ->
                assertEquals("203.0.113.7", command.getRequestContext().getIpAddress()));
    }
}
