package com.namehub.controller;

import com.namehub.mapper.RegistryResponseMapper;
import com.namehub.model.AddressType;
import com.namehub.service.RegistrationService;
import com.namehub.web.CallerPrincipal;
import com.namehub.web.RegistryException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RegistrationController.class)
@Import(RegistryResponseMapper.class)
class RegistrationControllerTest {

    private static final String REQUEST_BODY = """
            {
              "name": "alice",
              "address": "target-1",
              "addressType": "IDENTITY",
              "seasonId": 1,
              "blockReference": "5sigAlice"
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private RegistrationService registrationService;

    @Test
    void register_returnsReceiptWithPaymentId() throws Exception {
        OffsetDateTime subscriptionEnd = OffsetDateTime.of(2027, 3, 1, 12, 0, 0, 0, ZoneOffset.UTC);
        when(registrationService.register(eq("alice"), any(RegistrationService.RegistrationCommand.class)))
                .thenReturn(new RegistrationService.RegistrationReceipt(
                        7L, "alice", "alice", 1L, 100_000L, subscriptionEnd
                ));

        mockMvc.perform(post("/api/registrations")
                        .header(CallerPrincipal.HEADER, "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(REQUEST_BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.paymentId").value(7))
                .andExpect(jsonPath("$.name").value("alice"))
                .andExpect(jsonPath("$.seasonId").value(1))
                .andExpect(jsonPath("$.amountPaid").value(100000));

        verify(registrationService).register("alice", new RegistrationService.RegistrationCommand(
                "alice", "target-1", AddressType.IDENTITY, 1L, "5sigAlice"
        ));
    }

    @Test
    void register_replayedReferenceIsConflict() throws Exception {
        when(registrationService.register(eq("alice"), any(RegistrationService.RegistrationCommand.class)))
                .thenThrow(RegistryException.replayedPayment("5sigAlice"));

        mockMvc.perform(post("/api/registrations")
                        .header(CallerPrincipal.HEADER, "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(REQUEST_BODY))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("REPLAYED_PAYMENT"));
    }

    @Test
    void register_unverifiedPaymentIsPaymentRequired() throws Exception {
        when(registrationService.register(eq("alice"), any(RegistrationService.RegistrationCommand.class)))
                .thenThrow(RegistryException.paymentNotVerified("5sigAlice"));

        mockMvc.perform(post("/api/registrations")
                        .header(CallerPrincipal.HEADER, "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(REQUEST_BODY))
                .andExpect(status().isPaymentRequired())
                .andExpect(jsonPath("$.code").value("PAYMENT_NOT_VERIFIED"));
    }

    @Test
    void register_missingFieldsAreRejected() throws Exception {
        mockMvc.perform(post("/api/registrations")
                        .header(CallerPrincipal.HEADER, "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"alice\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.blockReference").value("blockReference is required"));

        verifyNoInteractions(registrationService);
    }

    @Test
    void register_malformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/registrations")
                        .header(CallerPrincipal.HEADER, "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Malformed request body"));
    }
}
