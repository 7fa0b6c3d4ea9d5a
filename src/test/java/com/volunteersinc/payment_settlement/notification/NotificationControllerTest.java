package com.volunteersinc.payment_settlement.notification;

import com.volunteersinc.payment_settlement.settlement.SecondaryEffect;
import com.volunteersinc.payment_settlement.settlement.SecondaryFailure;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(NotificationController.class)
class NotificationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private NotificationFanoutService fanoutService;

    @Test
    @DisplayName("Fan-out reports recipients, pushes and push failures")
    void fansOut() throws Exception {
        UUID causeId = UUID.randomUUID();
        UUID actorId = UUID.randomUUID();
        when(fanoutService.fanOut(eq(NotificationCategory.CAUSE), eq(causeId), eq(actorId), eq("Clean Water"), any()))
            .thenReturn(new FanoutResult(3, 2,
                List.of(new SecondaryFailure(SecondaryEffect.PUSH_DELIVERY, "no token"))));

        mockMvc.perform(post("/api/notifications/fanout")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"category\":\"cause\",\"related_id\":\"" + causeId + "\"," +
                         "\"actor_id\":\"" + actorId + "\",\"title\":\"Clean Water\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.recipients").value(3))
            .andExpect(jsonPath("$.pushed").value(2))
            .andExpect(jsonPath("$.push_failures").value(1));
    }

    @Test
    @DisplayName("Unknown categories are rejected")
    void rejectsUnknownCategory() throws Exception {
        mockMvc.perform(post("/api/notifications/fanout")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"category\":\"poll\",\"related_id\":\"" + UUID.randomUUID() + "\"," +
                         "\"actor_id\":\"" + UUID.randomUUID() + "\",\"title\":\"Vote\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("category must be one of cause, event, announcement"));

        verifyNoInteractions(fanoutService);
    }

    @Test
    @DisplayName("Missing fields fail validation")
    void validatesBody() throws Exception {
        mockMvc.perform(post("/api/notifications/fanout")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"category\":\"event\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.error").value("Request validation failed"))
            .andExpect(jsonPath("$.details.title").exists());
    }
}
