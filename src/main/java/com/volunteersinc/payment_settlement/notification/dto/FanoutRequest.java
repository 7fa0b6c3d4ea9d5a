package com.volunteersinc.payment_settlement.notification.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Sent by the admin flows after a cause, event or announcement is created.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FanoutRequest {

    @NotBlank
    private String category;

    @NotNull
    @JsonProperty("related_id")
    private UUID relatedId;

    @NotNull
    @JsonProperty("actor_id")
    private UUID actorId;

    @NotBlank
    private String title;

    private String body;
}
