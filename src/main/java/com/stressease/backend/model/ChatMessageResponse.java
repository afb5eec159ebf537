package com.stressease.backend.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.stressease.backend.crisis.CrisisContact;
import com.stressease.backend.crisis.RiskCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Reply to an inbound chat message. Crisis fields are present only on the
 * turns of the crisis dialogue that set them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ChatMessageResponse {

    @Builder.Default
    private boolean success = true;

    private ChatMessageVO userMessage;
    private ChatMessageVO aiResponse;
    private String sessionId;

    private Boolean crisisDetected;
    private RiskCategory crisisCategory;
    private Boolean confirmationRequired;
    private Boolean showResources;
    private List<CrisisContact> crisisResources;
}
