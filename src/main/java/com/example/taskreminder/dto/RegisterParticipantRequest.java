package com.example.taskreminder.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for registering or refreshing a participant's profile
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterParticipantRequest {

    @NotNull(message = "Participant ID is required")
    private Long id;

    private String handle;

    private String displayName;
}
