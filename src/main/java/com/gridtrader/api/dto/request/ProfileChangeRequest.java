package com.gridtrader.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for switching the active grid profile. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileChangeRequest {

    /** Profile name as configured under gridbot.grid.profiles, e.g. "Aggressive". */
    @NotBlank
    private String profile;
}
