package com.prediction.worthhub.worth_hub.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FinalizeRequest {

    /** Fixed-point, scale 1e6. */
    @NotNull
    private Long truthValue;
}
