package com.prediction.worthhub.worth_hub.dto;

import jakarta.validation.constraints.NotBlank;
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
public class CommitRequest {

    /** keccak256(prediction ‖ salt ‖ participant), hex. */
    @NotBlank
    private String commitmentHash;

    @NotNull
    private Long stake;
}
