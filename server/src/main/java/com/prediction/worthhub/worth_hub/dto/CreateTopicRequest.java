package com.prediction.worthhub.worth_hub.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
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
public class CreateTopicRequest {

    @NotNull
    @PositiveOrZero
    private Long topicId;

    @NotNull
    private String description;

    @NotNull
    private String symbol;

    /** Unix seconds. */
    @NotNull
    private Long commitDeadline;

    /** Unix seconds. */
    @NotNull
    private Long revealDeadline;

    @NotNull
    private Long minStake;

    /** Hex identity allowed to finalize the topic. */
    @NotBlank
    private String truthAuthority;
}
