package com.prediction.worthhub.worth_hub.dto;

import java.util.List;

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
public class SettleRequest {

    /** Hex identities of every participant of the topic. */
    @NotNull
    private List<String> participants;
}
