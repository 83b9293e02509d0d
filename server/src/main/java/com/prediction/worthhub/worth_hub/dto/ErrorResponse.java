package com.prediction.worthhub.worth_hub.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@AllArgsConstructor
public class ErrorResponse {

    private final String error;
    private final String category;
    private final String message;
}
