package com.example.support.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ChoicePayload {

    private long messageId;

    @NotBlank
    private String payload;
}
