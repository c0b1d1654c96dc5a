package com.streamchat.room.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.streamchat.exception.ChatErrorCode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponseDTO {

    private ChatErrorCode code;
    private String message;
    private Long retryAfterSeconds;
}
