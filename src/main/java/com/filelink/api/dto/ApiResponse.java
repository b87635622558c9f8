package com.filelink.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.http.HttpStatus;

/**
 * Envelope of every JSON answer. {@code status} is the outcome name ({@code OK} or a
 * denial reason), {@code message} a human readable text.
 */
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ApiResponse {

    private Integer statusCode;
    private String status;
    private String message;
    private Object data;

    public static ApiResponse ok(String message, Object data) {
        return ApiResponse.builder()
                .statusCode(HttpStatus.OK.value())
                .status("OK")
                .message(message)
                .data(data)
                .build();
    }

    public static ApiResponse accepted(String message, Object data) {
        return ApiResponse.builder()
                .statusCode(HttpStatus.ACCEPTED.value())
                .status("ACCEPTED")
                .message(message)
                .data(data)
                .build();
    }

    public static ApiResponse created(String message, Object data) {
        return ApiResponse.builder()
                .statusCode(HttpStatus.CREATED.value())
                .status("CREATED")
                .message(message)
                .data(data)
                .build();
    }
}
