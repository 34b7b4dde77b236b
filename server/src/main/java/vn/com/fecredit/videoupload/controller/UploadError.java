package vn.com.fecredit.videoupload.controller;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * JSON body of every REST error response.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadError {
    private String code;
    private String message;
    private Object details;

    @Builder.Default
    private LocalDateTime timestamp = LocalDateTime.now();
}
