package com.ktb.wordfilter.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReloadResponse {
    private boolean success;
    private String message;
    private Integer wordCount;
    private Long version;
    private List<String> warnings;

    public static ReloadResponse error(String message) {
        return ReloadResponse.builder()
                .success(false)
                .message(message)
                .build();
    }
}
