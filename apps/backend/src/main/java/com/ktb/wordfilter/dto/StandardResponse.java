package com.ktb.wordfilter.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StandardResponse {
    private boolean success;
    private String message;

    public static StandardResponse error(String message) {
        return new StandardResponse(false, message);
    }
}
