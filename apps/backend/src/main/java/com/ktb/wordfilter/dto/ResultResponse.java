package com.ktb.wordfilter.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * /validate, /exists, /filter 공통 응답 {"result": ...}
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResultResponse<T> {
    private T result;

    public static <T> ResultResponse<T> of(T result) {
        return new ResultResponse<>(result);
    }
}
