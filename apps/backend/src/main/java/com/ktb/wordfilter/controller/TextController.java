package com.ktb.wordfilter.controller;

import com.ktb.wordfilter.dto.ResultResponse;
import com.ktb.wordfilter.service.WordFilterService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "텍스트 (Text)", description = "금칙어 검사 및 마스킹 API")
@Slf4j
@RequiredArgsConstructor
@RestController
public class TextController {

    private final WordFilterService wordFilterService;

    @Operation(summary = "금칙어 검증", description = "금칙어가 없으면 result=true 를 반환합니다.")
    @PostMapping("/validate")
    public ResponseEntity<ResultResponse<Boolean>> validate(
            @Parameter(description = "검사할 텍스트") @RequestParam(name = "message", required = false, defaultValue = "") String message) {
        return ResponseEntity.ok(ResultResponse.of(wordFilterService.validate(message)));
    }

    @Operation(summary = "금칙어 포함 여부", description = "금칙어가 하나라도 있으면 result=true 를 반환합니다.")
    @PostMapping("/exists")
    public ResponseEntity<ResultResponse<Boolean>> exists(
            @Parameter(description = "검사할 텍스트") @RequestParam(name = "message", required = false, defaultValue = "") String message) {
        return ResponseEntity.ok(ResultResponse.of(wordFilterService.exists(message)));
    }

    @Operation(summary = "금칙어 마스킹", description = "금칙어를 글자 수만큼 placeholder 로 치환한 텍스트를 반환합니다.")
    @PostMapping("/filter")
    public ResponseEntity<ResultResponse<String>> filter(
            @Parameter(description = "마스킹할 텍스트") @RequestParam(name = "message", required = false, defaultValue = "") String message) {
        return ResponseEntity.ok(ResultResponse.of(wordFilterService.filter(message)));
    }
}
