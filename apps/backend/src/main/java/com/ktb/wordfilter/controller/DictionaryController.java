package com.ktb.wordfilter.controller;

import com.ktb.wordfilter.dictionary.DictionaryLoadException;
import com.ktb.wordfilter.dictionary.DictionaryLoadResult;
import com.ktb.wordfilter.dictionary.SourceWarning;
import com.ktb.wordfilter.dto.DictionaryStatus;
import com.ktb.wordfilter.dto.ReloadResponse;
import com.ktb.wordfilter.dto.StandardResponse;
import com.ktb.wordfilter.service.WordFilterService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "사전 (Dictionary)", description = "금칙어 사전 상태 조회 및 리로드 API")
@Slf4j
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/dictionary")
public class DictionaryController {

    private final WordFilterService wordFilterService;

    @Operation(summary = "사전 상태 조회", description = "현재 적용 중인 사전의 버전, 단어 수, 소스 파일을 조회합니다.")
    @GetMapping
    public ResponseEntity<DictionaryStatus> status() {
        return ResponseEntity.ok()
                .cacheControl(CacheControl.noCache())
                .body(wordFilterService.status());
    }

    @Operation(summary = "사전 리로드", description = "패턴에 맞는 파일로 사전을 다시 빌드하고 즉시 교체합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "리로드 성공",
                    content = @Content(schema = @Schema(implementation = ReloadResponse.class))),
            @ApiResponse(responseCode = "400", description = "패턴 오류 또는 일치하는 파일 없음 (기존 사전 유지)",
                    content = @Content(schema = @Schema(implementation = ReloadResponse.class))),
            @ApiResponse(responseCode = "500", description = "서버 내부 오류",
                    content = @Content(schema = @Schema(implementation = StandardResponse.class)))
    })
    @PostMapping("/reload")
    public ResponseEntity<?> reload(
            @Parameter(description = "사전 파일 패턴 (생략 시 설정값)") @RequestParam(name = "pattern", required = false) String pattern) {
        try {
            DictionaryLoadResult result = wordFilterService.reloadWithReport(pattern);

            List<String> warnings = result.getWarnings().stream()
                    .map(DictionaryController::formatWarning)
                    .toList();

            return ResponseEntity.ok(ReloadResponse.builder()
                    .success(true)
                    .wordCount(result.getSnapshot().getWordCount())
                    .version(result.getSnapshot().getVersion())
                    .warnings(warnings.isEmpty() ? null : warnings)
                    .build());

        } catch (DictionaryLoadException e) {
            return ResponseEntity.status(400).body(ReloadResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("사전 리로드 에러", e);
            return ResponseEntity.status(500)
                    .body(StandardResponse.error("사전 리로드 중 오류가 발생했습니다."));
        }
    }

    private static String formatWarning(SourceWarning warning) {
        return warning.getLineNumber() > 0
                ? warning.getSource() + ":" + warning.getLineNumber() + " " + warning.getReason()
                : warning.getSource() + " " + warning.getReason();
    }
}
