package org.nowstart.stratagem.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.nowstart.stratagem.data.dto.ConfirmationRequest;
import org.nowstart.stratagem.data.dto.PipelineSessionResponse;
import org.nowstart.stratagem.data.dto.StartPipelineRequest;
import org.nowstart.stratagem.service.PipelineSessionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/pipeline")
@Tag(name = "Pipeline", description = "전략 문장 번역, 사람 확인, 백테스트 실행 세션 API")
public class PipelineController {

    private final PipelineSessionService pipelineSessionService;

    public PipelineController(PipelineSessionService pipelineSessionService) {
        this.pipelineSessionService = pipelineSessionService;
    }

    @PostMapping("/sessions")
    @Operation(summary = "세션 시작", description = "전략 설명을 번역하고 해석 결과를 만든 뒤 사람 확인 단계에서 멈춥니다. autoConfirm이면 끝까지 실행합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "세션 생성"),
            @ApiResponse(responseCode = "400", description = "요청 검증 실패"),
            @ApiResponse(responseCode = "409", description = "이미 존재하거나 실행 중인 세션")
    })
    public ResponseEntity<PipelineSessionResponse> start(@RequestBody @Valid StartPipelineRequest request) {
        PipelineSessionResponse session = pipelineSessionService.start(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(session);
    }

    @GetMapping("/sessions/{sessionId}")
    @Operation(summary = "세션 조회", description = "마지막 체크포인트 기준 세션 상태를 조회합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "404", description = "세션 없음")
    })
    public PipelineSessionResponse getSession(@PathVariable String sessionId) {
        return pipelineSessionService.getSession(sessionId);
    }

    @PostMapping("/sessions/{sessionId}/confirmation")
    @Operation(summary = "해석 확인", description = "확인하면 검증과 백테스트를 이어서 실행하고, 수정 문장과 함께 거절하면 다시 번역합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "재개 성공"),
            @ApiResponse(responseCode = "404", description = "세션 없음"),
            @ApiResponse(responseCode = "409", description = "확인 대기 상태가 아니거나 실행 중")
    })
    public PipelineSessionResponse confirm(
            @PathVariable String sessionId,
            @RequestBody @Valid ConfirmationRequest request
    ) {
        return pipelineSessionService.confirm(sessionId, request);
    }

    @PostMapping("/sessions/{sessionId}/recover")
    @Operation(summary = "중단 세션 복구", description = "실행 중 멈춘 세션을 마지막 완료 노드부터 다시 실행합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "복구 성공"),
            @ApiResponse(responseCode = "404", description = "세션 없음"),
            @ApiResponse(responseCode = "409", description = "실행 중 상태가 아님")
    })
    public PipelineSessionResponse recover(@PathVariable String sessionId) {
        return pipelineSessionService.recover(sessionId);
    }

    @PostMapping("/sessions/{sessionId}/cancel")
    @Operation(summary = "세션 취소", description = "다음 노드 경계에서 세션을 실패 상태로 종료합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "취소 요청 성공"),
            @ApiResponse(responseCode = "404", description = "세션 없음"),
            @ApiResponse(responseCode = "409", description = "이미 종료된 세션")
    })
    public PipelineSessionResponse cancel(@PathVariable String sessionId) {
        return pipelineSessionService.cancel(sessionId);
    }

    @DeleteMapping("/sessions/{sessionId}")
    @Operation(summary = "세션 삭제", description = "세션 체크포인트를 삭제합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "삭제 성공"),
            @ApiResponse(responseCode = "404", description = "세션 없음")
    })
    public ResponseEntity<Void> delete(@PathVariable String sessionId) {
        pipelineSessionService.delete(sessionId);
        return ResponseEntity.noContent().build();
    }
}
