package me.golemcore.steward.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.steward.adapter.inbound.web.dto.ClockInRequest;
import me.golemcore.steward.adapter.inbound.web.dto.ClockOutRequest;
import me.golemcore.steward.adapter.inbound.web.dto.ContextUpdateRequest;
import me.golemcore.steward.domain.model.ClockInResult;
import me.golemcore.steward.domain.model.ClockOutResult;
import me.golemcore.steward.domain.model.ContextUpdateCommand;
import me.golemcore.steward.domain.model.ContextUpdateResult;
import me.golemcore.steward.domain.model.InboxStatus;
import me.golemcore.steward.domain.service.AuditInbox;
import me.golemcore.steward.domain.service.ContextMergeEngine;
import me.golemcore.steward.domain.service.ProjectLayoutService;
import me.golemcore.steward.domain.service.SessionManager;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;

/**
 * Session lifecycle and context update endpoints. The domain works with
 * blocking file I/O, so each call runs on the bounded elastic scheduler.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class StewardController {

    private final SessionManager sessionManager;
    private final ContextMergeEngine contextMergeEngine;
    private final AuditInbox auditInbox;
    private final ProjectLayoutService layoutService;

    @PostMapping("/sessions/clock-in")
    public Mono<ResponseEntity<ClockInResult>> clockIn(@RequestBody ClockInRequest request) {
        return Mono.fromCallable(() -> sessionManager.clockIn(
                request.getRole(),
                request.getFocus(),
                request.getWorkingDir(),
                request.getModel(),
                request.getTranscriptPath()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @PostMapping("/sessions/{sessionId}/clock-out")
    public Mono<ResponseEntity<ClockOutResult>> clockOut(@PathVariable String sessionId,
            @RequestBody ClockOutRequest request) {
        return Mono.fromCallable(() -> sessionManager.clockOut(sessionId, request.getWorkingDir(),
                request.getDescription()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @PostMapping("/context/update")
    public Mono<ResponseEntity<ContextUpdateResult>> updateContext(@RequestBody ContextUpdateRequest request) {
        ContextUpdateCommand command = ContextUpdateCommand.builder()
                .target(request.getTarget())
                .intent(request.getIntent())
                .content(request.getContent())
                .workingDir(request.getWorkingDir())
                .sessionId(request.getSessionId())
                .delegated(request.isDelegated())
                .acknowledgeConflicts(request.isAcknowledgeConflicts())
                .signals(request.getSignals() != null ? new LinkedHashMap<>(request.getSignals())
                        : new LinkedHashMap<>())
                .build();
        return Mono.fromCallable(() -> contextMergeEngine.update(command))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @GetMapping("/inbox/status")
    public Mono<ResponseEntity<InboxStatus>> inboxStatus(@RequestParam String workingDir) {
        return Mono.fromCallable(() -> auditInbox.status(layoutService.resolve(workingDir)))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }
}
