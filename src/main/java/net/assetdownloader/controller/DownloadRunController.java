package net.assetdownloader.controller;

import jakarta.validation.Valid;
import net.assetdownloader.application.download.DownloadOrchestrator;
import net.assetdownloader.controller.support.ErrorResponseUtils;
import net.assetdownloader.dto.DownloadRunRequest;
import net.assetdownloader.dto.DownloadRunStatusResponse;
import net.assetdownloader.exception.RunAlreadyActiveException;
import net.assetdownloader.exception.RunConfigValidationException;
import net.assetdownloader.service.event.RunEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;

/**
 * Endpoints for starting, cancelling and observing download runs.
 */
@RestController
@RequestMapping("/api/downloads")
public class DownloadRunController {

    private static final Logger log = LoggerFactory.getLogger(DownloadRunController.class);

    private final DownloadOrchestrator orchestrator;
    private final RunEventPublisher eventPublisher;

    public DownloadRunController(DownloadOrchestrator orchestrator, RunEventPublisher eventPublisher) {
        this.orchestrator = orchestrator;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Starts a run in the background.
     *
     * @return 202 when accepted, 400 with every validation problem, 409 when a run is active
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> startRun(@Valid @RequestBody DownloadRunRequest request) {
        try {
            orchestrator.startRun(request.config(), request.rows());
        } catch (RunAlreadyActiveException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        } catch (RunConfigValidationException e) {
            log.info("Rejected download run: {}", e.getErrors());
            return ErrorResponseUtils.badRequest("Invalid download configuration", e.getErrors());
        }
        log.info("Download run accepted for {} row(s).", request.rows().size());
        return ResponseEntity.accepted().body(Map.of("message", "Download run started"));
    }

    /**
     * Cancels the active run, if any. Always returns immediately.
     */
    @PostMapping(value = "/cancel", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> cancelRun() {
        boolean cancelled = orchestrator.cancelRun();
        return ResponseEntity.ok(Map.of("cancelled", cancelled));
    }

    @GetMapping(value = "/status", produces = MediaType.APPLICATION_JSON_VALUE)
    public DownloadRunStatusResponse status() {
        return new DownloadRunStatusResponse(
            orchestrator.state(),
            orchestrator.isRunning(),
            orchestrator.currentProgress(),
            orchestrator.lastCompletion(),
            orchestrator.lastError());
    }

    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events() {
        return eventPublisher.subscribe();
    }
}
