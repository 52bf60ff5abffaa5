package com.fightsight.analysis.controller;

import com.fightsight.analysis.dto.CombinationDTO;
import com.fightsight.analysis.dto.CreateSessionRequest;
import com.fightsight.analysis.dto.ReportDTO;
import com.fightsight.analysis.dto.RunSessionRequest;
import com.fightsight.analysis.dto.SessionStatusDTO;
import com.fightsight.analysis.model.StrikeEvent;
import com.fightsight.analysis.service.AnalysisSessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/analysis")
public class AnalysisController {

    private static final Logger log = LoggerFactory.getLogger(AnalysisController.class);

    private final AnalysisSessionService sessionService;

    public AnalysisController(AnalysisSessionService sessionService) {
        this.sessionService = sessionService;
    }

    @PostMapping("/sessions")
    public Mono<ResponseEntity<SessionStatusDTO>> create(@RequestBody CreateSessionRequest request) {
        log.info("Session intake received. videoId={}", request.videoId());
        return sessionService.createSession(request)
            .map(dto -> ResponseEntity.status(HttpStatus.CREATED).body(dto));
    }

    @PostMapping("/sessions/{id}/run")
    public Mono<ResponseEntity<Void>> run(@PathVariable Long id,
                                          @RequestBody(required = false) RunSessionRequest request) {
        String framesLocation = request == null ? null : request.framesLocation();
        log.info("Run requested. sessionId={} framesLocationOverride={}", id, framesLocation);
        return sessionService.requestRun(id, framesLocation)
            .map(accepted -> accepted
                ? ResponseEntity.accepted().<Void>build()
                : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).<Void>build());
    }

    @GetMapping("/sessions/{id}")
    public Mono<ResponseEntity<SessionStatusDTO>> session(@PathVariable Long id) {
        return sessionService.getSession(id)
            .map(ResponseEntity::ok);
    }

    @DeleteMapping("/sessions/{id}")
    public Mono<ResponseEntity<Void>> delete(@PathVariable Long id) {
        log.info("Session delete requested. sessionId={}", id);
        return sessionService.deleteSession(id)
            .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    @GetMapping("/sessions/{id}/strikes")
    public Flux<StrikeEvent> strikes(@PathVariable Long id) {
        return sessionService.getStrikes(id);
    }

    @GetMapping("/sessions/{id}/combinations")
    public Flux<CombinationDTO> combinations(@PathVariable Long id) {
        return sessionService.getCombinations(id);
    }

    @GetMapping("/sessions/{id}/report")
    public Mono<ResponseEntity<ReportDTO>> report(@PathVariable Long id) {
        return sessionService.getReport(id)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }
}
