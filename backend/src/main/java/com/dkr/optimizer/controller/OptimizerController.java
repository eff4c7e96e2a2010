package com.dkr.optimizer.controller;

import com.dkr.optimizer.dto.AnalysisRequest;
import com.dkr.optimizer.dto.AnalysisResponse;
import com.dkr.optimizer.model.Opportunity;
import com.dkr.optimizer.service.OptimizerOrchestratorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/api/optimizer")
@CrossOrigin(origins = "*")
public class OptimizerController {

    private static final Logger log = LoggerFactory.getLogger(OptimizerController.class);

    private final OptimizerOrchestratorService orchestrator;

    public OptimizerController(OptimizerOrchestratorService orchestrator) {
        this.orchestrator = orchestrator;
    }

    // Example: POST /api/optimizer/analyze with the standings/leaderboard snapshot as JSON body
    @PostMapping("/analyze")
    public AnalysisResponse analyze(@RequestBody AnalysisRequest request) {
        long start = System.currentTimeMillis();
        String user = request != null ? request.getUsername() : null;
        log.info("[Optimizer][REQ] username={}, standings={}, leaderboards={}", user,
                request != null && request.getStandings() != null ? request.getStandings().size() : 0,
                request != null && request.getLeaderboards() != null ? request.getLeaderboards().size() : 0);
        try {
            AnalysisResponse resp = orchestrator.analyze(request);
            log.info("[Optimizer][OK] username={}, opportunities={}, ms={}", user, resp.getOpportunities().size(),
                    (System.currentTimeMillis() - start));
            return resp;
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        } catch (Exception ex) {
            log.error("[Optimizer][ERR] username={}, msg={}", user, ex.toString());
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Optimizer run failed: " + ex.getMessage(), ex);
        }
    }

    @PostMapping("/opportunities")
    public List<Opportunity> opportunities(@RequestBody AnalysisRequest request) {
        try {
            return orchestrator.opportunities(request);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
    }
}
