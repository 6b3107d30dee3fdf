package com.dfsoptimizer.api.controller;

import com.dfsoptimizer.api.dto.request.OptimizeRequest;
import com.dfsoptimizer.api.dto.request.PipelineRequest;
import com.dfsoptimizer.api.dto.request.SimulateRequest;
import com.dfsoptimizer.api.dto.response.LineupResponse;
import com.dfsoptimizer.api.dto.response.OptimizeResponse;
import com.dfsoptimizer.api.dto.response.PipelineResponse;
import com.dfsoptimizer.api.dto.response.PresetResponse;
import com.dfsoptimizer.constraint.ConstraintSet;
import com.dfsoptimizer.constraint.RosterPreset;
import com.dfsoptimizer.domain.model.Lineup;
import com.dfsoptimizer.mapper.LineupMapper;
import com.dfsoptimizer.mapper.RequestAssembler;
import com.dfsoptimizer.optimizer.LineupOptimizer;
import com.dfsoptimizer.optimizer.OptimizationResult;
import com.dfsoptimizer.pipeline.LineupPipelineService;
import com.dfsoptimizer.pipeline.PipelineReport;
import com.dfsoptimizer.pool.PlayerPool;
import com.dfsoptimizer.portfolio.PortfolioFilterResult;
import com.dfsoptimizer.portfolio.StackAuditor;
import com.dfsoptimizer.simulation.SimulationReport;
import jakarta.validation.Valid;
import java.util.Arrays;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for lineup generation and simulation.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/lineups/optimize -- generate a batch of distinct lineups</li>
 *   <li>POST /api/lineups/simulate -- Monte Carlo simulation of caller-built lineups</li>
 *   <li>POST /api/lineups/pipeline -- optimize, simulate and filter in one call</li>
 *   <li>GET /api/lineups/presets -- supported site/sport roster layouts</li>
 * </ul>
 *
 * <p>Infeasible constraint sets answer 422 with the constraint class in {@code details.cause};
 * a batch that stops early still answers 200 with requested vs delivered counts.
 */
@RestController
@RequestMapping("/api/lineups")
public class LineupController {

    private static final Logger log = LoggerFactory.getLogger(LineupController.class);

    private final LineupMapper lineupMapper = Mappers.getMapper(LineupMapper.class);

    private final LineupOptimizer lineupOptimizer;
    private final LineupPipelineService lineupPipelineService;
    private final StackAuditor stackAuditor;
    private final RequestAssembler requestAssembler;

    public LineupController(
            LineupOptimizer lineupOptimizer,
            LineupPipelineService lineupPipelineService,
            StackAuditor stackAuditor,
            RequestAssembler requestAssembler) {
        this.lineupOptimizer = lineupOptimizer;
        this.lineupPipelineService = lineupPipelineService;
        this.stackAuditor = stackAuditor;
        this.requestAssembler = requestAssembler;
    }

    @PostMapping("/optimize")
    public ResponseEntity<OptimizeResponse> optimize(@Valid @RequestBody OptimizeRequest request) {
        log.info("Optimize requested: {} player(s), preset {}", request.getPlayers().size(),
                request.getConstraints().getPreset());
        PlayerPool pool = requestAssembler.pool(request.getPlayers());
        ConstraintSet constraints = requestAssembler.constraints(pool, request.getConstraints());
        OptimizationResult result = lineupOptimizer.optimize(constraints, requestAssembler.optimizerSettings(request));
        return ResponseEntity.ok(toOptimizeResponse(result));
    }

    @PostMapping("/simulate")
    public ResponseEntity<SimulationReport> simulate(@Valid @RequestBody SimulateRequest request) {
        log.info("Simulate requested: {} lineup(s)", request.getLineups().size());
        PlayerPool pool = requestAssembler.pool(request.getPlayers());
        List<Lineup> lineups = requestAssembler.lineups(pool, request.getPreset(), request.getLineups());
        SimulationReport report = lineupPipelineService.simulate(
                lineups,
                pool,
                requestAssembler.correlations(request.getCorrelations()),
                request.getCorrelationStrength(),
                requestAssembler.simulationSettings(request.getSimulation()));
        return ResponseEntity.ok(report);
    }

    @PostMapping("/pipeline")
    public ResponseEntity<PipelineResponse> pipeline(@Valid @RequestBody PipelineRequest request) {
        PipelineReport report = lineupPipelineService.run(requestAssembler.pipelineInput(request));
        PortfolioFilterResult portfolio = report.getPortfolio();
        PipelineResponse response = PipelineResponse.builder()
                .optimization(toOptimizeResponse(report.getOptimization()))
                .simulation(report.getSimulation())
                .kept(portfolio != null ? toLineupResponses(portfolio.getKept()) : null)
                .excluded(portfolio != null ? portfolio.getExcluded() : null)
                .exposureReport(portfolio != null ? portfolio.getExposureReport() : null)
                .exposureCompliant(portfolio != null ? portfolio.isExposureCompliant() : null)
                .correlationCorrected(report.isCorrelationCorrected())
                .correlationMaxAdjustment(report.getCorrelationMaxAdjustment())
                .elapsedMs(report.getElapsedMs())
                .build();
        return ResponseEntity.ok(response);
    }

    @GetMapping("/presets")
    public ResponseEntity<List<PresetResponse>> presets() {
        List<PresetResponse> presets = Arrays.stream(RosterPreset.values())
                .map(preset -> PresetResponse.builder()
                        .name(preset.name())
                        .site(preset.getSite())
                        .sport(preset.getSport())
                        .salaryCap(preset.getDefaultSalaryCap())
                        .slots(preset.getSlots().stream()
                                .map(slot -> PresetResponse.Slot.builder()
                                        .name(slot.getName())
                                        .eligiblePositions(slot.getEligiblePositions().stream().sorted().toList())
                                        .flex(slot.isFlex())
                                        .build())
                                .toList())
                        .build())
                .toList();
        return ResponseEntity.ok(presets);
    }

    private OptimizeResponse toOptimizeResponse(OptimizationResult result) {
        return OptimizeResponse.builder()
                .batchId(result.getBatchId())
                .status(result.getStatus())
                .requested(result.getRequested())
                .delivered(result.getDelivered())
                .stopReason(result.getStopReason())
                .stopCause(result.getStopCause())
                .message(result.getMessage())
                .elapsedMs(result.getElapsedMs())
                .lineups(toLineupResponses(result.getLineups()))
                .stackAudit(stackAuditor.audit(result.getLineups()))
                .build();
    }

    private List<LineupResponse> toLineupResponses(List<Lineup> lineups) {
        List<LineupResponse> responses = lineupMapper.toResponseList(lineups);
        for (int i = 0; i < lineups.size(); i++) {
            responses.get(i).setStackType(stackAuditor.classify(lineups.get(i)));
        }
        return responses;
    }
}
