package com.dfsoptimizer.mapper;

import com.dfsoptimizer.api.dto.request.ConstraintsRequest;
import com.dfsoptimizer.api.dto.request.CorrelationRequest;
import com.dfsoptimizer.api.dto.request.ExposureTargetRequest;
import com.dfsoptimizer.api.dto.request.LineupRequest;
import com.dfsoptimizer.api.dto.request.OptimizeRequest;
import com.dfsoptimizer.api.dto.request.PipelineRequest;
import com.dfsoptimizer.api.dto.request.PlayerRequest;
import com.dfsoptimizer.api.dto.request.SimulationOptionsRequest;
import com.dfsoptimizer.api.dto.request.ThresholdsRequest;
import com.dfsoptimizer.config.OptimizerConfig;
import com.dfsoptimizer.config.SimulationConfig;
import com.dfsoptimizer.constraint.ConstraintSet;
import com.dfsoptimizer.constraint.LineupConstraints;
import com.dfsoptimizer.constraint.RosterPreset;
import com.dfsoptimizer.domain.model.CorrelationEntry;
import com.dfsoptimizer.domain.model.Lineup;
import com.dfsoptimizer.domain.model.Player;
import com.dfsoptimizer.domain.model.RosterSlot;
import com.dfsoptimizer.domain.model.RosterSlotSpec;
import com.dfsoptimizer.domain.model.SlotAssignment;
import com.dfsoptimizer.exception.ValidationException;
import com.dfsoptimizer.optimizer.OptimizerSettings;
import com.dfsoptimizer.pipeline.PipelineInput;
import com.dfsoptimizer.pool.PlayerPool;
import com.dfsoptimizer.portfolio.ExposureTarget;
import com.dfsoptimizer.portfolio.PortfolioThresholds;
import com.dfsoptimizer.simulation.SimulationSettings;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.mapstruct.factory.Mappers;
import org.springframework.stereotype.Component;

/**
 * Turns API requests into engine inputs, filling unset options from {@link OptimizerConfig} and
 * {@link SimulationConfig}. The engine never reads configuration itself.
 */
@Component
public class RequestAssembler {

    private final PlayerMapper playerMapper = Mappers.getMapper(PlayerMapper.class);
    private final CorrelationMapper correlationMapper = Mappers.getMapper(CorrelationMapper.class);
    private final ConstraintMapper constraintMapper = Mappers.getMapper(ConstraintMapper.class);

    private final OptimizerConfig optimizerConfig;
    private final SimulationConfig simulationConfig;

    public RequestAssembler(OptimizerConfig optimizerConfig, SimulationConfig simulationConfig) {
        this.optimizerConfig = optimizerConfig;
        this.simulationConfig = simulationConfig;
    }

    public PlayerPool pool(List<PlayerRequest> players) {
        return PlayerPool.load(playerMapper.toDomainList(players));
    }

    public ConstraintSet constraints(PlayerPool pool, ConstraintsRequest request) {
        RosterPreset preset = RosterPreset.fromName(request.getPreset());
        LineupConstraints constraints = LineupConstraints.builder()
                .salaryCap(preset.resolveSalaryCap(request.getSalaryCap()))
                .minSalary(request.getMinSalary())
                .maxPlayersPerTeam(request.getMaxPlayersPerTeam())
                .minGames(request.getMinGames())
                .minUniquePlayers(request.getMinUniquePlayers() != null
                        ? request.getMinUniquePlayers()
                        : optimizerConfig.getDefaultMinUniquePlayers())
                .lockedPlayerIds(request.getLockedPlayerIds() != null ? request.getLockedPlayerIds() : Set.of())
                .bannedPlayerIds(request.getBannedPlayerIds() != null ? request.getBannedPlayerIds() : Set.of())
                .stackRules(request.getStackRules() != null
                        ? constraintMapper.toStackRules(request.getStackRules())
                        : List.of())
                .build();
        return ConstraintSet.of(pool, preset.slotSpec(), constraints);
    }

    public OptimizerSettings optimizerSettings(OptimizeRequest request) {
        int lineupCount = request.getLineupCount() != null
                ? request.getLineupCount()
                : optimizerConfig.getDefaultLineupCount();
        if (lineupCount > optimizerConfig.getMaxLineupsPerRequest()) {
            throw new ValidationException("At most " + optimizerConfig.getMaxLineupsPerRequest()
                    + " lineups per request, asked for " + lineupCount);
        }
        return OptimizerSettings.builder()
                .lineupCount(lineupCount)
                .objective(request.getObjective() != null ? request.getObjective() : optimizerConfig.getDefaultObjective())
                .evOwnershipWeight(optimizerConfig.getEvOwnershipWeight())
                .jitterPercent(request.getJitterPercent() != null
                        ? request.getJitterPercent()
                        : optimizerConfig.getDefaultJitterPercent())
                .seed(request.getSeed() != null ? request.getSeed() : optimizerConfig.getDefaultSeed())
                .perLineupTimeoutMs(optimizerConfig.getPerLineupTimeoutMs())
                .solverBackend(optimizerConfig.getSolverBackend())
                .build();
    }

    public SimulationSettings simulationSettings(SimulationOptionsRequest request) {
        SimulationOptionsRequest options = request != null ? request : new SimulationOptionsRequest();
        return SimulationSettings.builder()
                .trials(options.getTrials() != null ? options.getTrials() : simulationConfig.getDefaultTrials())
                .seed(options.getSeed() != null ? options.getSeed() : simulationConfig.getDefaultSeed())
                .distributionMode(options.getDistributionMode() != null
                        ? options.getDistributionMode()
                        : simulationConfig.getDefaultDistributionMode())
                .targetScore(options.getTargetScore())
                .fieldSize(options.getFieldSize() != null ? options.getFieldSize() : simulationConfig.getDefaultFieldSize())
                .entryFee(options.getEntryFee() != null ? options.getEntryFee() : simulationConfig.getDefaultEntryFee())
                .contestType(options.getContestType() != null
                        ? options.getContestType()
                        : simulationConfig.getDefaultContestType())
                .fieldPlayerLimit(simulationConfig.getFieldPlayerLimit())
                .chunkSize(simulationConfig.getChunkSize())
                .maxTrials(simulationConfig.getMaxTrials())
                .chunkTimeoutMs(simulationConfig.getChunkTimeoutMs())
                .histogramBinWidth(simulationConfig.getHistogramBinWidth())
                .maxHistogramBytes(simulationConfig.getMaxHistogramBytes())
                .build();
    }

    public List<CorrelationEntry> correlations(List<CorrelationRequest> requests) {
        return requests != null ? correlationMapper.toDomainList(requests) : List.of();
    }

    public List<ExposureTarget> exposureTargets(List<ExposureTargetRequest> requests) {
        return requests != null ? constraintMapper.toExposureTargets(requests) : List.of();
    }

    public PortfolioThresholds thresholds(ThresholdsRequest request) {
        if (request == null) {
            return PortfolioThresholds.none();
        }
        return PortfolioThresholds.builder()
                .maxDuplicateRisk(request.getMaxDuplicateRisk())
                .minLeverage(request.getMinLeverage())
                .minRoi(request.getMinRoi())
                .maxTotalOwnership(request.getMaxTotalOwnership())
                .minWinProbability(request.getMinWinProbability())
                .build();
    }

    public PipelineInput pipelineInput(PipelineRequest request) {
        OptimizeRequest optimize = request.getOptimize();
        PlayerPool pool = pool(optimize.getPlayers());
        return PipelineInput.builder()
                .constraints(constraints(pool, optimize.getConstraints()))
                .correlations(correlations(request.getCorrelations()))
                .correlationStrength(request.getCorrelationStrength())
                .optimizerSettings(optimizerSettings(optimize))
                .simulationSettings(simulationSettings(request.getSimulation()))
                .exposureTargets(exposureTargets(request.getExposureTargets()))
                .thresholds(thresholds(request.getThresholds()))
                .build();
    }

    /**
     * Seats caller-built lineups in the preset's slot order. Each player must be in the pool,
     * eligible for its slot, and appear once.
     */
    public List<Lineup> lineups(PlayerPool pool, String presetName, List<LineupRequest> requests) {
        RosterSlotSpec slotSpec = RosterPreset.fromName(presetName).slotSpec();
        List<Lineup> lineups = new ArrayList<>(requests.size());
        Set<String> lineupIds = new HashSet<>();
        for (int index = 0; index < requests.size(); index++) {
            LineupRequest request = requests.get(index);
            if (!lineupIds.add(request.getLineupId())) {
                throw new ValidationException("Duplicate lineup id " + request.getLineupId());
            }
            lineups.add(seat(pool, slotSpec, request, index));
        }
        return lineups;
    }

    private static Lineup seat(PlayerPool pool, RosterSlotSpec slotSpec, LineupRequest request, int index) {
        List<String> ids = request.getPlayerIds();
        if (ids.size() != slotSpec.getRosterSize()) {
            throw new ValidationException("Lineup " + request.getLineupId() + " has " + ids.size()
                    + " players, roster needs " + slotSpec.getRosterSize());
        }
        List<SlotAssignment> assignments = new ArrayList<>(ids.size());
        Set<String> seen = new HashSet<>();
        int salary = 0;
        double projection = 0.0;
        for (int s = 0; s < ids.size(); s++) {
            String id = ids.get(s);
            if (!pool.contains(id)) {
                throw new ValidationException("Lineup " + request.getLineupId() + " references unknown player " + id);
            }
            if (!seen.add(id)) {
                throw new ValidationException("Lineup " + request.getLineupId() + " lists " + id + " twice");
            }
            Player player = pool.getById(id);
            RosterSlot slot = slotSpec.getSlot(s);
            if (!slot.accepts(player)) {
                throw new ValidationException("Lineup " + request.getLineupId() + ": " + player.getName()
                        + " cannot fill " + slot.getName());
            }
            assignments.add(SlotAssignment.builder()
                    .slotIndex(s)
                    .slotName(slot.getName())
                    .player(player)
                    .build());
            salary += player.getSalary();
            projection += player.getEffectiveProjection();
        }
        return Lineup.builder()
                .lineupId(request.getLineupId())
                .generationIndex(index)
                .assignments(List.copyOf(assignments))
                .totalSalary(salary)
                .totalProjection(projection)
                .objectiveValue(projection)
                .build();
    }
}
