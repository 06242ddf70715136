package com.project.scratch.analysis.store;

import com.project.scratch.analysis.DTOs.AnalysisResult;
import com.project.scratch.analysis.DTOs.Region;
import com.project.scratch.analysis.exceptions.ExperimentNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

/**
 * Experiment state kept in memory. Each experiment's state is an immutable snapshot swapped
 * with {@link ConcurrentMap#computeIfPresent}, so every update is atomic per experiment.
 */
@Repository
public class InMemoryExperimentStore implements ExperimentStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryExperimentStore.class);

    private record ExperimentState(Region region, List<AnalysisResult> results) {
        ExperimentState withResults(List<AnalysisResult> rs) {
            return new ExperimentState(region, List.copyOf(rs));
        }
    }

    private final ConcurrentMap<UUID, ExperimentState> experiments = new ConcurrentHashMap<>();

    @Override
    public UUID create() {
        UUID id = UUID.randomUUID();
        experiments.put(id, new ExperimentState(null, List.of()));
        log.info("Registered experiment {}", id);
        return id;
    }

    @Override
    public boolean exists(UUID experimentId) {
        return experiments.containsKey(experimentId);
    }

    @Override
    public Optional<Region> getRegion(UUID experimentId) {
        return Optional.ofNullable(state(experimentId).region());
    }

    @Override
    public List<AnalysisResult> getResultSet(UUID experimentId) {
        return state(experimentId).results();
    }

    @Override
    public void replaceResultSet(UUID experimentId, List<AnalysisResult> results) {
        update(experimentId, s -> s.withResults(results));
    }

    @Override
    public void replaceRegionAndResults(UUID experimentId, Region region, List<AnalysisResult> results) {
        update(experimentId, s -> new ExperimentState(region, List.copyOf(results)));
    }

    @Override
    public void upsertResult(UUID experimentId, AnalysisResult result) {
        update(experimentId, s -> {
            List<AnalysisResult> next = new ArrayList<>(s.results());
            boolean replaced = false;
            for (int i = 0; i < next.size(); i++) {
                if (next.get(i).imageId().equals(result.imageId())) {
                    next.set(i, result);
                    replaced = true;
                    break;
                }
            }
            if (!replaced) {
                next.add(result);
            }
            return s.withResults(next);
        });
    }

    @Override
    public boolean removeResult(UUID experimentId, UUID imageId) {
        boolean[] removed = new boolean[1];
        update(experimentId, s -> {
            List<AnalysisResult> next = new ArrayList<>(s.results());
            removed[0] = next.removeIf(r -> r.imageId().equals(imageId));
            return removed[0] ? s.withResults(next) : s;
        });
        return removed[0];
    }

    private ExperimentState state(UUID experimentId) {
        ExperimentState s = experiments.get(experimentId);
        if (s == null) {
            throw new ExperimentNotFoundException(experimentId);
        }
        return s;
    }

    private void update(UUID experimentId, UnaryOperator<ExperimentState> change) {
        if (experiments.computeIfPresent(experimentId, (id, s) -> change.apply(s)) == null) {
            throw new ExperimentNotFoundException(experimentId);
        }
    }
}
