package com.flowlayout.flowlayout_backend.stage;

import com.flowlayout.flowlayout_backend.config.LayoutSettings;
import com.flowlayout.flowlayout_backend.model.domain.DiagramEdge;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pushes targets to the right of their sources: for every edge with
 * stage(source) >= stage(target), target becomes source + step.
 *
 * Bounded by the pass cap, so a cycle ends with stages that are still not
 * monotonic. The caller gets that back as a non-converged outcome.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StagePropagator {

    private final LayoutSettings settings;

    /**
     * @param stages     node id to stage, updated in place
     * @param utilityIds sources whose outgoing edges are exempt
     */
    public PropagationOutcome propagate(Map<String, Double> stages, List<DiagramEdge> edges, Set<String> utilityIds) {
        int maxPasses = settings.getPropagationMaxPasses();
        double step = settings.getPropagationStep();

        for (int pass = 1; pass <= maxPasses; pass++) {
            boolean changed = false;
            for (DiagramEdge edge : edges) {
                if (utilityIds.contains(edge.getSource())) continue;
                Double source = stages.get(edge.getSource());
                Double target = stages.get(edge.getTarget());
                if (source == null || target == null) continue;
                if (source >= target) {
                    stages.put(edge.getTarget(), source + step);
                    changed = true;
                }
            }
            if (!changed) {
                log.debug("[Propagator] Converged after {} pass(es)", pass);
                return new PropagationOutcome(pass, true);
            }
        }
        log.warn("[Propagator] Stage order still changing after {} passes, keeping best effort", maxPasses);
        return new PropagationOutcome(maxPasses, false);
    }
}
