package com.flowlayout.flowlayout_backend.engine;

import com.flowlayout.flowlayout_backend.model.domain.LayoutMode;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps each {@link LayoutMode} to the strategy bean that lays it out. A mode
 * may have at most one strategy; a mode with none is left for the engine to
 * route elsewhere.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LayoutStrategyRegistry {

    private final List<LayoutStrategy> strategies;
    private final Map<LayoutMode, LayoutStrategy> byMode = new EnumMap<>(LayoutMode.class);

    @PostConstruct
    public void init() {
        byMode.clear();
        for (LayoutStrategy strategy : strategies) {
            LayoutStrategy previous = byMode.putIfAbsent(strategy.supportedMode(), strategy);
            if (previous != null) {
                throw new IllegalStateException("Layout mode " + strategy.supportedMode()
                        + " claimed by both " + previous.getClass().getSimpleName()
                        + " and " + strategy.getClass().getSimpleName());
            }
        }
        log.info("[Layout] Strategies registered for modes {}", byMode.keySet());
    }

    public LayoutStrategy get(LayoutMode mode) {
        LayoutStrategy strategy = byMode.get(mode);
        if (strategy == null) {
            throw new UnsupportedOperationException("No layout strategy registered for mode: " + mode);
        }
        return strategy;
    }

    public boolean isSupported(LayoutMode mode) {
        return byMode.containsKey(mode);
    }

    public Set<LayoutMode> modes() {
        return Collections.unmodifiableSet(byMode.keySet());
    }
}
