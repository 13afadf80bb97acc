package com.flowlayout.flowlayout_backend.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class LayoutConfig {

    @Value("${layout.node-width:150}")
    private double nodeWidth;

    @Value("${layout.node-height:130}")
    private double nodeHeight;

    @Value("${layout.column-gap:200}")
    private double columnGap;

    @Value("${layout.row-gap:60}")
    private double rowGap;

    @Value("${layout.lane-height:190}")
    private double laneHeight;

    @Value("${layout.section-width:230}")
    private double sectionWidth;

    @Value("${layout.badge-size:36}")
    private double badgeSize;

    @Value("${layout.propagation-max-passes:10}")
    private int propagationMaxPasses;

    @Bean
    public LayoutSettings layoutSettings() {
        // A lane band must fit a node, and a section column must fit a node
        double lane = Math.max(laneHeight, nodeHeight);
        double section = Math.max(sectionWidth, nodeWidth);
        int passes = Math.max(1, propagationMaxPasses);

        LayoutSettings settings = LayoutSettings.builder()
                .nodeWidth(nodeWidth)
                .nodeHeight(nodeHeight)
                .columnGap(columnGap)
                .rowGap(rowGap)
                .laneHeight(lane)
                .sectionWidth(section)
                .badgeSize(badgeSize)
                .propagationMaxPasses(passes)
                .build();
        log.info("Layout settings: node {}x{}, column gap {}, lane height {}, section width {}, max passes {}",
                nodeWidth, nodeHeight, columnGap, lane, section, passes);
        return settings;
    }
}
