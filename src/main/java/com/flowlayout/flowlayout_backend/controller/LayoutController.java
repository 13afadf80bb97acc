package com.flowlayout.flowlayout_backend.controller;

import com.flowlayout.flowlayout_backend.engine.SubgraphDetector;
import com.flowlayout.flowlayout_backend.model.domain.DiagramGraph;
import com.flowlayout.flowlayout_backend.model.dto.LayoutRequestDto;
import com.flowlayout.flowlayout_backend.model.dto.LayoutResponseDto;
import com.flowlayout.flowlayout_backend.service.DiagramLayoutService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/layout")
@RequiredArgsConstructor
public class LayoutController {

    private final DiagramLayoutService layoutService;

    @PostMapping
    public LayoutResponseDto layout(@RequestBody LayoutRequestDto request) {
        return LayoutResponseDto.from(layoutService.layout(request));
    }

    /** Normalized graph, no positions. Handy for checking what the parser understood. */
    @PostMapping("/parse")
    public DiagramGraph parse(@RequestBody LayoutRequestDto request) {
        return layoutService.parse(request);
    }

    @GetMapping("/detect")
    public SubgraphDetector.Detection detect(@RequestParam String id,
                                             @RequestParam(required = false) String label,
                                             @RequestParam(required = false) String parent) {
        return layoutService.detect(id, label, parent);
    }
}
