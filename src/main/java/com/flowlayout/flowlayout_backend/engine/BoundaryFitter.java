package com.flowlayout.flowlayout_backend.engine;

import com.flowlayout.flowlayout_backend.config.LayoutSettings;
import com.flowlayout.flowlayout_backend.model.domain.DiagramGraph;
import com.flowlayout.flowlayout_backend.model.domain.DiagramNode;
import com.flowlayout.flowlayout_backend.model.domain.NodeKind;
import com.flowlayout.flowlayout_backend.model.domain.Provider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Sizes the account boundaries around their members.
 *
 * External providers go first: their members are re-stacked in one column
 * left of the laid-out content and the boundary wraps that stack. The home
 * provider goes last and only measures where its members already are.
 */
@Slf4j
@Component
public class BoundaryFitter {

    /**
     * Members per provider whose boundary node exists. An explicit {@code boundary}
     * assignment wins; unassigned nodes are matched by keyword, and a node claimed
     * by an external provider is not offered to the home provider.
     */
    public Map<Provider, List<DiagramNode>> claimMembers(DiagramGraph graph) {
        Map<Provider, List<DiagramNode>> claims = new EnumMap<>(Provider.class);
        Set<String> claimed = new HashSet<>();

        for (Provider provider : Provider.fittingOrder()) {
            if (graph.findNode(provider.canonicalId()).isEmpty()) {
                continue;
            }
            List<DiagramNode> members = new ArrayList<>();
            for (DiagramNode node : graph.getNodes()) {
                if (node.getKind() == NodeKind.BOUNDARY || node.getKind() == NodeKind.BADGE
                        || claimed.contains(node.getId())) {
                    continue;
                }
                boolean member = node.getBoundary() != null
                        ? provider.key().equals(node.getBoundary())
                        : matchesKeywords(node, provider);
                if (member) {
                    members.add(node);
                    claimed.add(node.getId());
                }
            }
            claims.put(provider, members);
        }
        return claims;
    }

    private static boolean matchesKeywords(DiagramNode node, Provider provider) {
        // "snowflake" contains "lake"
        String text = provider.isHome() ? node.searchText() : node.searchText().replace("snowflake", "");
        for (String keyword : provider.memberKeywords()) {
            if (text.contains(keyword)) return true;
        }
        return false;
    }

    /** Members of external boundaries; the strategies leave these to {@link #fit}. */
    public Set<String> bypassIds(Map<Provider, List<DiagramNode>> claims) {
        Set<String> ids = new HashSet<>();
        claims.forEach((provider, members) -> {
            if (!provider.isHome()) {
                members.forEach(m -> ids.add(m.getId()));
            }
        });
        return ids;
    }

    public void fit(LayoutContext context, Map<Provider, List<DiagramNode>> claims) {
        LayoutSettings s = context.getSettings();
        double[] origin = contentOrigin(context);
        double contentMinX = origin[0];
        double contentMinY = origin[1];
        double minHeight = s.getBoundaryMinHeight() + s.getBoundaryLabelPadding();

        double nextExternalY = contentMinY;
        for (Provider provider : Provider.fittingOrder()) {
            Optional<DiagramNode> found = Optional.ofNullable(context.getNodesById().get(provider.canonicalId()));
            if (found.isEmpty()) {
                continue;
            }
            DiagramNode boundary = found.get();
            List<DiagramNode> members = claims.getOrDefault(provider, List.of());

            if (members.isEmpty()) {
                boundary.place(contentMinX, contentMinY, s.getBoundaryMinWidth(), minHeight);
                log.debug("[Boundary] {} has no members, minimum box at content origin", boundary.getId());
                continue;
            }

            if (provider.isHome()) {
                fitHome(boundary, members, s, minHeight);
            } else {
                fitExternal(boundary, members, s, minHeight, contentMinX, nextExternalY);
                nextExternalY = boundary.getY() + boundary.getHeight() + s.getBoundaryGap();
            }
            log.debug("[Boundary] {} fitted around {} member(s): ({}, {}) {}x{}", boundary.getId(), members.size(),
                    boundary.getX(), boundary.getY(), boundary.getWidth(), boundary.getHeight());
        }
    }

    private static void fitExternal(DiagramNode boundary, List<DiagramNode> members, LayoutSettings s,
                                    double minHeight, double contentMinX, double top) {
        double pad = s.getBoundaryPadding();
        double width = Math.max(s.getNodeWidth() + 2 * pad, s.getBoundaryMinWidth());
        double rawHeight = pad + s.getBoundaryTitleHeight()
                + (members.size() - 1) * s.getBoundaryRowHeight() + s.getNodeHeight() + pad;
        double height = Math.max(rawHeight, minHeight);
        double x = contentMinX - s.getBoundaryGap() - width;

        for (int i = 0; i < members.size(); i++) {
            DiagramNode member = members.get(i);
            member.place(x + pad, top + pad + s.getBoundaryTitleHeight() + i * s.getBoundaryRowHeight(),
                    s.getNodeWidth(), s.getNodeHeight());
            member.setColumn(null);
            member.setRow(null);
        }
        boundary.place(x, top, width, height);
    }

    private static void fitHome(DiagramNode boundary, List<DiagramNode> members, LayoutSettings s, double minHeight) {
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (DiagramNode m : members) {
            if (!m.isPositioned()) continue;
            minX = Math.min(minX, m.getX());
            minY = Math.min(minY, m.getY());
            maxX = Math.max(maxX, m.getX() + m.getWidth());
            maxY = Math.max(maxY, m.getY() + m.getHeight());
        }
        if (minX == Double.POSITIVE_INFINITY) {
            boundary.place(0, 0, s.getBoundaryMinWidth(), minHeight);
            return;
        }
        double pad = s.getBoundaryPadding();
        double x = minX - pad;
        double y = minY - pad - s.getBoundaryTitleHeight();
        double width = Math.max(maxX - minX + 2 * pad, s.getBoundaryMinWidth());
        double height = Math.max(maxY - minY + 2 * pad + s.getBoundaryTitleHeight(), minHeight);
        boundary.place(x, y, width, height);
    }

    /** Top-left of everything the strategy placed, badges included; (0, 0) when nothing was. */
    private static double[] contentOrigin(LayoutContext context) {
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        List<DiagramNode> placed = new ArrayList<>(context.layoutNodes());
        placed.addAll(context.getBadges());
        for (DiagramNode node : placed) {
            if (!node.isPositioned()) continue;
            minX = Math.min(minX, node.getX());
            minY = Math.min(minY, node.getY());
        }
        if (minX == Double.POSITIVE_INFINITY) {
            return new double[]{0, 0};
        }
        return new double[]{minX, minY};
    }
}
