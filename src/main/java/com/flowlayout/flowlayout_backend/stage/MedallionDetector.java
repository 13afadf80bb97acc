package com.flowlayout.flowlayout_backend.stage;

import com.flowlayout.flowlayout_backend.model.domain.DiagramNode;

import java.util.Collection;

public final class MedallionDetector {

    private MedallionDetector() {
    }

    /** True when any node is named after a bronze, silver or gold layer. */
    public static boolean isMedallion(Collection<DiagramNode> nodes) {
        for (DiagramNode node : nodes) {
            String text = ((node.getLabel() != null ? node.getLabel() : "") + " "
                    + (node.getComponentType() != null ? node.getComponentType() : "")).toLowerCase();
            if (text.contains("bronze") || text.contains("silver") || text.contains("gold")) {
                return true;
            }
        }
        return false;
    }
}
