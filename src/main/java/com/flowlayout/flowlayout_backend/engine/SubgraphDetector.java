package com.flowlayout.flowlayout_backend.engine;

import com.flowlayout.flowlayout_backend.model.domain.Subgraph;
import com.flowlayout.flowlayout_backend.model.domain.SubgraphKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies group blocks by naming convention.
 *
 * <ul>
 *   <li>lane: {@code path_1a}, {@code lane-2}, {@code row_b}. Index comes from the
 *       letter of a compound suffix, else number - 1, else the letter.</li>
 *   <li>section: {@code section_2}, {@code analytics_section}, {@code stage_1},
 *       {@code col_a}, {@code step_3}, {@code phase_1}, {@code zone_2}.</li>
 *   <li>boundary: cloud/account wording (index 0), or producer/consumer/source/sink
 *       ids (index -1, drawn outside the grid).</li>
 *   <li>group: everything else, with a short derived badge.</li>
 * </ul>
 */
@Slf4j
@Component
public class SubgraphDetector {

    public static final List<String> PALETTE = List.of(
            "#E3F2FD", "#F3E5F5", "#E8F5E9", "#FFF8E1",
            "#E1F5FE", "#FCE4EC", "#E0F2F1", "#FFF3E0",
            "#E8EAF6", "#F1F8E9", "#FFFDE7", "#ECEFF1");

    private static final Pattern LANE = Pattern.compile("^(?:path|lane|row|ingestion|flow|stream)[_-]?(\\d+[a-z]?|[a-z])$");
    private static final Pattern COMPOUND_SUFFIX = Pattern.compile("^(\\d+)([a-z])$");
    private static final Pattern FIRST_NUMBER = Pattern.compile("(\\d+)");
    private static final Pattern TRAILING_LETTER = Pattern.compile("([a-z])$");

    private static final List<Pattern> SECTIONS = List.of(
            Pattern.compile("^section[_-]?(\\w+)$"),
            Pattern.compile("^(\\w+)[_-]section$"),
            Pattern.compile("^stage[_-]?(\\w+)$"),
            Pattern.compile("^col(?:umn)?[_-]?(\\w+)$"),
            Pattern.compile("^step[_-]?(\\w+)$"),
            Pattern.compile("^phase[_-]?(\\w+)$"),
            Pattern.compile("^zone[_-]?(\\w+)$"));

    private static final List<String> BOUNDARY_KEYWORDS = List.of(
            "snowflake", "aws", "azure", "gcp", "google", "cloud", "account", "boundary", "vpc", "network");
    private static final List<String> OUTSIDE_KEYWORDS = List.of("producer", "consumer", "source", "sink");

    private static final Pattern LABEL_SUFFIX = Pattern.compile("(?:^|[\\s_-])(\\d+[a-z]?|[a-z])$", Pattern.CASE_INSENSITIVE);

    public Detection detect(String id, String label, String parent) {
        String idLower = id.toLowerCase(Locale.ROOT);
        String labelText = label != null ? label : id;
        String labelLower = labelText.toLowerCase(Locale.ROOT);

        Matcher lane = LANE.matcher(idLower);
        if (lane.matches()) {
            String suffix = lane.group(1);
            Matcher compound = COMPOUND_SUFFIX.matcher(suffix);
            int index = compound.matches()
                    ? compound.group(2).charAt(0) - 'a'
                    : numberOrLetterIndex(suffix);
            return new Detection(SubgraphKind.LANE, Math.max(0, index), suffix.toUpperCase(Locale.ROOT));
        }

        for (Pattern section : SECTIONS) {
            Matcher m = section.matcher(idLower);
            if (m.matches()) {
                String suffix = m.group(1);
                return new Detection(SubgraphKind.SECTION, Math.max(0, numberOrLetterIndex(suffix)),
                        suffix.toUpperCase(Locale.ROOT));
            }
        }

        for (String keyword : BOUNDARY_KEYWORDS) {
            if (idLower.contains(keyword) || labelLower.contains(keyword)) {
                return new Detection(SubgraphKind.BOUNDARY, 0, "");
            }
        }
        for (String keyword : OUTSIDE_KEYWORDS) {
            if (idLower.contains(keyword)) {
                return new Detection(SubgraphKind.BOUNDARY, -1, "");
            }
        }

        return new Detection(SubgraphKind.GROUP, 0, groupBadge(labelText));
    }

    /** Fills kind, index, badge and palette color on every subgraph, in declaration order. */
    public void classify(List<Subgraph> subgraphs) {
        for (int i = 0; i < subgraphs.size(); i++) {
            Subgraph sg = subgraphs.get(i);
            Detection d = detect(sg.getId(), sg.getLabel(), sg.getParent());
            sg.setKind(d.kind());
            sg.setIndex(d.index());
            sg.setBadgeLabel(d.badgeLabel());
            sg.setColor(PALETTE.get(i % PALETTE.size()));
            log.debug("[Detector] {} -> {} #{} '{}'", sg.getId(), d.kind(), d.index(), d.badgeLabel());
        }
    }

    private static int numberOrLetterIndex(String suffix) {
        Matcher number = FIRST_NUMBER.matcher(suffix);
        if (number.find()) {
            return Integer.parseInt(number.group(1)) - 1;
        }
        Matcher letter = TRAILING_LETTER.matcher(suffix);
        return letter.find() ? letter.group(1).charAt(0) - 'a' : 0;
    }

    private static String groupBadge(String label) {
        Matcher m = LABEL_SUFFIX.matcher(label.trim());
        if (m.find()) {
            return m.group(1).toUpperCase(Locale.ROOT);
        }
        String[] words = label.trim().split("[\\s_-]+");
        if (words.length >= 2) {
            StringBuilder initials = new StringBuilder();
            for (String w : words) {
                if (!w.isEmpty()) initials.append(w.charAt(0));
            }
            return initials.substring(0, Math.min(2, initials.length())).toUpperCase(Locale.ROOT);
        }
        return label.substring(0, Math.min(2, label.length())).toUpperCase(Locale.ROOT);
    }

    public record Detection(SubgraphKind kind, int index, String badgeLabel) {}
}
