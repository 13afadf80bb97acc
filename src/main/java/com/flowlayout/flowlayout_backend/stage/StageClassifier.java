package com.flowlayout.flowlayout_backend.stage;

import com.flowlayout.flowlayout_backend.model.domain.DiagramNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Initial pipeline stage of a node, 0 (external source) to 6 (consumption).
 * Rules run over the lower-cased "id label componentType" text and the first
 * match wins, so more specific rules sit above broader ones.
 */
@Slf4j
@Component
public class StageClassifier {

    public static final double DEFAULT_STAGE = 3;

    private static final Pattern NOT_SNOWFLAKE_LAKE = Pattern.compile("(?<!snowf)lake");
    private static final Pattern EXTERNAL_STAGE_OF_LAKE = Pattern.compile("external.*(s3|lake)");
    private static final Pattern STAGING_OBJECT = Pattern.compile("external.stage|_stage(?!order)");
    private static final Pattern EVENT_HUB = Pattern.compile("event.*hub");
    private static final Pattern BI_WORD = Pattern.compile("\\bbi\\b");
    private static final Pattern UTILITY = Pattern.compile("warehouse|compute|pool");

    private static final List<StageRule> RULES = List.of(
            new StageRule("external-source",
                    t -> t.contains("ext_") || t.contains("kafka") || t.matches("(?s).*azure.*blob.*")
                            || t.contains("gcs") || t.contains("api"), 0),
            new StageRule("object-store",
                    t -> (t.contains("s3") || NOT_SNOWFLAKE_LAKE.matcher(t).find())
                            && !EXTERNAL_STAGE_OF_LAKE.matcher(t).find(), 0),
            new StageRule("ingestion",
                    t -> containsAny(t, "snowpipe", "fivetran", "airbyte", "ingest", "pipe"), 1),
            new StageRule("staging-object", t -> STAGING_OBJECT.matcher(t).find(), 1.5),
            new StageRule("raw", t -> containsAny(t, "bronze", "raw", "landing", "staging"), 2),
            new StageRule("change-capture", t -> containsAny(t, "cdc", "change_capture"), 2.5),
            new StageRule("stream",
                    t -> t.contains("stream") && !t.contains("kafka") && !t.contains("kinesis")
                            && !EVENT_HUB.matcher(t).find(), 2.5),
            new StageRule("transform", t -> containsAny(t, "transform", "task", "clean", "dbt", "etl"), 3),
            new StageRule("silver", t -> t.contains("silver"), 3.5),
            new StageRule("curated", t -> containsAny(t, "gold", "refined", "curated", "mart", "business"), 4),
            new StageRule("serving", t -> containsAny(t, "analytics", "warehouse", "view", "serve"), 5),
            new StageRule("consumption",
                    t -> containsAny(t, "powerbi", "tableau", "looker", "metabase", "thoughtspot", "sigma",
                            "qlik", "dashboard", "report") || BI_WORD.matcher(t).find(), 6),
            // Plain tables land with raw data unless something above placed them
            new StageRule("table", t -> t.contains("table"), 2)
    );

    private static final Map<String, Double> STAGE_NAMES = Map.of(
            "source", 0.0,
            "ingest", 1.0,
            "raw", 2.0,
            "transform", 3.0,
            "refined", 4.0,
            "serve", 5.0,
            "consume", 6.0
    );

    public double classify(DiagramNode node) {
        String text = node.searchText();
        for (StageRule rule : RULES) {
            if (rule.matches().test(text)) {
                log.debug("[Stage] {} -> {} ({})", node.getId(), rule.stage(), rule.name());
                return rule.stage();
            }
        }
        if (node.getStageHint() != null && Double.isFinite(node.getStageHint())) {
            return node.getStageHint();
        }
        if (node.getStageName() != null) {
            Double named = STAGE_NAMES.get(node.getStageName().trim().toLowerCase(Locale.ROOT));
            if (named != null) {
                return named;
            }
        }
        return DEFAULT_STAGE;
    }

    /** Shared compute that fans out to many stages; its edges carry no pipeline order. */
    public boolean isUtility(DiagramNode node) {
        return UTILITY.matcher(node.searchText()).find();
    }

    private static boolean containsAny(String text, String... keywords) {
        for (String k : keywords) {
            if (text.contains(k)) return true;
        }
        return false;
    }

    private record StageRule(String name, Predicate<String> matches, double stage) {}
}
