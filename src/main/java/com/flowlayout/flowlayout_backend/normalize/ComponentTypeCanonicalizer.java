package com.flowlayout.flowlayout_backend.normalize;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Maps free-form component names onto the small set of canonical types the
 * icon service and the layout rules understand.
 */
public final class ComponentTypeCanonicalizer {

    private static final String DEFAULT_TYPE = "table";

    private static final Map<String, String> COMPOUND_TYPES = Map.ofEntries(
            Map.entry("cdc_stream", "stream"),
            Map.entry("change_stream", "stream"),
            Map.entry("transform_task", "task"),
            Map.entry("bronze_layer", "bronze_layer"),
            Map.entry("silver_layer", "silver_layer"),
            Map.entry("gold_layer", "gold_layer"),
            Map.entry("analytics_views", "analytics_views"),
            Map.entry("analytics_view", "analytics_views"),
            Map.entry("bronze_db", "database"),
            Map.entry("silver_db", "database"),
            Map.entry("gold_db", "database"),
            Map.entry("bronze_schema", "schema"),
            Map.entry("silver_schema", "schema"),
            Map.entry("gold_schema", "schema"),
            Map.entry("bronze_tables", "table"),
            Map.entry("silver_tables", "table"),
            Map.entry("gold_tables", "table")
    );

    // Order matters: more specific first
    private static final List<TypeRule> SUBSTRING_RULES = List.of(
            new TypeRule(c -> c.contains("snowpipe") || c.equals("pipe"), "snowpipe"),
            new TypeRule(c -> c.contains("kafka"), "kafka"),
            new TypeRule(c -> c.contains("stream"), "stream"),
            new TypeRule(c -> c.contains("task"), "task"),
            new TypeRule(c -> c.contains("schema"), "schema"),
            new TypeRule(c -> c.contains("table"), "table"),
            new TypeRule(c -> c.contains("view") || c.contains("analytic"), "view"),
            new TypeRule(c -> c.contains("warehouse") || c.contains("wh"), "warehouse"),
            new TypeRule(c -> c.contains("db") || c.contains("database"), "database"),
            new TypeRule(c -> c.contains("s3") || c.contains("lake"), "database")
    );

    // Common diagram wording → component name, keyed by the squashed label
    private static final Map<String, String> LABEL_SYNONYMS = Map.ofEntries(
            Map.entry("database", "Database"),
            Map.entry("db", "Database"),
            Map.entry("datastore", "Database"),
            Map.entry("datawarehouse", "Data WH"),
            Map.entry("warehouse", "Warehouse"),
            Map.entry("wh", "Warehouse"),
            Map.entry("snowflake", "Warehouse"),
            Map.entry("virtualwarehouse", "Virtual WH"),
            Map.entry("snowparkwarehouse", "Snowpark WH"),
            Map.entry("adaptivewarehouse", "Adaptive WH"),
            Map.entry("table", "Table"),
            Map.entry("tables", "Table"),
            Map.entry("view", "View"),
            Map.entry("schema", "Schema"),
            Map.entry("schemas", "Schema"),
            Map.entry("stream", "Stream"),
            Map.entry("streaming", "Stream"),
            Map.entry("snowpipe", "Snowpipe"),
            Map.entry("pipe", "Snowpipe"),
            Map.entry("task", "Task"),
            Map.entry("tasks", "Task"),
            Map.entry("staging", "Table"),
            Map.entry("landing", "Table"),
            Map.entry("rawdata", "Table"),
            Map.entry("cleanseddata", "Table"),
            Map.entry("curateddata", "Table"),
            Map.entry("csv", "Table"),
            Map.entry("csvfiles", "Table"),
            Map.entry("files", "Table"),
            Map.entry("api", "Stream"),
            Map.entry("apis", "Stream"),
            Map.entry("ingest", "Snowpipe"),
            Map.entry("ingestion", "Snowpipe"),
            Map.entry("extractlayer", "Snowpipe"),
            Map.entry("transformlayer", "Task"),
            Map.entry("loadlayer", "Table"),
            Map.entry("monitoring", "View"),
            Map.entry("logging", "View"),
            Map.entry("monitoringlogging", "View"),
            Map.entry("analytics", "View"),
            Map.entry("dashboard", "View"),
            Map.entry("report", "View"),
            Map.entry("reporting", "View"),
            Map.entry("metric", "View"),
            Map.entry("metrics", "View")
    );

    private static final List<TypeRule> LABEL_HEURISTICS = List.of(
            new TypeRule(n -> n.contains("warehouse"), "Warehouse"),
            new TypeRule(n -> n.contains("virtualwh"), "Virtual WH"),
            new TypeRule(n -> n.contains("snowparkw"), "Snowpark WH"),
            new TypeRule(n -> n.contains("adaptive"), "Adaptive WH"),
            new TypeRule(n -> n.contains("database") || n.contains("datastore"), "Database"),
            new TypeRule(n -> containsAny(n, "view", "dashboard", "report", "analytics", "monitor", "logg"), "View"),
            new TypeRule(n -> containsAny(n, "table", "csv", "file", "staging", "landing", "rawdata", "curated"), "Table"),
            new TypeRule(n -> containsAny(n, "api", "source", "ingest", "stream", "connect"), "Stream"),
            new TypeRule(n -> containsAny(n, "snowpipe", "extract", "pull", "ingestion"), "Snowpipe"),
            new TypeRule(n -> containsAny(n, "task", "transform", "clean", "validate", "aggregate", "format", "process"), "Task")
    );

    private ComponentTypeCanonicalizer() {
    }

    /**
     * Canonical type for a raw componentType. Boundary types come back unchanged;
     * a missing type becomes "table".
     */
    public static String canonicalize(String componentType) {
        if (componentType == null || componentType.isBlank()) {
            return DEFAULT_TYPE;
        }
        String raw = componentType.trim().toLowerCase(Locale.ROOT);
        if (raw.startsWith("account_boundary")) {
            return componentType;
        }

        String c = raw.replaceFirst("^(sf|ext|src|tgt)_", "");
        String compound = COMPOUND_TYPES.get(c);
        if (compound != null) {
            return compound;
        }
        for (TypeRule rule : SUBSTRING_RULES) {
            if (rule.matches().test(c)) {
                return rule.type();
            }
        }
        return componentType;
    }

    /**
     * Best-guess component name for a node declared only with a label:
     * synonym table first, then keyword heuristics, else the label itself.
     */
    public static String fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return DEFAULT_TYPE;
        }
        String norm = squash(label);
        String synonym = LABEL_SYNONYMS.get(norm);
        if (synonym != null) {
            return synonym;
        }
        for (TypeRule rule : LABEL_HEURISTICS) {
            if (rule.matches().test(norm)) {
                return rule.type();
            }
        }
        return label;
    }

    static String squash(String s) {
        return s.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }

    private static boolean containsAny(String text, String... keywords) {
        for (String k : keywords) {
            if (text.contains(k)) return true;
        }
        return false;
    }

    private record TypeRule(Predicate<String> matches, String type) {}
}
