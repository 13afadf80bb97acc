package com.flowlayout.flowlayout_backend.model.domain;

import java.util.List;
import java.util.Optional;

/**
 * The four account perimeters a diagram can draw. SNOWFLAKE is the home
 * platform: its boundary is measured around members that stay where the
 * layout put them. The others are external and re-stack their members.
 */
public enum Provider {
    SNOWFLAKE(true, List.of(
            "bronze", "silver", "gold", "layer", "task", "cdc",
            "transform", "warehouse", "analytics", "view", "table", "database", "schema",
            "stage", "snowpipe", "snowpipe_streaming", "pipe", "stream")),
    AWS(false, List.of("aws", "s3", "lake", "kinesis", "amazon_kinesis", "ext_kinesis")),
    AZURE(false, List.of("azure", "adls", "blob", "event_hub", "event_hubs", "eventhub", "ext_event_hub")),
    GCP(false, List.of("gcp", "gcs", "bigquery", "bq", "pub_sub", "pubsub"));

    public static final String BOUNDARY_PREFIX = "account_boundary_";

    private final boolean home;
    private final List<String> memberKeywords;

    Provider(boolean home, List<String> memberKeywords) {
        this.home = home;
        this.memberKeywords = memberKeywords;
    }

    public boolean isHome() {
        return home;
    }

    public List<String> memberKeywords() {
        return memberKeywords;
    }

    public String key() {
        return name().toLowerCase();
    }

    /** "account_boundary_snowflake" etc. */
    public String canonicalId() {
        return BOUNDARY_PREFIX + key();
    }

    /** External providers first, home last: the order boundaries are fitted in. */
    public static List<Provider> fittingOrder() {
        return List.of(AWS, AZURE, GCP, SNOWFLAKE);
    }

    public static Optional<Provider> fromKey(String key) {
        if (key == null || key.isBlank()) return Optional.empty();
        String k = key.trim().toLowerCase();
        if (k.startsWith(BOUNDARY_PREFIX)) {
            k = k.substring(BOUNDARY_PREFIX.length());
        }
        for (Provider p : values()) {
            if (p.key().equals(k)) return Optional.of(p);
        }
        return Optional.empty();
    }

    /**
     * Matches id + label text that names an account perimeter ("Snowflake Account",
     * "AWS Account", "Azure Boundary"). Individual cloud services ("Azure Blob
     * Storage", "Google Pub/Sub") do not match.
     */
    public static Optional<Provider> fromPerimeterText(String text) {
        if (text == null) return Optional.empty();
        String t = text.toLowerCase();
        if (t.contains("snowflake account")) return Optional.of(SNOWFLAKE);
        if (t.contains("aws account") || t.contains("amazon account")) return Optional.of(AWS);
        if (t.contains("azure account") || (t.contains("azure") && t.contains("boundary"))) {
            return Optional.of(AZURE);
        }
        if (t.contains("gcp account") || t.contains("google account")
                || ((t.contains("gcp") || t.contains("google")) && t.contains("boundary"))) {
            return Optional.of(GCP);
        }
        return Optional.empty();
    }

    /** Provider named by a boundary componentType / label / id, e.g. "account_boundary_aws". */
    public static Optional<Provider> fromBoundaryText(String text) {
        if (text == null) return Optional.empty();
        String t = text.toLowerCase();
        if (t.contains("snowflake")) return Optional.of(SNOWFLAKE);
        if (t.contains("aws") || t.contains("amazon")) return Optional.of(AWS);
        if (t.contains("azure")) return Optional.of(AZURE);
        if (t.contains("gcp") || t.contains("google")) return Optional.of(GCP);
        return Optional.empty();
    }
}
