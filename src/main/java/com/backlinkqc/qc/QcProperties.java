package com.backlinkqc.qc;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * QC thresholds, bound from {@code backlinkqc.qc.*}.
 */
@ConfigurationProperties(prefix = "backlinkqc.qc")
public record QcProperties(
    @DefaultValue("85") double approvedThreshold,
    @DefaultValue("70") double lightEditsThreshold,
    @DefaultValue("3") int maxAnchorParagraphDepth,
    @DefaultValue("0.10") double wordCountWarnTolerance,
    @DefaultValue("0.20") double wordCountBlockTolerance,
    @DefaultValue("50") int signoffCategoryFloor,
    @DefaultValue("4") int maxRecommendations
) {

    public QcProperties {
        if (lightEditsThreshold > approvedThreshold) {
            throw new IllegalArgumentException("light-edits threshold must not exceed the approved threshold");
        }
        if (wordCountWarnTolerance > wordCountBlockTolerance) {
            throw new IllegalArgumentException("word-count warn tolerance must not exceed the block tolerance");
        }
    }

    public static QcProperties defaults() {
        return new QcProperties(85, 70, 3, 0.10, 0.20, 50, 4);
    }
}
