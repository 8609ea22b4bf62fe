package uk.gegc.adaptive.features.categoryrating.domain.model;

public enum PerformanceTrend {
    IMPROVING,
    DECLINING,
    STABLE
}
