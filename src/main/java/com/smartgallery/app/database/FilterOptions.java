package com.smartgallery.app.database;

import java.util.List;

/** Distinct metadata values with file counts, and numeric ranges, for building filter UIs. */
public record FilterOptions(
        List<FacetCount> models,
        List<FacetCount> samplers,
        List<FacetCount> schedulers,
        Range cfg,
        Range steps,
        Range width,
        Range height
) {

    public record FacetCount(String value, long fileCount) {}

    public record Range(Double min, Double max) {}

    public record Ranges(Range cfg, Range steps, Range width, Range height) {}

    static FilterOptions of(List<FacetCount> models, List<FacetCount> samplers, List<FacetCount> schedulers,
                            Ranges ranges) {
        return new FilterOptions(models, samplers, schedulers, ranges.cfg(), ranges.steps(), ranges.width(),
                ranges.height());
    }
}
