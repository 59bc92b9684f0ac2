package com.smartgallery.app.database;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Query predicate over indexed files. Every field is optional; unset fields do not filter.
 * Metadata criteria are combined per sampler: a file matches when at least one of its samplers
 * satisfies all of them.
 */
public record GalleryFilter(
        Path folder,
        String search,
        boolean favoritesOnly,
        List<String> prefixes,
        List<String> extensions,
        String model,
        String sampler,
        String scheduler,
        Double cfgMin,
        Double cfgMax,
        Integer stepsMin,
        Integer stepsMax,
        Integer widthMin,
        Integer widthMax,
        Integer heightMin,
        Integer heightMax
) {

    public static final GalleryFilter ALL = builder().build();

    public GalleryFilter {
        prefixes = prefixes == null ? List.of() : List.copyOf(prefixes);
        extensions = extensions == null ? List.of() : List.copyOf(extensions);
    }

    public boolean hasMetadataCriteria() {
        return model != null || sampler != null || scheduler != null
                || cfgMin != null || cfgMax != null || stepsMin != null || stepsMax != null
                || widthMin != null || widthMax != null || heightMin != null || heightMax != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path folder;
        private String search;
        private boolean favoritesOnly;
        private final List<String> prefixes = new ArrayList<>();
        private final List<String> extensions = new ArrayList<>();
        private String model;
        private String sampler;
        private String scheduler;
        private Double cfgMin;
        private Double cfgMax;
        private Integer stepsMin;
        private Integer stepsMax;
        private Integer widthMin;
        private Integer widthMax;
        private Integer heightMin;
        private Integer heightMax;

        private Builder() {}

        public Builder folder(Path v) { this.folder = v; return this; }
        public Builder search(String v) { this.search = v; return this; }
        public Builder favoritesOnly(boolean v) { this.favoritesOnly = v; return this; }
        public Builder prefix(String v) { this.prefixes.add(v); return this; }
        public Builder extension(String v) { this.extensions.add(v); return this; }
        public Builder model(String v) { this.model = v; return this; }
        public Builder sampler(String v) { this.sampler = v; return this; }
        public Builder scheduler(String v) { this.scheduler = v; return this; }
        public Builder cfg(Double min, Double max) { this.cfgMin = min; this.cfgMax = max; return this; }
        public Builder steps(Integer min, Integer max) { this.stepsMin = min; this.stepsMax = max; return this; }
        public Builder width(Integer min, Integer max) { this.widthMin = min; this.widthMax = max; return this; }
        public Builder height(Integer min, Integer max) { this.heightMin = min; this.heightMax = max; return this; }

        public GalleryFilter build() {
            return new GalleryFilter(folder, search, favoritesOnly, prefixes, extensions, model, sampler, scheduler,
                    cfgMin, cfgMax, stepsMin, stepsMax, widthMin, widthMax, heightMin, heightMax);
        }
    }
}
