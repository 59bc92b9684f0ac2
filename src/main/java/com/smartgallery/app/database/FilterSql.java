package com.smartgallery.app.database;

import java.io.File;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

/**
 * Renders a {@link GalleryFilter} as a WHERE clause over {@code files f} with named parameters.
 * Each metadata criterion becomes its own correlated EXISTS so a file is never repeated per matching
 * sampler.
 */
final class FilterSql {

    static final String ESCAPE_CHAR = "!";
    static final String ESCAPE = " ESCAPE '" + ESCAPE_CHAR + "'";

    private final List<String> conditions = new ArrayList<>();
    private final Map<String, Object> params = new LinkedHashMap<>();

    private FilterSql() {}

    static FilterSql of(GalleryFilter filter) {
        FilterSql sql = new FilterSql();
        sql.build(filter);
        return sql;
    }

    String where() {
        return conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
    }

    Map<String, Object> params() {
        return params;
    }

    private void build(GalleryFilter f) {
        if (f.folder() != null) {
            String base = f.folder().toAbsolutePath().normalize().toString();
            String prefix = escapeLike(base + File.separator);
            conditions.add("f.path LIKE " + bind(prefix + "%") + ESCAPE);
            conditions.add("f.path NOT LIKE " + bind(prefix + "%" + escapeLike(File.separator) + "%") + ESCAPE);
        }

        if (f.hasMetadataCriteria()) {
            if (StringUtils.isNotEmpty(f.model())) exists("wm.model_name = " + bind(f.model()));
            if (StringUtils.isNotEmpty(f.sampler())) exists("wm.sampler_name = " + bind(f.sampler()));
            if (StringUtils.isNotEmpty(f.scheduler())) exists("wm.scheduler = " + bind(f.scheduler()));
            range("wm.cfg", f.cfgMin(), f.cfgMax());
            range("wm.steps", f.stepsMin(), f.stepsMax());
            range("wm.width", f.widthMin(), f.widthMax());
            range("wm.height", f.heightMin(), f.heightMax());
        }

        if (StringUtils.isNotBlank(f.search())) {
            conditions.add("f.name LIKE " + bind("%" + escapeLike(f.search().trim()) + "%") + ESCAPE);
        }

        if (f.favoritesOnly()) {
            conditions.add("f.is_favorite = 1");
        }

        List<String> prefixOr = new ArrayList<>();
        for (String p : f.prefixes()) {
            if (StringUtils.isBlank(p)) continue;
            prefixOr.add("f.name LIKE " + bind(escapeLike(p.trim()) + ESCAPE_CHAR + "_%") + ESCAPE);
        }
        if (!prefixOr.isEmpty()) conditions.add("(" + String.join(" OR ", prefixOr) + ")");

        List<String> extOr = new ArrayList<>();
        for (String ext : f.extensions()) {
            if (StringUtils.isBlank(ext)) continue;
            String clean = StringUtils.removeStart(ext.trim(), ".").toLowerCase(Locale.ROOT);
            extOr.add("LOWER(f.name) LIKE " + bind("%." + escapeLike(clean)) + ESCAPE);
        }
        if (!extOr.isEmpty()) conditions.add("(" + String.join(" OR ", extOr) + ")");
    }

    /** One correlated EXISTS per criterion; criteria may be satisfied by different samplers of a file. */
    private void exists(String criterion) {
        conditions.add("EXISTS (SELECT 1 FROM workflow_metadata wm WHERE wm.file_id = f.id AND " + criterion + ")");
    }

    /** Both bounds of a range must hold on the same sampler. */
    private void range(String column, Number min, Number max) {
        if (min == null && max == null) return;
        List<String> bounds = new ArrayList<>(2);
        if (min != null) bounds.add(column + " >= " + bind(min));
        if (max != null) bounds.add(column + " <= " + bind(max));
        exists(String.join(" AND ", bounds));
    }

    private String bind(Object value) {
        String name = "p" + params.size();
        params.put(name, value);
        return ":" + name;
    }

    // a backslash escape would be read as a quoted quote by the Jdbi SQL lexer
    static String escapeLike(String s) {
        return s.replace(ESCAPE_CHAR, ESCAPE_CHAR + ESCAPE_CHAR)
                .replace("%", ESCAPE_CHAR + "%")
                .replace("_", ESCAPE_CHAR + "_");
    }
}
