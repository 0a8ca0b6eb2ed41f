package com.conveyal.roofarea.metrics;

import com.conveyal.roofarea.RoofAreaException;
import com.conveyal.roofarea.common.Crs;
import com.conveyal.roofarea.common.DataSourceException;
import com.conveyal.roofarea.vector.Feature;
import com.conveyal.roofarea.vector.FeatureCollection;
import com.csvreader.CsvWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Sums roof areas per building, or per tile when features carry no building identifier. Areas come from a
 * precomputed area_m2 attribute when there is one, otherwise from the feature geometries measured in a metric CRS.
 */
public abstract class AreaAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(AreaAggregator.class);

    public static final String AREA_COLUMN = "area_m2";

    public static final String BUILDING_ID_COLUMN = "building_id";

    public static final String TILE_ID_COLUMN = "tile_id";

    public static final String[] CSV_HEADER = { "group_key", "total_area_m2" };

    /**
     * Numbers sort before everything else and by exact value among themselves, so large integer ids stay distinct.
     * Other keys are ordered by type name and then by their string form, so true and "true" are different groups.
     */
    public static final Comparator<Object> GROUP_KEY_ORDER = (a, b) -> {
        boolean aNumber = a instanceof Number;
        boolean bNumber = b instanceof Number;
        if (aNumber && bNumber) {
            return compareNumbers((Number) a, (Number) b);
        }
        if (aNumber != bNumber) {
            return aNumber ? -1 : 1;
        }
        int byType = a.getClass().getName().compareTo(b.getClass().getName());
        if (byType != 0) {
            return byType;
        }
        return a.toString().compareTo(b.toString());
    };

    /** Keys are normalized to Long or Double. Integers are compared exactly, also against finite doubles. */
    private static int compareNumbers (Number a, Number b) {
        if (a instanceof Long && b instanceof Long) {
            return Long.compare(a.longValue(), b.longValue());
        }
        double da = a.doubleValue();
        double db = b.doubleValue();
        if (!Double.isFinite(da) || !Double.isFinite(db)) {
            return Double.compare(da, db);
        }
        return exact(a).compareTo(exact(b));
    }

    private static BigDecimal exact (Number number) {
        return number instanceof Long ? BigDecimal.valueOf(number.longValue()) : new BigDecimal(number.doubleValue());
    }

    /**
     * @return one row per distinct non-null group key, ordered by key.
     * @throws RoofAreaException of type CONFIGURATION if there is neither a building_id nor a tile_id column, or if
     *         areas must be computed from geometries that have no CRS.
     */
    public static List<AggregatedArea> aggregate (FeatureCollection features) {
        String keyColumn = groupKeyColumn(features);
        boolean precomputed = features.hasColumn(AREA_COLUMN);
        FeatureCollection measured = features;
        if (!precomputed) {
            if (features.crs == null) {
                throw RoofAreaException.configuration("Features need a CRS to compute areas from their geometries.");
            }
            Crs metricCrs = AreaUtils.ensureMetricCrs(features.crs);
            if (!metricCrs.equals(features.crs)) {
                LOG.info("Reprojecting features from {} to {} to measure areas.", features.crs, metricCrs);
            }
            measured = features.reprojectTo(metricCrs);
        }
        Map<Object, Double> totals = new TreeMap<>(GROUP_KEY_ORDER);
        int skipped = 0;
        for (Feature feature : measured) {
            Object key = normalizeKey(feature.get(keyColumn));
            if (key == null) {
                skipped += 1;
                continue;
            }
            double area = precomputed ? attributeArea(feature) : geometryArea(feature);
            totals.merge(key, area, Double::sum);
        }
        if (skipped > 0) {
            LOG.warn("Skipped {} features without a {} value.", skipped, keyColumn);
        }
        List<AggregatedArea> rows = new ArrayList<>(totals.size());
        totals.forEach((key, total) -> rows.add(new AggregatedArea(key, total)));
        LOG.info("Aggregated {} features into {} groups by {}.", features.size(), rows.size(), keyColumn);
        return rows;
    }

    /** building_id if any feature has a value for it, otherwise tile_id if the column exists at all. */
    static String groupKeyColumn (FeatureCollection features) {
        if (features.hasValues(BUILDING_ID_COLUMN)) {
            return BUILDING_ID_COLUMN;
        }
        if (features.hasColumn(TILE_ID_COLUMN)) {
            return TILE_ID_COLUMN;
        }
        throw RoofAreaException.configuration(String.format(
                "Cannot aggregate areas: features have neither a %s nor a %s attribute.",
                BUILDING_ID_COLUMN, TILE_ID_COLUMN));
    }

    /** Integral numbers of any width group together, so 7 read as an Integer and 7 read as a Long are one key. */
    private static Object normalizeKey (Object key) {
        if (key instanceof Integer || key instanceof Long || key instanceof Short || key instanceof Byte) {
            return ((Number) key).longValue();
        }
        if (key instanceof BigInteger || key instanceof BigDecimal) {
            return ((Number) key).doubleValue();
        }
        return key;
    }

    private static double attributeArea (Feature feature) {
        Object value = feature.get(AREA_COLUMN);
        if (value == null) {
            return 0;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new DataSourceException("Feature " + feature.id + " has a non-numeric area_m2 value: " + value, e);
        }
    }

    private static double geometryArea (Feature feature) {
        return feature.geometry == null ? 0 : feature.geometry.getArea();
    }

    /** Write aggregated rows as CSV with a header line. Keys and areas are written with their natural string form. */
    public static void writeCsv (List<AggregatedArea> rows, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        BufferedWriter bufferedWriter = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
        CsvWriter csvWriter = new CsvWriter(bufferedWriter, ',');
        try {
            csvWriter.writeRecord(CSV_HEADER);
            for (AggregatedArea row : rows) {
                csvWriter.writeRecord(new String[] { row.groupKey.toString(), Double.toString(row.totalAreaM2) });
            }
        } finally {
            csvWriter.close();
        }
        LOG.info("Wrote {} aggregated areas to {}.", rows.size(), file);
    }

}
