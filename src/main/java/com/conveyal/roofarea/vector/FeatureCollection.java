package com.conveyal.roofarea.vector;

import com.conveyal.roofarea.common.Crs;
import com.conveyal.roofarea.common.Reprojector;
import org.locationtech.jts.geom.Geometry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An in-memory table of features sharing one CRS. The CRS may be null when the source did not declare one, in which
 * case operations that need real-world coordinates refuse to use the collection.
 *
 * The columns are the union of the attribute names seen on any feature, in order of first appearance, so a column
 * "exists" even if only some features carry a value for it.
 */
public class FeatureCollection implements Iterable<Feature> {

    public final Crs crs;

    private final List<Feature> features;

    private final Set<String> columns;

    public FeatureCollection (Crs crs, List<Feature> features) {
        this.crs = crs;
        this.features = Collections.unmodifiableList(new ArrayList<>(features));
        Set<String> columns = new LinkedHashSet<>();
        for (Feature feature : features) {
            columns.addAll(feature.properties.keySet());
        }
        this.columns = Collections.unmodifiableSet(columns);
    }

    public static FeatureCollection of (Crs crs, Feature... features) {
        return new FeatureCollection(crs, Arrays.asList(features));
    }

    public static FeatureCollection of (String crs, Feature... features) {
        return of(crs == null ? null : Crs.of(crs), features);
    }

    public List<Feature> features () {
        return features;
    }

    public int size () {
        return features.size();
    }

    public boolean isEmpty () {
        return features.isEmpty();
    }

    public Set<String> columns () {
        return columns;
    }

    public boolean hasColumn (String column) {
        return columns.contains(column);
    }

    /** True if at least one feature has a non-null value for the given attribute. */
    public boolean hasValues (String column) {
        return hasColumn(column) && features.stream().anyMatch(f -> f.get(column) != null);
    }

    public List<Geometry> geometries () {
        return features.stream().map(f -> f.geometry).collect(Collectors.toList());
    }

    /**
     * @return a collection with every geometry reprojected into the given CRS, or this same collection if it is
     * already in that CRS.
     * @throws NullPointerException if this collection has no CRS.
     */
    public FeatureCollection reprojectTo (Crs destination) {
        checkNotNull(crs, "Cannot reproject features without a CRS.");
        if (crs.equals(destination)) return this;
        List<Feature> reprojected = features.stream()
                .map(f -> f.withGeometry(Reprojector.reprojectGeometry(f.geometry, crs, destination)))
                .collect(Collectors.toList());
        return new FeatureCollection(destination, reprojected);
    }

    public Stream<Feature> stream () {
        return features.stream();
    }

    @Override
    public Iterator<Feature> iterator () {
        return features.iterator();
    }

    @Override
    public String toString () {
        return "FeatureCollection{crs=" + Objects.toString(crs) + ", features=" + features.size()
                + ", columns=" + columns + "}";
    }

}
