package com.tracemap.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.tracemap.config.AppProperties;
import com.tracemap.geo.CellSize;
import com.tracemap.geo.GeohashCodec;
import com.tracemap.model.BoundingBox;
import com.tracemap.model.Coordinate;
import com.tracemap.model.CoordinateSpan;
import com.tracemap.model.Viewport;
import com.tracemap.util.GeoValidator;

/**
 * Turns a viewport into a bounded set of geohash prefixes to query.
 *
 * <p>Wide spans get short (coarse) prefixes and few records per cell; narrow spans get
 * long prefixes and more records per cell. Whatever the viewport, the number of prefixes
 * never exceeds the fan-out cap: precision is lowered until the cover fits, and at the floor
 * precision the cover is truncated to the cells nearest the center.
 */
@Component
public class CoveragePlanner {

    private static final Logger log = LoggerFactory.getLogger(CoveragePlanner.class);

    private static final double MIN_LONGITUDE_SCALE = 0.3;

    // {minimum max-span in degrees, precision}; first match wins
    private static final double[][] PRECISION_STEPS = {
        {40.0, 2},
        {10.0, 3},
        {2.0, 4},
        {0.3, 5},
        {0.05, 6},
        {0.01, 7},
    };

    // {minimum max-span in degrees, max prefixes, per-cell limit}; first match wins
    private static final double[][] CAP_STEPS = {
        {40.0, 32, 5},
        {15.0, 24, 10},
        {5.0, 16, 20},
        {1.0, 12, 40},
    };
    private static final FetchCaps CLOSE_ZOOM_CAPS = new FetchCaps(9, 100);

    private final int writePrecision;
    private final int floorPrecision;
    private final double worldScaleSpanDegrees;

    public CoveragePlanner(AppProperties appProperties) {
        this.writePrecision = appProperties.getIndex().getWritePrecision();
        this.floorPrecision = appProperties.getIndex().getFloorPrecision();
        this.worldScaleSpanDegrees = appProperties.getFetch().getWorldScaleSpanDegrees();
        if (floorPrecision < GeohashCodec.MIN_PRECISION || floorPrecision > writePrecision
            || writePrecision > GeohashCodec.MAX_PRECISION) {
            throw new IllegalStateException("invalid index precisions: floor=" + floorPrecision
                + " write=" + writePrecision);
        }
    }

    public CoveragePlan plan(Viewport viewport) {
        CoordinateSpan span = viewport.getSpan();
        FetchCaps caps = chooseFetchCaps(span);
        int precision = choosePrecision(span);
        while (precision > floorPrecision && estimateCellCount(viewport, precision) > caps.getMaxPrefixes()) {
            precision--;
        }
        CoverSet cover = coverBoundingBox(viewport, precision, caps.getMaxPrefixes());
        CoveragePlan plan = new CoveragePlan(cover, caps);
        log.debug("Planned {} for {}", plan, viewport);
        return plan;
    }

    /**
     * Monotone step function of the larger span axis, clamped to [floor, write] precision.
     */
    public int choosePrecision(CoordinateSpan span) {
        double maxSpan = span.maxDelta();
        int precision = writePrecision;
        for (double[] step : PRECISION_STEPS) {
            if (maxSpan >= step[0]) {
                precision = (int) step[1];
                break;
            }
        }
        return clampPrecision(precision);
    }

    public FetchCaps chooseFetchCaps(CoordinateSpan span) {
        double maxSpan = span.maxDelta();
        for (double[] step : CAP_STEPS) {
            if (maxSpan >= step[0]) {
                return new FetchCaps((int) step[1], (int) step[2]);
            }
        }
        return CLOSE_ZOOM_CAPS;
    }

    /**
     * Analytic cell count for the viewport box at {@code precision}. The longitude width is
     * widened by 1/max(cos(lat), 0.3) at the box center latitude, so this is a heuristic
     * and only needs to agree with {@link #coverBoundingBox} in trend.
     */
    public int estimateCellCount(Viewport viewport, int precision) {
        BoundingBox box = viewport.boundingBox();
        CellSize size = GeohashCodec.cellSize(precision);
        double correctedWidth = size.getLongitudeWidth() / longitudeScale(box.center().getLatitude());
        long rows = Math.max(1, (long) Math.ceil(box.latitudeSpan() / size.getLatitudeHeight()));
        long cols = Math.max(1, (long) Math.ceil(box.longitudeSpan() / correctedWidth));
        return (int) Math.min(Integer.MAX_VALUE, rows * cols);
    }

    /**
     * Walks the viewport box cell by cell and collects the geohash of every cell it touches.
     * When more than {@code cap} cells are needed the walk restarts one precision coarser,
     * down to the floor precision, where the cells nearest the viewport center are kept.
     */
    public CoverSet coverBoundingBox(Viewport viewport, int precision, int cap) {
        if (cap < 1) {
            throw new IllegalArgumentException("cap must be positive");
        }
        BoundingBox box = viewport.boundingBox();
        int current = clampPrecision(precision);
        while (true) {
            boolean atFloor = current <= floorPrecision;
            Map<String, Coordinate> cells = walk(box, current, atFloor ? Integer.MAX_VALUE : cap + 1);
            if (cells.size() <= cap) {
                return new CoverSet(cells.keySet(), current, false);
            }
            if (atFloor) {
                log.warn("Cover of {} needs {} cells at floor precision {}, truncating to {}",
                    viewport, cells.size(), current, cap);
                return new CoverSet(nearest(cells, viewport.getCenter(), cap), current, true);
            }
            current--;
        }
    }

    /**
     * The cell holding {@code center} plus the cells one step away in each compass direction,
     * found by offsetting the center by one cell height/width and re-encoding. Approximate
     * near cell corners and at high latitudes; duplicates are dropped.
     */
    public List<String> neighborPrefixes(Coordinate center, int precision) {
        int p = clampPrecision(precision);
        CellSize size = GeohashCodec.cellSize(p);
        Set<String> prefixes = new LinkedHashSet<>();
        prefixes.add(GeohashCodec.encode(center, p));
        for (int dLat = 1; dLat >= -1; dLat--) {
            for (int dLng = -1; dLng <= 1; dLng++) {
                if (dLat == 0 && dLng == 0) {
                    continue;
                }
                double lat = GeoValidator.clampLatitude(center.getLatitude() + dLat * size.getLatitudeHeight());
                double lng = GeoValidator.clampLongitude(center.getLongitude() + dLng * size.getLongitudeWidth());
                prefixes.add(GeohashCodec.encode(lat, lng, p));
            }
        }
        return new ArrayList<>(prefixes);
    }

    public boolean isWorldScale(CoordinateSpan span) {
        return span.maxDelta() >= worldScaleSpanDegrees;
    }

    public int getWritePrecision() {
        return writePrecision;
    }

    public int getFloorPrecision() {
        return floorPrecision;
    }

    private Map<String, Coordinate> walk(BoundingBox box, int precision, int limit) {
        CellSize size = GeohashCodec.cellSize(precision);
        double height = size.getLatitudeHeight();
        double width = size.getLongitudeWidth();

        // corner cells come from the encoder itself, so rounding can never shift the grid off by one
        BoundingBox first = GeohashCodec.decodeBounds(GeohashCodec.encode(box.getMinLat(), box.getMinLng(), precision));
        BoundingBox last = GeohashCodec.decodeBounds(GeohashCodec.encode(box.getMaxLat(), box.getMaxLng(), precision));
        long firstRow = Math.round((first.getMinLat() + 90.0) / height);
        long lastRow = Math.round((last.getMinLat() + 90.0) / height);
        long firstCol = Math.round((first.getMinLng() + 180.0) / width);
        long lastCol = Math.round((last.getMinLng() + 180.0) / width);

        Map<String, Coordinate> cells = new LinkedHashMap<>();
        for (long row = firstRow; row <= lastRow; row++) {
            double lat = -90.0 + (row + 0.5) * height;
            for (long col = firstCol; col <= lastCol; col++) {
                double lng = -180.0 + (col + 0.5) * width;
                cells.putIfAbsent(GeohashCodec.encode(lat, lng, precision), new Coordinate(lat, lng));
                if (cells.size() >= limit) {
                    return cells;
                }
            }
        }
        return cells;
    }

    private static Set<String> nearest(Map<String, Coordinate> cells, Coordinate center, int cap) {
        Set<String> kept = new LinkedHashSet<>();
        cells.entrySet().stream()
            .sorted(Comparator.comparingDouble(e -> squaredDegrees(e.getValue(), center)))
            .limit(cap)
            .forEach(e -> kept.add(e.getKey()));
        return kept;
    }

    private static double squaredDegrees(Coordinate a, Coordinate b) {
        double dLat = a.getLatitude() - b.getLatitude();
        double dLng = a.getLongitude() - b.getLongitude();
        return dLat * dLat + dLng * dLng;
    }

    private static double longitudeScale(double latitude) {
        return Math.max(Math.cos(Math.toRadians(latitude)), MIN_LONGITUDE_SCALE);
    }

    private int clampPrecision(int precision) {
        return Math.max(floorPrecision, Math.min(precision, writePrecision));
    }
}
