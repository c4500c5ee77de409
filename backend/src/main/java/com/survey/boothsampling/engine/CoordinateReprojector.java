package com.survey.boothsampling.engine;

import com.survey.boothsampling.exception.CoordinateReferenceException;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.Proj4jException;
import org.locationtech.proj4j.ProjCoordinate;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Moves coordinates between reference systems named by EPSG code.
 * Geographic systems use x = longitude, y = latitude.
 */
@Component
@Slf4j
public class CoordinateReprojector {

    public static final String WGS84 = "EPSG:4326";

    private static final Pattern EPSG_CODE = Pattern.compile("EPSG(?::|::|/0/|/)(\\d+)$");

    private final CRSFactory crsFactory = new CRSFactory();
    private final CoordinateTransformFactory transformFactory = new CoordinateTransformFactory();

    // Parsed systems are immutable, transforms are not, so only the former is shared
    private final Map<String, CoordinateReferenceSystem> systems = new ConcurrentHashMap<>();

    /**
     * Reduces the spellings found in GeoJSON and shapefile sidecars to {@code EPSG:<code>}.
     *
     * @return normalized name, or null when the input is blank
     */
    public static String normalize(String crs) {
        if (crs == null || crs.isBlank()) {
            return null;
        }
        String trimmed = crs.trim();
        String upper = trimmed.toUpperCase(Locale.ROOT);
        if (upper.endsWith("CRS84") || upper.endsWith("CRS:84")) {
            return WGS84;
        }
        Matcher matcher = EPSG_CODE.matcher(upper);
        if (matcher.find()) {
            return "EPSG:" + matcher.group(1);
        }
        return trimmed;
    }

    public static boolean sameReference(String first, String second) {
        String a = normalize(first);
        String b = normalize(second);
        return a != null && a.equals(b);
    }

    /**
     * Builds a transform from one named system to another. The returned operator is not
     * thread-safe and should stay within one region's processing.
     *
     * @throws CoordinateReferenceException if either name is unknown to the transform library
     */
    public UnaryOperator<Coordinate> transformer(String sourceCrs, String targetCrs) {
        if (sameReference(sourceCrs, targetCrs)) {
            return UnaryOperator.identity();
        }
        CoordinateTransform transform = transformFactory.createTransform(
                lookup(sourceCrs), lookup(targetCrs));
        ProjCoordinate in = new ProjCoordinate();
        ProjCoordinate out = new ProjCoordinate();
        return coordinate -> {
            in.x = coordinate.x;
            in.y = coordinate.y;
            try {
                transform.transform(in, out);
            } catch (Proj4jException e) {
                throw new CoordinateReferenceException(String.format(
                        "Cannot transform (%f, %f) from %s to %s", coordinate.x, coordinate.y,
                        sourceCrs, targetCrs), e);
            }
            return new Coordinate(out.x, out.y);
        };
    }

    public Coordinate transform(Coordinate coordinate, String sourceCrs, String targetCrs) {
        return transformer(sourceCrs, targetCrs).apply(coordinate);
    }

    public boolean isKnown(String crs) {
        try {
            lookup(crs);
            return true;
        } catch (CoordinateReferenceException e) {
            return false;
        }
    }

    private CoordinateReferenceSystem lookup(String crs) {
        String name = normalize(crs);
        if (name == null) {
            throw new CoordinateReferenceException("Coordinate reference system is not declared");
        }
        return systems.computeIfAbsent(name, key -> {
            try {
                log.debug("Parsing coordinate reference system {}", key);
                return crsFactory.createFromName(key);
            } catch (Proj4jException e) {
                throw new CoordinateReferenceException("Unknown coordinate reference system: " + key, e);
            }
        });
    }
}
