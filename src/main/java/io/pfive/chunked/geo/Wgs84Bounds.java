// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.geo;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;

import static com.google.common.base.Preconditions.checkArgument;

/// A geographic bounding box in WGS84 degrees. Width and height instead of min/max are somewhat
/// easier to validate as long as all values are positive. These serve the same purpose as a JTS
/// Envelope, and can be converted to one for geometric operations.
public record Wgs84Bounds(double minLon, double minLat, double widthLon, double heightLat) {

    private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();

    public Wgs84Bounds {
        checkArgument(widthLon >= 0 && heightLat >= 0, "Bounds must have non-negative width and height.");
    }

    public static Wgs84Bounds fromMinMax (double minLon, double minLat, double maxLon, double maxLat) {
        return new Wgs84Bounds(minLon, minLat, maxLon - minLon, maxLat - minLat);
    }

    public double maxLon () { return minLon + widthLon; }
    public double maxLat () { return minLat + heightLat; }

    public static Wgs84Bounds fromWgsEnvelope (Envelope env) {
        return new Wgs84Bounds(env.getMinX(), env.getMinY(), env.getWidth(), env.getHeight());
    }

    public Envelope toEnvelope () {
        return new Envelope(minLon, maxLon(), minLat, maxLat());
    }

    public Geometry toGeometry () {
        return GEOMETRY_FACTORY.toGeometry(toEnvelope());
    }

    /// Create a new Wgs84Bounds that is a minimal bounding box for this one and the supplied one.
    public Wgs84Bounds encompass (Wgs84Bounds other) {
        double xMin = Math.min(minLon, other.minLon);
        double yMin = Math.min(minLat, other.minLat);
        double xMax = Math.max(maxLon(), other.maxLon());
        double yMax = Math.max(maxLat(), other.maxLat());
        return fromMinMax(xMin, yMin, xMax, yMax);
    }

    /// Return the part of this box that lies inside the other one, or null if they do not overlap.
    public Wgs84Bounds intersection (Wgs84Bounds other) {
        Envelope env = toEnvelope().intersection(other.toEnvelope());
        if (env.isNull()) return null;
        return fromWgsEnvelope(env);
    }

    @JsonIgnore
    public double area () {
        return widthLon * heightLat;
    }

}
