package org.Aayush.planning.workspace;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.locationtech.jts.geom.util.AffineTransformation;
import org.locationtech.jts.operation.valid.IsValidOp;
import org.locationtech.jts.operation.valid.TopologyValidationError;
import org.locationtech.jts.simplify.TopologyPreservingSimplifier;

import java.util.Objects;

/**
 * Simple polygon backed by a JTS {@link Polygon}.
 * <p>
 * Point and segment queries go through a {@link PreparedGeometry}, which caches the
 * spatial index of the ring. Containment is closed: boundary points are inside.
 * </p>
 */
public final class PolygonShape implements RegionShape {
    private static final GeometryFactory GEOMETRY = new GeometryFactory();
    private static final double MIN_AREA = 1e-12;
    private static final double COLLINEAR_EPS = 1e-12;
    /** Tolerance used to simplify buffered outlines after footprint inflation. */
    private static final double INFLATION_SIMPLIFY_TOLERANCE = 0.01;

    private final Polygon polygon;
    private final PreparedGeometry prepared;

    private PolygonShape(Polygon polygon) {
        this.polygon = polygon;
        this.prepared = PreparedGeometryFactory.prepare(polygon);
    }

    /**
     * Builds a polygon from its outer ring. The ring is closed automatically.
     *
     * @param vertices {@code {x, y}} pairs in either winding order.
     * @throws GeometryException when the ring is degenerate or self-intersecting.
     */
    public static PolygonShape of(double[]... vertices) {
        Objects.requireNonNull(vertices, "vertices");
        if (vertices.length < 3) {
            throw new GeometryException(
                    GeometryException.REASON_DEGENERATE_REGION,
                    "polygon needs at least 3 vertices, got " + vertices.length
            );
        }
        Coordinate[] ring = new Coordinate[vertices.length + 1];
        for (int i = 0; i < vertices.length; i++) {
            double[] v = vertices[i];
            if (v == null || v.length != 2) {
                throw new GeometryException(
                        GeometryException.REASON_DIMENSION_MISMATCH,
                        "polygon vertex " + i + " must be an {x, y} pair"
                );
            }
            if (!Double.isFinite(v[0]) || !Double.isFinite(v[1])) {
                throw new GeometryException(
                        GeometryException.REASON_NON_FINITE_COORDINATE,
                        "polygon vertex " + i + " must be finite"
                );
            }
            ring[i] = new Coordinate(v[0], v[1]);
        }
        ring[vertices.length] = new Coordinate(ring[0]);
        if (allCollinear(ring)) {
            throw new GeometryException(
                    GeometryException.REASON_DEGENERATE_REGION,
                    "polygon vertices are collinear or repeated (zero area)"
            );
        }
        return fromPolygon(GEOMETRY.createPolygon(ring));
    }

    /**
     * Axis-aligned box.
     */
    public static PolygonShape box(double minX, double minY, double maxX, double maxY) {
        return of(
                new double[]{minX, minY},
                new double[]{maxX, minY},
                new double[]{maxX, maxY},
                new double[]{minX, maxY}
        );
    }

    private static PolygonShape fromPolygon(Polygon polygon) {
        IsValidOp validOp = new IsValidOp(polygon);
        TopologyValidationError error = validOp.getValidationError();
        if (error != null) {
            String reason = error.getErrorType() == TopologyValidationError.SELF_INTERSECTION
                    || error.getErrorType() == TopologyValidationError.RING_SELF_INTERSECTION
                    ? GeometryException.REASON_SELF_INTERSECTING_REGION
                    : GeometryException.REASON_DEGENERATE_REGION;
            throw new GeometryException(reason, "invalid polygon: " + error.getMessage()
                    + " at " + error.getCoordinate());
        }
        if (polygon.getNumInteriorRing() > 0) {
            throw new GeometryException(
                    GeometryException.REASON_DEGENERATE_REGION,
                    "polygon regions must not have holes"
            );
        }
        if (polygon.getArea() <= MIN_AREA) {
            throw new GeometryException(
                    GeometryException.REASON_DEGENERATE_REGION,
                    "polygon area must be > " + MIN_AREA + ", got " + polygon.getArea()
            );
        }
        return new PolygonShape(polygon);
    }

    private static boolean allCollinear(Coordinate[] ring) {
        Coordinate a = ring[0];
        for (int i = 1; i < ring.length - 1; i++) {
            for (int j = i + 1; j < ring.length - 1; j++) {
                Coordinate b = ring[i];
                Coordinate c = ring[j];
                double cross = (b.x - a.x) * (c.y - a.y) - (b.y - a.y) * (c.x - a.x);
                if (Math.abs(cross) > COLLINEAR_EPS) {
                    return false;
                }
            }
        }
        return true;
    }

    @Override
    public boolean contains(double x, double y) {
        return prepared.covers(point(x, y));
    }

    @Override
    public boolean intersectsSegment(double x1, double y1, double x2, double y2) {
        if (x1 == x2 && y1 == y2) {
            return contains(x1, y1);
        }
        Geometry segment = GEOMETRY.createLineString(new Coordinate[]{
                new Coordinate(x1, y1),
                new Coordinate(x2, y2)
        });
        return prepared.intersects(segment);
    }

    @Override
    public Envelope envelope() {
        return new Envelope(polygon.getEnvelopeInternal());
    }

    @Override
    public double area() {
        return polygon.getArea();
    }

    /**
     * Buffers the outline by {@code clearance} and simplifies the rounded corners.
     */
    @Override
    public PolygonShape inflate(double clearance) {
        ShapeArguments.requireClearance(clearance);
        if (clearance == 0.0d) {
            return this;
        }
        Geometry buffered = polygon.buffer(clearance);
        Geometry simplified = TopologyPreservingSimplifier.simplify(buffered, INFLATION_SIMPLIFY_TOLERANCE);
        if (!(simplified instanceof Polygon)) {
            throw new GeometryException(
                    GeometryException.REASON_DEGENERATE_REGION,
                    "inflation produced " + simplified.getGeometryType() + " instead of a polygon"
            );
        }
        return fromPolygon((Polygon) simplified);
    }

    @Override
    public PolygonShape scale(double factor) {
        ShapeArguments.requirePositiveFactor(factor);
        Point centroid = polygon.getCentroid();
        AffineTransformation transformation =
                AffineTransformation.scaleInstance(factor, factor, centroid.getX(), centroid.getY());
        return fromPolygon((Polygon) transformation.transform(polygon));
    }

    /**
     * @return copy of the outer ring, closing vertex excluded.
     */
    public double[][] vertices() {
        Coordinate[] ring = polygon.getExteriorRing().getCoordinates();
        double[][] out = new double[ring.length - 1][];
        for (int i = 0; i < out.length; i++) {
            out[i] = new double[]{ring[i].x, ring[i].y};
        }
        return out;
    }

    private static Point point(double x, double y) {
        return GEOMETRY.createPoint(new Coordinate(x, y));
    }

    @Override
    public String toString() {
        return "Polygon" + polygon.toText().substring("POLYGON".length());
    }
}
