package rasterkit.processing.geo;

import rasterkit.domain.geometry.BoundingBox;
import rasterkit.domain.geometry.PlanarPoint;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Intersecciones de rectas y segmentos con los bordes de una caja alineada con los ejes.
 */
public final class BoxIntersection {

    /**
     * Prohibido construir esta clase utilidad
     */
    private BoxIntersection() {
    }

    /**
     * Puntos en los que la recta {@code y = point.y + slope * (x - point.x)} toca el borde de la caja.
     * Una esquina tocada por dos lados aparece una sola vez.
     *
     * @return Conjunto vacío si la recta no toca la caja.
     */
    public static Set<PlanarPoint> lineIntersections(PlanarPoint point, double slope, BoundingBox box) {
        Objects.requireNonNull(point, "El punto no puede ser nulo.");
        Objects.requireNonNull(box, "La caja no puede ser nula.");
        PlanarPoint bl = box.bottomLeft();
        PlanarPoint ur = box.upperRight();
        Set<PlanarPoint> points = new LinkedHashSet<>();

        // Lados izquierdo y derecho
        for (double x : new double[]{bl.x(), ur.x()}) {
            double y = point.y() + (x - point.x()) * slope;
            if (box.containsY(y)) {
                points.add(new PlanarPoint(x, y));
            }
        }

        // Lados inferior y superior; una recta horizontal no los corta en un punto
        if (slope != 0) {
            for (double y : new double[]{bl.y(), ur.y()}) {
                double x = point.x() + (y - point.y()) / slope;
                if (box.containsX(x)) {
                    points.add(new PlanarPoint(x, y));
                }
            }
        }
        return points;
    }

    /**
     * Puntos en los que el segmento {@code [p1, p2]} toca el borde de la caja.
     * Los segmentos verticales se tratan aparte.
     */
    public static Set<PlanarPoint> segmentIntersections(PlanarPoint p1, PlanarPoint p2, BoundingBox box) {
        Objects.requireNonNull(p1, "El primer extremo no puede ser nulo.");
        Objects.requireNonNull(p2, "El segundo extremo no puede ser nulo.");
        Objects.requireNonNull(box, "La caja no puede ser nula.");

        Set<PlanarPoint> candidates;
        if (p1.x() == p2.x()) {
            candidates = new LinkedHashSet<>();
            if (box.containsX(p1.x())) {
                candidates.add(new PlanarPoint(p1.x(), box.bottomLeft().y()));
                candidates.add(new PlanarPoint(p1.x(), box.upperRight().y()));
            }
        } else {
            double slope = (p2.y() - p1.y()) / (p2.x() - p1.x());
            candidates = lineIntersections(p1, slope, box);
        }

        double xMin = Math.min(p1.x(), p2.x());
        double xMax = Math.max(p1.x(), p2.x());
        double yMin = Math.min(p1.y(), p2.y());
        double yMax = Math.max(p1.y(), p2.y());
        Set<PlanarPoint> points = new LinkedHashSet<>();
        for (PlanarPoint p : candidates) {
            if (p.x() >= xMin && p.x() <= xMax && p.y() >= yMin && p.y() <= yMax) {
                points.add(p);
            }
        }
        return points;
    }
}
