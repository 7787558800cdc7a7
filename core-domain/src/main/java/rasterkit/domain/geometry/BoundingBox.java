package rasterkit.domain.geometry;

import java.util.Objects;

/**
 * Rectángulo alineado con los ejes, dado por sus esquinas inferior izquierda y superior derecha.
 */
public record BoundingBox(PlanarPoint bottomLeft, PlanarPoint upperRight) {

    public BoundingBox {
        Objects.requireNonNull(bottomLeft, "La esquina inferior izquierda no puede ser nula.");
        Objects.requireNonNull(upperRight, "La esquina superior derecha no puede ser nula.");
        if (bottomLeft.x() > upperRight.x() || bottomLeft.y() > upperRight.y()) {
            throw new IllegalArgumentException("Caja inválida: " + bottomLeft + " no está por debajo y a la izquierda de " + upperRight);
        }
    }

    public static BoundingBox of(double xMin, double yMin, double xMax, double yMax) {
        return new BoundingBox(new PlanarPoint(xMin, yMin), new PlanarPoint(xMax, yMax));
    }

    public boolean containsX(double x) {
        return bottomLeft.x() <= x && x <= upperRight.x();
    }

    public boolean containsY(double y) {
        return bottomLeft.y() <= y && y <= upperRight.y();
    }
}
