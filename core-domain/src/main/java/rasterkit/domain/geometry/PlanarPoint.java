package rasterkit.domain.geometry;

/**
 * Punto del plano.
 */
public record PlanarPoint(double x, double y) {

    public static PlanarPoint of(double x, double y) {
        return new PlanarPoint(x, y);
    }
}
