package rasterkit.processing.geo;

import lombok.extern.slf4j.Slf4j;
import rasterkit.domain.array.BooleanNDArray;
import rasterkit.domain.geometry.PlanarPoint;

import java.awt.geom.Path2D;
import java.util.List;
import java.util.Objects;

/**
 * Rasteriza un polígono sobre una malla rectilínea: cada nodo {@code (x[i], y[j])}
 * se marca si cae dentro del polígono según la regla par-impar.
 */
@Slf4j
public final class PolygonRasterizer {

    /**
     * Prohibido construir esta clase utilidad
     */
    private PolygonRasterizer() {
    }

    /**
     * @param vertices Vértices del polígono, en orden; se cierra automáticamente.
     * @param x        Coordenadas del eje 0 de la malla.
     * @param y        Coordenadas del eje 1 de la malla.
     * @return Máscara de forma {@code (x.length, y.length)}.
     * @throws IllegalArgumentException si el polígono tiene menos de 3 vértices.
     */
    public static BooleanNDArray rasterize(List<PlanarPoint> vertices, double[] x, double[] y) {
        Objects.requireNonNull(vertices, "Los vértices no pueden ser nulos.");
        Objects.requireNonNull(x, "Las coordenadas x no pueden ser nulas.");
        Objects.requireNonNull(y, "Las coordenadas y no pueden ser nulas.");
        if (vertices.size() < 3) {
            throw new IllegalArgumentException("Un polígono necesita al menos 3 vértices, se recibieron " + vertices.size() + ".");
        }

        Path2D path = new Path2D.Double(Path2D.WIND_EVEN_ODD);
        path.moveTo(vertices.get(0).x(), vertices.get(0).y());
        for (int k = 1; k < vertices.size(); k++) {
            path.lineTo(vertices.get(k).x(), vertices.get(k).y());
        }
        path.closePath();

        BooleanNDArray mask = BooleanNDArray.falses(x.length, y.length);
        for (int i = 0; i < x.length; i++) {
            for (int j = 0; j < y.length; j++) {
                if (path.contains(x[i], y[j])) {
                    mask.set(true, i, j);
                }
            }
        }
        log.debug("Polígono de {} vértices rasterizado: {}", vertices.size(), mask);
        return mask;
    }
}
