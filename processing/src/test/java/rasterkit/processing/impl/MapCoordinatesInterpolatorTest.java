package rasterkit.processing.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import rasterkit.domain.array.NDArray;
import rasterkit.domain.grid.InterpolationOrder;
import rasterkit.exception.ShapeMismatchException;

import static org.junit.jupiter.api.Assertions.*;

class MapCoordinatesInterpolatorTest {

    private final MapCoordinatesInterpolator interpolator = new MapCoordinatesInterpolator();
    private final NDArray square = NDArray.fromMatrix(new double[][]{{0, 1}, {2, 3}});

    @Test
    @DisplayName("Orden 1: interpolación bilineal en el centro de la celda")
    void linear_shouldInterpolateBilinearly() {
        double[] values = interpolator.interpolate(square, new double[][]{{0.5, 0.0, 1.0}, {0.5, 0.25, 1.0}},
                InterpolationOrder.LINEAR, Double.NaN);

        assertArrayEquals(new double[]{1.5, 0.25, 3.0}, values, 1e-12);
    }

    @Test
    @DisplayName("Orden 0: vecino más próximo, medios hacia arriba")
    void nearest_shouldRoundHalfUp() {
        double[] values = interpolator.interpolate(square, new double[][]{{0.5, 0.49}, {0.49, 0.5}},
                InterpolationOrder.NEAREST, Double.NaN);

        assertArrayEquals(new double[]{2.0, 1.0}, values, 1e-12);
    }

    @Test
    @DisplayName("Puntos fuera de [0, n-1] o no finitos reciben el valor de relleno")
    void outside_shouldReceiveFillValue() {
        double[] values = interpolator.interpolate(square,
                new double[][]{{-0.1, 1.5, Double.NaN, 1.0 + 1e-12}, {0.0, 0.0, 0.0, 0.0}},
                InterpolationOrder.LINEAR, -9.0);

        assertEquals(-9.0, values[0]);
        assertEquals(-9.0, values[1]);
        assertEquals(-9.0, values[2]);
        assertEquals(2.0, values[3], 1e-9);
    }

    @Test
    @DisplayName("Corte no cuadrado: la fila d de coordenadas corresponde al eje d")
    void linear_nonSquare_shouldKeepAxisOrder() {
        NDArray rect = NDArray.fromMatrix(new double[][]{{0, 1, 2}, {10, 11, 12}});

        double[] values = interpolator.interpolate(rect, new double[][]{{1.0, 0.5}, {1.5, 2.0}},
                InterpolationOrder.LINEAR, Double.NaN);

        assertArrayEquals(new double[]{11.5, 7.0}, values, 1e-12);
    }

    @Test
    @DisplayName("1D: el extremo superior usa el último intervalo")
    void linear1D_shouldHandleUpperEdge() {
        NDArray line = NDArray.of(new double[]{0, 10, 20}, 3);

        double[] values = interpolator.interpolate(line, new double[][]{{0.25, 1.5, 2.0}},
                InterpolationOrder.LINEAR, Double.NaN);

        assertArrayEquals(new double[]{2.5, 15.0, 20.0}, values, 1e-12);
    }

    @Test
    @DisplayName("Número de filas de coordenadas distinto del rango -> ShapeMismatch")
    void interpolate_shouldValidateCoordinateRows() {
        assertThrows(ShapeMismatchException.class, () -> interpolator.interpolate(square,
                new double[][]{{0.0}}, InterpolationOrder.LINEAR, 0.0));
        assertThrows(ShapeMismatchException.class, () -> interpolator.interpolate(square,
                new double[][]{{0.0, 1.0}, {0.0}}, InterpolationOrder.LINEAR, 0.0));
    }
}
