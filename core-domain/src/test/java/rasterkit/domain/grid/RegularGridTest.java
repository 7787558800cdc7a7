package rasterkit.domain.grid;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import rasterkit.domain.array.NDArray;
import rasterkit.exception.ShapeMismatchException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RegularGridTest {

    @Test
    @DisplayName("Mapeo afín: los límites caen en los píxeles 0 y n-1")
    void toPixel_shouldMapLimitsToFirstAndLastPixel() {
        // ARRANGE
        RegularGrid grid = new RegularGrid(List.of(AxisLimits.of(10.0, 20.0), AxisLimits.of(-1.0, 1.0)), new int[]{11, 5});

        // ACT & ASSERT
        assertEquals(0.0, grid.toPixel(0, 10.0), 1e-12);
        assertEquals(10.0, grid.toPixel(0, 20.0), 1e-12);
        assertEquals(2.5, grid.toPixel(0, 12.5), 1e-12);
        assertArrayEquals(new double[]{0.0, 2.0, 4.0}, grid.toPixels(1, new double[]{-1.0, 0.0, 1.0}), 1e-12);
    }

    @Test
    @DisplayName("Límites y tamaños en número distinto -> ShapeMismatch")
    void constructor_shouldRejectMismatchedRank() {
        assertThrows(ShapeMismatchException.class,
                () -> new RegularGrid(List.of(AxisLimits.of(0, 1)), new int[]{2, 2}));
    }

    @Test
    @DisplayName("TargetGrid: forma y número de puntos de la malla destino")
    void targetGrid_shouldReportShape() {
        TargetGrid target = TargetGrid.of(new double[]{0, 1, 2}, new double[]{5, 6});

        assertArrayEquals(new int[]{3, 2}, target.shape());
        assertEquals(6, target.pointCount());
        assertEquals(2, target.rank());
    }

    @Test
    @DisplayName("Kernel: solo núcleos cuadrados de rango 2")
    void kernel_shouldRequireSquareMatrix() {
        assertThrows(ShapeMismatchException.class, () -> new Kernel(NDArray.zeros(2, 3)));
        assertThrows(ShapeMismatchException.class, () -> new Kernel(NDArray.zeros(3)));

        Kernel kernel = new Kernel(NDArray.fromMatrix(new double[][]{{0, 1}, {1, 0}}));
        assertEquals(2, kernel.size());
        assertEquals(2, kernel.footprint().count());
    }

    @Test
    @DisplayName("InterpolationOrder: solo órdenes 0 y 1")
    void interpolationOrder_shouldOnlyAcceptZeroAndOne() {
        assertEquals(InterpolationOrder.NEAREST, InterpolationOrder.fromOrder(0));
        assertEquals(InterpolationOrder.LINEAR, InterpolationOrder.fromOrder(1));
        assertThrows(IllegalArgumentException.class, () -> InterpolationOrder.fromOrder(3));
    }

    @Test
    @DisplayName("Coordinates: exige secuencias estrictamente crecientes")
    void coordinates_shouldRequireStrictlyIncreasing() {
        assertTrue(Coordinates.isStrictlyIncreasing(new double[]{0, 1, 3}));
        assertFalse(Coordinates.isStrictlyIncreasing(new double[]{0, 1, 1}));
        assertThrows(IllegalArgumentException.class,
                () -> Coordinates.requireStrictlyIncreasing("x", new double[]{0}, 2));
        assertThrows(IllegalArgumentException.class,
                () -> Coordinates.requireStrictlyIncreasing("x", new double[]{0, Double.NaN}, 2));
    }
}
