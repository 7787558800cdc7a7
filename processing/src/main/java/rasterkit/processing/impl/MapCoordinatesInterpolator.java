package rasterkit.processing.impl;

import net.imglib2.RandomAccessible;
import net.imglib2.RealRandomAccess;
import net.imglib2.interpolation.InterpolatorFactory;
import net.imglib2.interpolation.randomaccess.NLinearInterpolatorFactory;
import net.imglib2.interpolation.randomaccess.NearestNeighborInterpolatorFactory;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;
import rasterkit.domain.array.NDArray;
import rasterkit.domain.grid.InterpolationOrder;
import rasterkit.exception.ShapeMismatchException;
import rasterkit.processing.i.ICoordinateInterpolator;

import java.util.Arrays;
import java.util.Objects;

/**
 * Interpolador N-dimensional sobre coordenadas de píxel fraccionarias.
 * <p>
 * Orden 0 toma el píxel más próximo (medios hacia arriba). Orden 1 combina los
 * {@code 2^k} vecinos con pesos multilineales. Un punto con alguna coordenada
 * no finita o fuera de {@code [0, n - 1]} recibe el valor de relleno.
 * <p>
 * La evaluación se delega en los interpoladores de imglib2 sobre una extensión
 * por borde del corte: en el extremo {@code n - 1} el vecino exterior pesa cero
 * y nunca contamina el resultado con el relleno.
 */
public class MapCoordinatesInterpolator implements ICoordinateInterpolator {

    /**
     * Holgura para absorber el error de redondeo del mapeo afín en los bordes.
     */
    private static final double EDGE_TOLERANCE = 1e-9;

    @Override
    public String getName() {
        return "MapCoordinates";
    }

    @Override
    public String getDescription() {
        return "Interpolación de vecino más próximo o multilineal en coordenadas de píxel, con relleno constante fuera del dominio.";
    }

    @Override
    public double[] interpolate(NDArray slice, double[][] coordinates, InterpolationOrder order, double fillValue) {
        Objects.requireNonNull(order, "El orden de interpolación no puede ser nulo.");
        int rank = slice.rank();
        if (coordinates.length != rank) {
            throw new ShapeMismatchException("Se recibieron coordenadas para " + coordinates.length
                    + " ejes, pero el corte tiene rango " + rank + ".");
        }
        int points = rank == 0 ? 1 : coordinates[0].length;
        for (double[] axis : coordinates) {
            if (axis.length != points) {
                throw new ShapeMismatchException("Todas las filas de coordenadas deben tener " + points + " puntos.");
            }
        }

        double[] values = new double[points];
        if (rank == 0) {
            Arrays.fill(values, slice.getFlat(0));
            return values;
        }
        if (slice.size() == 0) {
            Arrays.fill(values, fillValue);
            return values;
        }

        RandomAccessible<DoubleType> extended = Views.extendBorder(NDArrayImgs.wrap(slice));
        RealRandomAccess<DoubleType> access = Views.interpolate(extended, factoryFor(order)).realRandomAccess();
        int[] shape = slice.shape();
        for (int p = 0; p < points; p++) {
            boolean inside = true;
            for (int d = 0; d < rank && inside; d++) {
                double pixel = coordinates[d][p];
                if (!Double.isFinite(pixel) || pixel < -EDGE_TOLERANCE || pixel > shape[d] - 1 + EDGE_TOLERANCE) {
                    inside = false;
                } else {
                    access.setPosition(Math.min(Math.max(pixel, 0.0), shape[d] - 1), NDArrayImgs.dimensionOf(d, rank));
                }
            }
            values[p] = inside ? access.get().getRealDouble() : fillValue;
        }
        return values;
    }

    private static InterpolatorFactory<DoubleType, RandomAccessible<DoubleType>> factoryFor(InterpolationOrder order) {
        return switch (order) {
            case NEAREST -> new NearestNeighborInterpolatorFactory<>();
            case LINEAR -> new NLinearInterpolatorFactory<>();
        };
    }
}
