package rasterkit.domain.grid;

import rasterkit.exception.ShapeMismatchException;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Malla cartesiana regular implícita: límites {@code [min, max]} por eje junto
 * con el número de muestras del array a lo largo de ese eje.
 * <p>
 * Es el mapeador afín de coordenadas físicas a índices de píxel fraccionarios:
 * <pre>
 *     p = (c - lo) * (n - 1) / (hi - lo)
 * </pre>
 * No interpola: el resultado se entrega a un interpolador independiente.
 */
public final class RegularGrid {

    private final List<AxisLimits> limits;
    private final int[] sizes;

    public RegularGrid(List<AxisLimits> limits, int[] sizes) {
        Objects.requireNonNull(limits, "Los límites no pueden ser nulos.");
        Objects.requireNonNull(sizes, "Los tamaños no pueden ser nulos.");
        if (limits.size() != sizes.length) {
            throw new ShapeMismatchException("Se recibieron " + limits.size() + " límites para "
                    + sizes.length + " ejes.");
        }
        this.limits = List.copyOf(limits);
        this.sizes = sizes.clone();
    }

    public int rank() {
        return sizes.length;
    }

    public int[] sizes() {
        return sizes.clone();
    }

    public AxisLimits limits(int axis) {
        return limits.get(axis);
    }

    /**
     * Índice de píxel fraccionario de la coordenada física {@code coordinate} en el eje {@code axis}.
     */
    public double toPixel(int axis, double coordinate) {
        AxisLimits l = limits.get(axis);
        return (coordinate - l.min()) * (sizes[axis] - 1) / (l.max() - l.min());
    }

    /**
     * Mapea una secuencia completa de coordenadas de un eje.
     */
    public double[] toPixels(int axis, double[] coordinates) {
        double[] pixels = new double[coordinates.length];
        for (int i = 0; i < coordinates.length; i++) {
            pixels[i] = toPixel(axis, coordinates[i]);
        }
        return pixels;
    }

    @Override
    public String toString() {
        return "RegularGrid{limits=" + limits + ", sizes=" + Arrays.toString(sizes) + "}";
    }
}
