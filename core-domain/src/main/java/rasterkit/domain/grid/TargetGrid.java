package rasterkit.domain.grid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Malla destino: una secuencia 1D de coordenadas físicas por eje regridado.
 * Su producto exterior (indexado matricial, el primer eje varía más lento)
 * forma la malla completa de puntos destino.
 */
public final class TargetGrid {

    private final List<double[]> axes;

    public TargetGrid(List<double[]> axes) {
        Objects.requireNonNull(axes, "Los ejes destino no pueden ser nulos.");
        List<double[]> copy = new ArrayList<>(axes.size());
        for (double[] axis : axes) {
            copy.add(Objects.requireNonNull(axis, "Un eje destino no puede ser nulo.").clone());
        }
        this.axes = Collections.unmodifiableList(copy);
    }

    public static TargetGrid of(double[]... axes) {
        return new TargetGrid(List.of(axes));
    }

    public int rank() {
        return axes.size();
    }

    public double[] axis(int index) {
        return axes.get(index).clone();
    }

    /**
     * Forma de la malla destino: la longitud de cada eje.
     */
    public int[] shape() {
        int[] shape = new int[axes.size()];
        for (int i = 0; i < shape.length; i++) {
            shape[i] = axes.get(i).length;
        }
        return shape;
    }

    public int pointCount() {
        int count = 1;
        for (double[] axis : axes) {
            count = Math.multiplyExact(count, axis.length);
        }
        return count;
    }
}
