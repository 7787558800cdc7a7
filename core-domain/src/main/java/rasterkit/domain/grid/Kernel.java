package rasterkit.domain.grid;

import rasterkit.domain.array.BooleanNDArray;
import rasterkit.domain.array.NDArray;
import rasterkit.exception.ShapeMismatchException;

import java.util.Arrays;
import java.util.Objects;

/**
 * Núcleo cuadrado {@code n x n} para convolución. Se genera, nunca se persiste.
 */
public final class Kernel {

    private final NDArray weights;

    public Kernel(NDArray weights) {
        Objects.requireNonNull(weights, "Los pesos del núcleo no pueden ser nulos.");
        int[] shape = weights.shape();
        if (shape.length != 2 || shape[0] != shape[1]) {
            throw new ShapeMismatchException("El núcleo debe ser cuadrado de rango 2, forma recibida: "
                    + Arrays.toString(shape));
        }
        this.weights = weights.copy();
    }

    public int size() {
        return weights.dim(0);
    }

    public double get(int i, int j) {
        return weights.get(i, j);
    }

    public NDArray weights() {
        return weights.copy();
    }

    /**
     * Celdas con peso distinto de cero.
     */
    public BooleanNDArray footprint() {
        return weights.test(w -> w != 0.0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return weights.equals(((Kernel) o).weights);
    }

    @Override
    public int hashCode() {
        return weights.hashCode();
    }

    @Override
    public String toString() {
        return "Kernel{" + size() + "x" + size() + "}";
    }
}
