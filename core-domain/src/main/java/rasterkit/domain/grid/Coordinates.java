package rasterkit.domain.grid;

import java.util.Objects;

/**
 * Validaciones de secuencias de coordenadas 1D.
 */
public final class Coordinates {

    /**
     * Prohibido construir esta clase utilidad
     */
    private Coordinates() {
    }

    public static boolean isStrictlyIncreasing(double[] values) {
        for (int i = 1; i < values.length; i++) {
            if (!(values[i] > values[i - 1])) {
                return false;
            }
        }
        return true;
    }

    /**
     * @throws IllegalArgumentException si la secuencia tiene menos de {@code minLength} puntos o no es estrictamente creciente.
     */
    public static double[] requireStrictlyIncreasing(String name, double[] values, int minLength) {
        Objects.requireNonNull(values, "Las coordenadas '" + name + "' no pueden ser nulas.");
        if (values.length < minLength) {
            throw new IllegalArgumentException("Las coordenadas '" + name + "' necesitan al menos "
                    + minLength + " puntos, se recibieron " + values.length + ".");
        }
        if (!isStrictlyIncreasing(values)) {
            throw new IllegalArgumentException("Las coordenadas '" + name + "' deben ser estrictamente crecientes.");
        }
        return values;
    }
}
