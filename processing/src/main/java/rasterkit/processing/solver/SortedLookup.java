package rasterkit.processing.solver;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/**
 * Búsqueda del índice más próximo a un valor en una secuencia ordenada ascendentemente.
 */
public final class SortedLookup {

    /**
     * Lado preferido al buscar el índice más próximo.
     */
    public enum Location {
        /** Elemento más cercano por la izquierda (o igual). */
        LEFT,
        /** Elemento más cercano por la derecha (o igual). */
        RIGHT,
        /** Elemento más cercano; en caso de empate, el de menor índice. */
        CLOSEST;

        public static Location parse(String name) {
            Objects.requireNonNull(name, "La ubicación no puede ser nula.");
            try {
                return valueOf(name.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Ubicación no válida '" + name + "'. Se esperaba una de: "
                        + Arrays.toString(values()), e);
            }
        }
    }

    /**
     * Prohibido construir esta clase utilidad
     */
    private SortedLookup() {
    }

    public static int closestIndex(double[] sorted, double value) {
        return closestIndex(sorted, value, Location.CLOSEST);
    }

    /**
     * Fuera del rango de la secuencia devuelve el primer o el último índice, sea cual sea {@code location}.
     *
     * @throws IllegalArgumentException si la secuencia está vacía.
     */
    public static int closestIndex(double[] sorted, double value, Location location) {
        Objects.requireNonNull(sorted, "La secuencia no puede ser nula.");
        Objects.requireNonNull(location, "La ubicación no puede ser nula.");
        if (sorted.length == 0) {
            throw new IllegalArgumentException("No se puede buscar en una secuencia vacía.");
        }

        int pos = lowerBound(sorted, value);
        if (pos == 0) {
            return 0;
        }
        if (pos == sorted.length) {
            return sorted.length - 1;
        }
        return switch (location) {
            case CLOSEST -> value - sorted[pos - 1] <= sorted[pos] - value ? pos - 1 : pos;
            case LEFT -> value == sorted[pos] ? pos : pos - 1;
            case RIGHT -> pos;
        };
    }

    // Primera posición cuyo valor no es menor que 'value'.
    private static int lowerBound(double[] sorted, double value) {
        int lo = 0;
        int hi = sorted.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (sorted[mid] < value) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }
}
