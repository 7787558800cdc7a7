package rasterkit.domain.grid;

import java.util.Arrays;

/**
 * Orden de interpolación soportado por el interpolador de coordenadas.
 */
public enum InterpolationOrder {
    /**
     * Orden 0: vecino más próximo.
     */
    NEAREST(0),
    /**
     * Orden 1: lineal por tramos (multilineal en N dimensiones).
     */
    LINEAR(1);

    private final int order;

    InterpolationOrder(int order) {
        this.order = order;
    }

    public int getOrder() {
        return order;
    }

    /**
     * @throws IllegalArgumentException si el orden no está soportado.
     */
    public static InterpolationOrder fromOrder(int order) {
        for (InterpolationOrder value : values()) {
            if (value.order == order) {
                return value;
            }
        }
        throw new IllegalArgumentException("Orden de interpolación no soportado: " + order
                + ". Valores válidos: " + Arrays.toString(values()));
    }
}
