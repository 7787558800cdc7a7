package rasterkit.domain.signal;

/**
 * Ventana de índices enteros {@code [t1, t2]} que acota una búsqueda por bisección.
 *
 * @param t1 Índice inferior (incluido).
 * @param t2 Índice superior (incluido), estrictamente mayor que {@code t1}.
 */
public record SearchWindow(int t1, int t2) {

    public SearchWindow {
        if (t1 < 0) {
            throw new IllegalArgumentException("El límite inferior de la ventana no puede ser negativo: " + t1);
        }
        if (t1 >= t2) {
            throw new IllegalArgumentException("La ventana de búsqueda debe cumplir t1 < t2, recibido ["
                    + t1 + ", " + t2 + "].");
        }
    }

    /**
     * Ventana completa de una señal de {@code length} muestras.
     */
    public static SearchWindow full(int length) {
        return new SearchWindow(0, length - 1);
    }

    public int width() {
        return t2 - t1;
    }
}
