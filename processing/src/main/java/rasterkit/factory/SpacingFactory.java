package rasterkit.factory;

/**
 * Generación de secuencias de coordenadas 1D para construir mallas destino.
 */
public final class SpacingFactory {

    private static final double DEFAULT_STRETCH = 2.0;

    /**
     * Prohibido construir esta clase utilidad
     */
    private SpacingFactory() {
    }

    /**
     * {@code n} valores equiespaciados entre {@code min} y {@code max}, ambos incluidos.
     */
    public static double[] linspace(int n, double min, double max) {
        if (n < 0) {
            throw new IllegalArgumentException("El número de puntos no puede ser negativo: " + n);
        }
        double[] values = new double[n];
        if (n == 1) {
            values[0] = min;
            return values;
        }
        double step = (max - min) / (n - 1);
        for (int i = 0; i < n; i++) {
            values[i] = min + i * step;
        }
        if (n > 1) {
            values[n - 1] = max; // Extremo exacto, sin error acumulado
        }
        return values;
    }

    public static double[] nonlinspace(int n, double min, double max) {
        return nonlinspace(n, min, max, DEFAULT_STRETCH);
    }

    /**
     * {@code n} valores entre {@code min} y {@code max} espaciados según {@code sinh(slope * x)},
     * con {@code x} equiespaciado en {@code [-1, 1]}: más densos en el centro del intervalo.
     *
     * @throws IllegalArgumentException si {@code n < 2} o {@code slope == 0}.
     */
    public static double[] nonlinspace(int n, double min, double max, double slope) {
        if (n < 2) {
            throw new IllegalArgumentException("nonlinspace necesita al menos 2 puntos, recibido: " + n);
        }
        if (slope == 0.0) {
            throw new IllegalArgumentException("La pendiente de estiramiento no puede ser cero.");
        }
        double[] x = linspace(n, -1.0, 1.0);
        double yMin = Math.sinh(slope * x[0]);
        double yMax = Math.sinh(slope * x[n - 1]);
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = (Math.sinh(slope * x[i]) - yMin) * (max - min) / (yMax - yMin) + min;
        }
        return values;
    }
}
