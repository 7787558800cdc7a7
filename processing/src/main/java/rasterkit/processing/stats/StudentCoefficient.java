package rasterkit.processing.stats;

import org.apache.commons.math3.distribution.TDistribution;

/**
 * Coeficientes de la distribución t de Student para intervalos de confianza.
 */
public final class StudentCoefficient {

    /**
     * Prohibido construir esta clase utilidad
     */
    private StudentCoefficient() {
    }

    /**
     * Cuantil {@code alpha} de la t de Student con {@code n} grados de libertad.
     *
     * @param n     Grados de libertad (&gt; 0).
     * @param alpha Probabilidad acumulada en {@code [0, 1]}, p. ej. 0.95.
     */
    public static double coefficient(double n, double alpha) {
        if (!(n > 0)) {
            throw new IllegalArgumentException("Los grados de libertad deben ser positivos: " + n);
        }
        if (!(alpha >= 0 && alpha <= 1)) {
            throw new IllegalArgumentException("La probabilidad debe estar en [0, 1]: " + alpha);
        }
        return new TDistribution(null, n).inverseCumulativeProbability(alpha);
    }
}
