package rasterkit.processing.stats;

import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import rasterkit.domain.fit.LinearFit;
import rasterkit.exception.ShapeMismatchException;

import java.util.Objects;

/**
 * Regresión lineal por mínimos cuadrados y correlación de Pearson.
 */
public final class LinearRegression {

    /**
     * Prohibido construir esta clase utilidad
     */
    private LinearRegression() {
    }

    public static LinearFit fit(double[] x, double[] y) {
        return fit(x, y, false);
    }

    /**
     * Ajusta {@code y = slope * x + intercept} en forma cerrada.
     *
     * @param fixedIntercept Si es {@code true}, la recta pasa por el origen ({@code intercept = 0}).
     * @return Pendiente, ordenada y cociente de residuos {@code Σ(y - ŷ)² / Σ y²}.
     * @throws ShapeMismatchException si {@code x} e {@code y} no tienen la misma longitud.
     */
    public static LinearFit fit(double[] x, double[] y, boolean fixedIntercept) {
        requireSameLength(x, y);
        int n = x.length;
        double sumX = 0;
        double sumY = 0;
        double sumXY = 0;
        double sumX2 = 0;
        double sumY2 = 0;
        for (int i = 0; i < n; i++) {
            sumX += x[i];
            sumY += y[i];
            sumXY += x[i] * y[i];
            sumX2 += x[i] * x[i];
            sumY2 += y[i] * y[i];
        }

        double slope;
        double intercept;
        if (fixedIntercept) {
            slope = sumXY / sumX2;
            intercept = 0.0;
        } else {
            double denominator = n * sumX2 - sumX * sumX;
            slope = (n * sumXY - sumX * sumY) / denominator;
            intercept = (sumY * sumX2 - sumX * sumXY) / denominator;
        }

        // Σ(y - m x - b)² desarrollado en sumas
        double residual = sumY2 + slope * slope * sumX2 + n * intercept * intercept
                + 2 * slope * intercept * sumX - 2 * slope * sumXY - 2 * intercept * sumY;
        return new LinearFit(slope, intercept, residual / sumY2);
    }

    /**
     * Coeficiente de correlación de Pearson. Devuelve NaN si alguna serie es constante
     * o tiene menos de dos muestras.
     */
    public static double correlation(double[] x, double[] y) {
        requireSameLength(x, y);
        if (x.length < 2) {
            return Double.NaN;
        }
        return new PearsonsCorrelation().correlation(x, y);
    }

    private static void requireSameLength(double[] x, double[] y) {
        Objects.requireNonNull(x, "x no puede ser nulo.");
        Objects.requireNonNull(y, "y no puede ser nulo.");
        if (x.length != y.length) {
            throw new ShapeMismatchException("x e y no tienen la misma longitud: " + x.length + " != " + y.length);
        }
    }
}
