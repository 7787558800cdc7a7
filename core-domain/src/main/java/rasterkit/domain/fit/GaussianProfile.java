package rasterkit.domain.fit;

import lombok.Builder;
import lombok.With;

/**
 * Curva gaussiana inmutable:
 * <pre>
 *     f(x) = amplitude * exp(-1/2 * ((x - mean) / std)^2)
 * </pre>
 *
 * @param mean      Valor medio.
 * @param std       Desviación típica.
 * @param amplitude Valor máximo de la curva.
 */
@Builder
@With
public record GaussianProfile(double mean, double std, double amplitude) {

    /**
     * Gaussiana normalizada (área unidad): {@code amplitude = 1 / (std * sqrt(2π))}.
     */
    public static GaussianProfile normalized(double mean, double std) {
        return new GaussianProfile(mean, std, 1.0 / (std * Math.sqrt(2.0 * Math.PI)));
    }

    public static GaussianProfile standard() {
        return normalized(0.0, 1.0);
    }

    public double evaluate(double x) {
        double z = (x - mean) / std;
        return amplitude * Math.exp(-0.5 * z * z);
    }

    public double[] evaluate(double[] x) {
        double[] y = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            y[i] = evaluate(x[i]);
        }
        return y;
    }
}
