package rasterkit.processing.stats;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.GaussianCurveFitter;
import org.apache.commons.math3.fitting.WeightedObservedPoints;
import rasterkit.domain.fit.GaussianProfile;
import rasterkit.exception.ShapeMismatchException;

import java.util.Objects;

/**
 * Ajuste por mínimos cuadrados de una curva gaussiana a datos {@code (x, y)}.
 * <p>
 * Delega en {@link GaussianCurveFitter} (Levenberg-Marquardt) partiendo de una estimación inicial.
 */
@Slf4j
public class GaussianFitter {

    private static final int DEFAULT_MAX_ITERATIONS = 1000;

    private final int maxIterations;

    public GaussianFitter() {
        this(DEFAULT_MAX_ITERATIONS);
    }

    public GaussianFitter(int maxIterations) {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("El número máximo de iteraciones debe ser positivo: " + maxIterations);
        }
        this.maxIterations = maxIterations;
    }

    /**
     * Ajuste partiendo de la gaussiana {@code (mean = 0, std = 1, amplitude = 1)}.
     */
    public GaussianProfile fit(double[] x, double[] y) {
        return fit(x, y, new GaussianProfile(0.0, 1.0, 1.0));
    }

    /**
     * @param x            Abscisas de las observaciones.
     * @param y            Valores observados.
     * @param initialGuess Estimación inicial de los tres parámetros.
     * @return Gaussiana ajustada.
     * @throws ShapeMismatchException   si {@code x} e {@code y} no tienen la misma longitud.
     * @throws IllegalArgumentException si los datos no permiten el ajuste.
     * @throws IllegalStateException    si el optimizador no converge.
     */
    public GaussianProfile fit(double[] x, double[] y, GaussianProfile initialGuess) {
        Objects.requireNonNull(x, "Las abscisas no pueden ser nulas.");
        Objects.requireNonNull(y, "Las ordenadas no pueden ser nulas.");
        Objects.requireNonNull(initialGuess, "La estimación inicial no puede ser nula.");
        if (x.length != y.length) {
            throw new ShapeMismatchException("x e y deben tener la misma longitud: " + x.length + " != " + y.length);
        }

        WeightedObservedPoints observations = new WeightedObservedPoints();
        for (int i = 0; i < x.length; i++) {
            observations.add(x[i], y[i]);
        }

        // Orden de parámetros de Commons Math: {norma, media, sigma}
        double[] start = {initialGuess.amplitude(), initialGuess.mean(), initialGuess.std()};
        GaussianCurveFitter fitter = GaussianCurveFitter.create()
                .withStartPoint(start)
                .withMaxIterations(maxIterations);

        double[] parameters;
        try {
            parameters = fitter.fit(observations.toList());
        } catch (MathIllegalStateException e) {
            throw new IllegalStateException("El ajuste gaussiano no convergió: " + e.getMessage(), e);
        } catch (MathIllegalArgumentException e) {
            throw new IllegalArgumentException("Datos no válidos para el ajuste gaussiano: " + e.getMessage(), e);
        }

        GaussianProfile fitted = new GaussianProfile(parameters[1], parameters[2], parameters[0]);
        log.debug("Gaussiana ajustada a {} puntos: {}", x.length, fitted);
        return fitted;
    }
}
