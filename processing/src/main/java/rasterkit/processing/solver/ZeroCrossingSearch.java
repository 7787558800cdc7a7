package rasterkit.processing.solver;

import lombok.extern.slf4j.Slf4j;
import rasterkit.config.ProcessingConfig;
import rasterkit.domain.signal.Bracket;
import rasterkit.domain.signal.SearchWindow;

import java.util.Objects;

/**
 * Búsqueda por bisección del intervalo de muestras en el que una señal 1D cruza un valor objetivo.
 * <p>
 * Sobre la señal centrada {@code c[i] = s[i] - target}, reduce la ventana
 * {@code [t1, t2]} a dos muestras adyacentes. Si {@code c[t2]} y {@code c[t3]}
 * están estrictamente del mismo lado del objetivo, el cruce está a la
 * izquierda de {@code t3}; en otro caso (incluida una muestra exactamente
 * sobre el objetivo) está a su derecha.
 * <p>
 * La búsqueda no lanza excepciones por falta de convergencia: el resultado
 * siempre es el mejor {@code t1} alcanzado, y su estado indica si es fiable.
 */
@Slf4j
public class ZeroCrossingSearch {

    public static final int DEFAULT_MAX_ITERATIONS = 10_000;

    private final int maxIterations;

    public ZeroCrossingSearch() {
        this(DEFAULT_MAX_ITERATIONS);
    }

    public ZeroCrossingSearch(ProcessingConfig config) {
        this(config.getMaxBisectionIterations());
    }

    public ZeroCrossingSearch(int maxIterations) {
        if (maxIterations < 0) {
            throw new IllegalArgumentException("El límite de iteraciones no puede ser negativo: " + maxIterations);
        }
        this.maxIterations = maxIterations;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public Bracket findBracket(double[] signal, double target) {
        Objects.requireNonNull(signal, "La señal no puede ser nula.");
        return findBracket(signal, target, SearchWindow.full(signal.length));
    }

    public Bracket findBracket(double[] signal, double target, int t1) {
        Objects.requireNonNull(signal, "La señal no puede ser nula.");
        return findBracket(signal, target, new SearchWindow(t1, signal.length - 1));
    }

    /**
     * @param signal Señal muestreada.
     * @param target Valor cuyo cruce se busca.
     * @param window Ventana inicial {@code [t1, t2]}, con {@code t2 < signal.length}.
     * @return Intervalo {@code [index, index + 1]} y estado de la búsqueda.
     * @throws IllegalArgumentException si la ventana se sale de la señal.
     */
    public Bracket findBracket(double[] signal, double target, SearchWindow window) {
        Objects.requireNonNull(signal, "La señal no puede ser nula.");
        Objects.requireNonNull(window, "La ventana de búsqueda no puede ser nula.");
        if (window.t2() >= signal.length) {
            throw new IllegalArgumentException("La ventana [" + window.t1() + ", " + window.t2()
                    + "] se sale de una señal de " + signal.length + " muestras.");
        }

        double[] centered = new double[signal.length];
        for (int i = 0; i < signal.length; i++) {
            centered[i] = signal[i] - target;
        }

        int t1 = window.t1();
        int t2 = window.t2();
        int iterations = 0;
        while (t2 - t1 > 1 && iterations < maxIterations) {
            iterations++;
            int t3 = (t1 + t2) / 2;
            if (centered[t2] * centered[t3] > 0) {
                t2 = t3;
            } else {
                t1 = t3;
            }
        }

        if (t2 - t1 > 1) {
            log.warn("Bisección detenida tras {} iteraciones con la ventana [{}, {}] sin reducir.", iterations, t1, t2);
            return new Bracket(t1, Bracket.Status.ITERATION_LIMIT, iterations);
        }
        if (centered[t1] * centered[t1 + 1] <= 0) {
            return new Bracket(t1, Bracket.Status.CROSSING, iterations);
        }
        log.warn("No hay cruce del valor {} en la ventana [{}, {}].", target, window.t1(), window.t2());
        return new Bracket(t1, Bracket.Status.NO_SIGN_CHANGE, iterations);
    }
}
