package rasterkit.processing.solver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import rasterkit.config.ProcessingConfig;
import rasterkit.domain.signal.Bracket;
import rasterkit.domain.signal.SearchWindow;

import static org.junit.jupiter.api.Assertions.*;

class ZeroCrossingSearchTest {

    private final ZeroCrossingSearch search = new ZeroCrossingSearch();

    @Test
    @DisplayName("Una muestra exactamente en el objetivo cuenta como cruce")
    void findBracket_exactSample_isCrossing() {
        // ACT
        Bracket bracket = search.findBracket(new double[]{-2, -1, 0, 1, 2}, 0.0);

        // ASSERT
        assertTrue(bracket.index() == 1 || bracket.index() == 2, "Índice inesperado: " + bracket.index());
        assertTrue(bracket.isCrossing());
    }

    @Test
    @DisplayName("Señales crecientes y decrecientes: intervalo que contiene el objetivo")
    void findBracket_monotonicSignals() {
        Bracket rising = search.findBracket(new double[]{0, 1, 2, 3}, 1.5);
        Bracket falling = search.findBracket(new double[]{3, 2, 1, 0}, 1.5);

        assertEquals(1, rising.index());
        assertEquals(Bracket.Status.CROSSING, rising.status());
        assertEquals(1, falling.index());
        assertEquals(Bracket.Status.CROSSING, falling.status());
        assertEquals(2, rising.iterations());
    }

    @Test
    @DisplayName("Sin cambio de signo: se devuelve el mejor índice con estado NO_SIGN_CHANGE")
    void findBracket_noSignChange() {
        Bracket bracket = search.findBracket(new double[]{1, 2, 3}, 0.0);

        assertEquals(Bracket.Status.NO_SIGN_CHANGE, bracket.status());
        assertEquals(0, bracket.index());
        assertFalse(bracket.isCrossing());
    }

    @Test
    @DisplayName("Límite de iteraciones: la búsqueda se detiene y lo indica en el estado")
    void findBracket_iterationLimit() {
        // ARRANGE
        double[] signal = new double[10];
        for (int i = 0; i < signal.length; i++) {
            signal[i] = i;
        }
        ZeroCrossingSearch capped = new ZeroCrossingSearch(1);

        // ACT
        Bracket bracket = capped.findBracket(signal, 8.5);

        // ASSERT
        assertEquals(Bracket.Status.ITERATION_LIMIT, bracket.status());
        assertEquals(1, bracket.iterations());
        assertEquals(4, bracket.index());
    }

    @Test
    @DisplayName("La ventana restringe la búsqueda y se valida contra la longitud de la señal")
    void findBracket_window() {
        double[] signal = {0, 2, 0, 2, 0};

        assertEquals(3, search.findBracket(signal, 1.0, 2).index());
        assertEquals(0, search.findBracket(signal, 1.0, new SearchWindow(0, 1)).index());
        assertThrows(IllegalArgumentException.class,
                () -> search.findBracket(signal, 1.0, new SearchWindow(1, 5)));
        assertThrows(IllegalArgumentException.class, () -> search.findBracket(new double[]{1.0}, 0.0));
    }

    @Test
    @DisplayName("El límite de iteraciones se toma de la configuración")
    void constructor_fromConfig() {
        assertEquals(ZeroCrossingSearch.DEFAULT_MAX_ITERATIONS, new ZeroCrossingSearch().getMaxIterations());
        assertEquals(5, new ZeroCrossingSearch(ProcessingConfig.builder().maxBisectionIterations(5).build())
                .getMaxIterations());
        assertThrows(IllegalArgumentException.class, () -> new ZeroCrossingSearch(-1));
    }
}
