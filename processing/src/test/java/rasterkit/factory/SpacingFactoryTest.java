package rasterkit.factory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SpacingFactoryTest {

    @Test
    @DisplayName("linspace: extremos incluidos y paso constante")
    void linspace() {
        assertArrayEquals(new double[]{0, 0.25, 0.5, 0.75, 1}, SpacingFactory.linspace(5, 0, 1), 1e-12);
        assertArrayEquals(new double[]{3}, SpacingFactory.linspace(1, 3, 7));
        assertEquals(0, SpacingFactory.linspace(0, 0, 1).length);
    }

    @Test
    @DisplayName("nonlinspace: simétrico, entre los límites y más denso en el centro")
    void nonlinspace_isDenserInTheMiddle() {
        // ACT
        double[] values = SpacingFactory.nonlinspace(7, 10, 20);

        // ASSERT
        assertEquals(10.0, values[0], 1e-12);
        assertEquals(20.0, values[6], 1e-12);
        assertEquals(15.0, values[3], 1e-12);
        for (int i = 0; i < 7; i++) {
            assertEquals(30.0, values[i] + values[6 - i], 1e-9);
        }
        assertTrue(values[3] - values[2] < values[1] - values[0]);
    }

    @Test
    @DisplayName("nonlinspace necesita al menos 2 puntos y pendiente no nula")
    void nonlinspace_validation() {
        assertThrows(IllegalArgumentException.class, () -> SpacingFactory.nonlinspace(1, 0, 1));
        assertThrows(IllegalArgumentException.class, () -> SpacingFactory.nonlinspace(5, 0, 1, 0.0));
    }
}
