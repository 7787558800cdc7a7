package rasterkit.domain.grid;

import lombok.Builder;

/**
 * Extensión física {@code [min, max]} de un eje de una malla regular.
 * <p>
 * {@code min == max} se admite: el mapeo a píxeles degenera entonces en
 * NaN/Infinito y los puntos afectados reciben el valor de relleno.
 *
 * @param min Coordenada física del primer píxel del eje.
 * @param max Coordenada física del último píxel del eje.
 */
@Builder
public record AxisLimits(double min, double max) {

    public static AxisLimits of(double min, double max) {
        return new AxisLimits(min, max);
    }

    public double span() {
        return max - min;
    }
}
