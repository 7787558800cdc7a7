package rasterkit.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;
import rasterkit.domain.grid.InterpolationOrder;

/**
 * Opciones del interpolador de coordenadas usado por el remuestreo de mallas.
 */
@Value
@Builder
@With
@Jacksonized
public class InterpolationOptions {

    /**
     * Orden de interpolación. Por defecto lineal por tramos.
     */
    @Builder.Default
    InterpolationOrder order = InterpolationOrder.LINEAR;

    /**
     * Valor asignado a los puntos que caen fuera de la malla origen. Por defecto NaN.
     */
    @Builder.Default
    double fillValue = Double.NaN;

    public static InterpolationOptions defaults() {
        return InterpolationOptions.builder().build();
    }
}
