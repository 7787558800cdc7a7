package rasterkit.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;
import rasterkit.domain.grid.BoundaryMode;

/**
 * Contenedor principal de la configuración de procesado.
 * Agrupa el paralelismo del motor de apilado con los parámetros por defecto de
 * cada componente numérico.
 */
@Value
@Builder
@With
@Jacksonized
public class ProcessingConfig {

    /**
     * Número de hilos para recorrer los cortes apilados. 1 equivale a ejecución secuencial.
     */
    @Builder.Default
    int cpuProcessorCount = 1;

    /**
     * Cota explícita de pasos de bisección en la búsqueda de cruces.
     */
    @Builder.Default
    int maxBisectionIterations = 10_000;

    /**
     * Opciones por defecto del remuestreo de mallas.
     */
    @Builder.Default
    InterpolationOptions interpolation = InterpolationOptions.defaults();

    /**
     * Convenio de borde de la convolución usada al dilatar máscaras.
     */
    @Builder.Default
    BoundaryMode dilationBoundary = BoundaryMode.CONSTANT;

    public static ProcessingConfig defaults() {
        return ProcessingConfig.builder().build();
    }
}
