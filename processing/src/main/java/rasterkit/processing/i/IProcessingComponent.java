package rasterkit.processing.i;

/**
 * Contrato base para cualquier componente numérico de la librería.
 * Permite tratar a todas las primitivas de forma polimórfica para tareas
 * de logging, identificación y depuración.
 */
public interface IProcessingComponent {
    /**
     * Nombre corto del algoritmo (ej: "AreaWeighted", "Multilinear").
     */
    String getName();

    /**
     * Descripción técnica detallada.
     */
    default String getDescription() {
        return "Sin descripción disponible.";
    }
}
