package rasterkit.domain.grid;

/**
 * Convenio para las celdas que caen fuera del array durante una convolución.
 */
public enum BoundaryMode {
    /**
     * Fuera del array se lee un valor constante (0 por defecto).
     */
    CONSTANT,
    /**
     * Reflexión sobre el borde, repitiendo la celda extrema: {@code d c b a | a b c d | d c b a}.
     */
    REFLECT,
    /**
     * Se repite la celda extrema: {@code a a a a | a b c d | d d d d}.
     */
    NEAREST,
    /**
     * Periódico: {@code a b c d | a b c d | a b c d}.
     */
    WRAP
}
