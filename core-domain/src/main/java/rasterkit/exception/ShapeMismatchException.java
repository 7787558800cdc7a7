package rasterkit.exception;

/**
 * Señala un desacuerdo estructural entre formas: número de ejes seleccionados
 * distinto del rango de la operación, límites que no casan con las mallas
 * destino, o un array de salida con dimensiones incompatibles.
 * <p>
 * Se lanza siempre antes de empezar cualquier cálculo numérico.
 */
public class ShapeMismatchException extends IllegalArgumentException {

    public ShapeMismatchException(String message) {
        super(message);
    }
}
