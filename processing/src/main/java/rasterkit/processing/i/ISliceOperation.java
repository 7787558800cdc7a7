package rasterkit.processing.i;

import rasterkit.domain.array.NDArray;

/**
 * Operación de rango fijo aplicada a un único corte de la pila.
 * <p>
 * Los argumentos adicionales que necesite la operación se capturan en el propio
 * objeto. La operación no debe guardar estado entre cortes: cada invocación
 * depende solo de su corte de entrada.
 */
@FunctionalInterface
public interface ISliceOperation {
    /**
     * @param slice Corte de entrada, con la forma de los ejes operativos.
     * @return Corte resultado, con la forma de los ejes operativos de la salida.
     */
    NDArray apply(NDArray slice);
}
