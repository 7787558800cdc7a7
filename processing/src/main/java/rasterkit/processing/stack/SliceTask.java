package rasterkit.processing.stack;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import rasterkit.domain.array.NDArray;
import rasterkit.domain.array.StackedView;
import rasterkit.processing.i.ISliceOperation;

import java.util.concurrent.Callable;

/**
 * Tarea ejecutable que aplica la operación a una única entrada de la pila.
 * Está diseñada para ser ejecutada en un pool de hilos: solo lee de la vista
 * de entrada, y el resultado lo escribe el orquestador en su índice de pila.
 */
@Getter
@RequiredArgsConstructor
public class SliceTask implements Callable<SliceTask> {

    // --- Entradas para la tarea ---
    private final int stackIndex;
    private final StackedView source; // Vista de entrada (compartida, solo lectura)
    private final ISliceOperation operation;

    // --- Resultado de la tarea ---
    private NDArray result;

    @Override
    public SliceTask call() {
        this.result = operation.apply(source.gather(stackIndex));
        return this;
    }
}
