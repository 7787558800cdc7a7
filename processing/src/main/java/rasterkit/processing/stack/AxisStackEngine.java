package rasterkit.processing.stack;

import lombok.extern.slf4j.Slf4j;
import rasterkit.config.ProcessingConfig;
import rasterkit.domain.array.NDArray;
import rasterkit.domain.array.StackedView;
import rasterkit.domain.axis.AxisSelection;
import rasterkit.exception.ShapeMismatchException;
import rasterkit.processing.i.ISliceOperation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Motor genérico de apilado de ejes: "seleccionar ejes, aplanar el resto,
 * recorrer, reensamblar".
 * <p>
 * Es la única autoridad sobre la contabilidad de ejes. Los consumidores
 * (remuestreo, dilatación, promediado) solo aportan la operación por corte.
 * <p>
 * Responsabilidades:
 * 1. Resolver y validar la selección de ejes antes de cualquier cálculo.
 * 2. Ver el array como {@code (stackSize, *operatingShape)} sin alterar los valores fuera de los ejes operativos.
 * 3. Invocar la operación sobre cada corte (en secuencia o en un pool de hilos) y
 *    escribir cada resultado en su índice de pila, sin importar el orden de finalización.
 */
@Slf4j
public class AxisStackEngine implements AutoCloseable {

    private final int processorCount;

    // Pool de hilos. Solo existe si la config pide más de un procesador.
    private final ExecutorService threadPool;

    public AxisStackEngine() {
        this(ProcessingConfig.defaults());
    }

    public AxisStackEngine(ProcessingConfig config) {
        Objects.requireNonNull(config, "La configuración no puede ser nula.");
        this.processorCount = Math.max(config.getCpuProcessorCount(), 1);
        this.threadPool = processorCount > 1 ? Executors.newFixedThreadPool(processorCount) : null;
        log.info("AxisStackEngine inicializado. (Hilos: {})", processorCount);
    }

    public int getProcessorCount() {
        return processorCount;
    }

    public NDArray apply(ISliceOperation operation, int opRank, NDArray array) {
        return apply(operation, opRank, array, AxisSelection.trailing(), null);
    }

    public NDArray apply(ISliceOperation operation, int opRank, NDArray array, AxisSelection axes) {
        return apply(operation, opRank, array, axes, null);
    }

    /**
     * Aplica {@code operation} sobre los ejes {@code axes} de {@code array}, recorriendo los ejes restantes.
     *
     * @param operation Operación por corte. Los argumentos extra van capturados en ella.
     * @param opRank    Número de ejes sobre los que trabaja la operación.
     * @param array     Array de entrada. No se modifica.
     * @param axes      Ejes operativos, en orden. {@code null} equivale a los últimos {@code opRank}.
     * @param output    Array de salida en el orden de ejes original, o {@code null} para reservar
     *                  uno con la forma de la entrada. Obligatorio si la operación cambia el tamaño
     *                  de los ejes operativos. Si se proporciona, se escribe en él y se devuelve.
     * @return La salida, en el orden de ejes original.
     * @throws ShapeMismatchException si la selección o la salida no son coherentes con la entrada,
     *                                o si la operación devuelve un corte con otra forma.
     */
    public NDArray apply(ISliceOperation operation, int opRank, NDArray array, AxisSelection axes, NDArray output) {
        Objects.requireNonNull(operation, "La operación no puede ser nula.");
        Objects.requireNonNull(array, "El array de entrada no puede ser nulo.");

        // 1. Resolver ejes (normalización y validación explícitas)
        int[] operatingAxes = AxisSelection.orTrailing(axes).resolve(opRank, array.rank());

        // 2. Preparar la salida
        NDArray target = (output == null) ? NDArray.zeros(array.shape()) : validateOutput(output, array, operatingAxes);

        // 3. Vistas apiladas de entrada y salida (mismos ejes, misma pila)
        StackedView input = StackedView.of(array, operatingAxes);
        StackedView result = StackedView.of(target, operatingAxes);
        int stackSize = input.stackSize();

        log.debug("Apilado: forma {} -> pila {} x {} (ejes operativos {})",
                Arrays.toString(array.shape()), stackSize,
                Arrays.toString(input.operatingShape()), Arrays.toString(operatingAxes));

        // 4. Recorrer la pila
        if (threadPool == null || stackSize <= 1) {
            for (int s = 0; s < stackSize; s++) {
                result.scatter(s, requireSlice(operation.apply(input.gather(s)), s));
            }
        } else {
            processParallel(operation, input, result, stackSize);
        }
        return target;
    }

    private void processParallel(ISliceOperation operation, StackedView input, StackedView result, int stackSize) {
        List<SliceTask> tasks = new ArrayList<>(stackSize);
        for (int s = 0; s < stackSize; s++) {
            tasks.add(new SliceTask(s, input, operation));
        }

        List<Future<SliceTask>> futures;
        try {
            futures = threadPool.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Procesado de la pila interrumpido.", e);
        }

        for (Future<SliceTask> future : futures) {
            SliceTask task;
            try {
                task = future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Procesado de la pila interrumpido.", e);
            } catch (ExecutionException e) {
                if (e.getCause() instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new IllegalStateException("Error al procesar un corte de la pila.", e.getCause());
            }
            // Cada resultado va a su propio índice, sea cual sea el orden de finalización.
            result.scatter(task.getStackIndex(), requireSlice(task.getResult(), task.getStackIndex()));
        }
    }

    private static NDArray requireSlice(NDArray slice, int stackIndex) {
        if (slice == null) {
            throw new IllegalStateException("La operación devolvió null para la entrada de pila " + stackIndex + ".");
        }
        return slice;
    }

    private static NDArray validateOutput(NDArray output, NDArray array, int[] operatingAxes) {
        int[] outShape = output.shape();
        int[] inShape = array.shape();
        if (outShape.length != inShape.length) {
            throw new ShapeMismatchException("La salida tiene rango " + outShape.length
                    + " pero la entrada tiene rango " + inShape.length + ".");
        }
        boolean[] operating = new boolean[inShape.length];
        for (int axis : operatingAxes) {
            operating[axis] = true;
        }
        for (int axis = 0; axis < inShape.length; axis++) {
            if (!operating[axis] && outShape[axis] != inShape[axis]) {
                throw new ShapeMismatchException("La salida " + Arrays.toString(outShape)
                        + " no coincide con la entrada " + Arrays.toString(inShape)
                        + " en el eje apilado " + axis + ".");
            }
        }
        return output;
    }

    @Override
    public void close() {
        if (threadPool != null && !threadPool.isShutdown()) {
            threadPool.shutdown();
        }
        log.info("AxisStackEngine cerrado.");
    }
}
