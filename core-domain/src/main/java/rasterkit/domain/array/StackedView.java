package rasterkit.domain.array;

import rasterkit.exception.ShapeMismatchException;

import java.util.Arrays;

/**
 * Vista lógica de un {@link NDArray} con forma {@code (stackSize, *operatingShape)}.
 * <p>
 * Los ejes no operativos (en su orden original) se aplanan en un único eje de
 * pila; los ejes operativos quedan al final en el orden de la selección. No se
 * copia ni se permuta nada: cada entrada de la pila se localiza con los strides
 * del array original, de modo que {@link #gather} y {@link #scatter} solo tocan
 * las celdas de esa entrada.
 */
public final class StackedView {

    private final NDArray array;
    private final int[] strides;
    private final int[] operatingAxes;
    private final int[] stackAxes;
    private final int[] stackShape;
    private final int[] operatingShape;
    private final int stackSize;

    /**
     * Desplazamiento de cada celda operativa (orden fila-mayor) respecto a la base de su entrada.
     */
    private final int[] operatingOffsets;

    private StackedView(NDArray array, int[] operatingAxes) {
        this.array = array;
        this.operatingAxes = operatingAxes.clone();
        int rank = array.rank();
        int[] shape = array.shape();
        this.strides = array.strides();

        boolean[] operating = new boolean[rank];
        for (int axis : operatingAxes) {
            operating[axis] = true;
        }
        this.stackAxes = new int[rank - operatingAxes.length];
        int k = 0;
        for (int axis = 0; axis < rank; axis++) {
            if (!operating[axis]) {
                stackAxes[k++] = axis;
            }
        }
        this.stackShape = new int[stackAxes.length];
        for (int i = 0; i < stackAxes.length; i++) {
            stackShape[i] = shape[stackAxes[i]];
        }
        this.operatingShape = new int[operatingAxes.length];
        for (int i = 0; i < operatingAxes.length; i++) {
            operatingShape[i] = shape[operatingAxes[i]];
        }
        this.stackSize = NDArray.sizeOf(stackShape);

        this.operatingOffsets = new int[NDArray.sizeOf(operatingShape)];
        if (operatingOffsets.length > 0) {
            int[] index = new int[operatingShape.length];
            int flat = 0;
            do {
                int offset = 0;
                for (int d = 0; d < index.length; d++) {
                    offset += index[d] * strides[operatingAxes[d]];
                }
                operatingOffsets[flat++] = offset;
            } while (NDArray.nextIndex(index, operatingShape));
        }
    }

    /**
     * Crea la vista para unos ejes operativos ya normalizados y validados.
     */
    public static StackedView of(NDArray array, int[] operatingAxes) {
        return new StackedView(array, operatingAxes);
    }

    public int stackSize() {
        return stackSize;
    }

    public int[] stackShape() {
        return stackShape.clone();
    }

    public int[] operatingShape() {
        return operatingShape.clone();
    }

    /**
     * Permutación que lleva los ejes operativos al final: ejes de pila y después ejes operativos.
     */
    public int[] permutation() {
        int[] perm = new int[stackAxes.length + operatingAxes.length];
        System.arraycopy(stackAxes, 0, perm, 0, stackAxes.length);
        System.arraycopy(operatingAxes, 0, perm, stackAxes.length, operatingAxes.length);
        return perm;
    }

    private int baseOffset(int stackIndex) {
        if (stackIndex < 0 || stackIndex >= stackSize) {
            throw new IndexOutOfBoundsException("La entrada de pila " + stackIndex
                    + " está fuera de los límites [0, " + (stackSize - 1) + "].");
        }
        int remaining = stackIndex;
        int offset = 0;
        for (int d = stackShape.length - 1; d >= 0; d--) {
            offset += (remaining % stackShape[d]) * strides[stackAxes[d]];
            remaining /= stackShape[d];
        }
        return offset;
    }

    /**
     * Copia la entrada {@code stackIndex} en un array nuevo de forma {@code operatingShape}.
     */
    public NDArray gather(int stackIndex) {
        int base = baseOffset(stackIndex);
        double[] source = array.data();
        double[] slice = new double[operatingOffsets.length];
        for (int i = 0; i < slice.length; i++) {
            slice[i] = source[base + operatingOffsets[i]];
        }
        return NDArray.of(slice, operatingShape);
    }

    /**
     * Escribe un corte de forma {@code operatingShape} en la entrada {@code stackIndex} del array subyacente.
     */
    public void scatter(int stackIndex, NDArray slice) {
        if (!Arrays.equals(slice.shape(), operatingShape)) {
            throw new ShapeMismatchException("El corte tiene forma " + Arrays.toString(slice.shape())
                    + " pero la vista espera " + Arrays.toString(operatingShape) + ".");
        }
        int base = baseOffset(stackIndex);
        double[] target = array.data();
        double[] values = slice.data();
        for (int i = 0; i < values.length; i++) {
            target[base + operatingOffsets[i]] = values[i];
        }
    }
}
