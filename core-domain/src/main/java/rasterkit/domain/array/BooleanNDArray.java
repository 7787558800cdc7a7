package rasterkit.domain.array;

import rasterkit.exception.ShapeMismatchException;

import java.util.Arrays;
import java.util.Objects;

/**
 * Máscara booleana de rango N, con el mismo layout fila-mayor que {@link NDArray}.
 */
public final class BooleanNDArray {

    private final int[] shape;
    private final int[] strides;
    private final boolean[] data;

    private BooleanNDArray(boolean[] data, int[] shape) {
        this.shape = shape;
        this.strides = NDArray.stridesOf(shape);
        this.data = data;
    }

    static BooleanNDArray wrap(boolean[] data, int[] shape) {
        return new BooleanNDArray(data, shape);
    }

    public static BooleanNDArray falses(int... shape) {
        int[] checked = NDArray.checkShape(shape);
        return new BooleanNDArray(new boolean[NDArray.sizeOf(checked)], checked);
    }

    public static BooleanNDArray of(boolean[] data, int... shape) {
        Objects.requireNonNull(data, "Los datos de la máscara no pueden ser nulos.");
        int[] checked = NDArray.checkShape(shape);
        if (data.length != NDArray.sizeOf(checked)) {
            throw new ShapeMismatchException("Se esperaban " + NDArray.sizeOf(checked) + " valores para la forma "
                    + Arrays.toString(checked) + ", se recibieron " + data.length + ".");
        }
        return new BooleanNDArray(data.clone(), checked);
    }

    public static BooleanNDArray fromMatrix(boolean[][] matrix) {
        int rows = matrix.length;
        int cols = rows == 0 ? 0 : matrix[0].length;
        boolean[] flat = new boolean[rows * cols];
        for (int i = 0; i < rows; i++) {
            if (matrix[i].length != cols) {
                throw new ShapeMismatchException("La máscara no es rectangular en la fila " + i + ".");
            }
            System.arraycopy(matrix[i], 0, flat, i * cols, cols);
        }
        return new BooleanNDArray(flat, new int[]{rows, cols});
    }

    public int[] shape() {
        return shape.clone();
    }

    public int rank() {
        return shape.length;
    }

    public int size() {
        return data.length;
    }

    public boolean get(int... index) {
        return data[offset(index)];
    }

    public void set(boolean value, int... index) {
        data[offset(index)] = value;
    }

    private int offset(int[] index) {
        if (index.length != shape.length) {
            throw new IllegalArgumentException("Se esperaban " + shape.length + " índices, se recibieron " + index.length + ".");
        }
        int offset = 0;
        for (int d = 0; d < index.length; d++) {
            if (index[d] < 0 || index[d] >= shape[d]) {
                throw new IndexOutOfBoundsException("El índice " + index[d] + " está fuera de los límites [0, "
                        + (shape[d] - 1) + "] en el eje " + d + ".");
            }
            offset += index[d] * strides[d];
        }
        return offset;
    }

    /**
     * Conversión numérica: {@code true -> 1.0}, {@code false -> 0.0}.
     */
    public NDArray toNumeric() {
        double[] values = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            values[i] = data[i] ? 1.0 : 0.0;
        }
        return NDArray.of(values, shape);
    }

    public int count() {
        int count = 0;
        for (boolean b : data) {
            if (b) count++;
        }
        return count;
    }

    public boolean any() {
        return count() > 0;
    }

    /**
     * Copia de la entrada {@code index} a lo largo del eje 0.
     */
    public BooleanNDArray slice(int index) {
        if (shape.length == 0) {
            throw new ShapeMismatchException("No se puede extraer un corte de una máscara de rango 0.");
        }
        if (index < 0 || index >= shape[0]) {
            throw new IndexOutOfBoundsException("El corte " + index + " está fuera de los límites [0, " + (shape[0] - 1) + "].");
        }
        int[] sliceShape = Arrays.copyOfRange(shape, 1, shape.length);
        int length = NDArray.sizeOf(sliceShape);
        return new BooleanNDArray(Arrays.copyOfRange(data, index * length, (index + 1) * length), sliceShape);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BooleanNDArray that = (BooleanNDArray) o;
        return Arrays.equals(shape, that.shape) && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(shape) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "BooleanNDArray" + Arrays.toString(shape) + " (" + count() + " celdas activas)";
    }
}
