package rasterkit.domain.array;

import rasterkit.exception.AxisOutOfRangeException;
import rasterkit.exception.ShapeMismatchException;

import java.util.Arrays;
import java.util.Objects;
import java.util.function.DoublePredicate;
import java.util.function.DoubleUnaryOperator;

/**
 * Array numérico de rango N con forma fija, almacenado en un único array
 * primitivo plano en orden fila-mayor (el último eje varía más rápido).
 * <p>
 * Sigue semántica de valor: todas las derivaciones ({@link #reshape},
 * {@link #transpose}, {@link #map}...) devuelven un array nuevo. La única
 * escritura sobre un array existente es explícita: {@link #set},
 * {@link #setFlat} y {@link #copyInto}.
 * <p>
 * Layout: {@code offset(i0, i1, ..., ik) = Σ ij * strides[j]}.
 */
public final class NDArray {

    private final int[] shape;
    private final int[] strides;
    private final double[] data;

    private NDArray(double[] data, int[] shape) {
        this.shape = shape;
        this.strides = stridesOf(shape);
        this.data = data;
    }

    // --- FACTORÍAS ---

    public static NDArray zeros(int... shape) {
        int[] checked = checkShape(shape);
        return new NDArray(new double[sizeOf(checked)], checked);
    }

    public static NDArray filled(double value, int... shape) {
        NDArray array = zeros(shape);
        Arrays.fill(array.data, value);
        return array;
    }

    /**
     * Crea un array copiando los datos planos dados.
     *
     * @throws ShapeMismatchException si la longitud de los datos no coincide con el producto de la forma.
     */
    public static NDArray of(double[] data, int... shape) {
        Objects.requireNonNull(data, "Los datos no pueden ser nulos.");
        int[] checked = checkShape(shape);
        if (data.length != sizeOf(checked)) {
            throw new ShapeMismatchException("Se esperaban " + sizeOf(checked) + " valores para la forma "
                    + Arrays.toString(checked) + ", se recibieron " + data.length + ".");
        }
        return new NDArray(data.clone(), checked);
    }

    /**
     * Crea un array de rango 2 a partir de una matriz rectangular.
     */
    public static NDArray fromMatrix(double[][] matrix) {
        Objects.requireNonNull(matrix, "La matriz no puede ser nula.");
        int rows = matrix.length;
        int cols = rows == 0 ? 0 : matrix[0].length;
        double[] flat = new double[rows * cols];
        for (int i = 0; i < rows; i++) {
            if (matrix[i].length != cols) {
                throw new ShapeMismatchException("La matriz no es rectangular: la fila " + i + " tiene "
                        + matrix[i].length + " columnas, se esperaban " + cols + ".");
            }
            System.arraycopy(matrix[i], 0, flat, i * cols, cols);
        }
        return new NDArray(flat, new int[]{rows, cols});
    }

    // --- UTILIDADES DE FORMA ---

    static int[] checkShape(int[] shape) {
        Objects.requireNonNull(shape, "La forma no puede ser nula.");
        for (int size : shape) {
            if (size < 0) {
                throw new IllegalArgumentException("Las dimensiones no pueden ser negativas: " + Arrays.toString(shape));
            }
        }
        return shape.clone();
    }

    /**
     * Número de elementos de una forma (producto de sus dimensiones).
     */
    public static int sizeOf(int[] shape) {
        int size = 1;
        for (int dim : shape) {
            size = Math.multiplyExact(size, dim);
        }
        return size;
    }

    /**
     * Strides fila-mayor de una forma, en número de elementos.
     */
    public static int[] stridesOf(int[] shape) {
        int[] strides = new int[shape.length];
        int stride = 1;
        for (int i = shape.length - 1; i >= 0; i--) {
            strides[i] = stride;
            stride *= Math.max(shape[i], 1);
        }
        return strides;
    }

    /**
     * Normaliza un índice de eje con signo (contado desde el final si es negativo).
     *
     * @throws AxisOutOfRangeException si el eje no está en {@code [-rank, rank)}.
     */
    public static int normalizeAxis(int axis, int rank) {
        if (axis < -rank || axis >= rank) {
            throw new AxisOutOfRangeException(axis, rank);
        }
        return axis < 0 ? axis + rank : axis;
    }

    /**
     * Avanza un multi-índice en orden fila-mayor. Devuelve {@code false} al agotar la forma.
     */
    static boolean nextIndex(int[] index, int[] shape) {
        for (int d = shape.length - 1; d >= 0; d--) {
            if (++index[d] < shape[d]) {
                return true;
            }
            index[d] = 0;
        }
        return false;
    }

    // --- ACCESO ---

    public int[] shape() {
        return shape.clone();
    }

    public int[] strides() {
        return strides.clone();
    }

    public int rank() {
        return shape.length;
    }

    public int size() {
        return data.length;
    }

    /**
     * Tamaño a lo largo de un eje (admite índices negativos).
     */
    public int dim(int axis) {
        return shape[normalizeAxis(axis, shape.length)];
    }

    public double get(int... index) {
        return data[offset(index)];
    }

    public void set(double value, int... index) {
        data[offset(index)] = value;
    }

    public double getFlat(int flatIndex) {
        return data[flatIndex];
    }

    public void setFlat(int flatIndex, double value) {
        data[flatIndex] = value;
    }

    /**
     * Copia de los datos planos.
     */
    public double[] toArray() {
        return data.clone();
    }

    public double[][] toMatrix() {
        if (shape.length != 2) {
            throw new ShapeMismatchException("toMatrix requiere rango 2, el array tiene rango " + shape.length + ".");
        }
        double[][] matrix = new double[shape[0]][];
        for (int i = 0; i < shape[0]; i++) {
            matrix[i] = Arrays.copyOfRange(data, i * shape[1], (i + 1) * shape[1]);
        }
        return matrix;
    }

    // Acceso interno sin copia para las vistas del mismo paquete.
    double[] data() {
        return data;
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

    // --- DERIVACIONES ---

    public NDArray copy() {
        return new NDArray(data.clone(), shape.clone());
    }

    /**
     * Reinterpreta los datos con otra forma del mismo tamaño. Admite un único {@code -1}.
     */
    public NDArray reshape(int... newShape) {
        int[] target = newShape.clone();
        int inferred = -1;
        int known = 1;
        for (int i = 0; i < target.length; i++) {
            if (target[i] == -1) {
                if (inferred >= 0) {
                    throw new IllegalArgumentException("Solo se puede inferir una dimensión (-1) en reshape.");
                }
                inferred = i;
            } else if (target[i] < 0) {
                throw new IllegalArgumentException("Dimensión negativa en reshape: " + Arrays.toString(newShape));
            } else {
                known *= target[i];
            }
        }
        if (inferred >= 0) {
            if (known == 0 || data.length % known != 0) {
                throw new ShapeMismatchException("No se puede inferir la dimensión para reshape de "
                        + Arrays.toString(shape) + " a " + Arrays.toString(newShape) + ".");
            }
            target[inferred] = data.length / known;
        }
        if (sizeOf(target) != data.length) {
            throw new ShapeMismatchException("No se puede cambiar la forma " + Arrays.toString(shape)
                    + " a " + Arrays.toString(newShape) + ".");
        }
        return new NDArray(data.clone(), target);
    }

    /**
     * Permuta los ejes: el eje {@code i} del resultado es el eje {@code perm[i]} de este array.
     */
    public NDArray transpose(int... perm) {
        if (perm.length != shape.length) {
            throw new ShapeMismatchException("La permutación " + Arrays.toString(perm)
                    + " no corresponde a un array de rango " + shape.length + ".");
        }
        boolean[] seen = new boolean[shape.length];
        int[] newShape = new int[shape.length];
        int[] sourceStrides = new int[shape.length];
        for (int i = 0; i < perm.length; i++) {
            int axis = normalizeAxis(perm[i], shape.length);
            if (seen[axis]) {
                throw new IllegalArgumentException("Eje repetido en la permutación: " + Arrays.toString(perm));
            }
            seen[axis] = true;
            newShape[i] = shape[axis];
            sourceStrides[i] = strides[axis];
        }
        double[] result = new double[data.length];
        if (result.length > 0) {
            int[] index = new int[newShape.length];
            int flat = 0;
            do {
                int source = 0;
                for (int d = 0; d < index.length; d++) {
                    source += index[d] * sourceStrides[d];
                }
                result[flat++] = data[source];
            } while (nextIndex(index, newShape));
        }
        return new NDArray(result, newShape);
    }

    public NDArray swapAxes(int axisA, int axisB) {
        int a = normalizeAxis(axisA, shape.length);
        int b = normalizeAxis(axisB, shape.length);
        int[] perm = new int[shape.length];
        for (int i = 0; i < perm.length; i++) {
            perm[i] = i;
        }
        perm[a] = b;
        perm[b] = a;
        return transpose(perm);
    }

    public NDArray map(DoubleUnaryOperator operator) {
        double[] result = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            result[i] = operator.applyAsDouble(data[i]);
        }
        return new NDArray(result, shape.clone());
    }

    /**
     * Devuelve una copia en la que todo valor NaN o infinito se sustituye por {@code replacement}.
     */
    public NDArray replaceNonFinite(double replacement) {
        return map(v -> Double.isFinite(v) ? v : replacement);
    }

    public int countNonFinite() {
        int count = 0;
        for (double v : data) {
            if (!Double.isFinite(v)) {
                count++;
            }
        }
        return count;
    }

    public BooleanNDArray test(DoublePredicate predicate) {
        boolean[] result = new boolean[data.length];
        for (int i = 0; i < data.length; i++) {
            result[i] = predicate.test(data[i]);
        }
        return BooleanNDArray.wrap(result, shape.clone());
    }

    public BooleanNDArray greaterThan(double threshold) {
        return test(v -> v > threshold);
    }

    /**
     * Escribe los valores de este array en un array destino de la misma forma.
     */
    public NDArray copyInto(NDArray target) {
        if (!Arrays.equals(shape, target.shape)) {
            throw new ShapeMismatchException("No se puede copiar un array de forma " + Arrays.toString(shape)
                    + " en uno de forma " + Arrays.toString(target.shape) + ".");
        }
        System.arraycopy(data, 0, target.data, 0, data.length);
        return target;
    }

    /**
     * Igualdad con tolerancia absoluta. Dos NaN en la misma posición se consideran iguales.
     */
    public boolean allClose(NDArray other, double tolerance) {
        if (!Arrays.equals(shape, other.shape)) {
            return false;
        }
        for (int i = 0; i < data.length; i++) {
            double a = data[i];
            double b = other.data[i];
            if (Double.isNaN(a) && Double.isNaN(b)) {
                continue;
            }
            if (a != b && !(Math.abs(a - b) <= tolerance)) {
                return false;
            }
        }
        return true;
    }

    // Métodos equals y hashCode por forma y contenido.
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NDArray that = (NDArray) o;
        return Arrays.equals(shape, that.shape) && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(shape) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        String values = data.length <= 16
                ? Arrays.toString(data)
                : Arrays.toString(Arrays.copyOf(data, 16)).replace("]", ", ...]");
        return "NDArray" + Arrays.toString(shape) + " " + values;
    }
}
