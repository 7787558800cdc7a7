package rasterkit.domain.axis;

import rasterkit.domain.array.NDArray;
import rasterkit.exception.ShapeMismatchException;

import java.util.Arrays;

/**
 * Selección ordenada de los ejes sobre los que actúa directamente una operación
 * (ejes operativos). Los índices pueden ser negativos y se cuentan desde el final.
 * <p>
 * La selección por defecto ({@link #trailing()}) toma los últimos {@code opRank}
 * ejes en su orden actual. La normalización y validación contra el rango del
 * array se hace explícitamente con {@link #resolve(int, int)} al inicio de cada
 * operación, nunca a mitad de cálculo.
 */
public final class AxisSelection {

    private static final AxisSelection TRAILING = new AxisSelection(null);

    /**
     * Ejes pedidos, o {@code null} para "los últimos opRank ejes".
     */
    private final int[] axes;

    private AxisSelection(int[] axes) {
        this.axes = axes;
    }

    public static AxisSelection trailing() {
        return TRAILING;
    }

    public static AxisSelection of(int... axes) {
        if (axes == null) {
            return TRAILING;
        }
        return new AxisSelection(axes.clone());
    }

    /**
     * Sustituye una selección ausente por la selección por defecto.
     */
    public static AxisSelection orTrailing(AxisSelection selection) {
        return selection == null ? TRAILING : selection;
    }

    public boolean isTrailing() {
        return axes == null;
    }

    /**
     * Normaliza la selección a índices no negativos y la valida contra el rango del array.
     *
     * @param opRank    Número de ejes sobre los que trabaja la operación.
     * @param arrayRank Rango del array de entrada.
     * @return Los ejes operativos normalizados, en el orden pedido.
     * @throws ShapeMismatchException si el número de ejes no es {@code opRank} o {@code opRank} excede el rango.
     * @throws rasterkit.exception.AxisOutOfRangeException si algún eje está fuera de {@code [-rank, rank)}.
     * @throws IllegalArgumentException si hay ejes repetidos o {@code opRank} es negativo.
     */
    public int[] resolve(int opRank, int arrayRank) {
        if (opRank < 0) {
            throw new IllegalArgumentException("El rango de la operación no puede ser negativo: " + opRank);
        }
        if (opRank > arrayRank) {
            throw new ShapeMismatchException("La operación trabaja sobre " + opRank
                    + " ejes pero el array solo tiene rango " + arrayRank + ".");
        }
        if (axes == null) {
            int[] resolved = new int[opRank];
            for (int i = 0; i < opRank; i++) {
                resolved[i] = arrayRank - opRank + i;
            }
            return resolved;
        }
        if (axes.length != opRank) {
            throw new ShapeMismatchException("Se seleccionaron " + axes.length + " ejes " + Arrays.toString(axes)
                    + " pero la operación requiere exactamente " + opRank + ".");
        }
        int[] resolved = new int[opRank];
        boolean[] seen = new boolean[arrayRank];
        for (int i = 0; i < opRank; i++) {
            resolved[i] = NDArray.normalizeAxis(axes[i], arrayRank);
            if (seen[resolved[i]]) {
                throw new IllegalArgumentException("Eje repetido en la selección: " + Arrays.toString(axes));
            }
            seen[resolved[i]] = true;
        }
        return resolved;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(axes, ((AxisSelection) o).axes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(axes);
    }

    @Override
    public String toString() {
        return axes == null ? "AxisSelection[trailing]" : "AxisSelection" + Arrays.toString(axes);
    }
}
