package rasterkit.processing.impl;

import net.imglib2.RandomAccessible;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;
import rasterkit.domain.array.NDArray;
import rasterkit.domain.grid.BoundaryMode;

import java.util.Objects;

/**
 * Puente entre {@link NDArray} e imglib2.
 * <p>
 * imglib2 recorre primero la dimensión 0, justo al revés que el orden
 * fila-mayor de {@link NDArray}: el eje {@code a} de un array de rango
 * {@code k} es la dimensión {@code k - 1 - a} de la imagen. Con esa inversión
 * los datos planos se comparten sin reordenar.
 */
public final class NDArrayImgs {

    /**
     * Prohibido construir esta clase utilidad
     */
    private NDArrayImgs() {
    }

    /**
     * Imagen respaldada por una copia de los datos de {@code array}.
     */
    public static ArrayImg<DoubleType, DoubleArray> wrap(NDArray array) {
        return wrap(array.toArray(), array.shape());
    }

    /**
     * Imagen que escribe directamente sobre {@code data}, interpretado con la forma fila-mayor {@code shape}.
     */
    public static ArrayImg<DoubleType, DoubleArray> wrap(double[] data, int[] shape) {
        return ArrayImgs.doubles(data, dimensions(shape));
    }

    public static long[] dimensions(int[] shape) {
        long[] dims = new long[shape.length];
        for (int axis = 0; axis < shape.length; axis++) {
            dims[dimensionOf(axis, shape.length)] = shape[axis];
        }
        return dims;
    }

    public static int dimensionOf(int axis, int rank) {
        return rank - 1 - axis;
    }

    /**
     * Extiende la imagen más allá de sus límites según el convenio de borde.
     *
     * @param constantValue Valor exterior para {@link BoundaryMode#CONSTANT}; se ignora en el resto de modos.
     */
    public static RandomAccessible<DoubleType> extend(RandomAccessibleInterval<DoubleType> img,
                                                      BoundaryMode mode, double constantValue) {
        Objects.requireNonNull(mode, "El modo de borde no puede ser nulo.");
        return switch (mode) {
            case CONSTANT -> Views.extendValue(img, new DoubleType(constantValue));
            case REFLECT -> Views.extendMirrorDouble(img);
            case NEAREST -> Views.extendBorder(img);
            case WRAP -> Views.extendPeriodic(img);
        };
    }
}
