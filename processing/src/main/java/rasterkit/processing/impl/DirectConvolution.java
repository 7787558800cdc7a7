package rasterkit.processing.impl;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessible;
import net.imglib2.algorithm.neighborhood.Neighborhood;
import net.imglib2.algorithm.neighborhood.RectangleShape;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;
import rasterkit.domain.array.NDArray;
import rasterkit.domain.grid.BoundaryMode;
import rasterkit.exception.ShapeMismatchException;
import rasterkit.processing.i.IConvolution;

import java.util.Objects;

/**
 * Convolución N-dimensional directa con salida del mismo tamaño que la entrada.
 * <p>
 * El núcleo se invierte (convolución, no correlación) y su centro está en
 * {@code size / 2} en cada eje:
 * <pre>
 *     out[i] = Σk w[k] * in[i + c - k]
 * </pre>
 * Cada salida se acumula sobre un vecindario rectangular de imglib2 que cubre
 * el núcleo; las lecturas fuera del corte salen de la extensión del
 * {@link BoundaryMode} configurado.
 */
public class DirectConvolution implements IConvolution {

    private final BoundaryMode boundaryMode;
    private final double constantValue;

    /**
     * Convolución con borde constante a cero: fuera del array no hay nada.
     */
    public DirectConvolution() {
        this(BoundaryMode.CONSTANT, 0.0);
    }

    public DirectConvolution(BoundaryMode boundaryMode) {
        this(boundaryMode, 0.0);
    }

    public DirectConvolution(BoundaryMode boundaryMode, double constantValue) {
        this.boundaryMode = Objects.requireNonNull(boundaryMode, "El modo de borde no puede ser nulo.");
        this.constantValue = constantValue;
    }

    @Override
    public String getName() {
        return "DirectConvolution_" + boundaryMode;
    }

    @Override
    public BoundaryMode getBoundaryMode() {
        return boundaryMode;
    }

    @Override
    public NDArray convolve(NDArray slice, NDArray kernel) {
        int rank = slice.rank();
        if (kernel.rank() != rank) {
            throw new ShapeMismatchException("El núcleo tiene rango " + kernel.rank()
                    + " pero el corte tiene rango " + rank + ".");
        }
        int[] shape = slice.shape();
        double[] result = new double[slice.size()];
        if (slice.size() == 0 || kernel.size() == 0) {
            return NDArray.of(result, shape);
        }
        if (rank == 0) {
            return NDArray.of(new double[]{kernel.getFlat(0) * slice.getFlat(0)});
        }

        int[] kShape = kernel.shape();
        int[] kStrides = kernel.strides();
        int[] center = new int[rank];
        int span = 0;
        for (int axis = 0; axis < rank; axis++) {
            center[axis] = kShape[axis] / 2;
            span = Math.max(span, Math.max(center[axis], kShape[axis] - 1 - center[axis]));
        }

        ArrayImg<DoubleType, DoubleArray> source = NDArrayImgs.wrap(slice);
        RandomAccessible<DoubleType> extended = NDArrayImgs.extend(source, boundaryMode, constantValue);
        RandomAccess<DoubleType> target = NDArrayImgs.wrap(result, shape).randomAccess();

        for (Neighborhood<DoubleType> neighborhood : new RectangleShape(span, false).neighborhoods(Views.interval(extended, source))) {
            double sum = 0.0;
            Cursor<DoubleType> cursor = neighborhood.localizingCursor();
            while (cursor.hasNext()) {
                cursor.fwd();
                int kOffset = kernelOffset(cursor, neighborhood, center, kShape, kStrides);
                if (kOffset < 0) {
                    continue;
                }
                double w = kernel.getFlat(kOffset);
                if (w != 0.0) {
                    sum += w * cursor.get().getRealDouble();
                }
            }
            target.setPosition(neighborhood);
            target.get().setReal(sum);
        }
        return NDArray.of(result, shape);
    }

    /**
     * Posición plana del peso que multiplica al vecino {@code cursor}, o -1 si cae fuera del núcleo.
     */
    private static int kernelOffset(Cursor<DoubleType> cursor, Neighborhood<DoubleType> neighborhood,
                                    int[] center, int[] kShape, int[] kStrides) {
        int rank = kShape.length;
        int offset = 0;
        for (int axis = 0; axis < rank; axis++) {
            int dim = NDArrayImgs.dimensionOf(axis, rank);
            long k = center[axis] - (cursor.getLongPosition(dim) - neighborhood.getLongPosition(dim));
            if (k < 0 || k >= kShape[axis]) {
                return -1;
            }
            offset += (int) k * kStrides[axis];
        }
        return offset;
    }
}
