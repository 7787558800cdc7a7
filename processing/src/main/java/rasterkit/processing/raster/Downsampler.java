package rasterkit.processing.raster;

import lombok.extern.slf4j.Slf4j;
import rasterkit.domain.array.NDArray;
import rasterkit.domain.axis.AxisSelection;
import rasterkit.domain.grid.Coordinates;
import rasterkit.exception.ShapeMismatchException;
import rasterkit.processing.i.IAreaDownscaler;
import rasterkit.processing.impl.AreaWeightedDownscaler;
import rasterkit.processing.stack.AxisStackEngine;

import java.util.Objects;

/**
 * Reduce la resolución espacial de una pila de mapas 2D por promedio ponderado por área.
 * <p>
 * Delega el recorrido de la pila en {@link AxisStackEngine} (rango 2) y el
 * cálculo de cada corte en un {@link IAreaDownscaler}. Las celdas de salida
 * sin solape con la entrada (no finitas) se ponen a 0.
 */
@Slf4j
public class Downsampler {

    private static final int OP_RANK = 2;

    private final AxisStackEngine engine;
    private final IAreaDownscaler downscaler;

    public Downsampler() {
        this(new AxisStackEngine());
    }

    public Downsampler(AxisStackEngine engine) {
        this(engine, new AreaWeightedDownscaler());
    }

    public Downsampler(AxisStackEngine engine, IAreaDownscaler downscaler) {
        this.engine = Objects.requireNonNull(engine, "El motor de apilado no puede ser nulo.");
        this.downscaler = Objects.requireNonNull(downscaler, "El promediador no puede ser nulo.");
    }

    public NDArray average(NDArray array, double[] xIn, double[] yIn, double[] xOut, double[] yOut) {
        return average(array, xIn, yIn, xOut, yOut, AxisSelection.trailing());
    }

    /**
     * Promedia {@code array} de la malla {@code (xIn, yIn)} a la malla más gruesa {@code (xOut, yOut)}.
     *
     * @param array Array de rango ≥ 2. Los ejes no seleccionados se apilan y recorren.
     * @param xIn   Coordenadas del primer eje operativo (alta resolución), estrictamente crecientes.
     * @param yIn   Coordenadas del segundo eje operativo (alta resolución), estrictamente crecientes.
     * @param xOut  Coordenadas de salida del primer eje operativo.
     * @param yOut  Coordenadas de salida del segundo eje operativo.
     * @param axes  Los dos ejes operativos (x, y). Por defecto los dos últimos.
     * @return Array con los ejes operativos redimensionados a {@code xOut.length} y {@code yOut.length}.
     */
    public NDArray average(NDArray array, double[] xIn, double[] yIn, double[] xOut, double[] yOut, AxisSelection axes) {
        Objects.requireNonNull(array, "El array de entrada no puede ser nulo.");

        // 1. Validación estructural antes de cualquier cálculo
        int[] operatingAxes = AxisSelection.orTrailing(axes).resolve(OP_RANK, array.rank());
        Coordinates.requireStrictlyIncreasing("xIn", xIn, 2);
        Coordinates.requireStrictlyIncreasing("yIn", yIn, 2);
        Coordinates.requireStrictlyIncreasing("xOut", xOut, 2);
        Coordinates.requireStrictlyIncreasing("yOut", yOut, 2);
        if (array.dim(operatingAxes[0]) != xIn.length || array.dim(operatingAxes[1]) != yIn.length) {
            throw new ShapeMismatchException("Los ejes operativos miden [" + array.dim(operatingAxes[0]) + ", "
                    + array.dim(operatingAxes[1]) + "] pero las coordenadas de entrada son ["
                    + xIn.length + ", " + yIn.length + "].");
        }

        // 2. Salida pre-dimensionada: la operación cambia el tamaño de los ejes operativos
        int[] outShape = array.shape();
        outShape[operatingAxes[0]] = xOut.length;
        outShape[operatingAxes[1]] = yOut.length;

        NDArray result = engine.apply(
                slice -> downscaler.downscale(xIn, yIn, xOut, yOut, slice),
                OP_RANK, array, axes, NDArray.zeros(outShape));

        // 3. Recuperación local: celdas sin solape -> 0
        int nonFinite = result.countNonFinite();
        if (nonFinite > 0) {
            log.warn("{} celdas de salida sin solape con la entrada se han puesto a 0.", nonFinite);
            return result.replaceNonFinite(0.0);
        }
        return result;
    }
}
