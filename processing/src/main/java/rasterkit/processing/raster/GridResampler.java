package rasterkit.processing.raster;

import lombok.extern.slf4j.Slf4j;
import rasterkit.config.InterpolationOptions;
import rasterkit.config.ProcessingConfig;
import rasterkit.domain.array.NDArray;
import rasterkit.domain.axis.AxisSelection;
import rasterkit.domain.grid.AxisLimits;
import rasterkit.domain.grid.RegularGrid;
import rasterkit.domain.grid.TargetGrid;
import rasterkit.exception.ShapeMismatchException;
import rasterkit.processing.i.ICoordinateInterpolator;
import rasterkit.processing.impl.MapCoordinatesInterpolator;
import rasterkit.processing.stack.AxisStackEngine;

import java.util.List;
import java.util.Objects;

/**
 * Remuestrea un array definido sobre una malla cartesiana regular a una nueva malla destino.
 * <p>
 * Para cada corte de la pila, las coordenadas físicas de la malla destino se
 * convierten en índices de píxel fraccionarios con {@link RegularGrid} y se
 * evalúan con un {@link ICoordinateInterpolator}. La malla destino usa
 * indexado matricial: el corte resultante tiene forma {@code (len(t0), len(t1), ...)}.
 */
@Slf4j
public class GridResampler {

    private final AxisStackEngine engine;
    private final ICoordinateInterpolator interpolator;
    private final InterpolationOptions defaultOptions;

    public GridResampler() {
        this(new AxisStackEngine());
    }

    public GridResampler(AxisStackEngine engine) {
        this(engine, ProcessingConfig.defaults());
    }

    public GridResampler(AxisStackEngine engine, ProcessingConfig config) {
        this(engine, new MapCoordinatesInterpolator(), config.getInterpolation());
    }

    public GridResampler(AxisStackEngine engine, ICoordinateInterpolator interpolator, InterpolationOptions defaultOptions) {
        this.engine = Objects.requireNonNull(engine, "El motor de apilado no puede ser nulo.");
        this.interpolator = Objects.requireNonNull(interpolator, "El interpolador no puede ser nulo.");
        this.defaultOptions = Objects.requireNonNull(defaultOptions, "Las opciones por defecto no pueden ser nulas.");
    }

    public NDArray regrid(NDArray data, List<AxisLimits> limits, List<double[]> targetAxes) {
        return regrid(data, limits, targetAxes, AxisSelection.trailing(), defaultOptions);
    }

    public NDArray regrid(NDArray data, List<AxisLimits> limits, List<double[]> targetAxes, AxisSelection axes) {
        return regrid(data, limits, targetAxes, axes, defaultOptions);
    }

    public NDArray regrid(NDArray data, List<AxisLimits> limits, List<double[]> targetAxes, InterpolationOptions options) {
        return regrid(data, limits, targetAxes, AxisSelection.trailing(), options);
    }

    /**
     * @param data       Array N-dimensional a remuestrear.
     * @param limits     Extensión física {@code [min, max]} de cada eje regridado, en el orden de {@code axes}.
     * @param targetAxes Coordenadas destino de cada eje regridado, en el mismo orden.
     * @param axes       Ejes a regridar. Por defecto los {@code targetAxes.size()} últimos.
     * @param options    Orden de interpolación y valor de relleno.
     * @return Array nuevo cuyos ejes regridados miden la longitud de su eje destino.
     * @throws ShapeMismatchException   si el número de límites no coincide con el de ejes destino.
     * @throws IllegalArgumentException si no se pide ningún eje destino.
     */
    public NDArray regrid(NDArray data, List<AxisLimits> limits, List<double[]> targetAxes,
                          AxisSelection axes, InterpolationOptions options) {
        Objects.requireNonNull(data, "El array de entrada no puede ser nulo.");
        Objects.requireNonNull(limits, "Los límites no pueden ser nulos.");
        Objects.requireNonNull(targetAxes, "Los ejes destino no pueden ser nulos.");
        InterpolationOptions effective = options == null ? defaultOptions : options;

        // 1. Validación antes de cualquier cálculo
        if (limits.size() != targetAxes.size()) {
            throw new ShapeMismatchException("La extensión no tiene la forma correcta (" + limits.size()
                    + " límites, se esperaban " + targetAxes.size() + ").");
        }
        if (targetAxes.isEmpty()) {
            throw new IllegalArgumentException("Hay que indicar al menos un eje destino.");
        }
        int opRank = targetAxes.size();
        int[] operatingAxes = AxisSelection.orTrailing(axes).resolve(opRank, data.rank());

        // 2. Mapeo afín de la malla destino a píxeles de la malla origen, común a todos los cortes
        int[] sourceSizes = new int[opRank];
        for (int i = 0; i < opRank; i++) {
            sourceSizes[i] = data.dim(operatingAxes[i]);
        }
        RegularGrid source = new RegularGrid(limits, sourceSizes);
        TargetGrid target = new TargetGrid(targetAxes);
        double[][] pixels = meshPixels(source, target);

        int[] outShape = data.shape();
        int[] targetShape = target.shape();
        for (int i = 0; i < opRank; i++) {
            outShape[operatingAxes[i]] = targetShape[i];
        }
        log.debug("Remuestreo {} -> {} sobre los ejes {} (orden {}, relleno {})",
                source, target.pointCount(), axes, effective.getOrder(), effective.getFillValue());

        return engine.apply(
                slice -> NDArray.of(
                        interpolator.interpolate(slice, pixels, effective.getOrder(), effective.getFillValue()),
                        targetShape),
                opRank, data, axes, NDArray.zeros(outShape));
    }

    /**
     * Coordenadas de píxel de cada punto de la malla destino, {@code [eje][punto]}, con los
     * puntos en orden fila-mayor sobre la forma de la malla destino.
     */
    private static double[][] meshPixels(RegularGrid source, TargetGrid target) {
        int rank = target.rank();
        int[] shape = target.shape();
        int points = target.pointCount();
        double[][] axisPixels = new double[rank][];
        for (int d = 0; d < rank; d++) {
            axisPixels[d] = source.toPixels(d, target.axis(d));
        }

        double[][] pixels = new double[rank][points];
        int stride = points;
        for (int d = 0; d < rank; d++) {
            int n = shape[d];
            if (n == 0) {
                break;
            }
            stride /= n;
            for (int p = 0; p < points; p++) {
                pixels[d][p] = axisPixels[d][(p / stride) % n];
            }
        }
        return pixels;
    }
}
