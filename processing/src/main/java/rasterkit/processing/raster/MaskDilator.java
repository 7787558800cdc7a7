package rasterkit.processing.raster;

import lombok.extern.slf4j.Slf4j;
import rasterkit.config.ProcessingConfig;
import rasterkit.domain.array.BooleanNDArray;
import rasterkit.domain.array.NDArray;
import rasterkit.domain.axis.AxisSelection;
import rasterkit.domain.grid.Kernel;
import rasterkit.factory.KernelFactory;
import rasterkit.processing.i.IConvolution;
import rasterkit.processing.impl.DirectConvolution;
import rasterkit.processing.stack.AxisStackEngine;

import java.util.Objects;

/**
 * Agranda regiones booleanas de una pila de máscaras 2D.
 * <p>
 * Una celda pasa a ser verdadera si está dentro de la huella circular de radio
 * {@code nNeighbors} de alguna celda originalmente verdadera. Con el borde por
 * defecto ({@code CONSTANT} a 0) las celdas fuera del array cuentan como falsas,
 * así que la huella simplemente se recorta en los bordes.
 */
@Slf4j
public class MaskDilator {

    private static final int OP_RANK = 2;

    private final AxisStackEngine engine;
    private final IConvolution convolution;

    public MaskDilator() {
        this(new AxisStackEngine());
    }

    public MaskDilator(AxisStackEngine engine) {
        this(engine, new DirectConvolution());
    }

    public MaskDilator(AxisStackEngine engine, ProcessingConfig config) {
        this(engine, new DirectConvolution(config.getDilationBoundary()));
    }

    public MaskDilator(AxisStackEngine engine, IConvolution convolution) {
        this.engine = Objects.requireNonNull(engine, "El motor de apilado no puede ser nulo.");
        this.convolution = Objects.requireNonNull(convolution, "La convolución no puede ser nula.");
    }

    public BooleanNDArray dilate(BooleanNDArray mask, int nNeighbors) {
        return dilate(mask, nNeighbors, AxisSelection.trailing());
    }

    /**
     * @param mask       Máscara de rango ≥ 2.
     * @param nNeighbors Radio de la dilatación en celdas (≥ 0). 0 devuelve una copia.
     * @param axes       Los dos ejes espaciales. Por defecto los dos últimos.
     */
    public BooleanNDArray dilate(BooleanNDArray mask, int nNeighbors, AxisSelection axes) {
        Objects.requireNonNull(mask, "La máscara no puede ser nula.");
        if (nNeighbors < 0) {
            throw new IllegalArgumentException("El radio de dilatación no puede ser negativo: " + nNeighbors);
        }
        AxisSelection.orTrailing(axes).resolve(OP_RANK, mask.rank());

        Kernel kernel = KernelFactory.circleKernel(2 * nNeighbors + 1);
        NDArray weights = kernel.weights();
        log.debug("Dilatando máscara {} con núcleo {} ({})", mask, kernel, convolution.getBoundaryMode());

        NDArray convolved = engine.apply(slice -> convolution.convolve(slice, weights), OP_RANK, mask.toNumeric(), axes);
        return convolved.greaterThan(0.0);
    }
}
