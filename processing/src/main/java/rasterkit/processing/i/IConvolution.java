package rasterkit.processing.i;

import rasterkit.domain.array.NDArray;
import rasterkit.domain.grid.BoundaryMode;

public interface IConvolution extends IProcessingComponent {
    /**
     * Convolución N-dimensional con salida del mismo tamaño que la entrada.
     * @param slice  Corte de entrada.
     * @param kernel Pesos, del mismo rango que el corte.
     * @return Nuevo array con la forma de {@code slice}.
     */
    NDArray convolve(NDArray slice, NDArray kernel);

    /**
     * Convenio aplicado a las celdas fuera del corte.
     */
    BoundaryMode getBoundaryMode();
}
