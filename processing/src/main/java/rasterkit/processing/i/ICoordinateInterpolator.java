package rasterkit.processing.i;

import rasterkit.domain.array.NDArray;
import rasterkit.domain.grid.InterpolationOrder;

public interface ICoordinateInterpolator extends IProcessingComponent {
    /**
     * Evalúa el corte en coordenadas de píxel fraccionarias.
     * @param slice       Corte de rango k.
     * @param coordinates Array {@code [k][puntos]}: la fila {@code d} contiene la coordenada del eje {@code d} de cada punto.
     * @param order       Orden de interpolación.
     * @param fillValue   Valor para los puntos fuera del corte.
     * @return Un valor por punto, en el orden de las columnas de {@code coordinates}.
     */
    double[] interpolate(NDArray slice, double[][] coordinates, InterpolationOrder order, double fillValue);
}
