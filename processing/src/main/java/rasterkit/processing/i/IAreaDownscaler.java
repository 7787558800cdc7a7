package rasterkit.processing.i;

import rasterkit.domain.array.NDArray;

public interface IAreaDownscaler extends IProcessingComponent {
    /**
     * Promedia un corte 2D ponderando cada celda de entrada por su solape con cada celda de salida.
     * @param xIn   Coordenadas del eje 0 del corte (alta resolución), estrictamente crecientes.
     * @param yIn   Coordenadas del eje 1 del corte (alta resolución), estrictamente crecientes.
     * @param xOut  Coordenadas del eje 0 de la salida (baja resolución).
     * @param yOut  Coordenadas del eje 1 de la salida (baja resolución).
     * @param slice Corte de forma {@code (xIn.length, yIn.length)}.
     * @return Corte de forma {@code (xOut.length, yOut.length)}. Las celdas sin solape valen NaN.
     */
    NDArray downscale(double[] xIn, double[] yIn, double[] xOut, double[] yOut, NDArray slice);
}
