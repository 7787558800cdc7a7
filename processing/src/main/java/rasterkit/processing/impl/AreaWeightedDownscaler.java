package rasterkit.processing.impl;

import rasterkit.domain.array.NDArray;
import rasterkit.domain.grid.Coordinates;
import rasterkit.exception.ShapeMismatchException;
import rasterkit.processing.i.IAreaDownscaler;

/**
 * Promediado ponderado por área para reducir la resolución de un corte 2D.
 * <p>
 * Las coordenadas son centros de celda. Los bordes de cada celda están en el
 * punto medio entre centros vecinos; las celdas extremas se extienden media
 * separación más allá de su centro. El valor de una celda de salida es
 * <pre>
 *     Σ a[i][j] * wx[o][i] * wy[p][j]  /  (Σ wx[o][i] * Σ wy[p][j])
 * </pre>
 * donde {@code wx}, {@code wy} son los solapes 1D de intervalos. El solape 2D
 * es separable, así que se calculan por eje. Una celda de salida sin solape
 * queda en 0/0 = NaN; tratarla es responsabilidad del llamador.
 */
public class AreaWeightedDownscaler implements IAreaDownscaler {

    @Override
    public String getName() {
        return "AreaWeighted_2D";
    }

    @Override
    public String getDescription() {
        return "Promedio de celdas de entrada ponderado por el solape de intervalos con cada celda de salida.";
    }

    @Override
    public NDArray downscale(double[] xIn, double[] yIn, double[] xOut, double[] yOut, NDArray slice) {
        if (slice.rank() != 2) {
            throw new ShapeMismatchException("El promediado por área trabaja sobre cortes 2D, rango recibido: " + slice.rank());
        }
        if (slice.dim(0) != xIn.length || slice.dim(1) != yIn.length) {
            throw new ShapeMismatchException("El corte tiene forma [" + slice.dim(0) + ", " + slice.dim(1)
                    + "] pero las coordenadas de entrada son [" + xIn.length + ", " + yIn.length + "].");
        }
        double[][] wx = overlapWeights(cellEdges("xIn", xIn), cellEdges("xOut", xOut));
        double[][] wy = overlapWeights(cellEdges("yIn", yIn), cellEdges("yOut", yOut));

        int nxIn = xIn.length;
        int nyIn = yIn.length;
        int nxOut = xOut.length;
        int nyOut = yOut.length;

        // 1. Reducir el eje y: partial[i][p] = Σj a[i][j] * wy[p][j]
        double[][] partial = new double[nxIn][nyOut];
        for (int i = 0; i < nxIn; i++) {
            for (int p = 0; p < nyOut; p++) {
                double sum = 0.0;
                for (int j = 0; j < nyIn; j++) {
                    double w = wy[p][j];
                    if (w != 0.0) { // Saltar celdas sin solape para no arrastrar NaN ajenos
                        sum += slice.get(i, j) * w;
                    }
                }
                partial[i][p] = sum;
            }
        }

        // 2. Reducir el eje x y normalizar por el área solapada
        double[] sumWy = rowSums(wy);
        double[] out = new double[nxOut * nyOut];
        for (int o = 0; o < nxOut; o++) {
            double sumWx = 0.0;
            for (int i = 0; i < nxIn; i++) {
                sumWx += wx[o][i];
            }
            for (int p = 0; p < nyOut; p++) {
                double sum = 0.0;
                for (int i = 0; i < nxIn; i++) {
                    double w = wx[o][i];
                    if (w != 0.0) {
                        sum += partial[i][p] * w;
                    }
                }
                out[o * nyOut + p] = sum / (sumWx * sumWy[p]);
            }
        }
        return NDArray.of(out, nxOut, nyOut);
    }

    /**
     * Bordes de celda a partir de los centros: {@code n + 1} valores.
     */
    static double[] cellEdges(String name, double[] centers) {
        Coordinates.requireStrictlyIncreasing(name, centers, 2);
        int n = centers.length;
        double[] edges = new double[n + 1];
        edges[0] = centers[0] - (centers[1] - centers[0]) / 2.0;
        for (int i = 1; i < n; i++) {
            edges[i] = (centers[i - 1] + centers[i]) / 2.0;
        }
        edges[n] = centers[n - 1] + (centers[n - 1] - centers[n - 2]) / 2.0;
        return edges;
    }

    /**
     * Matriz {@code [nOut][nIn]} con la longitud del solape de cada par de intervalos.
     */
    static double[][] overlapWeights(double[] edgesIn, double[] edgesOut) {
        int nIn = edgesIn.length - 1;
        int nOut = edgesOut.length - 1;
        double[][] weights = new double[nOut][nIn];
        for (int o = 0; o < nOut; o++) {
            for (int i = 0; i < nIn; i++) {
                double overlap = Math.min(edgesOut[o + 1], edgesIn[i + 1]) - Math.max(edgesOut[o], edgesIn[i]);
                weights[o][i] = Math.max(0.0, overlap);
            }
        }
        return weights;
    }

    private static double[] rowSums(double[][] weights) {
        double[] sums = new double[weights.length];
        for (int r = 0; r < weights.length; r++) {
            for (double w : weights[r]) {
                sums[r] += w;
            }
        }
        return sums;
    }
}
