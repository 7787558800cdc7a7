package rasterkit.factory;

import rasterkit.domain.array.NDArray;
import rasterkit.domain.grid.Kernel;

/**
 * Fábrica de núcleos de convolución.
 */
public final class KernelFactory {

    /**
     * Prohibido construir esta clase utilidad
     */
    private KernelFactory() {
    }

    /**
     * Núcleo circular {@code n x n}: la celda {@code (i, j)} vale 1 si
     * <pre>
     *     (i - (n-1)/2)² + (j - (n-1)/2)² ≤ (n/2)²
     * </pre>
     * y 0 en otro caso. La fórmula del centro vale igual para {@code n} par e impar.
     *
     * @param n Lado del núcleo (≥ 1).
     * @return Núcleo simétrico frente a giros de 90° y reflexiones.
     * @throws IllegalArgumentException si {@code n < 1}.
     */
    public static Kernel circleKernel(int n) {
        if (n < 1) {
            throw new IllegalArgumentException("El lado del núcleo circular debe ser al menos 1, recibido: " + n);
        }
        double center = (n - 1) / 2.0;
        double radiusSquared = (n / 2.0) * (n / 2.0);
        NDArray weights = NDArray.zeros(n, n);
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                double di = i - center;
                double dj = j - center;
                if (di * di + dj * dj <= radiusSquared) {
                    weights.set(1.0, i, j);
                }
            }
        }
        return new Kernel(weights);
    }
}
