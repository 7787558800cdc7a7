package rasterkit.domain.fit;

/**
 * Resultado de una regresión lineal por mínimos cuadrados {@code y = slope * x + intercept}.
 *
 * @param slope         Pendiente.
 * @param intercept     Ordenada en el origen (0 si se fijó).
 * @param residualRatio Suma de residuos al cuadrado dividida por {@code Σ y²}.
 */
public record LinearFit(double slope, double intercept, double residualRatio) {

    public double predict(double x) {
        return slope * x + intercept;
    }
}
