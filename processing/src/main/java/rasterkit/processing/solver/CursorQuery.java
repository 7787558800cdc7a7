package rasterkit.processing.solver;

import lombok.Builder;

/**
 * Consulta de cursor sobre una curva muestreada {@code (x, y)}.
 *
 * @param x          Abscisas de la curva.
 * @param y          Ordenadas de la curva.
 * @param pointer    Valor de {@code y} (o de {@code x} si {@code swapAxes}) a localizar.
 * @param lowerBound Límite inferior opcional de la búsqueda, en unidades de {@code x}.
 * @param upperBound Límite superior opcional de la búsqueda, en unidades de {@code x}. Es inclusivo:
 *                   la ventana llega hasta la muestra siguiente al intervalo que contiene el límite,
 *                   de modo que un cruce situado justo en {@code upperBound} se encuentra.
 * @param swapAxes   Si es {@code true}, se intercambian los papeles de {@code x} e {@code y}.
 */
@Builder
public record CursorQuery(double[] x, double[] y, double pointer, Double lowerBound, Double upperBound, boolean swapAxes) {
}
