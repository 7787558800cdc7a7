package rasterkit.processing.solver;

import lombok.extern.slf4j.Slf4j;
import rasterkit.domain.signal.Bracket;
import rasterkit.domain.signal.SearchWindow;
import rasterkit.exception.CrossingNotFoundException;
import rasterkit.exception.ShapeMismatchException;

import java.util.Objects;

/**
 * Localiza la abscisa en la que una curva muestreada alcanza un valor dado,
 * interpolando linealmente dentro del intervalo que devuelve {@link ZeroCrossingSearch}.
 */
@Slf4j
public class CursorLocator {

    private final ZeroCrossingSearch search;

    public CursorLocator() {
        this(new ZeroCrossingSearch());
    }

    public CursorLocator(ZeroCrossingSearch search) {
        this.search = Objects.requireNonNull(search, "La búsqueda por bisección no puede ser nula.");
    }

    public double locate(double[] x, double[] y, double pointer) {
        return locate(CursorQuery.builder().x(x).y(y).pointer(pointer).build());
    }

    public double locate(double[] x, double[] y, double pointer, double lowerBound, double upperBound) {
        return locate(CursorQuery.builder().x(x).y(y).pointer(pointer)
                .lowerBound(lowerBound).upperBound(upperBound).build());
    }

    /**
     * Resuelve la consulta.
     * <p>
     * Los límites de la consulta se traducen a índices buscando su cruce en
     * {@code x}; el límite superior incluye la muestra siguiente a su intervalo.
     * Si la pendiente del intervalo es nula, el resultado es NaN o infinito.
     *
     * @throws CrossingNotFoundException si la curva no cruza {@code pointer} dentro de la ventana.
     * @throws IllegalArgumentException  si el límite inferior supera al superior.
     */
    public double locate(CursorQuery query) {
        Objects.requireNonNull(query, "La consulta no puede ser nula.");
        double[] xs = query.swapAxes() ? query.y() : query.x();
        double[] ys = query.swapAxes() ? query.x() : query.y();
        Objects.requireNonNull(xs, "Las abscisas no pueden ser nulas.");
        Objects.requireNonNull(ys, "Las ordenadas no pueden ser nulas.");
        if (xs.length != ys.length) {
            throw new ShapeMismatchException("x e y deben tener la misma longitud: " + xs.length + " != " + ys.length);
        }
        if (xs.length < 2) {
            throw new IllegalArgumentException("Se necesitan al menos 2 muestras para localizar un cursor.");
        }

        if (query.lowerBound() != null && query.upperBound() != null && query.lowerBound() > query.upperBound()) {
            throw new IllegalArgumentException("El límite inferior del cursor (" + query.lowerBound()
                    + ") no puede superar al superior (" + query.upperBound() + ").");
        }

        int n = xs.length;
        int t1 = query.lowerBound() == null ? 0 : search.findBracket(xs, query.lowerBound()).index();
        int t2 = query.upperBound() == null
                ? n - 1
                : Math.min(search.findBracket(xs, query.upperBound()).index() + 1, n - 1);
        SearchWindow window = new SearchWindow(t1, t2);

        Bracket bracket = search.findBracket(ys, query.pointer(), window);
        if (bracket.status() == Bracket.Status.NO_SIGN_CHANGE) {
            throw new CrossingNotFoundException(query.pointer(), bracket);
        }
        if (bracket.status() == Bracket.Status.ITERATION_LIMIT) {
            log.warn("Cursor interpolado en un intervalo no convergido ({}).", bracket);
        }

        int t = bracket.index();
        double slope = (ys[t + 1] - ys[t]) / (xs[t + 1] - xs[t]);
        return (query.pointer() - ys[t]) / slope + xs[t];
    }
}
