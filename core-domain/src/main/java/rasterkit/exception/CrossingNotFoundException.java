package rasterkit.exception;

import rasterkit.domain.signal.Bracket;

/**
 * La búsqueda por bisección terminó sin encontrar un cambio de signo en la
 * ventana pedida, así que no existe un cruce que interpolar.
 */
public class CrossingNotFoundException extends IllegalStateException {

    private final transient Bracket bracket;

    public CrossingNotFoundException(double target, Bracket bracket) {
        super("No se encontró cruce con el valor " + target + " (estado: " + bracket.status()
                + ", índice: " + bracket.index() + ").");
        this.bracket = bracket;
    }

    public Bracket getBracket() {
        return bracket;
    }
}
