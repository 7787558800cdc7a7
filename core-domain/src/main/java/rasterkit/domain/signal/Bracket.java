package rasterkit.domain.signal;

/**
 * Resultado de una búsqueda de cruce: el par de índices adyacentes
 * {@code [index, index + 1]} que se cree que contiene un cambio de signo.
 *
 * @param index      Índice inferior del intervalo encontrado.
 * @param status     Si el intervalo contiene realmente el cruce.
 * @param iterations Número de pasos de bisección ejecutados.
 */
public record Bracket(int index, Status status, int iterations) {

    public enum Status {
        /**
         * {@code c[index] * c[index + 1] <= 0}: hay cambio de signo o una muestra exactamente en el objetivo.
         */
        CROSSING,
        /**
         * La bisección terminó sin cambio de signo en el intervalo final.
         */
        NO_SIGN_CHANGE,
        /**
         * Se alcanzó el límite de iteraciones antes de reducir el intervalo a una celda.
         */
        ITERATION_LIMIT
    }

    public boolean isCrossing() {
        return status == Status.CROSSING;
    }
}
