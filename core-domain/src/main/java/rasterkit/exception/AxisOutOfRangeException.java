package rasterkit.exception;

/**
 * Índice de eje fuera del rango {@code [-rank, rank)} del array.
 */
public class AxisOutOfRangeException extends IndexOutOfBoundsException {

    private final int axis;
    private final int rank;

    public AxisOutOfRangeException(int axis, int rank) {
        super("El eje " + axis + " está fuera de los límites para un array de rango " + rank
                + " (válido: [" + (-rank) + ", " + (rank - 1) + "]).");
        this.axis = axis;
        this.rank = rank;
    }

    public int getAxis() {
        return axis;
    }

    public int getRank() {
        return rank;
    }
}
