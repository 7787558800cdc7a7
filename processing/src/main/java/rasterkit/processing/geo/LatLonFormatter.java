package rasterkit.processing.geo;

import java.util.IllegalFormatException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Formatea pares latitud/longitud como texto decimal con sufijos N/S/E/W.
 * <p>
 * La latitud se reduce módulo 90 y la longitud módulo 180, conservando el
 * signo como en {@code fmod}. No convierte a formato sexagesimal.
 */
public final class LatLonFormatter {

    public static final String DEFAULT_TEMPLATE = "(%lat, %lon)";
    public static final String DEFAULT_PRECISION = ".2f";

    private static final String LAT_PLACEHOLDER = "%lat";
    private static final String LON_PLACEHOLDER = "%lon";

    /**
     * Prohibido construir esta clase utilidad
     */
    private LatLonFormatter() {
    }

    public static String format(double lat, double lon) {
        return format(lat, lon, DEFAULT_TEMPLATE, DEFAULT_PRECISION);
    }

    public static String format(double lat, double lon, String template) {
        return format(lat, lon, template, DEFAULT_PRECISION);
    }

    /**
     * @param template  Texto en el que {@code %lat} y {@code %lon} se sustituyen por cada coordenada.
     * @param precision Especificador de formato sin el {@code %} inicial (p. ej. {@code ".3f"}), común a ambas.
     */
    public static String format(double lat, double lon, String template, String precision) {
        return format(lat, lon, template, List.of(precision, precision));
    }

    /**
     * @param precisions Dos especificadores de formato: latitud y longitud.
     * @throws IllegalArgumentException si no hay exactamente dos especificadores o alguno no es válido.
     */
    public static String format(double lat, double lon, String template, List<String> precisions) {
        Objects.requireNonNull(template, "La plantilla no puede ser nula.");
        Objects.requireNonNull(precisions, "Los formatos no pueden ser nulos.");
        if (precisions.size() != 2) {
            throw new IllegalArgumentException("Se esperaban 2 formatos (latitud, longitud), se recibieron " + precisions.size() + ".");
        }

        double wrappedLat = lat % 90.0;
        double wrappedLon = lon % 180.0;
        String latText = formatValue(Math.abs(wrappedLat), precisions.get(0)) + (wrappedLat >= 0 ? "N" : "S");
        String lonText = formatValue(Math.abs(wrappedLon), precisions.get(1)) + (wrappedLon >= 0 ? "E" : "W");

        return template.replace(LAT_PLACEHOLDER, latText).replace(LON_PLACEHOLDER, lonText);
    }

    private static String formatValue(double value, String precision) {
        Objects.requireNonNull(precision, "El formato no puede ser nulo.");
        try {
            return String.format(Locale.ROOT, "%" + precision, value);
        } catch (IllegalFormatException e) {
            throw new IllegalArgumentException("Formato numérico no válido: '" + precision + "'", e);
        }
    }
}
