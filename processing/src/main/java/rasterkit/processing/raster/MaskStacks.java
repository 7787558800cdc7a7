package rasterkit.processing.raster;

import rasterkit.domain.array.BooleanNDArray;

/**
 * Utilidades sobre pilas de máscaras.
 */
public final class MaskStacks {

    /**
     * Prohibido construir esta clase utilidad
     */
    private MaskStacks() {
    }

    /**
     * Indica si todas las máscaras a lo largo del eje 0 son idénticas a la primera.
     * Una pila vacía o de una sola máscara se considera uniforme.
     */
    public static boolean isUniform(BooleanNDArray stack) {
        if (stack.rank() == 0) {
            throw new IllegalArgumentException("Se esperaba una pila de máscaras de rango ≥ 1.");
        }
        int count = stack.shape()[0];
        if (count <= 1) {
            return true;
        }
        BooleanNDArray first = stack.slice(0);
        for (int i = 1; i < count; i++) {
            if (!first.equals(stack.slice(i))) {
                return false;
            }
        }
        return true;
    }
}
