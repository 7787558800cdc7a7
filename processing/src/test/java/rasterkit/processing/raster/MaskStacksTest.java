package rasterkit.processing.raster;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import rasterkit.domain.array.BooleanNDArray;

import static org.junit.jupiter.api.Assertions.*;

class MaskStacksTest {

    @Test
    @DisplayName("Pila de máscaras idénticas es uniforme; basta una celda distinta para que no lo sea")
    void isUniform_shouldCompareAgainstFirstMask() {
        // ARRANGE
        BooleanNDArray stack = BooleanNDArray.falses(3, 2, 2);
        for (int s = 0; s < 3; s++) {
            stack.set(true, s, 0, 1);
        }

        // ACT & ASSERT
        assertTrue(MaskStacks.isUniform(stack));
        stack.set(true, 2, 1, 1);
        assertFalse(MaskStacks.isUniform(stack));
    }

    @Test
    @DisplayName("Una sola máscara siempre es uniforme")
    void isUniform_singleMask() {
        assertTrue(MaskStacks.isUniform(BooleanNDArray.falses(1, 4, 4)));
        assertThrows(IllegalArgumentException.class, () -> MaskStacks.isUniform(BooleanNDArray.falses()));
    }
}
