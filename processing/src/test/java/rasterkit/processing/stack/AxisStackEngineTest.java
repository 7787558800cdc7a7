package rasterkit.processing.stack;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import rasterkit.config.ProcessingConfig;
import rasterkit.domain.array.NDArray;
import rasterkit.domain.axis.AxisSelection;
import rasterkit.exception.AxisOutOfRangeException;
import rasterkit.exception.ShapeMismatchException;
import rasterkit.processing.i.ISliceOperation;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@Slf4j
class AxisStackEngineTest {

    private AxisStackEngine engine;

    @AfterEach
    void tearDown() {
        if (engine != null) engine.close();
    }

    private static NDArray sample(int... shape) {
        double[] data = new double[NDArray.sizeOf(shape)];
        for (int i = 0; i < data.length; i++) {
            data[i] = Math.sin(i) * 10.0;
        }
        return NDArray.of(data, shape);
    }

    @Test
    @DisplayName("Identidad: aplicar la identidad devuelve el array original para cualquier selección válida")
    void apply_identity_shouldRoundTrip() {
        // ARRANGE
        engine = new AxisStackEngine();
        NDArray array = sample(2, 3, 4, 5);
        List<AxisSelection> selections = List.of(
                AxisSelection.trailing(),
                AxisSelection.of(0, 2),
                AxisSelection.of(3, 1),
                AxisSelection.of(-1, -4));

        // ACT & ASSERT
        for (AxisSelection axes : selections) {
            NDArray result = engine.apply(slice -> slice, 2, array, axes);
            assertEquals(array, result, "Fallo con la selección " + axes);
        }
    }

    @Test
    @DisplayName("Identidad en paralelo: cada corte vuelve a su índice de pila")
    void apply_identity_parallel_shouldRoundTrip() {
        // ARRANGE
        engine = new AxisStackEngine(ProcessingConfig.builder().cpuProcessorCount(4).build());
        NDArray array = sample(6, 7, 3, 2);

        // ACT
        NDArray result = engine.apply(slice -> slice, 2, array, AxisSelection.of(1, 3));

        // ASSERT
        assertEquals(4, engine.getProcessorCount());
        assertEquals(array, result);
    }

    @Test
    @DisplayName("La operación se invoca una vez por entrada de pila con la forma operativa")
    void apply_shouldInvokeOperationOncePerSlice() {
        // ARRANGE
        engine = new AxisStackEngine();
        ISliceOperation operation = mock(ISliceOperation.class);
        when(operation.apply(any())).thenAnswer(inv -> inv.getArgument(0));

        // ACT
        engine.apply(operation, 2, sample(2, 3, 4, 5), AxisSelection.of(1, 2));

        // ASSERT: pila = 2 * 5
        verify(operation, times(10)).apply(argThat(slice -> slice.dim(0) == 3 && slice.dim(1) == 4));
    }

    @Test
    @DisplayName("Salida pre-dimensionada: la operación puede cambiar el tamaño de los ejes operativos")
    void apply_withOutput_shouldAllowResizedOperatingAxes() {
        // ARRANGE: suma por columnas sobre el eje 0
        engine = new AxisStackEngine();
        NDArray array = NDArray.fromMatrix(new double[][]{{1, 2}, {3, 4}, {5, 6}});
        NDArray output = NDArray.zeros(1, 2);
        ISliceOperation columnSum = slice -> {
            double sum = 0.0;
            for (int i = 0; i < slice.size(); i++) {
                sum += slice.getFlat(i);
            }
            return NDArray.filled(sum, 1);
        };

        // ACT
        NDArray result = engine.apply(columnSum, 1, array, AxisSelection.of(0), output);

        // ASSERT
        assertSame(output, result);
        assertArrayEquals(new double[][]{{9, 12}}, result.toMatrix());
    }

    @Test
    @DisplayName("Los valores fuera de los ejes operativos no se alteran")
    void apply_shouldOnlyTouchOperatingAxes() {
        // ARRANGE
        engine = new AxisStackEngine(ProcessingConfig.builder().cpuProcessorCount(2).build());
        NDArray array = sample(3, 4, 2);

        // ACT
        NDArray doubled = engine.apply(slice -> slice.map(v -> 2 * v), 1, array, AxisSelection.of(1));

        // ASSERT
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 4; j++) {
                for (int k = 0; k < 2; k++) {
                    assertEquals(2 * array.get(i, j, k), doubled.get(i, j, k), 1e-12);
                }
            }
        }
    }

    @Test
    @DisplayName("Errores de selección y de salida se detectan antes de ejecutar la operación")
    void apply_shouldValidateBeforeComputing() {
        // ARRANGE
        engine = new AxisStackEngine();
        ISliceOperation operation = mock(ISliceOperation.class);
        NDArray array = sample(2, 3, 4);

        // ACT & ASSERT
        assertThrows(ShapeMismatchException.class, () -> engine.apply(operation, 2, array, AxisSelection.of(0)));
        assertThrows(ShapeMismatchException.class, () -> engine.apply(operation, 4, array));
        assertThrows(AxisOutOfRangeException.class, () -> engine.apply(operation, 2, array, AxisSelection.of(0, 3)));
        assertThrows(IllegalArgumentException.class, () -> engine.apply(operation, 2, array, AxisSelection.of(1, -2)));
        assertThrows(ShapeMismatchException.class,
                () -> engine.apply(operation, 2, array, AxisSelection.trailing(), NDArray.zeros(3, 3, 4)));
        assertThrows(ShapeMismatchException.class,
                () -> engine.apply(operation, 2, array, AxisSelection.trailing(), NDArray.zeros(2, 12)));
        verifyNoInteractions(operation);
    }

    @Test
    @DisplayName("Un corte con forma distinta a la esperada -> ShapeMismatch")
    void apply_shouldRejectWrongSliceShape() {
        engine = new AxisStackEngine();

        assertThrows(ShapeMismatchException.class,
                () -> engine.apply(slice -> NDArray.zeros(1, 1), 2, sample(2, 3, 4)));
    }

    @Test
    @DisplayName("Paralelo: una excepción de la operación se propaga sin envolver")
    void apply_parallel_shouldPropagateRuntimeException() {
        // ARRANGE
        engine = new AxisStackEngine(ProcessingConfig.builder().cpuProcessorCount(3).build());
        ISliceOperation failing = slice -> {
            throw new IllegalStateException("corte inválido");
        };

        // ACT
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> engine.apply(failing, 1, sample(4, 5)));

        // ASSERT
        assertEquals("corte inválido", e.getMessage());
    }

    @Test
    @DisplayName("Pila vacía: no se invoca la operación y se devuelve la salida a cero")
    void apply_emptyStack_shouldReturnZeros() {
        engine = new AxisStackEngine();
        ISliceOperation operation = mock(ISliceOperation.class);

        NDArray result = engine.apply(operation, 2, NDArray.zeros(0, 3, 3));

        assertArrayEquals(new int[]{0, 3, 3}, result.shape());
        verifyNoInteractions(operation);
    }
}
