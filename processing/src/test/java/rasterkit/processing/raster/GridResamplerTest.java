package rasterkit.processing.raster;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import rasterkit.config.InterpolationOptions;
import rasterkit.config.ProcessingConfig;
import rasterkit.domain.array.NDArray;
import rasterkit.domain.axis.AxisSelection;
import rasterkit.domain.grid.AxisLimits;
import rasterkit.domain.grid.InterpolationOrder;
import rasterkit.exception.ShapeMismatchException;
import rasterkit.processing.stack.AxisStackEngine;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GridResamplerTest {

    private final AxisStackEngine engine = new AxisStackEngine();
    private final GridResampler resampler = new GridResampler(engine);

    private static final InterpolationOptions NEAREST = InterpolationOptions.builder()
            .order(InterpolationOrder.NEAREST).build();

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private static NDArray range(int... shape) {
        double[] data = new double[NDArray.sizeOf(shape)];
        for (int i = 0; i < data.length; i++) {
            data[i] = i;
        }
        return NDArray.of(data, shape);
    }

    @Test
    @DisplayName("Orden 0 sobre la propia malla es la identidad")
    void regrid_nearestOnSourceGrid_isIdentity() {
        // ARRANGE
        NDArray data = range(4, 4);
        double[] axis = {0, 1, 2, 3};

        // ACT
        NDArray result = resampler.regrid(data, List.of(AxisLimits.of(0, 3), AxisLimits.of(0, 3)),
                List.of(axis, axis), NEAREST);

        // ASSERT
        assertEquals(data, result);
    }

    @Test
    @DisplayName("Indexado matricial: el corte de salida mide (len(t0), len(t1))")
    void regrid_shouldUseMatrixIndexing() {
        // ARRANGE: a[i][j] = 2 i + j sobre [0, 2] x [0, 1]
        NDArray data = NDArray.fromMatrix(new double[][]{{0, 1}, {2, 3}, {4, 5}});

        // ACT
        NDArray result = resampler.regrid(data, List.of(AxisLimits.of(0, 2), AxisLimits.of(0, 1)),
                List.of(new double[]{0, 2}, new double[]{0, 0.5, 1}));

        // ASSERT
        assertArrayEquals(new double[][]{{0, 0.5, 1}, {4, 4.5, 5}}, result.toMatrix());
    }

    @Test
    @DisplayName("Orden 1 por defecto con relleno NaN fuera de la extensión")
    void regrid_defaults_linearWithNaNFill() {
        NDArray line = NDArray.of(new double[]{0, 10, 20, 30}, 4);

        NDArray result = resampler.regrid(line, List.of(AxisLimits.of(0, 3)), List.of(new double[]{0.5, 1.5, -1, 4}));

        assertEquals(5.0, result.get(0), 1e-12);
        assertEquals(15.0, result.get(1), 1e-12);
        assertTrue(Double.isNaN(result.get(2)));
        assertTrue(Double.isNaN(result.get(3)));
    }

    @Test
    @DisplayName("Valor de relleno configurable por llamada y por configuración")
    void regrid_customFillValue() {
        NDArray line = NDArray.of(new double[]{0, 10}, 2);
        List<AxisLimits> limits = List.of(AxisLimits.of(0, 1));
        List<double[]> targets = List.of(new double[]{2.0});

        NDArray perCall = resampler.regrid(line, limits, targets, InterpolationOptions.defaults().withFillValue(-9));
        GridResampler configured = new GridResampler(engine, ProcessingConfig.builder()
                .interpolation(InterpolationOptions.builder().fillValue(-1).build()).build());

        assertEquals(-9.0, perCall.get(0));
        assertEquals(-1.0, configured.regrid(line, limits, targets).get(0));
    }

    @Test
    @DisplayName("Pila: los ejes no regridados se conservan y cada corte se remuestrea igual")
    void regrid_stack_shouldKeepStackedAxes() {
        // ARRANGE: forma (4, 3, 2), regridando el eje 0
        NDArray data = range(4, 3, 2);

        // ACT
        NDArray result = resampler.regrid(data, List.of(AxisLimits.of(0, 3)), List.of(new double[]{1.5}),
                AxisSelection.of(0));

        // ASSERT
        assertArrayEquals(new int[]{1, 3, 2}, result.shape());
        for (int j = 0; j < 3; j++) {
            for (int k = 0; k < 2; k++) {
                assertEquals((data.get(1, j, k) + data.get(2, j, k)) / 2, result.get(0, j, k), 1e-12);
            }
        }
    }

    @Test
    @DisplayName("Ejes regridados no finales y reordenados conservan su posición original")
    void regrid_reorderedLeadingAxes_shouldKeepAxisPositions() {
        // ARRANGE: forma (3, 2, 4), regridando los ejes 2 y 0 en ese orden con un motor paralelo
        NDArray data = range(3, 2, 4);
        List<AxisLimits> limits = List.of(AxisLimits.of(0, 3), AxisLimits.of(0, 2));
        AxisSelection axes = AxisSelection.of(2, 0);

        try (AxisStackEngine parallel = new AxisStackEngine(ProcessingConfig.builder().cpuProcessorCount(3).build())) {
            GridResampler parallelResampler = new GridResampler(parallel);

            // ACT
            NDArray identity = parallelResampler.regrid(data, limits,
                    List.of(new double[]{0, 1, 2, 3}, new double[]{0, 1, 2}), axes, NEAREST);
            NDArray reduced = parallelResampler.regrid(data, limits,
                    List.of(new double[]{3}, new double[]{0, 2}), axes, NEAREST);

            // ASSERT
            assertEquals(data, identity);
            assertArrayEquals(new int[]{2, 2, 1}, reduced.shape());
            for (int i = 0; i < 2; i++) {
                for (int j = 0; j < 2; j++) {
                    assertEquals(data.get(2 * i, j, 3), reduced.get(i, j, 0), 1e-12);
                }
            }
        }
    }

    @Test
    @DisplayName("Validación: límites y ejes destino en número distinto, o ninguno")
    void regrid_shouldValidateArguments() {
        NDArray data = range(4, 4);
        double[] axis = {0, 1};

        assertThrows(ShapeMismatchException.class,
                () -> resampler.regrid(data, List.of(AxisLimits.of(0, 1)), List.of(axis, axis)));
        assertThrows(IllegalArgumentException.class,
                () -> resampler.regrid(data, List.of(), List.of()));
        assertThrows(ShapeMismatchException.class,
                () -> resampler.regrid(range(4), List.of(AxisLimits.of(0, 1), AxisLimits.of(0, 1)), List.of(axis, axis)));
    }
}
