package io.contimg.pipeline.service.mosaic;

import io.contimg.pipeline.config.PipelineConfig;
import io.contimg.pipeline.exception.ValidationException;
import io.contimg.pipeline.service.engine.EngineGateway;
import io.contimg.pipeline.service.engine.EngineResult;
import io.contimg.pipeline.service.engine.ImagePlane;
import io.contimg.pipeline.service.engine.QualityMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TileCombinerTest {

    private static final CoordinateBounds TEMPLATE = new CoordinateBounds(10.0, 14.0, 30.0, 33.0);

    @Mock
    private EngineGateway engineGateway;

    private PipelineConfig pipelineConfig;
    private TileCombiner tileCombiner;

    @BeforeEach
    void setUp() {
        pipelineConfig = new PipelineConfig();
        tileCombiner = new TileCombiner(engineGateway, new MosaicValidator(), pipelineConfig);
    }

    @Test
    void tileOutsideTheTemplateIsRejectedWhateverItsQuality() {
        TileQualityMetrics excellentButElsewhere = tile("far", new CoordinateBounds(40.0, 42.0, 30.0, 33.0),
                                                        0.0001, 1000, 1.0);

        TileCombiner.TileSelection selection = tileCombiner.select(
                List.of(tile("a", 0.001), tile("b", 0.001), excellentButElsewhere), TEMPLATE,
                pipelineConfig.getMosaic());

        assertThat(selection.accepted()).extracting(t -> t.tile().tileId()).containsExactly("a", "b");
        assertThat(selection.rejected()).singleElement()
                .satisfies(r -> {
                    assertThat(r.tileId()).isEqualTo("far");
                    assertThat(r.reason()).contains("overlap");
                });
    }

    @Test
    void tileJustInsideThePixelMarginOverlaps() {
        // template edge at RA 14.0, margin 10 px x 0.001 deg
        TileQualityMetrics grazing = tile("edge", new CoordinateBounds(14.005, 16.0, 30.0, 33.0), 0.001, 50, 1.0);

        TileCombiner.TileSelection selection = tileCombiner.select(List.of(grazing), TEMPLATE,
                                                                   pipelineConfig.getMosaic());

        assertThat(selection.accepted()).hasSize(1);
    }

    @Test
    void tileWithoutBoundsIsRejected() {
        TileCombiner.TileSelection selection = tileCombiner.select(
                List.of(tile("unplaced", null, 0.001, 50, 1.0)), TEMPLATE, pipelineConfig.getMosaic());

        assertThat(selection.accepted()).isEmpty();
        assertThat(selection.rejected()).extracting(TileRejection::reason)
                .containsExactly("no coordinate bounds recorded");
    }

    @Test
    void qualityFiltersJudgeNoiseCoverageAndDynamicRange() {
        List<TileQualityMetrics> candidates = List.of(
                tile("good", 0.001),
                tile("good2", 0.001),
                tile("noisy", TEMPLATE, 0.009, 50, 1.0),
                tile("ceiling", TEMPLATE, 0.02, 50, 1.0),
                tile("thin", TEMPLATE, 0.001, 50, 0.05),
                tile("flat", TEMPLATE, 0.001, 2, 1.0),
                tile("blank", TEMPLATE, Double.NaN, 50, 1.0));

        TileCombiner.TileSelection selection = tileCombiner.select(candidates, TEMPLATE,
                                                                   pipelineConfig.getMosaic());

        assertThat(selection.accepted()).extracting(t -> t.tile().tileId()).containsExactly("good", "good2");
        assertThat(selection.rejected()).extracting(TileRejection::tileId)
                .containsExactlyInAnyOrder("noisy", "ceiling", "thin", "flat", "blank");
    }

    @Test
    void weightsAreCoverageOverVarianceAndSumToOne() {
        TileCombiner.TileSelection selection = tileCombiner.select(
                List.of(tile("quiet", 0.001), tile("louder", 0.002)), TEMPLATE, pipelineConfig.getMosaic());

        assertThat(selection.accepted().get(0).weight()).isCloseTo(0.8, within(1e-9));
        assertThat(selection.accepted().get(1).weight()).isCloseTo(0.2, within(1e-9));
        assertThat(selection.accepted().stream().mapToDouble(WeightedTile::weight).sum()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void tooFewUsableTilesFailsWithoutCallingTheEngine() {
        assertThatThrownBy(() -> tileCombiner.combine("mosaic_x", List.of(tile("only", 0.001)), TEMPLATE))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Only 1 of 1");
        verifyNoInteractions(engineGateway);
    }

    @Test
    void combinesAcceptedTilesAndValidatesTheResult() {
        when(engineGateway.invoke(eq("mosaic_x"), eq(TileCombiner.COMBINE_OPERATION), anyList(), anyMap()))
                .thenReturn(new EngineResult.Success("/stage/mosaic_x.fits",
                                                     new QualityMetrics(0.5, 0.001, -0.003, null, 0.9, null)));
        when(engineGateway.readImagePlane(anyString(), any())).thenReturn(noise(64, 0.001, 11));

        CombineOutcome outcome = tileCombiner.combine("mosaic_x", List.of(tile("a", 0.001), tile("b", 0.001)),
                                                      TEMPLATE);

        assertThat(outcome.outputPath()).isEqualTo("/stage/mosaic_x.fits");
        assertThat(outcome.usedTiles()).hasSize(2);
        assertThat(outcome.validation().passed()).isTrue();
        assertThat(outcome.toMetadata())
                .containsEntry("qa_status", "pass")
                .containsEntry("tiles_used", List.of("a", "b"));
    }

    private static TileQualityMetrics tile(String id, double rms) {
        return tile(id, TEMPLATE, rms, 50, 1.0);
    }

    private static TileQualityMetrics tile(String id, CoordinateBounds bounds, double rms, double dynamicRange,
                                           double coverage) {
        return new TileQualityMetrics(id, "/images/" + id + ".fits", bounds, rms, rms * dynamicRange, dynamicRange,
                                      coverage);
    }

    static ImagePlane noise(int size, double sigma, long seed) {
        Random random = new Random(seed);
        double[] pixels = new double[size * size];
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = random.nextGaussian() * sigma;
        }
        return new ImagePlane(size, size, pixels);
    }
}
