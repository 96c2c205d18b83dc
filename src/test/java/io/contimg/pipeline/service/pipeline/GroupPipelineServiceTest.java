package io.contimg.pipeline.service.pipeline;

import io.contimg.pipeline.config.PipelineConfig;
import io.contimg.pipeline.dto.registry.ArtifactLineage;
import io.contimg.pipeline.model.Artifact;
import io.contimg.pipeline.model.ArtifactKey;
import io.contimg.pipeline.model.DataType;
import io.contimg.pipeline.model.FileKind;
import io.contimg.pipeline.model.GroupStatus;
import io.contimg.pipeline.model.IncomingFile;
import io.contimg.pipeline.model.LifecycleState;
import io.contimg.pipeline.model.ProcessingGroup;
import io.contimg.pipeline.model.UpstreamStatus;
import io.contimg.pipeline.scheduler.GroupDetectionScheduler;
import io.contimg.pipeline.service.detect.FileArrivalService;
import io.contimg.pipeline.service.detect.Group;
import io.contimg.pipeline.service.detect.GroupDetector;
import io.contimg.pipeline.service.detect.GroupEmissionService;
import io.contimg.pipeline.service.detect.SubbandFileName;
import io.contimg.pipeline.service.engine.EngineRequest;
import io.contimg.pipeline.service.engine.EngineResult;
import io.contimg.pipeline.service.engine.ImagePlane;
import io.contimg.pipeline.service.engine.QualityMetrics;
import io.contimg.pipeline.service.registry.ArtifactRegistryService;
import io.contimg.pipeline.support.PipelineIntegrationSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static org.mockito.Mockito.doAnswer;

class GroupPipelineServiceTest extends PipelineIntegrationSupport {

    private static final LocalDateTime OBSERVATION = LocalDateTime.of(2025, 10, 2, 0, 12, 0);
    private static final String GROUP = "obs_2025-10-02T00:12:00";

    @Autowired
    private FileArrivalService fileArrivalService;
    @Autowired
    private GroupDetector groupDetector;
    @Autowired
    private GroupEmissionService groupEmissionService;
    @Autowired
    private GroupPipelineService groupPipelineService;
    @Autowired
    private GroupDetectionScheduler groupDetectionScheduler;
    @Autowired
    private ArtifactRegistryService registry;
    @Autowired
    private PipelineConfig pipelineConfig;

    @BeforeEach
    void answerLikeTheEngine() {
        when(imagingEngine.invoke(any())).thenAnswer(invocation -> respond(invocation.getArgument(0)));
        when(imagingEngine.readImagePlane(anyString())).thenReturn(flatNoise());
    }

    @Test
    void completeSubbandGroupIsProcessedIntoOnePublishedImage() {
        arriveSubbands(OBSERVATION, 16);

        Group group = detectSubbandGroup(OBSERVATION);
        assertThat(groupEmissionService.emit(group, UpstreamStatus.ARRIVED)).isPresent();
        Artifact image = groupPipelineService.process(group);

        assertThat(image).isNotNull();
        assertThat(image.key()).isEqualTo(new ArtifactKey(DataType.IMAGE, GROUP));
        assertThat(image.getLifecycleState()).isEqualTo(LifecycleState.PUBLISHED);
        assertThat(image.getMetadata()).containsEntry(StageInvocation.OBSERVED_AT, "2025-10-02T00:12:00");
        assertThat(deadLetterEntryRepository.count()).isZero();
        assertThat(groupEmissionService.find(GROUP)).map(ProcessingGroup::getStatus).contains(GroupStatus.COMPLETED);

        ArtifactLineage converted = registry.lineage(new ArtifactKey(DataType.CONVERTED_UNIT, GROUP));
        assertThat(converted.parents()).hasSize(16).allSatisfy(edge -> {
            assertThat(edge.artifact().dataType()).isEqualTo(DataType.RAW_UNIT);
            assertThat(edge.relation()).isEqualTo("convert");
        });

        Artifact calibrated = registry.get(new ArtifactKey(DataType.CALIBRATED_UNIT, GROUP));
        assertThat(calibrated.getStagePath()).isEqualTo("/stage/" + GROUP + ".selfcal1.ms");
        assertThat(calibrated.getMetadata()).containsEntry("selfcal_success", true);
        Artifact calTable = registry.get(new ArtifactKey(DataType.CALIBRATION_TABLE, GROUP));
        assertThat(calTable.getLifecycleState()).isEqualTo(LifecycleState.PUBLISHED);
        assertThat(calTable.getStagePath()).isEqualTo("/stage/" + GROUP + ".selfcal1.G");

        Optional<IncomingFile> indexed = incomingFileRepository.findByPath(image.getStagePath());
        assertThat(indexed).isPresent();
        assertThat(indexed.get().getKind()).isEqualTo(FileKind.IMAGE);
        assertThat(indexed.get().getUpstreamStatus()).isEqualTo(UpstreamStatus.IMAGED);
        assertThat(indexed.get().getObservedAt()).isEqualTo(OBSERVATION);
    }

    @Test
    void processingTheSameGroupTwiceDoesNoNewWork() {
        arriveSubbands(OBSERVATION, 16);
        Group group = detectSubbandGroup(OBSERVATION);
        groupEmissionService.emit(group, UpstreamStatus.ARRIVED);
        groupPipelineService.process(group);
        long artifacts = artifactRepository.count();

        Artifact again = groupPipelineService.process(group);

        assertThat(again.getLifecycleState()).isEqualTo(LifecycleState.PUBLISHED);
        assertThat(again.getPublishAttempts()).isEqualTo(1);
        assertThat(artifactRepository.count()).isEqualTo(artifacts);
    }

    @Test
    void incompleteObservationIsNotDetected() {
        arriveSubbands(OBSERVATION, 15);

        assertThat(groupDetectionScheduler.detectGroups(pipelineConfig.getDetection().getSubband())).isZero();
        assertThat(processingGroupRepository.count()).isZero();
    }

    @Test
    void detectionEmitsEachGroupOnceAndRunsItToCompletion() {
        arriveSubbands(OBSERVATION, 16);
        PipelineConfig.Profile subband = pipelineConfig.getDetection().getSubband();

        assertThat(groupDetectionScheduler.detectGroups(subband)).isEqualTo(1);
        assertThat(groupDetectionScheduler.detectGroups(subband)).isZero();

        await().atMost(Duration.ofSeconds(20)).untilAsserted(() -> assertThat(groupEmissionService.find(GROUP))
                .map(ProcessingGroup::getStatus).contains(GroupStatus.COMPLETED));
        assertThat(processingGroupRepository.count()).isEqualTo(1);
        assertThat(incomingFileRepository.findAll()).filteredOn(f -> f.getKind() == FileKind.SUBBAND)
                .extracting(IncomingFile::getUpstreamStatus).containsOnly(UpstreamStatus.GROUPED);
    }

    @Test
    void failingStageFailsTheGroupAndStopsLaterStages() {
        doAnswer(invocation -> {
            EngineRequest request = invocation.getArgument(0);
            return "calibrate".equals(request.operation())
                    ? EngineResult.permanentFailure("NO_SOLUTIONS", "calibrator not visible")
                    : respond(request);
        }).when(imagingEngine).invoke(any());
        arriveSubbands(OBSERVATION, 16);
        Group group = detectSubbandGroup(OBSERVATION);
        groupEmissionService.emit(group, UpstreamStatus.ARRIVED);

        Artifact last = groupPipelineService.process(group);

        assertThat(last.key()).isEqualTo(new ArtifactKey(DataType.CALIBRATED_UNIT, GROUP));
        assertThat(last.getLifecycleState()).isEqualTo(LifecycleState.FAILED);
        assertThat(registry.find(new ArtifactKey(DataType.IMAGE, GROUP))).isEmpty();
        assertThat(groupEmissionService.find(GROUP)).map(ProcessingGroup::getStatus).contains(GroupStatus.FAILED);
        assertThat(deadLetterEntryRepository.count()).isEqualTo(1);
    }

    @Test
    void interruptedGroupIsResumedFromItsEmissionRecord() {
        arriveSubbands(OBSERVATION, 16);
        Group group = detectSubbandGroup(OBSERVATION);
        ProcessingGroup record = groupEmissionService.emit(group, UpstreamStatus.ARRIVED).orElseThrow();

        Artifact image = groupPipelineService.resume(record).orElseThrow().join();

        assertThat(image.getLifecycleState()).isEqualTo(LifecycleState.PUBLISHED);
        assertThat(groupEmissionService.find(GROUP)).map(ProcessingGroup::getStatus).contains(GroupStatus.COMPLETED);
    }

    @Test
    void publishedImagesFormAMosaic() {
        LocalDateTime start = LocalDateTime.of(2025, 10, 2, 1, 0);
        for (int i = 0; i < 12; i++) {
            publishImage(start.plusMinutes(5L * i), 10.0 + 0.5 * i);
        }
        PipelineConfig.Profile mosaicProfile = pipelineConfig.getDetection().getMosaic();
        IncomingFile reference = incomingFileRepository.findAll().stream()
                .filter(f -> f.getObservedAt().equals(start.plusMinutes(30)))
                .findFirst().orElseThrow();

        Group group = groupDetector.detect(reference, mosaicProfile.getWindowMinutes(),
                                           mosaicProfile.getRequiredStatus(), mosaicProfile.getExpectedMembers())
                .orElseThrow();
        groupEmissionService.emit(group, mosaicProfile.getRequiredStatus());
        Artifact mosaic = groupPipelineService.process(group);

        assertThat(mosaic.key()).isEqualTo(new ArtifactKey(DataType.MOSAIC, "mosaic_2025-10-02T01:00:00"));
        assertThat(mosaic.getLifecycleState()).isEqualTo(LifecycleState.PUBLISHED);
        assertThat(mosaic.getMetadata()).containsEntry("qa_status", "pass");
        assertThat(registry.lineage(mosaic.key()).parents()).hasSize(12)
                .extracting(ArtifactLineage.Edge::relation).containsOnly("combine");
        assertThat(groupEmissionService.find(group.groupId())).map(ProcessingGroup::getStatus)
                .contains(GroupStatus.COMPLETED);
    }

    private void arriveSubbands(LocalDateTime observation, int count) {
        List<Integer> order = new ArrayList<>();
        for (int i = 1; i < count; i++) {
            order.add(i);
        }
        Collections.shuffle(order, new Random(16));
        // the first writer fixes the observation time the later ones snap onto
        order.add(0, 0);
        for (int index : order) {
            LocalDateTime written = observation.plusSeconds(index % 4);
            fileArrivalService.recordSubbandArrival(String.format("/data/incoming/%s_sb%02d.hdf5",
                                                                  SubbandFileName.TIMESTAMP_FORMAT.format(written),
                                                                  index));
        }
    }

    private Group detectSubbandGroup(LocalDateTime observation) {
        PipelineConfig.Profile subband = pipelineConfig.getDetection().getSubband();
        IncomingFile reference = incomingFileRepository.findAll().stream()
                .filter(f -> observation.equals(f.getObservedAt()))
                .findFirst().orElseThrow();
        return groupDetector.detect(reference, subband.getWindowMinutes(), subband.getRequiredStatus(),
                                    subband.getExpectedMembers()).orElseThrow();
    }

    private void publishImage(LocalDateTime observedAt, double ra) {
        String path = "/published/image/obs_" + observedAt + ".fits";
        ArtifactKey key = new ArtifactKey(DataType.IMAGE, "obs_" + observedAt);
        Map<String, Object> metadata = imageResult(path, ra).metrics().toMetadata();
        registry.register(key, path, metadata);
        registry.markPublishing(key);
        registry.markPublished(key);
        fileArrivalService.recordImage(path, observedAt);
    }

    private static EngineResult respond(EngineRequest request) {
        String group = String.valueOf(request.parameters().getOrDefault("groupId", "unknown"));
        switch (request.operation()) {
            case "convert":
                return productResult("/stage/" + group + ".ms");
            case "calibrate":
                return new EngineResult.Success("/stage/" + group + ".cal.ms",
                                                new QualityMetrics(null, null, null, 0.02, null, null),
                                                Map.of("caltable", "/stage/" + group + ".G"));
            case "selfcal": {
                int iteration = (Integer) request.parameters().get("iteration");
                String base = request.artifactPaths().get(0).replaceAll("(\\.cal|\\.selfcal\\d+)\\.ms$", "");
                return new EngineResult.Success(base + ".selfcal" + iteration + ".ms",
                                                new QualityMetrics(0.03, 0.001, -0.002, 0.05, null, null),
                                                Map.of("caltable", base + ".selfcal" + iteration + ".G",
                                                       "image", base + ".selfcal" + iteration + ".fits"));
            }
            case "image":
                if ("selfcal-baseline".equals(request.parameters().get("purpose"))) {
                    return new EngineResult.Success("/stage/baseline.fits",
                                                    new QualityMetrics(0.02, 0.001, -0.002, null, null, null));
                }
                return imageResult("/stage/" + group + ".image.fits", 12.0);
            case "combine":
                return new EngineResult.Success("/stage/mosaic.fits",
                                                new QualityMetrics(0.05, 0.0008, -0.002, null, 0.95, null));
            default:
                return EngineResult.permanentFailure("UNKNOWN", request.operation());
        }
    }

    private static ImagePlane flatNoise() {
        Random random = new Random(5);
        double[] pixels = new double[64 * 64];
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = random.nextGaussian() * 0.001;
        }
        return new ImagePlane(64, 64, pixels);
    }
}
