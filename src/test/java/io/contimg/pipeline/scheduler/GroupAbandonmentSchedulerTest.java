package io.contimg.pipeline.scheduler;

import io.contimg.pipeline.config.PipelineConfig;
import io.contimg.pipeline.model.FileKind;
import io.contimg.pipeline.model.IncomingFile;
import io.contimg.pipeline.model.UpstreamStatus;
import io.contimg.pipeline.repository.IncomingFileRepository;
import io.contimg.pipeline.service.detect.GroupEmissionService;
import io.contimg.pipeline.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GroupAbandonmentSchedulerTest {

    private static final LocalDateTime OBS_A = LocalDateTime.of(2025, 10, 2, 0, 12);
    private static final LocalDateTime OBS_B = LocalDateTime.of(2025, 10, 2, 0, 17);

    @Mock
    private IncomingFileRepository incomingFileRepository;
    @Mock
    private GroupEmissionService groupEmissionService;
    @Captor
    private ArgumentCaptor<List<IncomingFile>> members;

    private final PipelineConfig pipelineConfig = new PipelineConfig();
    private final MutableClock clock = new MutableClock(Instant.parse("2025-10-02T02:00:00Z"));
    private GroupAbandonmentScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new GroupAbandonmentScheduler(pipelineConfig, incomingFileRepository, groupEmissionService, clock);
    }

    @Test
    void abandonsOncePerObservation() {
        PipelineConfig.Profile profile = pipelineConfig.getDetection().getSubband();
        when(incomingFileRepository.findByKindAndUpstreamStatusAndReceivedAtBefore(
                FileKind.SUBBAND, UpstreamStatus.ARRIVED, LocalDateTime.of(2025, 10, 2, 1, 30)))
                .thenReturn(List.of(member("a0", OBS_A), member("b0", OBS_B), member("a1", OBS_A)));

        int abandoned = scheduler.abandonStaleMembers(profile);

        assertThat(abandoned).isEqualTo(3);
        verify(groupEmissionService, times(2)).abandon(eq(FileKind.SUBBAND), eq("obs"), members.capture(),
                                                       eq(UpstreamStatus.ARRIVED), anyString());
        assertThat(members.getAllValues().get(0)).extracting(IncomingFile::getPath).containsExactly("a0", "a1");
        assertThat(members.getAllValues().get(1)).extracting(IncomingFile::getPath).containsExactly("b0");
    }

    @Test
    void nothingStaleMeansNoAbandonment() {
        when(incomingFileRepository.findByKindAndUpstreamStatusAndReceivedAtBefore(any(), any(), any()))
                .thenReturn(List.of());

        assertThat(scheduler.abandonStaleMembers(pipelineConfig.getDetection().getMosaic())).isZero();
        verify(groupEmissionService, never()).abandon(any(), anyString(), anyList(), any(), anyString());
    }

    @Test
    void disabledDetectionSkipsTheSweep() {
        pipelineConfig.getDetection().setEnabled(false);

        scheduler.abandonStaleMembers();

        verifyNoInteractions(incomingFileRepository, groupEmissionService);
    }

    private static IncomingFile member(String path, LocalDateTime observedAt) {
        return IncomingFile.builder()
                .path(path)
                .kind(FileKind.SUBBAND)
                .groupKey("obs")
                .observedAt(observedAt)
                .upstreamStatus(UpstreamStatus.ARRIVED)
                .build();
    }
}
