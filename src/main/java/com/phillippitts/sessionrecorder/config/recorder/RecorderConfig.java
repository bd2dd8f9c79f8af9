package com.phillippitts.sessionrecorder.config.recorder;

import com.phillippitts.sessionrecorder.config.properties.RecorderProperties;
import com.phillippitts.sessionrecorder.service.capture.CaptureSessionFactory;
import com.phillippitts.sessionrecorder.service.presentation.PresentationSurface;
import com.phillippitts.sessionrecorder.service.recorder.RecorderDependencies;
import com.phillippitts.sessionrecorder.service.recorder.RecorderMetricsPublisher;
import com.phillippitts.sessionrecorder.service.recorder.RecorderOptions;
import com.phillippitts.sessionrecorder.service.recorder.RecorderService;
import com.phillippitts.sessionrecorder.service.storage.DurableStore;
import com.phillippitts.sessionrecorder.service.transcription.TranscriptionCoordinator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;

/**
 * Initializes the process-wide {@link RecorderService} and exposes it as a bean.
 *
 * <p>The container calls {@link RecorderService#unload()} on shutdown, before the loop executor
 * it depends on is destroyed.
 */
@Configuration
public class RecorderConfig {

    private static final Logger LOG = LogManager.getLogger(RecorderConfig.class);

    @Bean(destroyMethod = "unload")
    public RecorderService recorderService(CaptureSessionFactory captureSessionFactory,
                                           PresentationSurface presentationSurface,
                                           TranscriptionCoordinator transcriptionCoordinator,
                                           DurableStore durableStore,
                                           RecorderProperties properties,
                                           ApplicationEventPublisher publisher,
                                           RecorderMetricsPublisher metricsPublisher,
                                           @Qualifier("recorderLoopExecutor") Executor recorderLoopExecutor) {
        RecorderDependencies deps = RecorderDependencies.builder()
                .captureSessionFactory(captureSessionFactory)
                .presentationSurface(presentationSurface)
                .transcriptionCoordinator(transcriptionCoordinator)
                .durableStore(durableStore)
                .properties(properties)
                .publisher(publisher)
                .metricsPublisher(metricsPublisher)
                .loopExecutor(recorderLoopExecutor)
                .build();
        LOG.debug("Creating recorder with capture={}, surface={}, transcription={}",
                captureSessionFactory.getClass().getSimpleName(),
                presentationSurface.getClass().getSimpleName(),
                transcriptionCoordinator.getClass().getSimpleName());
        return RecorderService.getInstance(deps, RecorderOptions.none());
    }
}
