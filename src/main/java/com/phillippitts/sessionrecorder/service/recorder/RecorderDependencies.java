package com.phillippitts.sessionrecorder.service.recorder;

import com.phillippitts.sessionrecorder.config.properties.RecorderProperties;
import com.phillippitts.sessionrecorder.service.capture.CaptureSessionFactory;
import com.phillippitts.sessionrecorder.service.presentation.PresentationSurface;
import com.phillippitts.sessionrecorder.service.storage.DurableStore;
import com.phillippitts.sessionrecorder.service.transcription.TranscriptionCoordinator;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Collaborators of {@link RecorderService}, grouped so the singleton can be created with one argument.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * RecorderDependencies deps = RecorderDependencies.builder()
 *     .captureSessionFactory(factory)
 *     .presentationSurface(surface)
 *     .transcriptionCoordinator(coordinator)
 *     .durableStore(store)
 *     .properties(props)
 *     .publisher(publisher)
 *     .loopExecutor(recorderLoopExecutor)
 *     .metricsPublisher(metrics)      // optional
 *     .build();
 * }</pre>
 *
 * <p>The loop executor must run tasks one at a time in submission order; all recorder state is
 * mutated from it.
 */
public final class RecorderDependencies {

    private final CaptureSessionFactory captureSessionFactory;
    private final PresentationSurface presentationSurface;
    private final TranscriptionCoordinator transcriptionCoordinator;
    private final DurableStore durableStore;
    private final RecorderProperties properties;
    private final ApplicationEventPublisher publisher;
    private final RecorderMetricsPublisher metricsPublisher;
    private final Executor loopExecutor;

    private RecorderDependencies(Builder b) {
        this.captureSessionFactory = b.captureSessionFactory;
        this.presentationSurface = b.presentationSurface;
        this.transcriptionCoordinator = b.transcriptionCoordinator;
        this.durableStore = b.durableStore;
        this.properties = b.properties;
        this.publisher = b.publisher;
        this.metricsPublisher = b.metricsPublisher;
        this.loopExecutor = b.loopExecutor;
    }

    public static Builder builder() {
        return new Builder();
    }

    public CaptureSessionFactory captureSessionFactory() {
        return captureSessionFactory;
    }

    public PresentationSurface presentationSurface() {
        return presentationSurface;
    }

    public TranscriptionCoordinator transcriptionCoordinator() {
        return transcriptionCoordinator;
    }

    public DurableStore durableStore() {
        return durableStore;
    }

    public RecorderProperties properties() {
        return properties;
    }

    public ApplicationEventPublisher publisher() {
        return publisher;
    }

    public RecorderMetricsPublisher metricsPublisher() {
        return metricsPublisher;
    }

    public Executor loopExecutor() {
        return loopExecutor;
    }

    public static final class Builder {

        // Required
        private CaptureSessionFactory captureSessionFactory;
        private PresentationSurface presentationSurface;
        private TranscriptionCoordinator transcriptionCoordinator;
        private DurableStore durableStore;
        private RecorderProperties properties;
        private ApplicationEventPublisher publisher;
        private Executor loopExecutor;

        // Optional
        private RecorderMetricsPublisher metricsPublisher = RecorderMetricsPublisher.NOOP;

        private Builder() {
        }

        public Builder captureSessionFactory(CaptureSessionFactory captureSessionFactory) {
            this.captureSessionFactory = captureSessionFactory;
            return this;
        }

        public Builder presentationSurface(PresentationSurface presentationSurface) {
            this.presentationSurface = presentationSurface;
            return this;
        }

        public Builder transcriptionCoordinator(TranscriptionCoordinator transcriptionCoordinator) {
            this.transcriptionCoordinator = transcriptionCoordinator;
            return this;
        }

        public Builder durableStore(DurableStore durableStore) {
            this.durableStore = durableStore;
            return this;
        }

        public Builder properties(RecorderProperties properties) {
            this.properties = properties;
            return this;
        }

        public Builder publisher(ApplicationEventPublisher publisher) {
            this.publisher = publisher;
            return this;
        }

        public Builder loopExecutor(Executor loopExecutor) {
            this.loopExecutor = loopExecutor;
            return this;
        }

        public Builder metricsPublisher(RecorderMetricsPublisher metricsPublisher) {
            this.metricsPublisher = metricsPublisher == null ? RecorderMetricsPublisher.NOOP : metricsPublisher;
            return this;
        }

        /**
         * @throws NullPointerException if a required dependency is missing
         */
        public RecorderDependencies build() {
            Objects.requireNonNull(captureSessionFactory, "captureSessionFactory is required");
            Objects.requireNonNull(presentationSurface, "presentationSurface is required");
            Objects.requireNonNull(transcriptionCoordinator, "transcriptionCoordinator is required");
            Objects.requireNonNull(durableStore, "durableStore is required");
            Objects.requireNonNull(properties, "properties is required");
            Objects.requireNonNull(publisher, "publisher is required");
            Objects.requireNonNull(loopExecutor, "loopExecutor is required");
            return new RecorderDependencies(this);
        }
    }
}
