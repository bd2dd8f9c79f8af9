package com.phillippitts.sessionrecorder.service.capture;

import com.phillippitts.sessionrecorder.config.properties.AudioCaptureProperties;
import com.phillippitts.sessionrecorder.service.storage.DurableStore;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import javax.sound.sampled.AudioSystem;
import java.time.Clock;
import java.util.Objects;

/**
 * Default {@link CaptureSessionFactory}: every session records from a Java Sound input line.
 *
 * <p>Test configurations can provide alternative implementations by marking them as @Primary.
 */
@Component
public class JavaSoundCaptureSessionFactory implements CaptureSessionFactory {

    private static final Logger LOG = LogManager.getLogger(JavaSoundCaptureSessionFactory.class);

    private final AudioCaptureProperties props;
    private final DurableStore store;
    private final ApplicationEventPublisher publisher;
    private final DataLineProvider provider;
    private final Clock clock;

    @Autowired
    public JavaSoundCaptureSessionFactory(AudioCaptureProperties props,
                                          DurableStore store,
                                          ApplicationEventPublisher publisher) {
        this(props, store, publisher, DataLineProvider.system(), Clock.systemDefaultZone());
    }

    // Package-private for tests
    JavaSoundCaptureSessionFactory(AudioCaptureProperties props,
                                   DurableStore store,
                                   ApplicationEventPublisher publisher,
                                   DataLineProvider provider,
                                   Clock clock) {
        this.props = Objects.requireNonNull(props);
        this.store = Objects.requireNonNull(store);
        this.publisher = Objects.requireNonNull(publisher);
        this.provider = Objects.requireNonNull(provider);
        this.clock = Objects.requireNonNull(clock);
    }

    @PostConstruct
    public void logSystemInfo() {
        String os = System.getProperty("os.name");
        String arch = System.getProperty("os.arch");
        int mixerCount = AudioSystem.getMixerInfo().length;
        LOG.info("Audio capture initialized: OS={}, arch={}, available-mixers={}, chunk={}ms, max-duration={}ms",
                os, arch, mixerCount, props.getChunkMillis(), props.getMaxDurationMs());
    }

    @Override
    public CaptureSession create(CaptureRequest request, CaptureSessionListener listener) {
        return new JavaSoundCaptureSession(request, listener, props, store, publisher, provider, clock);
    }
}
