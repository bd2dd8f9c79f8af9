package com.phillippitts.sessionrecorder;

import com.phillippitts.sessionrecorder.config.properties.AudioCaptureProperties;
import com.phillippitts.sessionrecorder.config.properties.RecorderProperties;
import com.phillippitts.sessionrecorder.config.properties.ThreadPoolProperties;
import com.phillippitts.sessionrecorder.config.properties.TranscriptionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        RecorderProperties.class,
        AudioCaptureProperties.class,
        TranscriptionProperties.class,
        ThreadPoolProperties.class
})
public class SessionRecorderApplication {

    public static void main(String[] args) {
        SpringApplication.run(SessionRecorderApplication.class, args);
    }

}
