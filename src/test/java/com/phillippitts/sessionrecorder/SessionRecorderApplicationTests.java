package com.phillippitts.sessionrecorder;

import com.phillippitts.sessionrecorder.domain.LifecycleState;
import com.phillippitts.sessionrecorder.service.capture.CaptureSessionFactory;
import com.phillippitts.sessionrecorder.service.capture.JavaSoundCaptureSessionFactory;
import com.phillippitts.sessionrecorder.service.recorder.RecorderService;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@Tag("integration")
@ActiveProfiles("test")
@AutoConfigureMockMvc
@SpringBootTest(
    properties = {
        "audio.capture.chunk-millis=40",
        "audio.capture.max-duration-ms=60000"
    }
)
class SessionRecorderApplicationTests {

    @Autowired
    private RecorderService recorder;

    @Autowired
    private CaptureSessionFactory captureSessionFactory;

    @Autowired
    private MockMvc mvc;

    @Test
    void contextLoads() {
        assertThat(recorder).isSameAs(RecorderService.getInstance());
        assertThat(recorder.snapshot().state()).isEqualTo(LifecycleState.IDLE);
        assertThat(captureSessionFactory).isInstanceOf(JavaSoundCaptureSessionFactory.class);
    }

    @Test
    void statusEndpointEchoesRequestId() throws Exception {
        mvc.perform(get("/recorder").header("X-Request-ID", "it-1"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-ID", "it-1"))
                .andExpect(jsonPath("$.recorder.state").value("IDLE"));
    }
}
