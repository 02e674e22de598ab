package com.phillippitts.scriptmonitor;

import com.phillippitts.scriptmonitor.service.alignment.ScriptAlignmentEngine;
import com.phillippitts.scriptmonitor.service.subtitle.SubtitleForwarder;
import com.phillippitts.scriptmonitor.service.transport.MonitorServer;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ScriptMonitorApplicationTests {

    @Autowired
    private MonitorServer server;

    @Autowired
    private SubtitleForwarder forwarder;

    @Autowired
    private ScriptAlignmentEngine engine;

    @Test
    void contextLoads() {
        assertThat(server.isRunning()).isTrue();
        assertThat(server.getLocalPort()).isPositive();
        assertThat(forwarder.isEnabled()).isFalse();
        assertThat(engine.getAlignerName()).isEqualTo("sequential");
    }
}
