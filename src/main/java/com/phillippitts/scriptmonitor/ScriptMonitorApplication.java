package com.phillippitts.scriptmonitor;

import com.phillippitts.scriptmonitor.config.properties.AlignmentProperties;
import com.phillippitts.scriptmonitor.config.properties.MonitorServerProperties;
import com.phillippitts.scriptmonitor.config.properties.RawOutProperties;
import com.phillippitts.scriptmonitor.config.properties.ReferenceProperties;
import com.phillippitts.scriptmonitor.config.properties.SubtitleProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        AlignmentProperties.class,
        MonitorServerProperties.class,
        SubtitleProperties.class,
        RawOutProperties.class,
        ReferenceProperties.class
})
@EnableScheduling
public class ScriptMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScriptMonitorApplication.class, args);
    }

}
