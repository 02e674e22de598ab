package com.phillippitts.scriptmonitor.service.reference;

import com.phillippitts.scriptmonitor.config.properties.ReferenceProperties;
import com.phillippitts.scriptmonitor.exception.ReferenceLoadException;
import com.phillippitts.scriptmonitor.service.reference.event.ReferenceLoadedEvent;
import com.phillippitts.scriptmonitor.testutil.EventCapturingPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReferenceScriptServiceTest {

    @TempDir
    Path tempDir;

    private ReferenceProperties props;
    private EventCapturingPublisher publisher;
    private ReferenceScriptService service;

    @BeforeEach
    void setUp() {
        props = new ReferenceProperties();
        publisher = new EventCapturingPublisher();
        service = new ReferenceScriptService(props, publisher);
    }

    @Test
    void collapsesWhitespaceRunsAndLineBreaks() {
        assertThat(ReferenceScriptService.collapse("  안녕하세요.\n\n반갑습니다\t여러분  "))
                .isEqualTo("안녕하세요. 반갑습니다 여러분");
    }

    @Test
    void loadsUtf8ScriptFromFile() throws IOException {
        Path file = tempDir.resolve("script.txt");
        Files.writeString(file, "오늘 날씨가\n매우 좋습니다\n", StandardCharsets.UTF_8);

        String script = service.loadFromFile(file);

        assertThat(script).isEqualTo("오늘 날씨가 매우 좋습니다");
        assertThat(service.current()).isEqualTo(script);
        assertThat(service.isLoaded()).isTrue();
        assertThat(publisher.eventsOfType(ReferenceLoadedEvent.class))
                .singleElement()
                .satisfies(e -> {
                    assertThat(e.source()).isEqualTo(file.toString());
                    assertThat(e.length()).isEqualTo(script.length());
                });
    }

    @Test
    void missingFileThrowsAndKeepsPreviousScript() {
        service.loadFromText("이전 대본");
        Path missing = tempDir.resolve("missing.txt");

        assertThatThrownBy(() -> service.loadFromFile(missing))
                .isInstanceOf(ReferenceLoadException.class)
                .extracting(e -> ((ReferenceLoadException) e).getPath())
                .isEqualTo(missing.toString());
        assertThat(service.current()).isEqualTo("이전 대본");
    }

    @Test
    void loadFromTextPublishesTextSource() {
        service.loadFromText("안녕하세요");

        assertThat(publisher.eventsOfType(ReferenceLoadedEvent.class))
                .extracting(ReferenceLoadedEvent::source)
                .containsExactly(ReferenceScriptService.TEXT_SOURCE);
    }

    @Test
    void nullTextIsRejected() {
        assertThatThrownBy(() -> service.loadFromText(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nothingLoadedByDefault() {
        assertThat(service.current()).isEmpty();
        assertThat(service.isLoaded()).isFalse();
    }

    @Test
    void blankConfiguredPathStartsWithoutScript() {
        props.setPath("  ");

        service.loadConfiguredScript();

        assertThat(service.isLoaded()).isFalse();
        assertThat(publisher.eventsOfType(ReferenceLoadedEvent.class)).isEmpty();
    }

    @Test
    void unreadableConfiguredPathIsLoggedNotThrown() {
        props.setPath(tempDir.resolve("nope.txt").toString());

        service.loadConfiguredScript();

        assertThat(service.isLoaded()).isFalse();
    }

    @Test
    void configuredPathIsLoadedOnStartup() throws IOException {
        Path file = tempDir.resolve("script.txt");
        Files.writeString(file, "대본 입니다", StandardCharsets.UTF_8);
        props.setPath(file.toString());

        service.loadConfiguredScript();

        assertThat(service.current()).isEqualTo("대본 입니다");
    }
}
