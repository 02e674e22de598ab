package com.phillippitts.scriptmonitor.service.subtitle;

import com.phillippitts.scriptmonitor.config.properties.SubtitleProperties;
import com.phillippitts.scriptmonitor.exception.SubtitleForwardException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubtitleClientTest {

    private static final int CHECKCODE = 20250918;
    private static final int EXPECTED = SubtitleProperties.DEFAULT_RESPONSE_CHECKCODE;

    private FakeSubtitleServer sink;
    private SubtitleClient client;

    @BeforeEach
    void setUp() throws IOException {
        sink = new FakeSubtitleServer(EXPECTED);
        client = new SubtitleClient("127.0.0.1", sink.port(), CHECKCODE, EXPECTED, 2000);
    }

    @AfterEach
    void tearDown() throws IOException {
        client.disconnect();
        sink.close();
    }

    @Test
    void sendsTrimmedTextOverOnePersistentConnection() {
        assertThat(client.send("  {\"text\":\"안녕하세요\"}  ")).isTrue();
        assertThat(client.send("{\"text\":\"반갑습니다\"}")).isTrue();

        assertThat(sink.received).hasSize(2);
        assertThat(sink.received.get(0).text()).isEqualTo("{\"text\":\"안녕하세요\"}");
        assertThat(sink.received.get(0).checkcode()).isEqualTo(CHECKCODE);
        assertThat(sink.received.get(0).requestCode()).isEqualTo(SubtitleClient.REQUEST_SUBTITLE);
        assertThat(sink.connections.get()).isEqualTo(1);
        assertThat(client.isConnected()).isTrue();
    }

    @Test
    void blankTextIsNotSent() {
        assertThat(client.send("   ")).isFalse();
        assertThat(client.send(null)).isFalse();

        assertThat(sink.received).isEmpty();
        assertThat(client.isConnected()).isFalse();
    }

    @Test
    void connectIsIdempotent() {
        client.connect();
        client.connect();

        assertThat(client.isConnected()).isTrue();
    }

    @Test
    void wrongResponseCheckcodeFailsAndDisconnects() {
        sink.respondWith(0x12345678, 0);

        assertThatThrownBy(() -> client.send("자막"))
                .isInstanceOf(SubtitleForwardException.class)
                .hasMessageContaining("checkcode");
        assertThat(client.isConnected()).isFalse();
    }

    @Test
    void errorStatusFailsAndNextSendReconnects() {
        sink.respondWith(EXPECTED, 3);
        assertThatThrownBy(() -> client.send("자막"))
                .isInstanceOf(SubtitleForwardException.class)
                .hasMessageContaining("status 3");

        sink.respondWith(EXPECTED, 0);
        assertThat(client.send("자막")).isTrue();
        assertThat(sink.connections.get()).isEqualTo(2);
    }

    @Test
    void unreachableServerFailsToConnect() throws IOException {
        int closedPort;
        try (ServerSocket placeholder = new ServerSocket(0)) {
            closedPort = placeholder.getLocalPort();
        }
        SubtitleClient offline = new SubtitleClient("127.0.0.1", closedPort, CHECKCODE, EXPECTED, 500);

        assertThatThrownBy(offline::connect)
                .isInstanceOf(SubtitleForwardException.class)
                .extracting(e -> ((SubtitleForwardException) e).getEndpoint())
                .isEqualTo("127.0.0.1:" + closedPort);
        assertThat(offline.isConnected()).isFalse();
    }
}
