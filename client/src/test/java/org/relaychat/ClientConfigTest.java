package org.relaychat;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClientConfigTest {

    @Test
    void defaultsToLocalServerWithoutName() {
        ClientConfig config = ClientConfig.fromArgs(new String[0]);

        assertThat(config.host()).isEqualTo("127.0.0.1");
        assertThat(config.port()).isEqualTo(9999);
        assertThat(config.name()).isEmpty();
    }

    @Test
    void readsHostPortAndName() {
        ClientConfig config = ClientConfig.fromArgs(new String[]{"chat.local", "5000", " alice "});

        assertThat(config.host()).isEqualTo("chat.local");
        assertThat(config.port()).isEqualTo(5000);
        assertThat(config.name()).contains("alice");
    }

    @Test
    void rejectsInvalidArguments() {
        assertThatThrownBy(() -> ClientConfig.fromArgs(new String[]{"host", "port"})).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ClientConfig.fromArgs(new String[]{"host", "0"})).hasMessageContaining("out of range");
        assertThatThrownBy(() -> ClientConfig.fromArgs(new String[]{"host", "1", "   "})).hasMessageContaining("empty");
        assertThatThrownBy(() -> ClientConfig.fromArgs(new String[]{"a", "1", "b", "c"})).isInstanceOf(IllegalArgumentException.class);
    }
}
