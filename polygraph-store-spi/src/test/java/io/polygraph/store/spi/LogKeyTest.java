package io.polygraph.store.spi;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LogKeyTest {

    @Test
    void randomKeysAreDistinctHex() {
        LogKey a = LogKey.random();
        LogKey b = LogKey.random();

        assertThat(a.hex()).hasSize(64).matches("[0-9a-f]+");
        assertThat(a).isNotEqualTo(b);
    }

    @Test
    void parseNormalizesCase() {
        LogKey key = LogKey.random();

        assertThat(LogKey.parse(key.hex().toUpperCase())).isEqualTo(key);
        assertThat(LogKey.parse(" " + key.hex() + "\n")).isEqualTo(key);
    }

    @Test
    void discoveryKeyIsStableAndDiffersFromKey() {
        LogKey key = LogKey.random();

        assertThat(key.discoveryKey()).isEqualTo(LogKey.parse(key.hex()).discoveryKey());
        assertThat(key.discoveryKey()).hasSize(64).isNotEqualTo(key.hex());
        assertThat(key.shortForm()).isEqualTo(key.hex().substring(58));
    }

    @Test
    void rejectsMalformedKeys() {
        assertThatThrownBy(() -> LogKey.parse("abc")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> LogKey.parse("z".repeat(64))).isInstanceOf(IllegalArgumentException.class);
    }
}
