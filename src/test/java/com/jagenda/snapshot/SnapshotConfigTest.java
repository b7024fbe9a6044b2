package com.jagenda.snapshot;

import com.jagenda.storage.MalformedLinePolicy;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class SnapshotConfigTest {
    @Test
    void shouldUseDefaultValues() {
        SnapshotConfig config = new SnapshotConfig.Builder().build();
        assertThat(config.getMalformedLinePolicy()).isEqualTo(MalformedLinePolicy.FAIL);
        assertThat(config.getListingTitle()).isEqualTo("PHONE BOOK");
    }

    @Test
    void shouldUseCustomValues() {
        SnapshotConfig config = new SnapshotConfig.Builder()
            .setMalformedLinePolicy(MalformedLinePolicy.SKIP)
            .setListingTitle("CLIENTS")
            .build();

        assertThat(config.getMalformedLinePolicy()).isEqualTo(MalformedLinePolicy.SKIP);
        assertThat(config.getListingTitle()).isEqualTo("CLIENTS");
    }

    @Test
    void shouldRejectMissingValues() {
        SnapshotConfig.Builder builder = new SnapshotConfig.Builder();
        assertThatThrownBy(() -> builder.setMalformedLinePolicy(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.setListingTitle(" ")).isInstanceOf(IllegalArgumentException.class);
    }
}
