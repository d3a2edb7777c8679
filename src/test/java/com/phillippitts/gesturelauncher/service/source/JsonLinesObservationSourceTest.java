package com.phillippitts.gesturelauncher.service.source;

import com.phillippitts.gesturelauncher.exception.ObservationSourceException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonLinesObservationSourceTest {

    @TempDir
    Path dir;

    @Test
    void readsOneTickPerNonBlankLine() throws Exception {
        Path feed = dir.resolve("feed.jsonl");
        Files.writeString(feed, "{\"fingers\":[0,1,0,0,0]}\n\n   \n{}\n");
        JsonLinesObservationSource source = new JsonLinesObservationSource(feed.toString(), new ObservationJsonParser());
        source.open();

        Optional<Tick> first = source.next();
        Optional<Tick> second = source.next();
        Optional<Tick> end = source.next();
        source.close();

        assertThat(first).hasValueSatisfying(t -> assertThat(t.observation()).isPresent());
        assertThat(second).hasValueSatisfying(t -> assertThat(t.observation()).isEmpty());
        assertThat(end).isEmpty();
    }

    @Test
    void missingFileFailsToOpen() {
        JsonLinesObservationSource source = new JsonLinesObservationSource(dir.resolve("nope").toString(),
                new ObservationJsonParser());

        assertThatThrownBy(source::open)
                .isInstanceOf(ObservationSourceException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void describesStdin() {
        assertThat(new JsonLinesObservationSource("-", new ObservationJsonParser()).describe()).isEqualTo("stdin");
    }

    @Test
    void nextBeforeOpenIsAnError() {
        JsonLinesObservationSource source = new JsonLinesObservationSource(dir.toString(), new ObservationJsonParser());
        assertThatThrownBy(source::next).isInstanceOf(IllegalStateException.class);
    }
}
