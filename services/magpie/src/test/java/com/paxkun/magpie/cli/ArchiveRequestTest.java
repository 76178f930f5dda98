package com.paxkun.magpie.cli;

import com.paxkun.magpie.service.source.EightComicSource;
import com.paxkun.magpie.service.source.SourceRegistry;
import com.paxkun.magpie.service.source.XmanhuaSource;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArchiveRequestTest {

    private final SourceRegistry registry = new SourceRegistry(List.of(new EightComicSource(), new XmanhuaSource()));

    @Test
    void parsesSourceBookAndFlags() {
        ArchiveRequest request = ArchiveRequest.parse(
                new DefaultApplicationArguments("--from-xmanhua", "--book-id=73xm", "--overwrite", "--show-index"),
                registry);

        assertThat(request.source()).isInstanceOf(XmanhuaSource.class);
        assertThat(request.bookId()).isEqualTo("73xm");
        assertThat(request.overwrite()).isTrue();
        assertThat(request.showIndex()).isTrue();
        assertThat(request.rescan()).isFalse();
    }

    @Test
    void requiresExactlyOneSource() {
        assertThatThrownBy(() -> ArchiveRequest.parse(new DefaultApplicationArguments("--book-id=1"), registry))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("You must select one source from --from-8comic, --from-xmanhua");
        assertThatThrownBy(() -> ArchiveRequest.parse(
                new DefaultApplicationArguments("--from-8comic", "--from-xmanhua", "--book-id=1"), registry))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("You must select only one source");
    }

    @Test
    void requiresBookId() {
        assertThatThrownBy(() -> ArchiveRequest.parse(new DefaultApplicationArguments("--from-8comic"), registry))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("--book-id");
        assertThatThrownBy(() -> ArchiveRequest.parse(
                new DefaultApplicationArguments("--from-8comic", "--book-id="), registry))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
