package com.paxkun.magpie.service.assembly;

import com.paxkun.magpie.service.LoggerService;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ListingGeneratorTest {

    @TempDir
    Path tempDir;

    @Mock
    private LoggerService logger;

    @InjectMocks
    private ListingGenerator generator;

    @Test
    void listsEveryReadableDocumentInNameOrder() throws IOException {
        Path documents = Files.createDirectories(tempDir.resolve("Comic_1-pdf"));
        DocumentAssembler assembler = new DocumentAssembler();
        Files.write(documents.resolve("ch0002 - B <two>.pdf"),
                assembler.assemble(List.of(DocumentAssemblerTest.jpeg(10, 10))));
        Files.write(documents.resolve("ch0001 - A.pdf"),
                assembler.assemble(List.of(DocumentAssemblerTest.jpeg(10, 10), DocumentAssemblerTest.jpeg(10, 20))));
        Files.writeString(documents.resolve("notes.txt"), "ignored");

        Path index = generator.generate(documents);

        assertThat(index).isEqualTo(documents.resolve(ListingGenerator.INDEX_FILE));
        String html = Files.readString(index, StandardCharsets.UTF_8);
        assertThat(html).startsWith("<!DOCTYPE html>");

        Document parsed = Jsoup.parse(html);
        assertThat(parsed.title()).isEqualTo("PDF Content Index - Comic_1-pdf");
        assertThat(parsed.selectFirst("div.stats").text()).startsWith("Total PDFs: 2 |");

        List<Element> links = parsed.select("div.pdf-item a");
        assertThat(links).extracting(Element::text).containsExactly("ch0001 - A", "ch0002 - B <two>");
        assertThat(links.get(0).attr("href")).isEqualTo("ch0001 - A.pdf");
        assertThat(parsed.select("div.pdf-info").first().text()).startsWith("Pages: 2 | Size: ");
    }

    @Test
    void skipsDocumentsThatCannotBeOpened() throws IOException {
        Path documents = Files.createDirectories(tempDir.resolve("Broken-pdf"));
        Files.writeString(documents.resolve("ch0001 - Torn.pdf"), "not a pdf");

        Path index = generator.generate(documents);

        Document parsed = Jsoup.parse(Files.readString(index, StandardCharsets.UTF_8));
        assertThat(parsed.select("div.pdf-item")).isEmpty();
        verify(logger).warn(eq("LISTING"), contains("ch0001 - Torn.pdf"));
    }
}
