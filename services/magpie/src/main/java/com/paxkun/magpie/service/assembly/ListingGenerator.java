package com.paxkun.magpie.service.assembly;

import com.paxkun.magpie.exception.ArtifactIOException;
import com.paxkun.magpie.service.LoggerService;
import lombok.RequiredArgsConstructor;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Writes {@code index.html} into a documents directory, one row per chapter PDF.
 * <p>
 * Author: Pax
 */
@Component
@RequiredArgsConstructor
public class ListingGenerator {

    public static final String INDEX_FILE = "index.html";
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String STYLE =
            "body { font-family: Arial, sans-serif; margin: 2rem; background-color: #f5f5f5; }\n" +
            ".header { text-align: center; margin-bottom: 2rem; color: #2c3e50; }\n" +
            ".stats { text-align: center; margin-bottom: 1.5rem; color: #7f8c8d; }\n" +
            ".pdf-list { max-width: 800px; margin: 0 auto; background: white; padding: 2rem;\n" +
            "            border-radius: 10px; box-shadow: 0 2px 5px rgba(0,0,0,0.1); }\n" +
            ".pdf-item { padding: 1rem; border-bottom: 1px solid #eee; display: flex;\n" +
            "            justify-content: space-between; align-items: center; }\n" +
            ".pdf-item:hover { background-color: #f9f9f9; }\n" +
            ".pdf-info { color: #666; font-size: 0.9rem; }\n" +
            "a { color: #2980b9; text-decoration: none; font-weight: bold; }\n" +
            "a:hover { color: #3498db; }\n";

    private final LoggerService logger;

    /**
     * @param documentsDir directory holding the assembled chapter documents
     * @return path of the generated index
     */
    public Path generate(Path documentsDir) {
        List<Entry> entries = collectEntries(documentsDir);
        String folderName = documentsDir.getFileName().toString();

        Document html = Document.createShell("");
        html.head().appendElement("meta").attr("charset", "UTF-8");
        html.head().appendElement("meta")
                .attr("name", "viewport")
                .attr("content", "width=device-width, initial-scale=1.0");
        html.title("PDF Content Index - " + folderName);
        html.head().appendElement("style").appendChild(new DataNode(STYLE));

        Element header = html.body().appendElement("div").addClass("header");
        header.appendElement("h1").text(folderName);
        header.appendElement("div").addClass("stats")
                .text("Total PDFs: " + entries.size() + " | Last Updated: " + LocalDateTime.now().format(TIME_FORMAT));

        Element list = html.body().appendElement("div").addClass("pdf-list");
        for (Entry entry : entries) {
            Element item = list.appendElement("div").addClass("pdf-item");
            item.appendElement("a")
                    .attr("href", entry.fileName())
                    .attr("target", "_blank")
                    .text(entry.title());
            item.appendElement("div").addClass("pdf-info")
                    .text("Pages: " + entry.pages()
                            + " | Size: " + String.format(Locale.ROOT, "%.1f KB", entry.sizeBytes() / 1024.0)
                            + " | Modified: " + entry.modified());
        }

        Path indexPath = documentsDir.resolve(INDEX_FILE);
        try {
            Files.writeString(indexPath, "<!DOCTYPE html>\n" + html.html(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ArtifactIOException("Failed to write listing " + indexPath, e);
        }
        logger.info("LISTING", "Generated listing with " + entries.size() + " documents at " + indexPath);
        return indexPath;
    }

    private List<Entry> collectEntries(Path documentsDir) {
        List<Path> pdfs;
        try (Stream<Path> files = Files.list(documentsDir)) {
            pdfs = files.filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ArtifactIOException("Failed to list documents in " + documentsDir, e);
        }

        List<Entry> entries = new ArrayList<>();
        for (Path pdf : pdfs) {
            String fileName = pdf.getFileName().toString();
            try (PDDocument document = Loader.loadPDF(pdf.toFile())) {
                String modified = LocalDateTime.ofInstant(Files.getLastModifiedTime(pdf).toInstant(), ZoneId.systemDefault())
                        .format(TIME_FORMAT);
                entries.add(new Entry(
                        fileName.substring(0, fileName.length() - ".pdf".length()),
                        fileName,
                        document.getNumberOfPages(),
                        Files.size(pdf),
                        modified));
            } catch (IOException e) {
                logger.warn("LISTING", "Skipping unreadable document " + fileName + ": " + e.getMessage());
            }
        }
        return entries;
    }

    private record Entry(String title, String fileName, int pages, long sizeBytes, String modified) {
    }
}
