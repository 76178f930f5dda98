package com.paxkun.magpie.service.assembly;

import com.paxkun.magpie.exception.AssemblyException;
import com.paxkun.magpie.service.acquisition.EncodedImage;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.JPEGFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Calendar;
import java.util.List;

/**
 * Builds one PDF per chapter: one page per image, each page exactly the size of its
 * image (72 DPI, so one pixel is one point), no margins, input order as reading order.
 * <p>
 * Author: Pax
 */
@Component
public class DocumentAssembler {

    public byte[] assemble(List<EncodedImage> images) {
        return assemble(images, null);
    }

    /**
     * @param images pages in reading order
     * @param title  document title metadata, may be null
     * @throws AssemblyException if {@code images} is empty or PDF generation fails
     */
    public byte[] assemble(List<EncodedImage> images, String title) {
        if (images == null || images.isEmpty()) {
            throw new AssemblyException("Cannot assemble a document without images");
        }

        try (PDDocument document = new PDDocument()) {
            PDDocumentInformation info = document.getDocumentInformation();
            info.setProducer("Magpie");
            info.setCreationDate(Calendar.getInstance());
            if (title != null) {
                info.setTitle(title);
            }

            for (EncodedImage image : images) {
                PDRectangle pageSize = new PDRectangle(image.width(), image.height());
                PDPage page = new PDPage(pageSize);
                document.addPage(page);

                PDImageXObject pdImage = JPEGFactory.createFromByteArray(document, image.bytes());
                try (PDPageContentStream contentStream = new PDPageContentStream(document, page)) {
                    contentStream.drawImage(pdImage, 0, 0, pageSize.getWidth(), pageSize.getHeight());
                }
            }

            ByteArrayOutputStream output = new ByteArrayOutputStream();
            document.save(output);
            return output.toByteArray();
        } catch (IOException e) {
            throw new AssemblyException("PDF generation failed: " + e.getMessage(), e);
        }
    }
}
