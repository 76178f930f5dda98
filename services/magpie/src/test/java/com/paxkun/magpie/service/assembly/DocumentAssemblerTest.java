package com.paxkun.magpie.service.assembly;

import com.paxkun.magpie.exception.AssemblyException;
import com.paxkun.magpie.service.acquisition.EncodedImage;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentAssemblerTest {

    private final DocumentAssembler assembler = new DocumentAssembler();

    @Test
    void writesOnePagePerImageSizedToTheImage() throws IOException {
        List<EncodedImage> pages = List.of(jpeg(160, 240), jpeg(160, 80), jpeg(320, 240));

        byte[] pdf = assembler.assemble(pages, "ch0001 - Start");

        try (PDDocument document = Loader.loadPDF(pdf)) {
            assertThat(document.getNumberOfPages()).isEqualTo(3);
            PDRectangle second = document.getPage(1).getMediaBox();
            assertThat(second.getWidth()).isEqualTo(160f);
            assertThat(second.getHeight()).isEqualTo(80f);
            assertThat(document.getPage(2).getMediaBox().getWidth()).isEqualTo(320f);
            assertThat(document.getDocumentInformation().getTitle()).isEqualTo("ch0001 - Start");
        }
    }

    @Test
    void refusesEmptyChapter() {
        assertThatThrownBy(() -> assembler.assemble(List.of()))
                .isInstanceOf(AssemblyException.class);
        assertThatThrownBy(() -> assembler.assemble(null))
                .isInstanceOf(AssemblyException.class);
    }

    static EncodedImage jpeg(int width, int height) throws IOException {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        ImageIO.write(image, "jpeg", buffer);
        return new EncodedImage(buffer.toByteArray(), width, height);
    }
}
