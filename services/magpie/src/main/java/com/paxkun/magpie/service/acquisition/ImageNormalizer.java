package com.paxkun.magpie.service.acquisition;

import com.paxkun.magpie.exception.DecodeException;
import com.paxkun.magpie.exception.InvalidDimensionsException;
import org.springframework.stereotype.Component;
import org.w3c.dom.Node;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataNode;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.Image;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Turns one raw image payload into a page ready for assembly: decoded, checked,
 * flattened to RGB, resized to the preferred width and re-encoded as a 72 DPI JPEG.
 * <p>
 * Stateless and safe to share between acquisition workers.
 * <p>
 * Author: Pax
 */
@Component
public class ImageNormalizer {

    public static final int PREFERRED_WIDTH = 1600;
    public static final int MAX_DIMENSION = 65500;
    public static final int MIN_DIMENSION = 4;
    static final float JPEG_QUALITY = 0.90f;
    static final int OUTPUT_DPI = 72;

    private static final String JPEG_METADATA_FORMAT = "javax_imageio_jpeg_image_1.0";

    /**
     * @throws DecodeException            if the payload is not a complete, readable image
     * @throws InvalidDimensionsException if the image reports a zero dimension
     */
    public EncodedImage normalize(byte[] rawBytes) {
        if (rawBytes == null || rawBytes.length == 0) {
            throw new DecodeException("Empty image payload");
        }

        BufferedImage decoded = decode(rawBytes);
        Size target = targetSize(decoded.getWidth(), decoded.getHeight());

        BufferedImage rgb = toRgb(decoded);
        BufferedImage resized = resize(rgb, target);
        return new EncodedImage(encodeJpeg(resized), target.width(), target.height());
    }

    /**
     * Preferred width with aspect ratio kept, corrected first by height, then by width,
     * then floored. The order matters for extreme aspect ratios.
     */
    static Size targetSize(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new InvalidDimensionsException(width, height);
        }

        int targetWidth = PREFERRED_WIDTH;
        double ratio = (double) PREFERRED_WIDTH / width;
        int targetHeight = (int) (height * ratio);

        if (targetHeight > MAX_DIMENSION) {
            ratio = (double) MAX_DIMENSION / height;
            targetWidth = (int) (width * ratio);
            targetHeight = MAX_DIMENSION;
        }

        if (targetWidth > MAX_DIMENSION) {
            ratio = (double) MAX_DIMENSION / width;
            targetWidth = MAX_DIMENSION;
            targetHeight = (int) (height * ratio);
        }

        targetWidth = Math.max(Math.min(targetWidth, MAX_DIMENSION), MIN_DIMENSION);
        targetHeight = Math.max(Math.min(targetHeight, MAX_DIMENSION), MIN_DIMENSION);
        return new Size(targetWidth, targetHeight);
    }

    private BufferedImage decode(byte[] rawBytes) {
        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(rawBytes))) {
            if (input == null) {
                throw new DecodeException("Cannot open image stream");
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                throw new DecodeException("Unrecognized image format (" + rawBytes.length + " bytes)");
            }

            ImageReader reader = readers.next();
            List<String> warnings = new ArrayList<>();
            try {
                reader.addIIOReadWarningListener((source, warning) -> warnings.add(warning));
                reader.setInput(input, true, true);

                int width = reader.getWidth(0);
                int height = reader.getHeight(0);
                if (width <= 0 || height <= 0) {
                    throw new InvalidDimensionsException(width, height);
                }

                BufferedImage image = reader.read(0);
                if (!warnings.isEmpty()) {
                    throw new DecodeException("Image failed integrity check: " + warnings.get(0));
                }
                return image;
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            throw new DecodeException("Failed to decode image: " + e.getMessage(), e);
        } catch (IllegalArgumentException | IllegalStateException | IndexOutOfBoundsException e) {
            // Some ImageIO plugins signal corrupt data with runtime exceptions
            throw new DecodeException("Corrupt image data: " + e.getMessage(), e);
        }
    }

    /**
     * Flattens alpha and palette images onto white and yields a plain RGB raster.
     */
    private BufferedImage toRgb(BufferedImage source) {
        if (source.getType() == BufferedImage.TYPE_INT_RGB) {
            return source;
        }
        BufferedImage rgb = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, source.getWidth(), source.getHeight());
            g.drawImage(source, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    private BufferedImage resize(BufferedImage source, Size target) {
        if (source.getWidth() == target.width() && source.getHeight() == target.height()) {
            return source;
        }

        BufferedImage output = new BufferedImage(target.width(), target.height(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = output.createGraphics();
        try {
            boolean shrinking = target.width() < source.getWidth() || target.height() < source.getHeight();
            if (shrinking) {
                // Area averaging weights every source pixel that falls into a target pixel
                Image scaled = source.getScaledInstance(target.width(), target.height(), Image.SCALE_AREA_AVERAGING);
                g.drawImage(scaled, 0, 0, null);
            } else {
                g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
                g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
                g.drawImage(source, 0, 0, target.width(), target.height(), null);
            }
        } finally {
            g.dispose();
        }
        return output;
    }

    private byte[] encodeJpeg(BufferedImage image) {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IllegalStateException("No JPEG writer available");
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        try (ImageOutputStream output = ImageIO.createImageOutputStream(buffer)) {
            writer.setOutput(output);

            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(JPEG_QUALITY);

            IIOMetadata metadata = writer.getDefaultImageMetadata(ImageTypeSpecifier.createFromRenderedImage(image), param);
            applyDpi(metadata);

            writer.write(null, new IIOImage(image, null, metadata), param);
        } catch (IOException e) {
            throw new DecodeException("Failed to encode JPEG: " + e.getMessage(), e);
        } finally {
            writer.dispose();
        }
        return buffer.toByteArray();
    }

    private void applyDpi(IIOMetadata metadata) throws IOException {
        IIOMetadataNode root = (IIOMetadataNode) metadata.getAsTree(JPEG_METADATA_FORMAT);
        Node jfif = root.getElementsByTagName("app0JFIF").item(0);
        if (jfif instanceof IIOMetadataNode node) {
            node.setAttribute("resUnits", "1");
            node.setAttribute("Xdensity", String.valueOf(OUTPUT_DPI));
            node.setAttribute("Ydensity", String.valueOf(OUTPUT_DPI));
            metadata.setFromTree(JPEG_METADATA_FORMAT, root);
        }
    }

    record Size(int width, int height) {
    }
}
