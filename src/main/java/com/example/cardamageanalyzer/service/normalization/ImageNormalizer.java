package com.example.cardamageanalyzer.service.normalization;

import com.example.cardamageanalyzer.config.AnalyzerProperties;
import com.example.cardamageanalyzer.exception.NormalizationException;
import com.example.cardamageanalyzer.model.ImagePayload;
import com.example.cardamageanalyzer.model.ItemErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.Objects;

/**
 * Brings every uploaded photo to the shape the scoring model expects: a fixed square raster
 * with a mild contrast boost and a brightness lift, re-encoded as JPEG. The transformation is
 * pure; the source payload is never touched and a fresh payload is returned.
 *
 * <p>Aspect ratio is not preserved. Photos are stretched to fill the square so that every item
 * of a batch reaches the oracle with the same dimensions.
 */
@Component
public class ImageNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ImageNormalizer.class);

    static final String OUTPUT_MEDIA_TYPE = "image/jpeg";
    private static final String OUTPUT_FORMAT = "jpeg";
    private static final int MID_GRAY = 128;

    private final int targetSize;
    private final float jpegQuality;
    private final int[] channelLookup;

    public ImageNormalizer(AnalyzerProperties properties) {
        AnalyzerProperties.Normalization settings = properties.getNormalization();
        this.targetSize = settings.getTargetSize();
        this.jpegQuality = settings.getJpegQuality();
        this.channelLookup = buildLookup(settings.getBrightness(), settings.getContrast());
    }

    /**
     * Classic contrast correction factor: values above 1 push each channel away from mid-gray.
     */
    static double contrastFactor(int contrast) {
        return (259.0 * (contrast + 255)) / (255.0 * (259 - contrast));
    }

    private static int[] buildLookup(int brightness, int contrast) {
        double factor = contrastFactor(contrast);
        int[] lookup = new int[256];
        for (int value = 0; value < lookup.length; value++) {
            double adjusted = factor * (value - MID_GRAY) + MID_GRAY + brightness;
            lookup[value] = clamp((int) Math.round(adjusted));
        }
        return lookup;
    }

    private static int clamp(int value) {
        return Math.max(0, Math.min(255, value));
    }

    public ImagePayload normalize(ImagePayload image) throws NormalizationException {
        Objects.requireNonNull(image, "image");
        if (!image.isRaster()) {
            throw new NormalizationException(ItemErrorKind.UNSUPPORTED_MEDIA_TYPE,
                    String.format("Unsupported media type '%s' for %s", image.mediaType(), image.fileName()));
        }

        BufferedImage decoded = decode(image);
        BufferedImage transformed = transform(decoded);
        byte[] encoded = encode(transformed, image.fileName());

        log.debug("Normalized {} from {}x{} to {}x{} ({} -> {} bytes)", image.fileName(),
                decoded.getWidth(), decoded.getHeight(), targetSize, targetSize, image.size(), encoded.length);
        return new ImagePayload(outputName(image.fileName()), OUTPUT_MEDIA_TYPE, encoded, targetSize, targetSize);
    }

    /**
     * Resamples {@code source} to the target square and applies the channel correction. Exposed
     * separately from {@link #normalize(ImagePayload)} so callers can inspect exact pixel values
     * before lossy encoding.
     */
    public BufferedImage transform(BufferedImage source) {
        Objects.requireNonNull(source, "source");
        BufferedImage resized = resize(source);
        correctChannels(resized);
        return resized;
    }

    /**
     * Corrected value of a single 8-bit colour channel.
     */
    public int correctChannel(int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException("Channel value out of range: " + value);
        }
        return channelLookup[value];
    }

    public int getTargetSize() {
        return targetSize;
    }

    private BufferedImage decode(ImagePayload image) throws NormalizationException {
        BufferedImage decoded;
        try (InputStream inputStream = new ByteArrayInputStream(image.data())) {
            decoded = ImageIO.read(inputStream);
        } catch (IOException | RuntimeException ex) {
            throw new NormalizationException(ItemErrorKind.DECODE_FAILURE,
                    "Unable to decode image " + image.fileName(), ex);
        }
        if (decoded == null) {
            throw new NormalizationException(ItemErrorKind.DECODE_FAILURE,
                    "No decoder recognised the data of " + image.fileName());
        }
        if (decoded.getWidth() <= 0 || decoded.getHeight() <= 0) {
            throw new NormalizationException(ItemErrorKind.DECODE_FAILURE,
                    "Decoded image has no pixels: " + image.fileName());
        }
        return decoded;
    }

    private BufferedImage resize(BufferedImage source) {
        int type = source.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        BufferedImage resized = new BufferedImage(targetSize, targetSize, type);
        Graphics2D g = resized.createGraphics();
        try {
            g.setComposite(AlphaComposite.Src);
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.setRenderingHint(RenderingHints.KEY_COLOR_RENDERING, RenderingHints.VALUE_COLOR_RENDER_QUALITY);
            g.drawImage(source, 0, 0, targetSize, targetSize, null);
        } finally {
            g.dispose();
        }
        return resized;
    }

    // Alpha is carried over untouched.
    private void correctChannels(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            image.getRGB(0, y, width, 1, row, 0, width);
            for (int x = 0; x < width; x++) {
                int argb = row[x];
                int alpha = argb & 0xFF000000;
                int red = channelLookup[(argb >> 16) & 0xFF];
                int green = channelLookup[(argb >> 8) & 0xFF];
                int blue = channelLookup[argb & 0xFF];
                row[x] = alpha | (red << 16) | (green << 8) | blue;
            }
            image.setRGB(0, y, width, 1, row, 0, width);
        }
    }

    private byte[] encode(BufferedImage image, String fileName) throws NormalizationException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(OUTPUT_FORMAT);
        if (!writers.hasNext()) {
            throw new NormalizationException(ItemErrorKind.ENCODE_FAILURE, "No JPEG encoder available");
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        try (ImageOutputStream imageStream = ImageIO.createImageOutputStream(outputStream)) {
            if (imageStream == null) {
                throw new NormalizationException(ItemErrorKind.ENCODE_FAILURE,
                        "Unable to open an output stream for " + fileName);
            }
            writer.setOutput(imageStream);
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(jpegQuality);
            writer.write(null, new IIOImage(toOpaque(image), null, null), param);
        } catch (IOException | RuntimeException ex) {
            throw new NormalizationException(ItemErrorKind.ENCODE_FAILURE, "Unable to encode " + fileName, ex);
        } finally {
            writer.dispose();
        }
        return outputStream.toByteArray();
    }

    // JPEG has no alpha channel; transparent areas end up black.
    private BufferedImage toOpaque(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        BufferedImage opaque = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = opaque.createGraphics();
        try {
            g.setColor(Color.BLACK);
            g.fillRect(0, 0, image.getWidth(), image.getHeight());
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return opaque;
    }

    private static String outputName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        return base + ".jpg";
    }
}
