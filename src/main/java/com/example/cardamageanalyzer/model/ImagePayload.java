package com.example.cardamageanalyzer.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable encoded image as uploaded by a client or produced by the normalizer. The
 * {@code width} and {@code height} fields are {@code 0} until the payload has been decoded at
 * least once; uploads are not decoded on ingestion.
 */
public record ImagePayload(String fileName, String mediaType, byte[] data, int width, int height) {

    private static final String IMAGE_PREFIX = "image/";
    private static final String SVG = "image/svg+xml";

    public ImagePayload {
        Objects.requireNonNull(data, "data");
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Image dimensions cannot be negative");
        }
        if (fileName == null || fileName.isBlank()) {
            fileName = "image";
        }
        mediaType = mediaType == null ? "" : mediaType.trim().toLowerCase(Locale.ROOT);
        data = data.clone();
    }

    public static ImagePayload of(String fileName, String mediaType, byte[] data) {
        return new ImagePayload(fileName, mediaType, data, 0, 0);
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    public int size() {
        return data.length;
    }

    /**
     * Vector formats are declared as {@code image/*} too, so SVG is excluded explicitly.
     */
    public boolean isRaster() {
        return mediaType.startsWith(IMAGE_PREFIX) && !mediaType.equals(SVG);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ImagePayload that)) {
            return false;
        }
        return width == that.width
                && height == that.height
                && fileName.equals(that.fileName)
                && mediaType.equals(that.mediaType)
                && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(fileName, mediaType, width, height);
        return 31 * result + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "ImagePayload[fileName=" + fileName + ", mediaType=" + mediaType + ", bytes=" + data.length
                + ", width=" + width + ", height=" + height + "]";
    }
}
