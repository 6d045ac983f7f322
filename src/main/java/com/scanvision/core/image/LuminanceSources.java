package com.scanvision.core.image;

import com.google.zxing.LuminanceSource;
import com.google.zxing.client.j2se.BufferedImageLuminanceSource;

import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;
import java.util.Objects;

/**
 * Адаптеры «картинка → источник яркости».
 * Сырые буферы переводятся в 8-битный серый BufferedImage, чтобы источник поддерживал поворот.
 */
public final class LuminanceSources {

    private LuminanceSources() {
        // no-op
    }

    public static LuminanceSource fromImage(BufferedImage image) {
        Objects.requireNonNull(image, "image");
        return new BufferedImageLuminanceSource(image);
    }

    /** Пиксели в формате 0xAARRGGBB, построчно. */
    public static LuminanceSource fromArgb(int[] argb, int width, int height) {
        Objects.requireNonNull(argb, "argb");
        checkSize(argb.length, width, height, 1);
        byte[] gray = new byte[width * height];
        for (int i = 0; i < gray.length; i++) {
            int p = argb[i];
            gray[i] = (byte) PixelFormat.luma((p >> 16) & 0xFF, (p >> 8) & 0xFF, p & 0xFF);
        }
        return new BufferedImageLuminanceSource(toGrayImage(gray, width, height));
    }

    public static LuminanceSource fromRaw(byte[] raw, int width, int height, PixelFormat format) {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(format, "format");
        checkSize(raw.length, width, height, format.bytesPerPixel());
        byte[] gray = new byte[width * height];
        for (int i = 0; i < gray.length; i++) {
            gray[i] = (byte) format.luminance(raw, i);
        }
        return new BufferedImageLuminanceSource(toGrayImage(gray, width, height));
    }

    static BufferedImage toGrayImage(byte[] gray, int width, int height) {
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        WritableRaster raster = img.getRaster();
        raster.setDataElements(0, 0, width, height, gray);
        return img;
    }

    private static void checkSize(int length, int width, int height, int bytesPerPixel) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Invalid image size: " + width + "x" + height);
        }
        long need = (long) width * height * bytesPerPixel;
        if (length < need) {
            throw new IllegalArgumentException("Buffer too small: " + length + " < " + need
                    + " for " + width + "x" + height);
        }
    }
}
