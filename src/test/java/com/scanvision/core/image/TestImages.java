package com.scanvision.core.image;

import com.google.zxing.BarcodeFormat;
import com.google.zxing.WriterException;
import com.google.zxing.client.j2se.MatrixToImageWriter;
import com.google.zxing.oned.Code128Writer;
import com.google.zxing.qrcode.QRCodeWriter;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

/** Синтетические картинки со штрихкодами для тестов. */
public final class TestImages {

    private TestImages() {
        // no-op
    }

    public static BufferedImage qr(String text, int size) {
        try {
            return toRgb(MatrixToImageWriter.toBufferedImage(
                    new QRCodeWriter().encode(text, BarcodeFormat.QR_CODE, size, size)));
        } catch (WriterException e) {
            throw new IllegalStateException(e);
        }
    }

    public static BufferedImage code128(String text, int width, int height) {
        return toRgb(MatrixToImageWriter.toBufferedImage(
                new Code128Writer().encode(text, BarcodeFormat.CODE_128, width, height)));
    }

    /** Поворот на 90° по часовой стрелке. */
    public static BufferedImage rotateClockwise(BufferedImage src) {
        int w = src.getWidth(), h = src.getHeight();
        BufferedImage dst = new BufferedImage(h, w, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                dst.setRGB(h - 1 - y, x, src.getRGB(x, y));
            }
        }
        return dst;
    }

    public static BufferedImage invert(BufferedImage src) {
        BufferedImage dst = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < src.getHeight(); y++) {
            for (int x = 0; x < src.getWidth(); x++) {
                dst.setRGB(x, y, ~src.getRGB(x, y) & 0xFFFFFF);
            }
        }
        return dst;
    }

    /** Картинки рядом на белом фоне с отступом {@code gap}. */
    public static BufferedImage sideBySide(int gap, BufferedImage... parts) {
        int w = gap, h = 0;
        for (BufferedImage p : parts) {
            w += p.getWidth() + gap;
            h = Math.max(h, p.getHeight());
        }
        h += 2 * gap;
        BufferedImage dst = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = dst.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, w, h);
            int x = gap;
            for (BufferedImage p : parts) {
                g.drawImage(p, x, gap, null);
                x += p.getWidth() + gap;
            }
        } finally {
            g.dispose();
        }
        return dst;
    }

    public static int[] argbPixels(BufferedImage img) {
        return img.getRGB(0, 0, img.getWidth(), img.getHeight(), null, 0, img.getWidth());
    }

    private static BufferedImage toRgb(BufferedImage src) {
        BufferedImage dst = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = dst.createGraphics();
        try {
            g.drawImage(src, 0, 0, null);
        } finally {
            g.dispose();
        }
        return dst;
    }
}
