package com.scanvision.core.image;

/**
 * Раскладка пикселей в «сыром» буфере кадра.
 * Порядок каналов указан так, как байты лежат в памяти.
 */
public enum PixelFormat {
    GRAY8(1),
    RGB24(3),
    BGR24(3),
    RGBA32(4),
    ARGB32(4),
    BGRA32(4),
    /** 16 бит на пиксель, little-endian: RRRRRGGG GGGBBBBB. */
    RGB565(2);

    private final int bytesPerPixel;

    PixelFormat(int bytesPerPixel) {
        this.bytesPerPixel = bytesPerPixel;
    }

    public int bytesPerPixel() {
        return bytesPerPixel;
    }

    /** Яркость пикселя с индексом {@code pixel} (0..w*h-1), 0..255. */
    int luminance(byte[] raw, int pixel) {
        int o = pixel * bytesPerPixel;
        return switch (this) {
            case GRAY8 -> raw[o] & 0xFF;
            case RGB24, RGBA32 -> luma(raw[o] & 0xFF, raw[o + 1] & 0xFF, raw[o + 2] & 0xFF);
            case BGR24, BGRA32 -> luma(raw[o + 2] & 0xFF, raw[o + 1] & 0xFF, raw[o] & 0xFF);
            case ARGB32 -> luma(raw[o + 1] & 0xFF, raw[o + 2] & 0xFF, raw[o + 3] & 0xFF);
            case RGB565 -> {
                int v = (raw[o] & 0xFF) | ((raw[o + 1] & 0xFF) << 8);
                int r = (v >> 11) & 0x1F;
                int g = (v >> 5) & 0x3F;
                int b = v & 0x1F;
                // расширяем до 8 бит
                yield luma((r << 3) | (r >> 2), (g << 2) | (g >> 4), (b << 3) | (b >> 2));
            }
        };
    }

    // Y = 0.299R + 0.587G + 0.114B в целочисленном виде
    static int luma(int r, int g, int b) {
        return (306 * r + 601 * g + 117 * b) >> 10;
    }
}
