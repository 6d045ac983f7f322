package com.scanvision.core.image;

import com.google.zxing.LuminanceSource;

/** Сырой буфер кадра → источник яркости. По умолчанию {@link LuminanceSources#fromRaw}. */
@FunctionalInterface
public interface RawLuminanceFactory {

    RawLuminanceFactory DEFAULT = LuminanceSources::fromRaw;

    LuminanceSource create(byte[] raw, int width, int height, PixelFormat format);
}
