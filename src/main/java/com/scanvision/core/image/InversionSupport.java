package com.scanvision.core.image;

import com.google.zxing.LuminanceSource;

/**
 * Необязательная возможность источника яркости: может ли он отдать инвертированный вид.
 * Источники, не реализующие интерфейс, считаются инвертируемыми: {@link LuminanceSource#invert()}
 * в ZXing работает для любого источника.
 */
public interface InversionSupport {

    boolean isInversionSupported();

    static boolean isInversionSupported(LuminanceSource source) {
        if (source instanceof InversionSupport s) {
            return s.isInversionSupported();
        }
        return source != null;
    }
}
