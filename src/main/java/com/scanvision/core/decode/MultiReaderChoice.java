package com.scanvision.core.decode;

import com.google.zxing.BarcodeFormat;

import java.util.Collection;

/**
 * Какой движок поиска нескольких символов использовать.
 * SPECIALIZED — выделенный QR-ридер; GENERIC — обёртка над одиночным ридером.
 */
public enum MultiReaderChoice {
    SPECIALIZED,
    GENERIC;

    /** Выделенный движок есть только для QR: ограничение ровно одним форматом QR_CODE. */
    public static MultiReaderChoice select(Collection<BarcodeFormat> formatRestriction) {
        if (formatRestriction != null
                && formatRestriction.size() == 1
                && formatRestriction.contains(BarcodeFormat.QR_CODE)) {
            return SPECIALIZED;
        }
        return GENERIC;
    }
}
