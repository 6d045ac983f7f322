package com.scanvision.core.decode;

import com.google.zxing.Reader;
import com.google.zxing.multi.GenericMultipleBarcodeReader;
import com.google.zxing.multi.MultipleBarcodeReader;
import com.google.zxing.multi.qrcode.QRCodeMultiReader;

/** Создаёт движок для decodeMultiple; вызывается заново на каждый вызов. */
@FunctionalInterface
public interface MultiReaderFactory {

    MultiReaderFactory DEFAULT = (choice, single) -> switch (choice) {
        case SPECIALIZED -> new QRCodeMultiReader();
        case GENERIC -> new GenericMultipleBarcodeReader(single);
    };

    /**
     * @param choice результат {@link MultiReaderChoice#select}
     * @param single одиночный ридер, которым пользуется {@link BarcodeReader}
     */
    MultipleBarcodeReader create(MultiReaderChoice choice, Reader single);
}
