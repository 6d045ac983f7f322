package com.scanvision.core.decode;

import com.google.zxing.BarcodeFormat;
import com.google.zxing.multi.GenericMultipleBarcodeReader;
import com.google.zxing.multi.qrcode.QRCodeMultiReader;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MultiReaderChoiceTest {

    @Test
    void exactlyQrIsSpecialized() {
        assertEquals(MultiReaderChoice.SPECIALIZED, MultiReaderChoice.select(Set.of(BarcodeFormat.QR_CODE)));
        assertEquals(MultiReaderChoice.SPECIALIZED, MultiReaderChoice.select(List.of(BarcodeFormat.QR_CODE)));
    }

    @Test
    void everythingElseIsGeneric() {
        assertEquals(MultiReaderChoice.GENERIC, MultiReaderChoice.select(null));
        assertEquals(MultiReaderChoice.GENERIC, MultiReaderChoice.select(Set.of()));
        assertEquals(MultiReaderChoice.GENERIC, MultiReaderChoice.select(Set.of(BarcodeFormat.AZTEC)));
        assertEquals(MultiReaderChoice.GENERIC,
                MultiReaderChoice.select(EnumSet.of(BarcodeFormat.QR_CODE, BarcodeFormat.DATA_MATRIX)));
    }

    @Test
    void defaultFactoryBuildsMatchingEngines() {
        var single = new MultiFormatStatefulReader();
        assertInstanceOf(QRCodeMultiReader.class,
                MultiReaderFactory.DEFAULT.create(MultiReaderChoice.SPECIALIZED, single));
        assertInstanceOf(GenericMultipleBarcodeReader.class,
                MultiReaderFactory.DEFAULT.create(MultiReaderChoice.GENERIC, single));
    }
}
