package com.scanvision.core.decode;

import com.google.zxing.BinaryBitmap;
import com.google.zxing.NotFoundException;
import com.google.zxing.Reader;
import com.google.zxing.Result;

/**
 * Ридер, который умеет повторно использовать внутреннее состояние (хинты, набор под-ридеров)
 * с прошлого вызова {@link #decode(BinaryBitmap, java.util.Map)}.
 */
public interface StatefulReader extends Reader {

    /** Декодирует с сохранённым состоянием; хинты не принимаются. */
    Result decodeWithState(BinaryBitmap image) throws NotFoundException;
}
