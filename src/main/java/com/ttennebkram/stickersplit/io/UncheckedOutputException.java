package com.ttennebkram.stickersplit.io;

import com.ttennebkram.stickersplit.model.StickerSplitException;

import java.io.IOException;

/**
 * An output folder could not be prepared, so no tile of the image can be written.
 */
public class UncheckedOutputException extends StickerSplitException {

    public UncheckedOutputException(String message, IOException cause) {
        super(message, cause);
    }
}
