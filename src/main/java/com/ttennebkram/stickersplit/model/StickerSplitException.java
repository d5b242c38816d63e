package com.ttennebkram.stickersplit.model;

/**
 * Base class of the errors raised while splitting a sticker sheet.
 * Unchecked: callers in a batch catch it per image, everyone else lets it propagate.
 */
public class StickerSplitException extends RuntimeException {

    public StickerSplitException(String message) {
        super(message);
    }

    public StickerSplitException(String message, Throwable cause) {
        super(message, cause);
    }
}
