package com.ttennebkram.stickersplit.model;

/**
 * The image itself cannot be used: unsupported pixel format, zero size,
 * a buffer that does not match its descriptor, or a file that does not decode.
 * Aborts the pipeline of that image only.
 */
public class InputException extends StickerSplitException {

    public InputException(String message) {
        super(message);
    }

    public InputException(String message, Throwable cause) {
        super(message, cause);
    }
}
