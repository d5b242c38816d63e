package com.ttennebkram.stickersplit.model;

/**
 * A request or configuration value is out of range. Always raised before any
 * pixel processing starts.
 */
public class ParameterException extends StickerSplitException {

    public ParameterException(String message) {
        super(message);
    }

    public ParameterException(String message, Throwable cause) {
        super(message, cause);
    }
}
