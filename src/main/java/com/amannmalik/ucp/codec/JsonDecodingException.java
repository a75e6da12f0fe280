package com.amannmalik.ucp.codec;

public final class JsonDecodingException extends RuntimeException {
    public JsonDecodingException(String message) {
        super(message);
    }

    public JsonDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
