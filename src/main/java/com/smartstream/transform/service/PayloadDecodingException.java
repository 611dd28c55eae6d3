package com.smartstream.transform.service;

public class PayloadDecodingException extends RuntimeException {
    /**
     * Creates an exception for a raw object whose bytes cannot be turned into text.
     */
    public PayloadDecodingException(String m, Throwable c) { super(m, c); }
}
