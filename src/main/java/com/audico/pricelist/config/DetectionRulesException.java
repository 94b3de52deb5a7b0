package com.audico.pricelist.config;

/**
 * The keyword table could not be loaded or is incomplete.
 */
public class DetectionRulesException extends RuntimeException {
    public DetectionRulesException(String message) {
        super(message);
    }

    public DetectionRulesException(String message, Throwable cause) {
        super(message, cause);
    }
}
