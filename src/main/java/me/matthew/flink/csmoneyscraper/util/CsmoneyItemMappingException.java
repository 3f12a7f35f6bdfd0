package me.matthew.flink.csmoneyscraper.util;

/**
 * Thrown when a raw cs.money record does not match the expected item shape,
 * e.g. an unknown category code or a missing required field.
 */
public class CsmoneyItemMappingException extends RuntimeException {

    public CsmoneyItemMappingException(String message) {
        super(message);
    }

    public CsmoneyItemMappingException(String message, Throwable cause) {
        super(message, cause);
    }
}
