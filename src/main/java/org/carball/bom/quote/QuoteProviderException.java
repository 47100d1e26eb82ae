package org.carball.bom.quote;

public class QuoteProviderException extends Exception {

    public QuoteProviderException(String message) {
        super(message);
    }

    public QuoteProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
