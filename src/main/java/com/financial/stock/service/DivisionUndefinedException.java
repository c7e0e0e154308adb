package com.financial.stock.service;

/**
 * Thrown when a ratio is requested whose denominator is zero, e.g. the
 * dividend yield of a stock priced at 0 or the P/E ratio of a stock
 * that pays no dividend.
 */
public class DivisionUndefinedException extends ArithmeticException {

    public DivisionUndefinedException(String message) {
        super(message);
    }
}
