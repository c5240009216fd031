package com.prradar.aggregator.display;

/**
 * Which of the two views a list of items is built from.
 */
public enum PrType {
    OPEN,
    APPROVED
}
