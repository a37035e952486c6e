package com.gridbot.model;

/**
 * How grid prices are spread between the bottom and top of the range.
 */
public enum SpacingType {
    ARITHMETIC,
    GEOMETRIC
}
