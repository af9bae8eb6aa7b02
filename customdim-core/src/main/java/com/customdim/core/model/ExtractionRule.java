package com.customdim.core.model;

/**
 * Derives a dimension value from another tracked attribute. {@code dimension} names the source
 * attribute (see the extraction source registry), {@code pattern} is interpreted by that source.
 */
public record ExtractionRule(String dimension, String pattern) {}
