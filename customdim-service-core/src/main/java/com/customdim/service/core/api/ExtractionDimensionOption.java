package com.customdim.service.core.api;

public record ExtractionDimensionOption(String value, String name) {}
