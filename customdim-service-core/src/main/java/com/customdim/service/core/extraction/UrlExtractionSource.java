package com.customdim.service.core.extraction;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(10)
public class UrlExtractionSource extends RegexExtractionSource {

    @Override
    public String id() {
        return "url";
    }

    @Override
    public String displayName() {
        return "Page URL";
    }

    @Override
    protected String subject(TrackingRequest request) {
        return request.url();
    }
}
