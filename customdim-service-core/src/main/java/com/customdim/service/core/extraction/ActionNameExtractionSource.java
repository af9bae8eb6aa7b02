package com.customdim.service.core.extraction;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(30)
public class ActionNameExtractionSource extends RegexExtractionSource {

    @Override
    public String id() {
        return "action_name";
    }

    @Override
    public String displayName() {
        return "Page Title";
    }

    @Override
    protected String subject(TrackingRequest request) {
        return request.actionName();
    }
}
