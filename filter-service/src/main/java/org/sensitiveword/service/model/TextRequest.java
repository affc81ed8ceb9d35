package org.sensitiveword.service.model;

public record TextRequest(String text) {}
