package org.sensitiveword.core.service;

public record FilterResult(String filtered) {}
