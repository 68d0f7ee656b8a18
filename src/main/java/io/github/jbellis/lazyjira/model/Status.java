package io.github.jbellis.lazyjira.model;

public record Status(String id, String name, StatusCategory category) {}
