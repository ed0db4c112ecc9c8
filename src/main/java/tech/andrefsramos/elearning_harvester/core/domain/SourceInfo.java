package tech.andrefsramos.elearning_harvester.core.domain;

public record SourceInfo(String key, String displayName) {}
