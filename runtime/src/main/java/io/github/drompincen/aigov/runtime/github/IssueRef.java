package io.github.drompincen.aigov.runtime.github;

public record IssueRef(int number, String url) {}
