package com.spotify.retrier;

public record FakeResponse(int httpStatusCode) implements Response {}
