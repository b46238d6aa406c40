package org.neuralchilli.plexor.api;

public record ErrorResponse(String error) {
}
