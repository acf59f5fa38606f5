package com.linlay.assistantgw.model.api;

public record ErrorResponse(String error, String message, int status) {
}
