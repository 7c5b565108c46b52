package com.drawsync.servicebackend.web.dto;

public record ErrorResponse(String code, String error) {
}
