package com.dococr.api.dto;

public record ModeDescriptor(int code, String name, String description) {
}
