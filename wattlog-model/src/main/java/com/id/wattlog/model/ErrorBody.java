package com.id.wattlog.model;

public record ErrorBody(String error) {
}
