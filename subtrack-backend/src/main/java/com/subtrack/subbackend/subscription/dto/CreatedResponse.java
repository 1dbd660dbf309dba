package com.subtrack.subbackend.subscription.dto;

public record CreatedResponse(String id) {}
