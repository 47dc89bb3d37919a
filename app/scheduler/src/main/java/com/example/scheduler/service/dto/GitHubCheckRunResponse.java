package com.example.scheduler.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GitHubCheckRunResponse(String name, String status, String conclusion) {}
