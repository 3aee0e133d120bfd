package com.github.revdownloader.controller;

import com.github.revdownloader.model.DownloadOptions;
import jakarta.validation.Valid;
import lombok.Data;

@Data
public class StartSessionRequest {

    private String url;

    @Valid
    private DownloadOptions options;
}
