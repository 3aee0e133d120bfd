package com.github.revdownloader.controller;

import com.github.revdownloader.model.DownloadErrorType;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ErrorResponse {

    private final DownloadErrorType errorType;
    private final String message;
}
