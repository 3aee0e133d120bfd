package com.github.revdownloader.service.retry;

import com.github.revdownloader.model.DownloadErrorType;
import com.github.revdownloader.service.PlatformDetector;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Maps backend error text to an error type. Checks run in priority order and
 * the first match wins; matching is case-insensitive.
 */
@Component
@RequiredArgsConstructor
public class ErrorClassifier {

    private final PlatformDetector platformDetector;

    public DownloadErrorType classify(String errorText, String url) {
        String lower = errorText == null ? "" : errorText.toLowerCase(Locale.ROOT);

        if (lower.contains("drm")) {
            return DownloadErrorType.DRM_UNSUPPORTED;
        }
        if (lower.contains("private video")) {
            return DownloadErrorType.PRIVATE_CONTENT;
        }
        if (platformDetector.isLoginRestricted(url)
                && (lower.contains("login") || lower.contains("cookie"))) {
            return DownloadErrorType.AUTH_REQUIRED;
        }
        if (lower.contains("ip address is blocked")) {
            return DownloadErrorType.IP_BLOCKED;
        }
        if (lower.contains("403") || lower.contains("forbidden")) {
            return DownloadErrorType.RATE_LIMITED;
        }
        return DownloadErrorType.BACKEND_ERROR;
    }
}
