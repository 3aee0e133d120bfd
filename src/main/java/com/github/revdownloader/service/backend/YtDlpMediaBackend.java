package com.github.revdownloader.service.backend;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.revdownloader.config.DownloaderProperties;
import com.github.revdownloader.service.parser.ProgressParser;
import com.github.revdownloader.service.parser.YtDlpProgressTemplateParser;
import org.springframework.stereotype.Component;

/**
 * Default backend: plain yt-dlp with structured JSON progress.
 */
@Component
public class YtDlpMediaBackend extends AbstractYtDlpBackend {

    private final ObjectMapper objectMapper;

    public YtDlpMediaBackend(YtDlpCommandBuilder commandBuilder, YtDlpProcessExecutor processExecutor,
                             YtDlpMetadataParser metadataParser, DownloaderProperties properties,
                             ObjectMapper objectMapper) {
        super(commandBuilder, processExecutor, metadataParser, properties);
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean impersonate() {
        return false;
    }

    @Override
    protected boolean progressTemplate() {
        return true;
    }

    @Override
    protected ProgressParser createProgressParser() {
        return new YtDlpProgressTemplateParser(objectMapper);
    }
}
