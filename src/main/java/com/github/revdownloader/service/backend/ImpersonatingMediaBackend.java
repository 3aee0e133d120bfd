package com.github.revdownloader.service.backend;

import com.github.revdownloader.config.DownloaderProperties;
import com.github.revdownloader.service.parser.PercentProgressParser;
import com.github.revdownloader.service.parser.ProgressParser;
import org.springframework.stereotype.Component;

/**
 * Backend for platforms that reject non-browser clients. Runs yt-dlp with
 * {@code --impersonate} and reads the percentage off its console progress.
 */
@Component
public class ImpersonatingMediaBackend extends AbstractYtDlpBackend {

    public ImpersonatingMediaBackend(YtDlpCommandBuilder commandBuilder, YtDlpProcessExecutor processExecutor,
                                     YtDlpMetadataParser metadataParser, DownloaderProperties properties) {
        super(commandBuilder, processExecutor, metadataParser, properties);
    }

    @Override
    protected boolean impersonate() {
        return true;
    }

    @Override
    protected boolean progressTemplate() {
        return false;
    }

    @Override
    protected ProgressParser createProgressParser() {
        return new PercentProgressParser();
    }
}
