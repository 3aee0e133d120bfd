package com.github.revdownloader;

import com.github.revdownloader.config.DownloaderProperties;
import com.github.revdownloader.service.backend.MediaBackend;
import com.github.revdownloader.service.backend.MediaBackendRouter;
import com.github.revdownloader.service.session.SessionController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "revdownloader.download.concurrency=4")
@DisplayName("Application context")
class RevDownloaderApplicationTests {

    @Autowired
    private MediaBackend mediaBackend;

    @Autowired
    private SessionController sessionController;

    @Autowired
    private DownloaderProperties properties;

    @Test
    @DisplayName("should wire the routing backend and bind configuration")
    void contextLoads() {
        assertInstanceOf(MediaBackendRouter.class, mediaBackend);
        assertNotNull(sessionController);
        assertTrue(sessionController.getActiveSession().isEmpty());
        assertEquals(4, properties.getDownload().getConcurrency());
        assertEquals(3, properties.getRetry().getMaxAttempts());
    }
}
