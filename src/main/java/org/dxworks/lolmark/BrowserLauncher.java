package org.dxworks.lolmark;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Desktop;
import java.awt.GraphicsEnvironment;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Opens a generated page with the desktop's default browser, when there is a desktop.
 */
public class BrowserLauncher {

    private static final Logger logger = LoggerFactory.getLogger(BrowserLauncher.class);

    /**
     * @return true if the browser was asked to open the page
     */
    public boolean open(Path page) {
        if (GraphicsEnvironment.isHeadless()
                || !Desktop.isDesktopSupported()
                || !Desktop.getDesktop().isSupported(Desktop.Action.BROWSE)) {
            logger.warn("No desktop browser available, not opening {}", page);
            return false;
        }
        try {
            Desktop.getDesktop().browse(page.toAbsolutePath().toUri());
            return true;
        } catch (IOException e) {
            logger.warn("Failed to open {} in a browser: {}", page, e.getMessage());
            return false;
        }
    }
}
