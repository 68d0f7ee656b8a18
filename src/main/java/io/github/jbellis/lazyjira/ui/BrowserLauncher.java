package io.github.jbellis.lazyjira.ui;

import java.awt.Desktop;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Opens a URL in the user's browser: AWT Desktop where available, otherwise the platform's opener command. */
public class BrowserLauncher implements Consumer<URI> {
    private static final Logger logger = LogManager.getLogger(BrowserLauncher.class);

    @Override
    public void accept(URI uri) {
        try {
            if (Desktop.isDesktopSupported() && Desktop.getDesktop().isSupported(Desktop.Action.BROWSE)) {
                Desktop.getDesktop().browse(uri);
            } else {
                new ProcessBuilder(openerCommand(System.getProperty("os.name"), uri))
                        .redirectErrorStream(true)
                        .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                        .start();
            }
            logger.debug("Opened {}", uri);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not open " + uri, e);
        }
    }

    static List<String> openerCommand(String osName, URI uri) {
        var os = osName.toLowerCase(Locale.ROOT);
        if (os.contains("win")) {
            return List.of("rundll32", "url.dll,FileProtocolHandler", uri.toString());
        } else if (os.contains("mac")) {
            return List.of("open", uri.toString());
        }
        return List.of("xdg-open", uri.toString());
    }
}
