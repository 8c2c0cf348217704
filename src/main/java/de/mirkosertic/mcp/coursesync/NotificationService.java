package de.mirkosertic.mcp.coursesync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Best effort desktop notifications for finished and failed synchronization runs.
 * <p>
 * Child processes never inherit the standard streams, because STDIO carries the MCP protocol.
 */
public class NotificationService {

    private static final Logger logger = LoggerFactory.getLogger(NotificationService.class);

    private final String os;
    private final boolean enabled;

    public NotificationService(final boolean enabled) {
        this.os = System.getProperty("os.name", "").toLowerCase();
        this.enabled = enabled;
        logger.info("NotificationService initialized for OS: {} (enabled: {})", os, enabled);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void notify(final String title, final String message) {
        if (!enabled) {
            return;
        }
        try {
            if (os.contains("mac")) {
                notifyMacOS(title, message);
            } else if (os.contains("win")) {
                notifyWindows(title, message);
            } else if (os.contains("linux")) {
                notifyLinux(title, message);
            } else {
                logger.debug("Notifications not supported on this OS: {}", os);
            }
        } catch (final IOException e) {
            logger.debug("Failed to send notification: {}", e.getMessage());
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Interrupted while sending notification");
        }
    }

    private void notifyMacOS(final String title, final String message) throws IOException {
        final ProcessBuilder pb = new ProcessBuilder(
                "osascript", "-e",
                String.format("display notification \"%s\" with title \"%s\"",
                        escapeForAppleScript(message),
                        escapeForAppleScript(title))
        );
        start(pb);
    }

    private void notifyWindows(final String title, final String message) throws IOException, InterruptedException {
        final String script = String.format(
                "[Windows.UI.Notifications.ToastNotificationManager, Windows.UI.Notifications, ContentType = WindowsRuntime] | Out-Null; " +
                "$template = [Windows.UI.Notifications.ToastNotificationManager]::GetTemplateContent([Windows.UI.Notifications.ToastTemplateType]::ToastText02); " +
                "$textNodes = $template.GetElementsByTagName('text'); " +
                "$textNodes.Item(0).AppendChild($template.CreateTextNode('%s')) | Out-Null; " +
                "$textNodes.Item(1).AppendChild($template.CreateTextNode('%s')) | Out-Null; " +
                "$toast = [Windows.UI.Notifications.ToastNotification]::new($template); " +
                "[Windows.UI.Notifications.ToastNotificationManager]::CreateToastNotifier('MCP Course Sync').Show($toast);",
                escapeForPowerShell(title),
                escapeForPowerShell(message)
        );
        start(new ProcessBuilder("powershell", "-Command", script)).waitFor();
    }

    private void notifyLinux(final String title, final String message) throws IOException, InterruptedException {
        start(new ProcessBuilder("notify-send", title, message)).waitFor();
    }

    private static Process start(final ProcessBuilder pb) throws IOException {
        pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        return pb.start();
    }

    static String escapeForAppleScript(final String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    static String escapeForPowerShell(final String text) {
        return text.replace("'", "''").replace("\"", "`\"");
    }
}
