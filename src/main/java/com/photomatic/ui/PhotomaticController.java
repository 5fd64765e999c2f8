package com.photomatic.ui;

import com.photomatic.config.ConfigService;
import com.photomatic.core.session.PhotoSession;
import com.photomatic.logging.PhotoFailureLog;

import javax.swing.SwingUtilities;

/**
 * Thin controller that owns the lifecycle of the desktop window and its session.
 */
public final class PhotomaticController {
    private final PhotoSession session;
    private final PhotomaticView view;

    public PhotomaticController() {
        ConfigService config = ConfigService.getInstance();
        this.session = PhotoSession.create(
            config.getLayoutSettings(),
            SwingUtilities::invokeLater,
            new PhotoFailureLog(config.getFailureLogFile())
        );
        this.view = new PhotomaticView(session, config);
    }

    public PhotomaticView getView() {
        return view;
    }

    public static void main(String[] args) {
        SwingUtilities.invokeLater(() -> new PhotomaticController());
    }
}
