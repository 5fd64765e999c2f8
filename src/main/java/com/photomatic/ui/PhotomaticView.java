package com.photomatic.ui;

import com.photomatic.config.ConfigService;
import com.photomatic.core.export.PhotoExportException;
import com.photomatic.core.export.PhotoExporter;
import com.photomatic.core.export.SingleFileSaveTarget;
import com.photomatic.core.ingest.BatchResult;
import com.photomatic.core.ingest.IngestFailure;
import com.photomatic.core.model.DisplayOption;
import com.photomatic.core.model.FilePhotoSource;
import com.photomatic.core.model.PhotoRecord;
import com.photomatic.core.model.PhotoSource;
import com.photomatic.core.session.PhotoSession;
import com.photomatic.core.session.SessionSnapshot;
import com.photomatic.core.session.SessionState;
import com.photomatic.logging.AppLogger;

import javax.swing.*;
import javax.swing.filechooser.FileNameExtensionFilter;
import java.awt.*;
import java.awt.event.WindowAdapter;
import java.awt.event.WindowEvent;
import java.awt.image.BufferedImage;
import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Main window: preview canvas, filmstrip, option toggles and the open/add/save actions.
 * <p>
 * Everything here runs on the Swing event thread, which is also the thread the session
 * publishes ingested photos on.
 */
public class PhotomaticView {

    private static final Logger LOGGER = AppLogger.get();
    private static final String[] IMAGE_EXTENSIONS = {"jpg", "jpeg", "png", "gif", "bmp"};

    private final PhotoSession session;
    private final ConfigService configService;

    private final JFrame frame;
    private final CanvasPanel canvasPanel = new CanvasPanel();
    private final DefaultListModel<PhotoRecord> filmstripModel = new DefaultListModel<>();
    private final JList<PhotoRecord> filmstrip = new JList<>(filmstripModel);
    private final Map<DisplayOption, JCheckBox> optionBoxes = new EnumMap<>(DisplayOption.class);
    private final JButton openButton = new JButton("Open Photos…");
    private final JButton addButton = new JButton("Add Photos…");
    private final JButton saveButton = new JButton("Save…");
    private final JLabel statusLabel = new JLabel(" ");

    private boolean syncingSelection;

    public PhotomaticView(PhotoSession session, ConfigService configService) {
        this.session = session;
        this.configService = configService;

        frame = new JFrame("Photomatic");
        frame.setDefaultCloseOperation(JFrame.DISPOSE_ON_CLOSE);
        frame.setSize(1200, 900);
        frame.setLayout(new BorderLayout(8, 8));

        // Top: actions + options
        JPanel topPanel = new JPanel(new FlowLayout(FlowLayout.LEFT, 8, 8));
        openButton.addActionListener(e -> choosePhotos(true));
        addButton.addActionListener(e -> choosePhotos(false));
        saveButton.addActionListener(e -> saveCurrent());
        topPanel.add(openButton);
        topPanel.add(addButton);
        topPanel.add(saveButton);
        topPanel.add(Box.createHorizontalStrut(16));
        addOption(topPanel, DisplayOption.ROUNDED_CORNERS, "Rounded corners");
        addOption(topPanel, DisplayOption.METADATA_OVERLAY, "Show exposure info");
        addOption(topPanel, DisplayOption.LIGHT_MAT, "Light mat");
        addOption(topPanel, DisplayOption.GLOW, "Glow");
        frame.add(topPanel, BorderLayout.NORTH);

        // Center: preview
        frame.add(canvasPanel, BorderLayout.CENTER);

        // Bottom: filmstrip + status
        filmstrip.setCellRenderer(new ThumbnailCellRenderer());
        filmstrip.setLayoutOrientation(JList.HORIZONTAL_WRAP);
        filmstrip.setVisibleRowCount(1);
        filmstrip.setSelectionMode(ListSelectionModel.SINGLE_SELECTION);
        filmstrip.addListSelectionListener(e -> {
            if (!e.getValueIsAdjusting() && !syncingSelection && filmstrip.getSelectedIndex() >= 0) {
                session.selectPhoto(filmstrip.getSelectedIndex());
            }
        });
        JScrollPane filmstripScroll = new JScrollPane(filmstrip,
            ScrollPaneConstants.VERTICAL_SCROLLBAR_NEVER, ScrollPaneConstants.HORIZONTAL_SCROLLBAR_AS_NEEDED);
        filmstripScroll.setPreferredSize(new Dimension(0, ThumbnailCellRenderer.THUMB_HEIGHT + 48));
        JPanel bottomPanel = new JPanel(new BorderLayout(8, 4));
        bottomPanel.add(filmstripScroll, BorderLayout.CENTER);
        bottomPanel.add(statusLabel, BorderLayout.SOUTH);
        frame.add(bottomPanel, BorderLayout.SOUTH);

        session.store().subscribe(this::onSessionChanged);
        session.stateMachine().subscribe(this::onStateChanged);
        frame.addWindowListener(new WindowAdapter() {
            @Override
            public void windowClosed(WindowEvent e) {
                session.close();
            }
        });

        onStateChanged(session.stateMachine().state());
        frame.setLocationRelativeTo(null);
        frame.setVisible(true);
    }

    private void addOption(JPanel panel, DisplayOption option, String label) {
        JCheckBox box = new JCheckBox(label, session.options().isEnabled(option));
        box.addActionListener(e -> {
            session.setOption(option, box.isSelected());
            refreshPreview();
        });
        optionBoxes.put(option, box);
        panel.add(box);
    }

    private void choosePhotos(boolean replace) {
        JFileChooser chooser = new JFileChooser(configService.getOpenDirectory().toFile());
        chooser.setDialogTitle(replace ? "Open Photos" : "Add Photos");
        chooser.setFileSelectionMode(JFileChooser.FILES_ONLY);
        chooser.setMultiSelectionEnabled(true);
        chooser.setFileFilter(new FileNameExtensionFilter("Images", IMAGE_EXTENSIONS));
        if (chooser.showOpenDialog(frame) != JFileChooser.APPROVE_OPTION) return;

        File[] selected = chooser.getSelectedFiles();
        if (selected == null || selected.length == 0) return;
        configService.setOpenDirectory(selected[0].toPath().getParent());

        List<Path> paths = new ArrayList<>();
        Arrays.stream(selected).map(File::toPath).forEach(paths::add);
        List<PhotoSource> sources = FilePhotoSource.of(paths);

        CompletableFuture<BatchResult> batch;
        try {
            batch = replace ? session.loadReplace(sources) : session.loadAppend(sources);
        } catch (IllegalStateException e) {
            JOptionPane.showMessageDialog(frame, e.getMessage(), "Busy", JOptionPane.WARNING_MESSAGE);
            return;
        }
        statusLabel.setText("Loading " + sources.size() + " photo(s)…");
        batch.whenComplete((result, error) -> {
            if (error != null) {
                JOptionPane.showMessageDialog(frame,
                    "Loading stopped.\nError: " + error.getMessage(), "Load Error", JOptionPane.ERROR_MESSAGE);
            } else if (!result.failures().isEmpty()) {
                reportSkipped(result);
            }
            updateStatus();
        });
    }

    private void reportSkipped(BatchResult result) {
        StringBuilder message = new StringBuilder("Skipped " + result.failures().size() + " file(s):");
        for (IngestFailure failure : result.failures()) {
            message.append("\n  ").append(failure.sourceName());
        }
        JOptionPane.showMessageDialog(frame, message.toString(), "Some Photos Were Skipped", JOptionPane.WARNING_MESSAGE);
    }

    private void saveCurrent() {
        PhotoRecord photo = session.store().selected().orElse(null);
        if (photo == null || !session.stateMachine().canExport()) return;

        JFileChooser chooser = new JFileChooser(configService.getExportDirectory().toFile());
        chooser.setDialogTitle("Save Photo");
        chooser.setSelectedFile(new File(configService.getExportDirectory().toFile(),
            PhotoExporter.suggestedFileName(photo.getName())));
        chooser.setFileFilter(new FileNameExtensionFilter("JPEG", "jpeg", "jpg"));
        if (chooser.showSaveDialog(frame) != JFileChooser.APPROVE_OPTION) return;

        Path target = chooser.getSelectedFile().toPath();
        configService.setExportDirectory(target.toAbsolutePath().getParent());
        frame.setCursor(Cursor.getPredefinedCursor(Cursor.WAIT_CURSOR));
        try {
            String location = session.exportCurrent(new SingleFileSaveTarget(target));
            statusLabel.setText("Saved " + location);
        } catch (PhotoExportException e) {
            JOptionPane.showMessageDialog(frame, "Could not save.\nError: " + e.getMessage(), "Save Error", JOptionPane.ERROR_MESSAGE);
        } finally {
            frame.setCursor(Cursor.getDefaultCursor());
        }
    }

    private void onSessionChanged() {
        SessionSnapshot snapshot = session.store().snapshot();
        syncingSelection = true;
        try {
            List<PhotoRecord> records = snapshot.records();
            if (!matchesFilmstrip(records)) {
                filmstripModel.clear();
                records.forEach(filmstripModel::addElement);
            }
            if (records.isEmpty()) {
                filmstrip.clearSelection();
            } else {
                filmstrip.setSelectedIndex(snapshot.selectedIndex());
                filmstrip.ensureIndexIsVisible(snapshot.selectedIndex());
            }
        } finally {
            syncingSelection = false;
        }
        refreshPreview();
        updateStatus();
    }

    private boolean matchesFilmstrip(List<PhotoRecord> records) {
        if (records.size() != filmstripModel.size()) {
            return false;
        }
        for (int i = 0; i < records.size(); i++) {
            if (records.get(i) != filmstripModel.get(i)) {
                return false;
            }
        }
        return true;
    }

    private void onStateChanged(SessionState state) {
        boolean canLoad = session.stateMachine().canLoad();
        boolean canEdit = session.stateMachine().canEdit();
        openButton.setEnabled(canLoad);
        addButton.setEnabled(canLoad && !session.store().isEmpty());
        saveButton.setEnabled(session.stateMachine().canExport());
        optionBoxes.values().forEach(box -> box.setEnabled(canEdit));
        filmstrip.setEnabled(canEdit);
        LOGGER.fine(() -> "View state " + state);
        updateStatus();
    }

    private void refreshPreview() {
        try {
            canvasPanel.setImage(session.renderCurrent().orElse(null));
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Preview render failed", e);
            canvasPanel.setImage(null);
        }
    }

    private void updateStatus() {
        SessionState state = session.stateMachine().state();
        if (state == SessionState.LOADING) return;
        int size = session.store().size();
        if (size == 0) {
            statusLabel.setText("Open photos to begin.");
        } else {
            int index = session.store().selectedIndex();
            String name = session.store().selected().map(PhotoRecord::getName).orElse("");
            statusLabel.setText("Photo " + (index + 1) + " of " + size + " - " + name);
        }
    }

    /** Scales the shared preview surface to fit the panel. */
    private static class CanvasPanel extends JPanel {
        private BufferedImage image;

        CanvasPanel() {
            setBackground(Color.DARK_GRAY);
        }

        void setImage(BufferedImage img) {
            this.image = img;
            repaint();
        }

        @Override
        protected void paintComponent(Graphics g) {
            super.paintComponent(g);
            if (image == null) return;
            Graphics2D g2 = (Graphics2D) g;
            g2.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            double scale = Math.min((double) getWidth() / image.getWidth(), (double) getHeight() / image.getHeight());
            int dw = (int) (image.getWidth() * scale);
            int dh = (int) (image.getHeight() * scale);
            int dx = (getWidth() - dw) / 2;
            int dy = (getHeight() - dh) / 2;
            g2.drawImage(image, dx, dy, dw, dh, null);
        }
    }
}
