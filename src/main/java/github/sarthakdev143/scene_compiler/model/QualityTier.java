package github.sarthakdev143.scene_compiler.model;

import java.util.Locale;

public enum QualityTier {
    LOW("-ql", "480p15"),
    MEDIUM("-qm", "720p30"),
    HIGH("-qh", "1080p60");

    private final String renderFlag;
    private final String outputDirectory;

    QualityTier(String renderFlag, String outputDirectory) {
        this.renderFlag = renderFlag;
        this.outputDirectory = outputDirectory;
    }

    public static QualityTier fromInput(String input) {
        if (input == null || input.isBlank()) {
            return LOW;
        }

        try {
            return QualityTier.valueOf(input.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("quality must be one of LOW, MEDIUM, HIGH.");
        }
    }

    public String renderFlag() {
        return renderFlag;
    }

    public String outputDirectory() {
        return outputDirectory;
    }
}
