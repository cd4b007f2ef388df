package github.sarthakdev143.frame_factory.model;

import java.util.Locale;

public enum ImageFormat {
    JPEG("jpeg", true),
    PNG("png", false),
    NONE("none", false);

    private final String extension;
    private final boolean lossy;

    ImageFormat(String extension, boolean lossy) {
        this.extension = extension;
        this.lossy = lossy;
    }

    public String extension() {
        return extension;
    }

    public boolean isLossy() {
        return lossy;
    }

    public boolean producesImages() {
        return this != NONE;
    }

    public static ImageFormat fromInput(String input) {
        if (input == null || input.isBlank()) {
            return JPEG;
        }

        try {
            return ImageFormat.valueOf(input.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("imageFormat must be one of JPEG, PNG, NONE.");
        }
    }
}
