package com.starscape.rapidresize.features.transcode.domain;

/**
 * Output encodings. AUTO is resolved per image before encoding.
 */
public enum OutputFormat {
    AUTO(null, null, false),
    JPEG("jpeg", ".jpg", true),
    PNG("png", ".png", true),
    WEBP("webp", ".webp", false);

    private final String imageIoName;
    private final String extension;
    private final boolean carriesExif;

    OutputFormat(String imageIoName, String extension, boolean carriesExif) {
        this.imageIoName = imageIoName;
        this.extension = extension;
        this.carriesExif = carriesExif;
    }

    /**
     * Format name understood by {@code ImageIO.getImageWritersByFormatName}.
     */
    public String getImageIoName() {
        return imageIoName;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * Whether output in this format can embed an EXIF block here.
     */
    public boolean carriesExif() {
        return carriesExif;
    }

    public boolean isConcrete() {
        return this != AUTO;
    }
}
