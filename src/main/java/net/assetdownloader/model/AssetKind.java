package net.assetdownloader.model;

/** Kind of target a download job writes. */
public enum AssetKind {
    IMAGE(".jpg"),
    PDF(".pdf");

    private final String extension;

    AssetKind(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }
}
