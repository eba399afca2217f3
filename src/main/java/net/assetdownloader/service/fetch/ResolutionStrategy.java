package net.assetdownloader.service.fetch;

/** Where an asset's bytes came from. */
public enum ResolutionStrategy {
    SOURCE_FOLDER,
    LOCAL_PATH,
    HTTP,
    NONE
}
