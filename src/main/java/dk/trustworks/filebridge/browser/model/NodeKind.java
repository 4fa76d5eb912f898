package dk.trustworks.filebridge.browser.model;

/**
 * What a browse entry stands for. Sites and drives are synthetic containers: they are
 * listed as folders so every level is traversed the same way.
 */
public enum NodeKind {
    FILE,
    FOLDER,
    SITE,
    DRIVE
}
