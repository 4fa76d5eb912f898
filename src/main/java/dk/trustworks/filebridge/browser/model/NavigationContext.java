package dk.trustworks.filebridge.browser.model;

/**
 * Where a browse call looks. The active level is decided by strict precedence: no site
 * lists sites, a site without a drive lists the site's drives, a drive lists folder contents.
 * {@code folderId} and {@code pageCursor} only matter at the folder level.
 *
 * @param organizationScope source connection id
 * @param pageCursor continuation cursor returned as {@code next_cursor} by a truncated listing
 */
public record NavigationContext(
    String organizationScope,
    String siteId,
    String driveId,
    String folderId,
    String pageCursor
) {
    public NavigationContext {
        siteId = blankToNull(siteId);
        driveId = blankToNull(driveId);
        folderId = blankToNull(folderId);
        pageCursor = blankToNull(pageCursor);
    }

    public static NavigationContext root(String organizationScope) {
        return new NavigationContext(organizationScope, null, null, null, null);
    }

    public boolean hasSite() {
        return siteId != null;
    }

    public boolean hasDrive() {
        return driveId != null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
