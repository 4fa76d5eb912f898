package dk.trustworks.filebridge.source;

import java.util.List;

/**
 * Placement context shared by every record of one transfer batch: the scope the file ids
 * belong to and the breadcrumb chain leading to it (site → drive, or drive only).
 *
 * @param siteId the site id, or null for flat providers
 * @param driveId the drive id the file ids are scoped to
 * @param breadcrumbs ancestors from the outermost container inwards
 */
public record Lineage(String siteId, String driveId, List<Breadcrumb> breadcrumbs) {

    public Lineage {
        breadcrumbs = breadcrumbs == null ? List.of() : List.copyOf(breadcrumbs);
    }
}
