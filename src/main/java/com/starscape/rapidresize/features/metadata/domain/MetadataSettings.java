package com.starscape.rapidresize.features.metadata.domain;

/**
 * Metadata part of a save configuration.
 *
 * @param stripLocation remove the GPS directory regardless of the policy
 */
public record MetadataSettings(
    MetadataPolicy policy,
    MetadataEdit edit,
    boolean stripLocation
) {

    public MetadataSettings {
        if (policy == null) {
            policy = MetadataPolicy.KEEP;
        }
        if (edit == null) {
            edit = MetadataEdit.none();
        }
    }

    public static MetadataSettings keep() {
        return new MetadataSettings(MetadataPolicy.KEEP, MetadataEdit.none(), false);
    }
}
