package io.regtransport.spec;

import java.util.List;

/**
 * Media types exchanged with a Registry v2 API.
 */
public interface MediaTypes {
    String MANIFEST_SCHEMA1 = "application/vnd.docker.distribution.manifest.v1+json";
    String MANIFEST_SCHEMA1_SIGNED = "application/vnd.docker.distribution.manifest.v1+prettyjws";
    String MANIFEST_SCHEMA2 = "application/vnd.docker.distribution.manifest.v2+json";
    String MANIFEST_LIST = "application/vnd.docker.distribution.manifest.list.v2+json";
    String LAYER = "application/vnd.docker.image.rootfs.diff.tar.gzip";
    String CONFIG_JSON = "application/vnd.docker.container.image.v1+json";
    String APPLICATION_JSON = "application/json";

    List<String> MANIFEST_SCHEMA1_TYPES = List.of(MANIFEST_SCHEMA1, MANIFEST_SCHEMA1_SIGNED);
    List<String> MANIFEST_SCHEMA2_TYPES = List.of(MANIFEST_SCHEMA2);
    List<String> SUPPORTED_MANIFEST_TYPES = List.of(MANIFEST_SCHEMA1, MANIFEST_SCHEMA1_SIGNED, MANIFEST_SCHEMA2);
}
