package io.b2mash.realtime.cluster;

import java.net.URI;

/** A member of the cluster and the base URL of its internal API. */
public record ClusterNode(String name, URI url) {}
