package com.amannmalik.ucp.api.discovery.model;

import com.amannmalik.ucp.util.Ensure;

import java.net.URI;

public record Capability(String name, String version, URI spec, URI schema, String extendsCapability) {
    public Capability {
        name = Ensure.nonBlank("capability.name", name);
        version = Ensure.nonBlank("capability.version", version);
        extendsCapability = Ensure.nonBlankOrNull("capability.extends", extendsCapability);
    }
}
