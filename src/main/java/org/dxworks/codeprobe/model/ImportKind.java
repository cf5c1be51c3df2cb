package org.dxworks.codeprobe.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ImportKind {
    STATIC_IMPORT("static-import"),
    EXPORT_FROM("export-from"),
    DYNAMIC_IMPORT("dynamic-import"),
    MODULE_REQUIRE("module-require");

    private final String name;

    ImportKind(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }
}
