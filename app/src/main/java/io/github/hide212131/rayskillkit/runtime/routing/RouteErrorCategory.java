package io.github.hide212131.rayskillkit.runtime.routing;

/** Why a route failed. The tag is what telemetry records. */
public enum RouteErrorCategory {
    NOT_FOUND("not_found"),
    PAYLOAD_TYPE("payload_type"),
    BUILD_FAILED("build_failed"),
    RUN_FAILED("run_failed"),
    OUTPUT_TYPE("output_type");

    private final String tag;

    RouteErrorCategory(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
