package io.github.hide212131.eden.env.runtime;

import java.util.List;

/** A second {@code resolve} call on the same resolver. Configuration is fixed for the process lifetime. */
public class ResolutionAlreadyPerformedException extends EnvironmentResolutionException {

    public ResolutionAlreadyPerformedException() {
        super(null, "Environment has already been resolved for this process; a second resolution is not allowed");
    }

    @Override
    public List<String> guidance() {
        return List.of("Reuse the ResolvedSet returned by the first resolve call");
    }
}
