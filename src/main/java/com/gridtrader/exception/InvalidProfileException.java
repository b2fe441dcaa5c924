package com.gridtrader.exception;

import java.util.Map;
import java.util.Set;

/** Thrown when a grid profile name is not one of the configured profiles. */
public class InvalidProfileException extends BaseException {

    public InvalidProfileException(String profileName, Set<String> knownProfiles) {
        super(
                ErrorCode.UNKNOWN_PROFILE,
                "Unknown grid profile: " + profileName,
                Map.of("profile", String.valueOf(profileName), "knownProfiles", knownProfiles));
    }
}
