package at.sv.prayer.config;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Determines the shadow length used for the asr time.
 */
@Getter
@RequiredArgsConstructor
public enum Madhab {
    SHAFI(1),
    HANAFI(2);

    private final int shadowLength;
}
