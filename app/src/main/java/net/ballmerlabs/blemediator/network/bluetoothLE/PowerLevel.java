package net.ballmerlabs.blemediator.network.bluetoothLE;

import net.ballmerlabs.blemediator.network.bluetoothLE.medium.PowerMode;

/**
 * Caller-facing power preference, mapped onto a radio {@link PowerMode}.
 */
public enum PowerLevel {
    HIGH_POWER {
        @Override
        public PowerMode toPowerMode() {
            return PowerMode.HIGH;
        }
    },
    LOW_POWER {
        // medium covers about a conference room, anything lower is not visible at a distance
        @Override
        public PowerMode toPowerMode() {
            return PowerMode.MEDIUM;
        }
    };

    public abstract PowerMode toPowerMode();
}
