package net.ballmerlabs.blemediator.network.bluetoothLE.advertisement;

import java.io.IOException;

/**
 * Thrown when received advertisement or header bytes cannot be decoded.
 */
public class InvalidAdvertisementException extends IOException {
    public InvalidAdvertisementException(String message) {
        super(message);
    }
}
