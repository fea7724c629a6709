package net.ballmerlabs.blemediator.network.bluetoothLE.tracker;

import net.ballmerlabs.blemediator.network.bluetoothLE.advertisement.AdvertisementReadResult;
import net.ballmerlabs.blemediator.network.bluetoothLE.medium.BlePeripheral;

import java.util.List;

/**
 * Reads the advertisements hosted behind a header from a remote GATT server.
 * Blocks for the duration of the GATT exchange.
 */
@FunctionalInterface
public interface AdvertisementFetcher {
    /**
     * @param peripheral            remote device hosting the advertisements
     * @param numSlots              slot count announced in the header
     * @param psm                   psm announced in the header
     * @param interestingServiceIds tracked service ids the header may host
     * @param advertisementReadResult result of an earlier attempt to resume, or null
     * @return the (possibly partial) result, never null
     */
    AdvertisementReadResult fetchAdvertisements(
            BlePeripheral peripheral,
            int numSlots,
            int psm,
            List<String> interestingServiceIds,
            AdvertisementReadResult advertisementReadResult
    );
}
